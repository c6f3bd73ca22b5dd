package com.flamingo.ai.foliospec.service.extraction;

import com.flamingo.ai.foliospec.config.ConversionConfig;
import com.flamingo.ai.foliospec.domain.model.Block;
import com.flamingo.ai.foliospec.domain.model.ExtractedDocument;
import com.flamingo.ai.foliospec.domain.model.ExtractedPage;
import com.flamingo.ai.foliospec.domain.model.FileType;
import java.io.IOException;
import java.io.Writer;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.font.PDFont;
import org.apache.pdfbox.text.PDFTextStripper;
import org.apache.pdfbox.text.TextPosition;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

/**
 * {@link DocumentExtractor} for PDF documents.
 *
 * <p>Uses Apache PDFBox 3.x to walk each page's text in content-stream order. Characters are
 * grouped into lines; for every line the extractor keeps the merged text, the largest font size
 * and whether any glyph came from a bold font. Lines are then classified:
 *
 * <ul>
 *   <li>max font size ≥ {@code h1FontSize} → heading level 1
 *   <li>max font size ≥ {@code h2FontSize}, or any bold span → heading level 2
 *   <li>anything else → paragraph
 * </ul>
 */
@Service
@Order(1)
@RequiredArgsConstructor
@Slf4j
public class PdfBoxDocumentExtractor implements DocumentExtractor {

  private final ConversionConfig conversionConfig;

  @Override
  public Optional<ExtractedDocument> extract(byte[] content) {
    try (PDDocument pdfDoc = Loader.loadPDF(content)) {
      LineCollector collector = new LineCollector();
      collector.writeText(pdfDoc, Writer.nullWriter());

      List<ExtractedPage> pages = new ArrayList<>();
      List<List<LineInfo>> linesPerPage = collector.getPages();
      for (int i = 0; i < linesPerPage.size(); i++) {
        List<Block> blocks = classifyLines(linesPerPage.get(i));
        log.debug("PDF page {}: {} blocks", i + 1, blocks.size());
        pages.add(new ExtractedPage(i + 1, blocks));
      }
      return Optional.of(new ExtractedDocument(FileType.PDF, pages));
    } catch (IOException | RuntimeException e) {
      log.error("PDFBox extraction failed: {}", e.getMessage());
      return Optional.empty();
    }
  }

  @Override
  public boolean supports(FileType fileType) {
    return fileType == FileType.PDF;
  }

  // ---- private helpers ----

  private List<Block> classifyLines(List<LineInfo> lines) {
    List<Block> blocks = new ArrayList<>();
    for (LineInfo line : lines) {
      String text = line.text().strip();
      if (text.isEmpty()) {
        continue;
      }
      text = EncodingFixer.fix(text);
      int headingLevel = classifyHeading(line);
      blocks.add(
          headingLevel > 0 ? Block.heading(headingLevel, text, null) : Block.paragraph(text, null));
    }
    return blocks;
  }

  private int classifyHeading(LineInfo line) {
    ConversionConfig.Pdf thresholds = conversionConfig.getPdf();
    if (line.maxFontSize() >= thresholds.getH1FontSize()) {
      return 1;
    }
    if (line.maxFontSize() >= thresholds.getH2FontSize() || line.bold()) {
      return 2;
    }
    return 0;
  }

  // ---- inner types ----

  /** Collects per-line font metrics during PDFTextStripper traversal, one list per page. */
  private static final class LineCollector extends PDFTextStripper {

    private final List<List<LineInfo>> pages = new ArrayList<>();
    private List<LineInfo> currentPage = new ArrayList<>();
    private final StringBuilder lineText = new StringBuilder();
    private float maxFontSize;
    private boolean bold;

    LineCollector() throws IOException {
      super();
      setSortByPosition(false);
    }

    @Override
    protected void startPage(PDPage page) throws IOException {
      currentPage = new ArrayList<>();
      super.startPage(page);
    }

    @Override
    protected void writeString(String text, List<TextPosition> textPositions) {
      lineText.append(text);
      for (TextPosition pos : textPositions) {
        maxFontSize = Math.max(maxFontSize, fontSize(pos));
        bold = bold || isBold(pos.getFont());
      }
    }

    @Override
    protected void writeWordSeparator() {
      lineText.append(getWordSeparator());
    }

    @Override
    protected void writeLineSeparator() {
      flushLine();
    }

    @Override
    protected void endPage(PDPage page) throws IOException {
      flushLine();
      pages.add(currentPage);
      super.endPage(page);
    }

    List<List<LineInfo>> getPages() {
      return pages;
    }

    private void flushLine() {
      if (lineText.length() > 0) {
        currentPage.add(new LineInfo(lineText.toString(), maxFontSize, bold));
      }
      lineText.setLength(0);
      maxFontSize = 0f;
      bold = false;
    }

    private static float fontSize(TextPosition pos) {
      float size = pos.getFontSizeInPt();
      return size > 0 ? size : pos.getFontSize();
    }

    private static boolean isBold(PDFont font) {
      return font != null
          && font.getName() != null
          && font.getName().toLowerCase(Locale.ROOT).contains("bold");
    }
  }

  /**
   * Metadata for a single line of text in a PDF.
   *
   * @param text concatenated Unicode text of the line
   * @param maxFontSize largest font size among the line's glyphs
   * @param bold whether any glyph of the line uses a bold font
   */
  record LineInfo(String text, float maxFontSize, boolean bold) {}
}
