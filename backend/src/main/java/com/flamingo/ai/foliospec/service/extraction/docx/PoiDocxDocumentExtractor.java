package com.flamingo.ai.foliospec.service.extraction.docx;

import com.flamingo.ai.foliospec.config.ConversionConfig;
import com.flamingo.ai.foliospec.domain.model.Block;
import com.flamingo.ai.foliospec.domain.model.ExtractedDocument;
import com.flamingo.ai.foliospec.domain.model.ExtractedPage;
import com.flamingo.ai.foliospec.domain.model.FileType;
import com.flamingo.ai.foliospec.domain.model.ListItem;
import com.flamingo.ai.foliospec.domain.model.Mark;
import com.flamingo.ai.foliospec.domain.model.Run;
import com.flamingo.ai.foliospec.service.extraction.DocumentExtractor;
import com.flamingo.ai.foliospec.service.extraction.EncodingFixer;
import java.io.ByteArrayInputStream;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.xwpf.usermodel.IBodyElement;
import org.apache.poi.xwpf.usermodel.UnderlinePatterns;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.apache.poi.xwpf.usermodel.XWPFRun;
import org.apache.poi.xwpf.usermodel.XWPFStyle;
import org.apache.poi.xwpf.usermodel.XWPFStyles;
import org.apache.poi.xwpf.usermodel.XWPFTable;
import org.apache.poi.xwpf.usermodel.XWPFTableCell;
import org.apache.poi.xwpf.usermodel.XWPFTableRow;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

/**
 * {@link DocumentExtractor} for Word documents, based on Apache POI XWPF.
 *
 * <p>Body elements are walked in document order. Paragraphs are classified as heading, list item
 * or plain paragraph by {@link DocxParagraphClassifier}; consecutive list items of the same type
 * are grouped through {@link ListStateMachine}. Tables become row/cell text grids. DOCX has no
 * stable page concept, so all blocks land on page 1.
 */
@Service
@Order(2)
@Slf4j
public class PoiDocxDocumentExtractor implements DocumentExtractor {

  private final DocxParagraphClassifier classifier;

  public PoiDocxDocumentExtractor(ConversionConfig conversionConfig) {
    this.classifier = new DocxParagraphClassifier(conversionConfig.getDocx());
  }

  @Override
  public Optional<ExtractedDocument> extract(byte[] content) {
    try (XWPFDocument document = new XWPFDocument(new ByteArrayInputStream(content))) {
      List<Block> blocks = new ArrayList<>();
      ListState state = ListState.NO_LIST;
      for (IBodyElement element : document.getBodyElements()) {
        ListStateMachine.Step step;
        if (element instanceof XWPFParagraph paragraph) {
          step = onParagraph(document, paragraph, state);
        } else if (element instanceof XWPFTable table) {
          step = ListStateMachine.onBlock(state, Block.table(tableRows(table)));
        } else {
          continue;
        }
        blocks.addAll(step.emitted());
        state = step.next();
      }
      blocks.addAll(ListStateMachine.finish(state));
      log.debug("DOCX extraction produced {} blocks", blocks.size());
      return Optional.of(
          new ExtractedDocument(FileType.DOCX, List.of(new ExtractedPage(1, blocks))));
    } catch (Exception e) {
      log.error("POI DOCX extraction failed: {}", e.getMessage());
      return Optional.empty();
    }
  }

  @Override
  public boolean supports(FileType fileType) {
    return fileType == FileType.DOCX;
  }

  private ListStateMachine.Step onParagraph(
      XWPFDocument document, XWPFParagraph paragraph, ListState state) {
    String text = EncodingFixer.fix(paragraph.getText()).strip();
    if (text.isEmpty()) {
      return ListStateMachine.onBreak(state);
    }
    String styleName = styleName(document, paragraph);

    Optional<Integer> headingLevel = classifier.headingLevel(styleName);
    if (headingLevel.isPresent()) {
      return ListStateMachine.onBlock(
          state, Block.heading(headingLevel.get(), text, runs(paragraph, text)));
    }

    Optional<ListType> listType = classifier.listType(paragraph.getNumID(), styleName, text);
    if (listType.isPresent()) {
      return ListStateMachine.onListItem(
          state, listType.get(), new ListItem(text, runs(paragraph, text)));
    }

    List<XWPFRun> runs = paragraph.getRuns();
    if (!runs.isEmpty()) {
      XWPFRun first = runs.get(0);
      if (classifier.isBoldHeading(first.isBold(), first.getFontSizeAsDouble(), text)) {
        return ListStateMachine.onBlock(
            state, Block.heading(classifier.boldHeadingLevel(), text, runs(paragraph, text)));
      }
    }
    return ListStateMachine.onBlock(state, Block.paragraph(text, runs(paragraph, text)));
  }

  /** Style display name, falling back to the style id when the document has no styles part. */
  private static String styleName(XWPFDocument document, XWPFParagraph paragraph) {
    String styleId = paragraph.getStyle();
    if (styleId == null) {
      return "";
    }
    XWPFStyles styles = document.getStyles();
    if (styles != null) {
      XWPFStyle style = styles.getStyle(styleId);
      if (style != null && style.getName() != null) {
        return style.getName();
      }
    }
    return styleId;
  }

  private static List<Run> runs(XWPFParagraph paragraph, String fallbackText) {
    List<Run> runs = new ArrayList<>();
    for (XWPFRun run : paragraph.getRuns()) {
      String text = run.text();
      if (text == null || text.isEmpty()) {
        continue;
      }
      Set<Mark> marks = EnumSet.noneOf(Mark.class);
      if (run.isBold()) {
        marks.add(Mark.BOLD);
      }
      if (run.isItalic()) {
        marks.add(Mark.ITALIC);
      }
      UnderlinePatterns underline = run.getUnderline();
      if (underline != null && underline != UnderlinePatterns.NONE) {
        marks.add(Mark.UNDERLINE);
      }
      runs.add(new Run(EncodingFixer.fix(text), marks));
    }
    return runs.isEmpty() ? List.of(Run.plain(fallbackText)) : runs;
  }

  private static List<List<String>> tableRows(XWPFTable table) {
    List<List<String>> rows = new ArrayList<>();
    for (XWPFTableRow row : table.getRows()) {
      List<String> cells = new ArrayList<>();
      for (XWPFTableCell cell : row.getTableCells()) {
        cells.add(
            cell.getParagraphs().stream()
                .map(p -> EncodingFixer.fix(p.getText()))
                .collect(Collectors.joining("\n")));
      }
      rows.add(cells);
    }
    return rows;
  }
}
