package com.flamingo.ai.foliospec.service.conversion;

import com.flamingo.ai.foliospec.config.ConversionConfig;
import com.flamingo.ai.foliospec.domain.model.Block;
import com.flamingo.ai.foliospec.domain.model.ExtractedDocument;
import com.flamingo.ai.foliospec.domain.model.FileType;
import com.flamingo.ai.foliospec.domain.spec.SpecNode;
import com.flamingo.ai.foliospec.exception.BlobStoreException;
import com.flamingo.ai.foliospec.exception.DocumentConversionException;
import com.flamingo.ai.foliospec.service.extraction.FileTypeSniffer;
import com.flamingo.ai.foliospec.service.render.HtmlRenderer;
import com.flamingo.ai.foliospec.service.render.TipTapRenderer;
import com.flamingo.ai.foliospec.service.spec.BuiltTree;
import com.flamingo.ai.foliospec.service.spec.SpecTreeBuilder;
import com.flamingo.ai.foliospec.service.spec.SpecTreeCodec;
import com.flamingo.ai.foliospec.service.storage.BlobStore;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Orchestrates a conversion: sniff, download, extract, build the canonical tree, render and store.
 *
 * <p>Malformed or unreadable input never fails the job; it ends up as a tree holding the fallback
 * paragraph. Only blob-store writes and invalid jobs raise.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DocumentConversionService {

  static final String SPEC_CONTENT_TYPE = "application/json";
  static final String HTML_CONTENT_TYPE = "text/html; charset=utf-8";

  private final BlobStore blobStore;
  private final FileTypeSniffer fileTypeSniffer;
  private final ExtractorRouter extractorRouter;
  private final SpecTreeBuilder specTreeBuilder;
  private final SpecTreeCodec specTreeCodec;
  private final HtmlRenderer htmlRenderer;
  private final TipTapRenderer tipTapRenderer;
  private final ConversionConfig conversionConfig;
  private final MeterRegistry meterRegistry;

  /**
   * Converts a stored document and writes the canonical tree and its renderings back to the blob
   * store.
   *
   * @param job conversion request
   * @return locations of the written artifacts
   * @throws DocumentConversionException if the job does not name a source document
   * @throws BlobStoreException if an output cannot be written
   */
  @Timed(value = "document.convert", description = "Time to convert a stored document")
  public ConversionResult convert(ConversionJob job) {
    if (job.bucketName() == null
        || job.bucketName().isBlank()
        || job.filename() == null
        || job.filename().isBlank()) {
      throw new DocumentConversionException(
          job.documentId(), "Job has no source document", "Bucket name and filename are required");
    }
    String docId = job.resolveDocumentId();
    log.info("Converting document {} from {}/{}", docId, job.bucketName(), job.filename());

    FileType fileType = fileTypeSniffer.sniff(blobStore, job.bucketName(), job.filename());
    byte[] content = download(job);
    InMemoryConversion conversion = convert(fileType, content, job.pageCount());

    ConversionConfig.Storage storage = conversionConfig.getStorage();
    if (storage.isCreateBuckets()) {
      blobStore.ensureBucket(storage.getSpecBucket());
      blobStore.ensureBucket(storage.getOutputBucket());
    }

    String specKey = docId + ".spec.json";
    blobStore.put(
        storage.getSpecBucket(),
        specKey,
        specTreeCodec.write(conversion.tree()),
        SPEC_CONTENT_TYPE);

    String htmlKey = docId + ".html";
    blobStore.put(
        storage.getOutputBucket(),
        htmlKey,
        htmlRenderer.render(conversion.tree()).getBytes(StandardCharsets.UTF_8),
        HTML_CONTENT_TYPE);

    String htmlLocation = storage.getOutputBucket() + "/" + htmlKey;
    String tiptapLocation = null;
    String location = htmlLocation;
    String contentType = HTML_CONTENT_TYPE;
    String tiptapContentType = conversionConfig.getTiptap().getContentType();
    if (tiptapContentType.equals(job.targetFileType())) {
      String tiptapKey = docId + ".json";
      blobStore.put(
          storage.getOutputBucket(),
          tiptapKey,
          tipTapRenderer.renderJson(conversion.tree()),
          tiptapContentType);
      tiptapLocation = storage.getOutputBucket() + "/" + tiptapKey;
      location = tiptapLocation;
      contentType = tiptapContentType;
    }

    log.info(
        "Converted document {} ({}, {} blocks, fallback={}) to {}",
        docId,
        conversion.detectedType(),
        conversion.blockCount(),
        conversion.fallbackUsed(),
        location);
    return new ConversionResult(
        docId,
        conversion.detectedType(),
        conversion.blockCount(),
        conversion.fallbackUsed(),
        storage.getSpecBucket() + "/" + specKey,
        htmlLocation,
        tiptapLocation,
        location,
        contentType);
  }

  /**
   * Converts bytes the caller already holds, without touching the blob store.
   *
   * @param content document bytes
   * @param pageCount expected page count for the fallback text, may be null
   */
  @Timed(value = "document.convert.inline", description = "Time to convert an uploaded document")
  public InMemoryConversion convert(byte[] content, Integer pageCount) {
    byte[] prefix =
        content == null
            ? new byte[0]
            : Arrays.copyOf(content, Math.min(content.length, FileTypeSniffer.PREFIX_LENGTH));
    return convert(fileTypeSniffer.sniff(prefix), content, pageCount);
  }

  private InMemoryConversion convert(FileType fileType, byte[] content, Integer pageCount) {
    List<Block> blocks =
        extractorRouter
            .extract(fileType, content)
            .map(ExtractedDocument::blocks)
            .orElse(List.of());
    int pages =
        pageCount != null ? pageCount : conversionConfig.getFallback().getDefaultPageCount();
    BuiltTree built = specTreeBuilder.buildTree(blocks, pages);
    SpecNode tree = built.root();
    boolean fallback = built.fallback();

    meterRegistry
        .counter("document.conversions", "type", fileType.name().toLowerCase(Locale.ROOT))
        .increment();
    if (fallback) {
      meterRegistry.counter("document.conversions.fallback").increment();
      log.warn(
          "No content extracted ({}, {} blocks), using fallback paragraph",
          fileType,
          blocks.size());
    }
    log.debug("Built spec tree with {} top-level nodes", tree.children().size());
    return new InMemoryConversion(fileType, blocks.size(), fallback, tree);
  }

  private byte[] download(ConversionJob job) {
    try {
      return blobStore.get(job.bucketName(), job.filename());
    } catch (BlobStoreException e) {
      log.error("Failed to download {}/{}: {}", job.bucketName(), job.filename(), e.getMessage());
      return new byte[0];
    }
  }
}
