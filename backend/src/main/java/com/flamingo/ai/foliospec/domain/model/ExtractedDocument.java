package com.flamingo.ai.foliospec.domain.model;

import java.util.List;

/**
 * Output of a {@link com.flamingo.ai.foliospec.service.extraction.DocumentExtractor}.
 *
 * @param sourceType format the document was read as
 * @param pages ordered pages; DOCX documents always yield a single logical page
 */
public record ExtractedDocument(FileType sourceType, List<ExtractedPage> pages) {

  public ExtractedDocument {
    pages = pages == null ? List.of() : List.copyOf(pages);
  }

  /** Returns all blocks in page order. */
  public List<Block> blocks() {
    return pages.stream().flatMap(p -> p.blocks().stream()).toList();
  }

  public boolean hasContent() {
    return pages.stream().anyMatch(p -> !p.blocks().isEmpty());
  }
}
