package com.flamingo.ai.foliospec.domain.model;

import java.util.List;

/**
 * Blocks of one page, in reading order.
 *
 * @param pageNumber 1-based page number
 * @param blocks ordered blocks
 */
public record ExtractedPage(int pageNumber, List<Block> blocks) {

  public ExtractedPage {
    blocks = blocks == null ? List.of() : List.copyOf(blocks);
  }
}
