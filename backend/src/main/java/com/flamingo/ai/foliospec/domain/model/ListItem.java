package com.flamingo.ai.foliospec.domain.model;

import java.util.List;

/**
 * One entry of a list block.
 *
 * @param text plain item text
 * @param runs inline formatting detail, possibly empty
 */
public record ListItem(String text, List<Run> runs) {

  public ListItem {
    text = text == null ? "" : text;
    runs = runs == null ? List.of() : List.copyOf(runs);
  }
}
