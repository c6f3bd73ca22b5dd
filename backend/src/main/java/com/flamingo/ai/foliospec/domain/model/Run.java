package com.flamingo.ai.foliospec.domain.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * A span of text inside a block carrying independent formatting marks.
 *
 * @param text run text, never null
 * @param marks formatting marks; unordered
 */
public record Run(String text, Set<Mark> marks) {

  public Run {
    text = text == null ? "" : text;
    marks = marks == null || marks.isEmpty() ? Set.of() : Set.copyOf(EnumSet.copyOf(marks));
  }

  public static Run plain(String text) {
    return new Run(text, Set.of());
  }

  public boolean has(Mark mark) {
    return marks.contains(mark);
  }
}
