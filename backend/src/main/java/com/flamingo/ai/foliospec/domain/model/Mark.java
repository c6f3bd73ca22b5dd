package com.flamingo.ai.foliospec.domain.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Inline formatting attribute of a {@link Run}.
 *
 * <p>Declaration order is the canonical mark order: bold, then italic, then underline. Both the
 * canonical tree and the HTML renderer rely on it.
 */
public enum Mark {
  BOLD("bold", "strong"),
  ITALIC("italic", "em"),
  UNDERLINE("underline", null);

  private final String tag;
  private final String alias;

  Mark(String tag, String alias) {
    this.tag = tag;
    this.alias = alias;
  }

  /** Tag written to the canonical tree and to TipTap, e.g. {@code "bold"}. */
  public String tag() {
    return tag;
  }

  /**
   * Resolves a mark tag, accepting the HTML-style aliases {@code strong} and {@code em}.
   *
   * @param tag mark tag as found in a canonical tree
   * @return the mark, or empty for unknown tags
   */
  public static Optional<Mark> fromTag(String tag) {
    if (tag == null) {
      return Optional.empty();
    }
    String normalized = tag.trim().toLowerCase(Locale.ROOT);
    return Arrays.stream(values())
        .filter(m -> m.tag.equals(normalized) || normalized.equals(m.alias))
        .findFirst();
  }
}
