package com.flamingo.ai.foliospec.domain.model;

import java.util.List;

/**
 * Unit of document content produced by an extractor, before canonicalization.
 *
 * <p>Only the fields relevant to the {@link #kind()} are populated: {@code level} for headings,
 * {@code rows} for tables, {@code items} for lists. {@code runs} is optional inline detail for
 * headings and paragraphs.
 *
 * @param kind block kind
 * @param text plain text (empty for tables and lists)
 * @param level heading level 1–6, 0 for other kinds
 * @param runs inline runs, possibly empty
 * @param rows table rows of cell texts
 * @param items list items
 */
public record Block(
    BlockKind kind,
    String text,
    int level,
    List<Run> runs,
    List<List<String>> rows,
    List<ListItem> items) {

  public Block {
    text = text == null ? "" : text;
    runs = runs == null ? List.of() : List.copyOf(runs);
    rows = rows == null ? List.of() : rows.stream().map(List::copyOf).toList();
    items = items == null ? List.of() : List.copyOf(items);
  }

  public static Block heading(int level, String text, List<Run> runs) {
    return new Block(BlockKind.HEADING, text, level, runs, null, null);
  }

  public static Block paragraph(String text, List<Run> runs) {
    return new Block(BlockKind.PARAGRAPH, text, 0, runs, null, null);
  }

  public static Block table(List<List<String>> rows) {
    return new Block(BlockKind.TABLE, "", 0, null, rows, null);
  }

  public static Block list(boolean ordered, List<ListItem> items) {
    BlockKind kind = ordered ? BlockKind.ORDERED_LIST : BlockKind.BULLET_LIST;
    return new Block(kind, "", 0, null, null, items);
  }
}
