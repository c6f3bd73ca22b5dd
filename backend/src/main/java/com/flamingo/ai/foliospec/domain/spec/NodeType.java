package com.flamingo.ai.foliospec.domain.spec;

import java.util.Arrays;

/**
 * Closed vocabulary of canonical tree node types.
 *
 * <p>On the wire a type is a fully-qualified tag: {@link #NAMESPACE} followed by the type name,
 * e.g. {@code https://spec.nldoc.nl/Resource/Heading}. Tags are resolved by their last path
 * segment so readers do not depend on the exact namespace. {@link #UNKNOWN} stands for any tag
 * outside the vocabulary and is never produced by the builder.
 */
public enum NodeType {
  DOCUMENT("Document"),
  HEADING("Heading"),
  PARAGRAPH("Paragraph"),
  TEXT("Text"),
  TABLE("Table"),
  TABLE_HEADER_ROW("TableHeaderRow"),
  TABLE_ROW("TableRow"),
  TABLE_CELL("TableCell"),
  BULLET_LIST("BulletList"),
  ORDERED_LIST("OrderedList"),
  LIST_ITEM("ListItem"),
  UNKNOWN("Unknown");

  public static final String NAMESPACE = "https://spec.nldoc.nl/Resource/";

  private final String typeName;

  NodeType(String typeName) {
    this.typeName = typeName;
  }

  public String typeName() {
    return typeName;
  }

  public String tag() {
    return NAMESPACE + typeName;
  }

  /**
   * Resolves a type tag by its last path segment.
   *
   * @param tag fully-qualified or bare type tag
   * @return matching type, {@link #UNKNOWN} otherwise
   */
  public static NodeType fromTag(String tag) {
    if (tag == null || tag.isBlank()) {
      return UNKNOWN;
    }
    String name = tag.substring(tag.lastIndexOf('/') + 1);
    return Arrays.stream(values())
        .filter(t -> t != UNKNOWN && t.typeName.equals(name))
        .findFirst()
        .orElse(UNKNOWN);
  }
}
