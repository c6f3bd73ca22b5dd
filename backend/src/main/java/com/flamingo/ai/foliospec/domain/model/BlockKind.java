package com.flamingo.ai.foliospec.domain.model;

/** Kind of a transient extractor block. */
public enum BlockKind {
  HEADING,
  PARAGRAPH,
  TABLE,
  BULLET_LIST,
  ORDERED_LIST
}
