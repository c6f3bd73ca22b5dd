package com.flamingo.ai.foliospec.service.extraction.docx;

/** Kind of list a DOCX paragraph belongs to. */
public enum ListType {
  BULLET,
  ORDERED
}
