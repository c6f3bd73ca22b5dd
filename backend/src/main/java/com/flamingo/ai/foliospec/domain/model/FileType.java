package com.flamingo.ai.foliospec.domain.model;

/** Document format detected from the leading magic bytes. */
public enum FileType {
  PDF("application/pdf"),
  DOCX("application/vnd.openxmlformats-officedocument.wordprocessingml.document"),
  UNKNOWN("application/octet-stream");

  private final String mimeType;

  FileType(String mimeType) {
    this.mimeType = mimeType;
  }

  public String mimeType() {
    return mimeType;
  }
}
