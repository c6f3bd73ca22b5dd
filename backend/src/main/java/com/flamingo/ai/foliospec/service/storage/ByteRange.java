package com.flamingo.ai.foliospec.service.storage;

/**
 * Inclusive byte range of a stored object.
 *
 * @param offset first byte, zero-based
 * @param length number of bytes, at least 1
 */
public record ByteRange(long offset, long length) {

  public ByteRange {
    if (offset < 0 || length < 1) {
      throw new IllegalArgumentException(
          "Invalid byte range: offset=" + offset + " length=" + length);
    }
  }

  /** Range covering the first {@code length} bytes. */
  public static ByteRange prefix(long length) {
    return new ByteRange(0, length);
  }

  /** HTTP {@code Range} header value, e.g. {@code bytes=0-7}. */
  public String toHeader() {
    return "bytes=" + offset + "-" + (offset + length - 1);
  }
}
