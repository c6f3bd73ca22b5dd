package com.flamingo.ai.foliospec.exception;

/** Exception thrown when the blob store cannot serve a read or accept a write. */
public class BlobStoreException extends RuntimeException {

  private final String bucket;
  private final String key;

  public BlobStoreException(String bucket, String key, String message, Throwable cause) {
    super(message, cause);
    this.bucket = bucket;
    this.key = key;
  }

  public String getBucket() {
    return bucket;
  }

  public String getKey() {
    return key;
  }

  public String getUserMessage() {
    return "Document storage is unavailable";
  }
}
