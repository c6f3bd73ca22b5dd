package com.flamingo.ai.foliospec.service.storage;

/**
 * Bucket/key object store holding source documents and conversion outputs.
 *
 * <p>Failures surface as {@link com.flamingo.ai.foliospec.exception.BlobStoreException}.
 */
public interface BlobStore {

  /** Reads a whole object. */
  byte[] get(String bucket, String key);

  /** Reads part of an object. Objects shorter than the range return what is available. */
  byte[] get(String bucket, String key, ByteRange range);

  /** Writes an object, replacing any previous version. */
  void put(String bucket, String key, byte[] content, String contentType);

  /** Creates {@code bucket} if it does not exist yet. */
  default void ensureBucket(String bucket) {}
}
