package com.flamingo.ai.foliospec.service.storage;

import com.flamingo.ai.foliospec.exception.BlobStoreException;
import io.github.resilience4j.retry.annotation.Retry;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.CreateBucketRequest;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadBucketRequest;
import software.amazon.awssdk.services.s3.model.NoSuchBucketException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;

/** {@link BlobStore} backed by an S3-compatible endpoint such as MinIO. */
@Service
@RequiredArgsConstructor
@Slf4j
public class S3BlobStore implements BlobStore {

  private final S3Client blobStoreS3Client;

  private final Set<String> knownBuckets = ConcurrentHashMap.newKeySet();

  @Override
  @Retry(name = "blobStore")
  public byte[] get(String bucket, String key) {
    return read(GetObjectRequest.builder().bucket(bucket).key(key).build());
  }

  @Override
  @Retry(name = "blobStore")
  public byte[] get(String bucket, String key, ByteRange range) {
    return read(GetObjectRequest.builder().bucket(bucket).key(key).range(range.toHeader()).build());
  }

  @Override
  @Retry(name = "blobStore")
  public void put(String bucket, String key, byte[] content, String contentType) {
    try {
      blobStoreS3Client.putObject(
          PutObjectRequest.builder()
              .bucket(bucket)
              .key(key)
              .contentType(contentType)
              .contentLength((long) content.length)
              .build(),
          RequestBody.fromBytes(content));
      log.debug("Stored {}/{} ({} bytes, {})", bucket, key, content.length, contentType);
    } catch (SdkException e) {
      throw new BlobStoreException(bucket, key, "Failed to write " + bucket + "/" + key, e);
    }
  }

  @Override
  public void ensureBucket(String bucket) {
    if (knownBuckets.contains(bucket)) {
      return;
    }
    try {
      blobStoreS3Client.headBucket(HeadBucketRequest.builder().bucket(bucket).build());
    } catch (NoSuchBucketException e) {
      createBucket(bucket);
    } catch (S3Exception e) {
      if (e.statusCode() != 404) {
        throw new BlobStoreException(bucket, null, "Failed to inspect bucket " + bucket, e);
      }
      createBucket(bucket);
    } catch (SdkException e) {
      throw new BlobStoreException(bucket, null, "Failed to inspect bucket " + bucket, e);
    }
    knownBuckets.add(bucket);
  }

  private void createBucket(String bucket) {
    try {
      blobStoreS3Client.createBucket(CreateBucketRequest.builder().bucket(bucket).build());
      log.info("Created bucket {}", bucket);
    } catch (SdkException e) {
      throw new BlobStoreException(bucket, null, "Failed to create bucket " + bucket, e);
    }
  }

  private byte[] read(GetObjectRequest request) {
    try {
      return blobStoreS3Client.getObjectAsBytes(request).asByteArray();
    } catch (SdkException e) {
      throw new BlobStoreException(
          request.bucket(),
          request.key(),
          "Failed to read " + request.bucket() + "/" + request.key(),
          e);
    }
  }
}
