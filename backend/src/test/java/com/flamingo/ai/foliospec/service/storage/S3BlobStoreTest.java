package com.flamingo.ai.foliospec.service.storage;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.foliospec.exception.BlobStoreException;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import software.amazon.awssdk.core.ResponseBytes;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.CreateBucketRequest;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectResponse;
import software.amazon.awssdk.services.s3.model.HeadBucketRequest;
import software.amazon.awssdk.services.s3.model.HeadBucketResponse;
import software.amazon.awssdk.services.s3.model.NoSuchBucketException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;

@ExtendWith(MockitoExtension.class)
@DisplayName("S3BlobStore Tests")
class S3BlobStoreTest {

  @Mock private S3Client s3Client;

  private S3BlobStore blobStore;

  @BeforeEach
  void setUp() {
    blobStore = new S3BlobStore(s3Client);
  }

  @Test
  @DisplayName("should send a range header for partial reads")
  void shouldSendRangeHeader() {
    byte[] bytes = "%PDF-1.7".getBytes(StandardCharsets.US_ASCII);
    when(s3Client.getObjectAsBytes(any(GetObjectRequest.class)))
        .thenReturn(ResponseBytes.fromByteArray(GetObjectResponse.builder().build(), bytes));

    assertThat(blobStore.get("input", "doc.pdf", ByteRange.prefix(8))).isEqualTo(bytes);

    ArgumentCaptor<GetObjectRequest> captor = ArgumentCaptor.forClass(GetObjectRequest.class);
    verify(s3Client).getObjectAsBytes(captor.capture());
    assertThat(captor.getValue().bucket()).isEqualTo("input");
    assertThat(captor.getValue().key()).isEqualTo("doc.pdf");
    assertThat(captor.getValue().range()).isEqualTo("bytes=0-7");
  }

  @Test
  @DisplayName("should wrap SDK failures in BlobStoreException")
  void shouldWrapReadFailures() {
    when(s3Client.getObjectAsBytes(any(GetObjectRequest.class)))
        .thenThrow(SdkClientException.create("connection refused"));

    assertThatThrownBy(() -> blobStore.get("input", "doc.pdf"))
        .isInstanceOf(BlobStoreException.class)
        .satisfies(
            e -> {
              assertThat(((BlobStoreException) e).getBucket()).isEqualTo("input");
              assertThat(((BlobStoreException) e).getKey()).isEqualTo("doc.pdf");
            });
  }

  @Test
  @DisplayName("should write objects with their content type")
  void shouldPutWithContentType() {
    blobStore.put("output", "doc.html", new byte[] {1, 2}, "text/html; charset=utf-8");

    ArgumentCaptor<PutObjectRequest> captor = ArgumentCaptor.forClass(PutObjectRequest.class);
    verify(s3Client).putObject(captor.capture(), any(RequestBody.class));
    assertThat(captor.getValue().bucket()).isEqualTo("output");
    assertThat(captor.getValue().key()).isEqualTo("doc.html");
    assertThat(captor.getValue().contentType()).isEqualTo("text/html; charset=utf-8");
    assertThat(captor.getValue().contentLength()).isEqualTo(2L);
  }

  @Test
  @DisplayName("should create a missing bucket once")
  void shouldCreateMissingBucketOnce() {
    when(s3Client.headBucket(any(HeadBucketRequest.class)))
        .thenThrow(NoSuchBucketException.builder().message("no bucket").build());

    blobStore.ensureBucket("output");
    blobStore.ensureBucket("output");

    verify(s3Client, times(1)).headBucket(any(HeadBucketRequest.class));
    verify(s3Client).createBucket(any(CreateBucketRequest.class));
  }

  @Test
  @DisplayName("should leave existing buckets alone")
  void shouldNotCreateExistingBucket() {
    when(s3Client.headBucket(any(HeadBucketRequest.class)))
        .thenReturn(HeadBucketResponse.builder().build());

    blobStore.ensureBucket("files");

    verify(s3Client, never()).createBucket(any(CreateBucketRequest.class));
  }
}
