package com.flamingo.ai.foliospec.api.dto.request;

import com.flamingo.ai.foliospec.service.conversion.ConversionJob;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for converting a document held in the blob store. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConversionRequest {

  /** Optional id; a {@code recordId}-style value is cut after its last {@code |||}. */
  private String documentId;

  @NotBlank(message = "Bucket name is required")
  private String bucketName;

  @NotBlank(message = "Filename is required")
  private String filename;

  private String targetFileType;

  @Positive(message = "Page count must be positive")
  private Integer pageCount;

  public ConversionJob toJob() {
    return new ConversionJob(documentId, bucketName, filename, targetFileType, pageCount);
  }
}
