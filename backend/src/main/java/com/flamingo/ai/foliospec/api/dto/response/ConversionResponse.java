package com.flamingo.ai.foliospec.api.dto.response;

import com.flamingo.ai.foliospec.domain.model.FileType;
import com.flamingo.ai.foliospec.service.conversion.ConversionResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO describing where the outputs of a conversion were written. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConversionResponse {

  private String documentId;
  private FileType detectedType;
  private int blockCount;
  private boolean fallbackUsed;
  private String specLocation;
  private String htmlLocation;
  private String tiptapLocation;
  private String location;
  private String contentType;

  /** Creates a ConversionResponse from a service result. */
  public static ConversionResponse fromResult(ConversionResult result) {
    return ConversionResponse.builder()
        .documentId(result.documentId())
        .detectedType(result.detectedType())
        .blockCount(result.blockCount())
        .fallbackUsed(result.fallbackUsed())
        .specLocation(result.specLocation())
        .htmlLocation(result.htmlLocation())
        .tiptapLocation(result.tiptapLocation())
        .location(result.location())
        .contentType(result.contentType())
        .build();
  }
}
