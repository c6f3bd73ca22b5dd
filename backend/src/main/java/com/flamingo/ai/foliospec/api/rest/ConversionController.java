package com.flamingo.ai.foliospec.api.rest;

import com.flamingo.ai.foliospec.api.dto.request.ConversionRequest;
import com.flamingo.ai.foliospec.api.dto.response.ConversionResponse;
import com.flamingo.ai.foliospec.config.ConversionConfig;
import com.flamingo.ai.foliospec.exception.DocumentConversionException;
import com.flamingo.ai.foliospec.service.conversion.DocumentConversionService;
import com.flamingo.ai.foliospec.service.conversion.InMemoryConversion;
import com.flamingo.ai.foliospec.service.render.HtmlRenderer;
import com.flamingo.ai.foliospec.service.render.TipTapRenderer;
import com.flamingo.ai.foliospec.service.spec.SpecTreeCodec;
import jakarta.validation.Valid;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

/** REST controller for document conversions. */
@RestController
@RequestMapping("/api/conversions")
@RequiredArgsConstructor
public class ConversionController {

  private final DocumentConversionService conversionService;
  private final SpecTreeCodec specTreeCodec;
  private final HtmlRenderer htmlRenderer;
  private final TipTapRenderer tipTapRenderer;
  private final ConversionConfig conversionConfig;

  /** Converts a stored document and writes the results back to the blob store. */
  @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<ConversionResponse> convert(@Valid @RequestBody ConversionRequest request) {
    ConversionResponse response =
        ConversionResponse.fromResult(conversionService.convert(request.toJob()));
    return ResponseEntity.status(HttpStatus.CREATED).body(response);
  }

  /**
   * Converts an uploaded document and returns the rendering directly: TipTap JSON for the TipTap
   * content type, the canonical tree for {@code application/json}, HTML otherwise.
   */
  @PostMapping(value = "/inline", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
  public ResponseEntity<byte[]> convertInline(
      @RequestParam("file") MultipartFile file,
      @RequestParam(value = "targetFileType", required = false) String targetFileType,
      @RequestParam(value = "pageCount", required = false) Integer pageCount) {
    byte[] content;
    try {
      content = file.getBytes();
    } catch (IOException e) {
      throw new DocumentConversionException(
          file.getOriginalFilename(), "Failed to read upload: " + e.getMessage(), e);
    }
    InMemoryConversion conversion = conversionService.convert(content, pageCount);

    String tiptapContentType = conversionConfig.getTiptap().getContentType();
    if (tiptapContentType.equals(targetFileType)) {
      return ResponseEntity.ok()
          .contentType(MediaType.parseMediaType(tiptapContentType))
          .body(tipTapRenderer.renderJson(conversion.tree()));
    }
    if (MediaType.APPLICATION_JSON_VALUE.equals(targetFileType)) {
      return ResponseEntity.ok()
          .contentType(MediaType.APPLICATION_JSON)
          .body(specTreeCodec.write(conversion.tree()));
    }
    return ResponseEntity.ok()
        .contentType(new MediaType(MediaType.TEXT_HTML, StandardCharsets.UTF_8))
        .body(htmlRenderer.render(conversion.tree()).getBytes(StandardCharsets.UTF_8));
  }
}
