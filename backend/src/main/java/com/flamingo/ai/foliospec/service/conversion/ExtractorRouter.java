package com.flamingo.ai.foliospec.service.conversion;

import com.flamingo.ai.foliospec.domain.model.ExtractedDocument;
import com.flamingo.ai.foliospec.domain.model.FileType;
import com.flamingo.ai.foliospec.service.extraction.DocumentExtractor;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Routes a detected {@link FileType} to the matching {@link DocumentExtractor}.
 *
 * <p>Extractors are injected by Spring in {@code @Order} order (PDF first, then DOCX). A known type
 * goes to the first extractor that supports it. For {@link FileType#UNKNOWN} every extractor is
 * tried in order and the first result that carries at least one block wins.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ExtractorRouter {

  private final List<DocumentExtractor> extractors;

  /**
   * Extracts {@code content} as {@code fileType}.
   *
   * @return extracted document, empty when no extractor produced a usable result
   */
  public Optional<ExtractedDocument> extract(FileType fileType, byte[] content) {
    if (content == null || content.length == 0) {
      return Optional.empty();
    }
    if (fileType != FileType.UNKNOWN) {
      return extractors.stream()
          .filter(e -> e.supports(fileType))
          .findFirst()
          .flatMap(e -> e.extract(content));
    }
    for (DocumentExtractor extractor : extractors) {
      Optional<ExtractedDocument> result = extractor.extract(content);
      if (result.isPresent() && result.get().hasContent()) {
        log.debug("Unknown format read by {}", extractor.getClass().getSimpleName());
        return result;
      }
    }
    log.warn("No extractor could read document of unknown format ({} bytes)", content.length);
    return Optional.empty();
  }
}
