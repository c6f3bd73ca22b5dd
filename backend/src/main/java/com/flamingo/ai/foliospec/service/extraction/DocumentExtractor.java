package com.flamingo.ai.foliospec.service.extraction;

import com.flamingo.ai.foliospec.domain.model.ExtractedDocument;
import com.flamingo.ai.foliospec.domain.model.FileType;
import java.util.Optional;

/**
 * Turns raw document bytes into ordered pages of typed blocks.
 *
 * <p>Implementations are format-specific (PDF, DOCX). They must be stateless so a single instance
 * can be shared across concurrent conversions, and they must not throw on malformed input: a
 * document that cannot be read yields {@link Optional#empty()}.
 */
public interface DocumentExtractor {

  /**
   * Extracts the document structure.
   *
   * @param content complete document bytes
   * @return extracted pages, or empty when the bytes cannot be read as this format
   */
  Optional<ExtractedDocument> extract(byte[] content);

  /**
   * Returns {@code true} if this extractor reads the given format.
   *
   * @param fileType sniffed file type
   * @return {@code true} if supported
   */
  boolean supports(FileType fileType);
}
