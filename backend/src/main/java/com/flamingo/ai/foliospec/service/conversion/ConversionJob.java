package com.flamingo.ai.foliospec.service.conversion;

/**
 * A request to convert one stored document.
 *
 * @param documentId explicit document id, may be null
 * @param bucketName bucket holding the source document
 * @param filename object key of the source document
 * @param targetFileType requested output content type, may be null
 * @param pageCount expected page count used in the fallback text, may be null
 */
public record ConversionJob(
    String documentId,
    String bucketName,
    String filename,
    String targetFileType,
    Integer pageCount) {

  static final String RECORD_ID_SEPARATOR = "|||";

  /**
   * Id used to name the output objects: the explicit id when set, with any {@code recordId}-style
   * prefix (everything up to the last {@code |||}) removed; the filename otherwise.
   */
  public String resolveDocumentId() {
    if (documentId == null || documentId.isBlank()) {
      return filename;
    }
    int separator = documentId.lastIndexOf(RECORD_ID_SEPARATOR);
    if (separator < 0) {
      return documentId;
    }
    String tail = documentId.substring(separator + RECORD_ID_SEPARATOR.length());
    return tail.isBlank() ? filename : tail;
  }
}
