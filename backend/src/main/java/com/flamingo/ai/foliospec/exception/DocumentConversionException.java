package com.flamingo.ai.foliospec.exception;

/** Exception thrown when a conversion job cannot be carried out. */
public class DocumentConversionException extends RuntimeException {

  private final String documentId;
  private final String userMessage;

  public DocumentConversionException(String documentId, String message) {
    super(message);
    this.documentId = documentId;
    this.userMessage = "Failed to convert document";
  }

  public DocumentConversionException(String documentId, String message, Throwable cause) {
    super(message, cause);
    this.documentId = documentId;
    this.userMessage = "Failed to convert document";
  }

  public DocumentConversionException(String documentId, String message, String userMessage) {
    super(message);
    this.documentId = documentId;
    this.userMessage = userMessage;
  }

  public String getDocumentId() {
    return documentId;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
