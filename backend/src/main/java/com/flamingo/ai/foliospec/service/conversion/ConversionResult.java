package com.flamingo.ai.foliospec.service.conversion;

import com.flamingo.ai.foliospec.domain.model.FileType;

/**
 * Outcome of a stored-document conversion.
 *
 * @param documentId resolved document id
 * @param detectedType file type found by the sniffer
 * @param blockCount number of extracted blocks
 * @param fallbackUsed whether the tree holds only the fallback paragraph
 * @param specLocation {@code bucket/key} of the canonical tree
 * @param htmlLocation {@code bucket/key} of the HTML rendering
 * @param tiptapLocation {@code bucket/key} of the TipTap rendering, null when not requested
 * @param location {@code bucket/key} of the requested output
 * @param contentType content type of the requested output
 */
public record ConversionResult(
    String documentId,
    FileType detectedType,
    int blockCount,
    boolean fallbackUsed,
    String specLocation,
    String htmlLocation,
    String tiptapLocation,
    String location,
    String contentType) {}
