package com.flamingo.ai.foliospec.service.conversion;

import com.flamingo.ai.foliospec.domain.model.FileType;
import com.flamingo.ai.foliospec.domain.spec.SpecNode;

/**
 * Result of converting bytes already held by the caller.
 *
 * @param detectedType file type found by the sniffer
 * @param blockCount number of extracted blocks
 * @param fallbackUsed whether the tree holds only the fallback paragraph
 * @param tree canonical tree
 */
public record InMemoryConversion(
    FileType detectedType, int blockCount, boolean fallbackUsed, SpecNode tree) {}
