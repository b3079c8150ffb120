package org.lexidex.indexing.service;

import java.nio.file.Path;

/**
 * Outcome of one rebuild.
 */
public record IndexStats(
    int documentsIndexed,
    int uniqueTerms,
    long totalTokens,
    Path outputPath
) {}
