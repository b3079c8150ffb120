package org.lexidex.core.index;

/**
 * Summary recorded when a bundle is built.
 */
public record BuildInfo(
        int documentCount,
        int vocabularySize,
        long totalTokens,
        long builtAtEpochMillis
) {}
