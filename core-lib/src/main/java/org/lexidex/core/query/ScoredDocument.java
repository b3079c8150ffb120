package org.lexidex.core.query;

public record ScoredDocument(int documentId, double score) {}
