package org.lexidex.core.query;

import org.lexidex.core.model.DocumentMetadata;

/**
 * A ranked document joined with its display metadata.
 */
public record SearchHit(int documentId, double score, DocumentMetadata metadata) {}
