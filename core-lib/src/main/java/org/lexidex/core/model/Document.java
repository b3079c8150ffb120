package org.lexidex.core.model;

import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * A document handed to the index builder by corpus ingestion.
 *
 * <p>Shape is checked here, at the ingestion boundary: ids are non-negative, text and metadata are never null.
 * A blank title is replaced by {@code "Document <id>"}.</p>
 */
public record Document(
        int id,
        String rawText,
        DocumentMetadata metadata
) {
    public Document {
        if (id < 0) {
            throw new IllegalArgumentException("Document id must be non-negative: " + id);
        }
        Objects.requireNonNull(rawText, "rawText");
        Objects.requireNonNull(metadata, "metadata");
        if (metadata.title().isBlank()) {
            metadata = new DocumentMetadata("Document " + id, metadata.path(), metadata.snippet());
        }
    }

    public static Document of(int id, String rawText, String title) {
        return new Document(id, rawText, new DocumentMetadata(title, "", ""));
    }

    @NotNull
    @Override
    public String toString() {
        return String.format("Document{id=%d, title='%s', chars=%d}", id, metadata.title(), rawText.length());
    }
}
