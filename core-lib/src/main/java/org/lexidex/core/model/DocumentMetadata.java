package org.lexidex.core.model;

import org.jetbrains.annotations.NotNull;

import java.io.Serial;
import java.io.Serializable;

/**
 * Display metadata of an indexed document. Only used when assembling results, never when scoring.
 */
public record DocumentMetadata(
        String title,
        String path,
        String snippet
) implements Serializable {

    public DocumentMetadata {
        title = title == null ? "" : title;
        path = path == null ? "" : path;
        snippet = snippet == null ? "" : snippet;
    }

    @NotNull
    @Override
    public String toString() {
        return String.format("DocumentMetadata{title='%s', path='%s'}", title, path);
    }

    @Serial
    private static final long serialVersionUID = 1L;
}
