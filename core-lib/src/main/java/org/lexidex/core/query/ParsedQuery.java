package org.lexidex.core.query;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * A query after mode detection and normalization. {@code terms} keeps query order and duplicates.
 */
public record ParsedQuery(QueryMode mode, List<String> terms) {
    public ParsedQuery {
        terms = List.copyOf(terms);
    }

    /** Terms with duplicates removed, first occurrence order. */
    public List<String> distinctTerms() {
        return new ArrayList<>(new LinkedHashSet<>(terms));
    }

    public boolean isEmpty() {
        return terms.isEmpty();
    }
}
