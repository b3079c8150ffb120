package org.lexidex.core.index;

import org.lexidex.core.model.DocumentMetadata;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Document id to display metadata. Consulted only when results are assembled.
 */
public final class DocumentStore {
    private final SortedMap<Integer, DocumentMetadata> documents;

    public DocumentStore(Map<Integer, DocumentMetadata> documents) {
        SortedMap<Integer, DocumentMetadata> copy = new TreeMap<>();
        for (Map.Entry<Integer, DocumentMetadata> entry : documents.entrySet()) {
            if (entry.getKey() == null || entry.getKey() < 0 || entry.getValue() == null) {
                throw new IllegalArgumentException("Invalid document store entry: " + entry);
            }
            copy.put(entry.getKey(), entry.getValue());
        }
        this.documents = Collections.unmodifiableSortedMap(copy);
    }

    public Optional<DocumentMetadata> get(int documentId) {
        return Optional.ofNullable(documents.get(documentId));
    }

    public int size() {
        return documents.size();
    }

    public SortedSet<Integer> ids() {
        return Collections.unmodifiableSortedSet(new TreeSet<>(documents.keySet()));
    }

    public SortedMap<Integer, DocumentMetadata> asMap() {
        return documents;
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof DocumentStore other && documents.equals(other.documents));
    }

    @Override
    public int hashCode() {
        return documents.hashCode();
    }

    @Override
    public String toString() {
        return "DocumentStore{documents=" + documents.size() + "}";
    }
}
