package org.lexidex.core.index;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Positional inverted index: term to postings ascending by document id, plus the normalized length of every
 * indexed document.
 *
 * <p>Instances are immutable. They come either from a {@link Builder}, which fills them in one ascending pass, or
 * from {@link #of(Map, Map)}, which re-checks every invariant on data read back from storage.</p>
 */
public final class InvertedIndex {
    private final SortedMap<String, List<Posting>> postings;
    private final SortedMap<Integer, Integer> documentLengths;
    private final Map<String, Long> totalTermFrequencies;
    private final long totalTokens;

    private InvertedIndex(SortedMap<String, List<Posting>> postings, SortedMap<Integer, Integer> documentLengths) {
        this.postings = Collections.unmodifiableSortedMap(postings);
        this.documentLengths = Collections.unmodifiableSortedMap(documentLengths);

        Map<String, Long> frequencies = new HashMap<>();
        long tokens = 0;
        for (Map.Entry<String, List<Posting>> entry : postings.entrySet()) {
            long total = 0;
            for (Posting posting : entry.getValue()) {
                total += posting.termFrequency();
            }
            frequencies.put(entry.getKey(), total);
            tokens += total;
        }
        this.totalTermFrequencies = Collections.unmodifiableMap(frequencies);
        this.totalTokens = tokens;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Rebuilds an index from raw maps, validating that
     * <ul>
     *   <li>every term is non-empty and has at least one posting,</li>
     *   <li>postings are strictly ascending by document id and refer to known documents,</li>
     *   <li>positions fall inside the document's length,</li>
     *   <li>the occurrences of each document add up to its length.</li>
     * </ul>
     *
     * @throws IllegalArgumentException on the first violated invariant
     */
    public static InvertedIndex of(Map<String, List<Posting>> postings, Map<Integer, Integer> documentLengths) {
        Objects.requireNonNull(postings, "postings");
        Objects.requireNonNull(documentLengths, "documentLengths");

        SortedMap<Integer, Integer> lengths = new TreeMap<>();
        for (Map.Entry<Integer, Integer> entry : documentLengths.entrySet()) {
            if (entry.getKey() == null || entry.getKey() < 0 || entry.getValue() == null || entry.getValue() < 0) {
                throw new IllegalArgumentException("Invalid document length entry: " + entry);
            }
            lengths.put(entry.getKey(), entry.getValue());
        }

        Map<Integer, Long> occurrences = new HashMap<>();
        Map<Integer, BitSet> occupied = new HashMap<>();
        SortedMap<String, List<Posting>> copy = new TreeMap<>();
        for (Map.Entry<String, List<Posting>> entry : postings.entrySet()) {
            String term = entry.getKey();
            List<Posting> list = entry.getValue();
            if (term == null || term.isEmpty()) {
                throw new IllegalArgumentException("Empty term in index");
            }
            if (list == null || list.isEmpty()) {
                throw new IllegalArgumentException("Term '" + term + "' has no postings");
            }
            int previous = -1;
            for (Posting posting : list) {
                int documentId = posting.documentId();
                if (documentId <= previous) {
                    throw new IllegalArgumentException("Postings of '" + term + "' are not ascending at document "
                            + documentId);
                }
                Integer length = lengths.get(documentId);
                if (length == null) {
                    throw new IllegalArgumentException("Term '" + term + "' refers to unknown document " + documentId);
                }
                if (posting.lastPosition() >= length) {
                    throw new IllegalArgumentException("Position " + posting.lastPosition() + " of '" + term
                            + "' is outside document " + documentId + " (length " + length + ")");
                }
                BitSet taken = occupied.computeIfAbsent(documentId, id -> new BitSet(length));
                for (int i = 0; i < posting.termFrequency(); i++) {
                    int position = posting.positionAt(i);
                    if (taken.get(position)) {
                        throw new IllegalArgumentException("Position " + position + " of document " + documentId
                                + " is claimed by more than one term, including '" + term + "'");
                    }
                    taken.set(position);
                }
                occurrences.merge(documentId, (long) posting.termFrequency(), Long::sum);
                previous = documentId;
            }
            copy.put(term, List.copyOf(list));
        }

        for (Map.Entry<Integer, Integer> entry : lengths.entrySet()) {
            long counted = occurrences.getOrDefault(entry.getKey(), 0L);
            if (counted != entry.getValue()) {
                throw new IllegalArgumentException("Document " + entry.getKey() + " has length " + entry.getValue()
                        + " but " + counted + " indexed occurrences");
            }
        }

        return new InvertedIndex(copy, lengths);
    }

    /**
     * @return postings of the term ascending by document id, empty if the term is not indexed
     */
    public List<Posting> postings(String term) {
        List<Posting> list = postings.get(term);
        return list == null ? List.of() : list;
    }

    /**
     * Binary search for the posting of a term in one document.
     */
    public Optional<Posting> posting(String term, int documentId) {
        List<Posting> list = postings(term);
        int low = 0;
        int high = list.size() - 1;
        while (low <= high) {
            int mid = (low + high) >>> 1;
            int current = list.get(mid).documentId();
            if (current < documentId) {
                low = mid + 1;
            } else if (current > documentId) {
                high = mid - 1;
            } else {
                return Optional.of(list.get(mid));
            }
        }
        return Optional.empty();
    }

    public boolean contains(String term) {
        return postings.containsKey(term);
    }

    public int documentFrequency(String term) {
        return postings(term).size();
    }

    /** Occurrences of the term across the whole corpus. */
    public long totalTermFrequency(String term) {
        return totalTermFrequencies.getOrDefault(term, 0L);
    }

    public int documentCount() {
        return documentLengths.size();
    }

    /**
     * @throws IllegalArgumentException if the document is not indexed
     */
    public int documentLength(int documentId) {
        Integer length = documentLengths.get(documentId);
        if (length == null) {
            throw new IllegalArgumentException("Unknown document " + documentId);
        }
        return length;
    }

    public boolean containsDocument(int documentId) {
        return documentLengths.containsKey(documentId);
    }

    public SortedSet<Integer> documentIds() {
        return Collections.unmodifiableSortedSet(new TreeSet<>(documentLengths.keySet()));
    }

    public SortedMap<Integer, Integer> documentLengths() {
        return documentLengths;
    }

    public SortedSet<String> vocabulary() {
        return Collections.unmodifiableSortedSet(new TreeSet<>(postings.keySet()));
    }

    public SortedMap<String, List<Posting>> asMap() {
        return postings;
    }

    /** Number of distinct terms. */
    public int size() {
        return postings.size();
    }

    public long totalTokens() {
        return totalTokens;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof InvertedIndex other)) {
            return false;
        }
        return postings.equals(other.postings) && documentLengths.equals(other.documentLengths);
    }

    @Override
    public int hashCode() {
        return Objects.hash(postings, documentLengths);
    }

    @Override
    public String toString() {
        return "InvertedIndex{terms=" + postings.size() + ", documents=" + documentLengths.size() + "}";
    }

    /**
     * Single-writer builder. Documents must arrive in strictly ascending id order, which keeps every posting list
     * sorted without a later reordering step.
     */
    public static final class Builder {
        private final Map<String, List<Posting>> postings = new HashMap<>();
        private final SortedMap<Integer, Integer> documentLengths = new TreeMap<>();
        private int lastDocumentId = -1;
        private boolean built;

        private Builder() {}

        /**
         * Adds one document's normalized term stream; the index of a term in the list is its position.
         *
         * @throws IllegalArgumentException if the id is not greater than the previous one
         */
        public Builder addDocument(int documentId, List<String> terms) {
            if (built) {
                throw new IllegalStateException("Index already built");
            }
            if (documentId <= lastDocumentId) {
                throw new IllegalArgumentException("Documents must be added in ascending id order: " + documentId
                        + " after " + lastDocumentId);
            }

            Map<String, List<Integer>> positionsByTerm = new LinkedHashMap<>();
            for (int i = 0; i < terms.size(); i++) {
                positionsByTerm.computeIfAbsent(terms.get(i), k -> new ArrayList<>()).add(i);
            }
            for (Map.Entry<String, List<Integer>> entry : positionsByTerm.entrySet()) {
                int[] positions = entry.getValue().stream().mapToInt(Integer::intValue).toArray();
                postings.computeIfAbsent(entry.getKey(), k -> new ArrayList<>())
                        .add(new Posting(documentId, positions));
            }

            documentLengths.put(documentId, terms.size());
            lastDocumentId = documentId;
            return this;
        }

        public InvertedIndex build() {
            built = true;
            SortedMap<String, List<Posting>> frozen = new TreeMap<>();
            for (Map.Entry<String, List<Posting>> entry : postings.entrySet()) {
                frozen.put(entry.getKey(), List.copyOf(entry.getValue()));
            }
            return new InvertedIndex(frozen, new TreeMap<>(documentLengths));
        }
    }
}
