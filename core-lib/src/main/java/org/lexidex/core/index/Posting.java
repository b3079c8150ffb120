package org.lexidex.core.index;

import java.util.Arrays;

/**
 * Occurrences of one term in one document: the document id and the strictly ascending, 0-based positions of the
 * term in that document's normalized token stream.
 */
public final class Posting {
    private final int documentId;
    private final int[] positions;

    public Posting(int documentId, int[] positions) {
        if (documentId < 0) {
            throw new IllegalArgumentException("Document id must be non-negative: " + documentId);
        }
        if (positions == null || positions.length == 0) {
            throw new IllegalArgumentException("Posting for document " + documentId + " has no positions");
        }
        for (int i = 0; i < positions.length; i++) {
            if (positions[i] < 0 || (i > 0 && positions[i] <= positions[i - 1])) {
                throw new IllegalArgumentException("Positions of document " + documentId
                        + " must be non-negative and strictly ascending: " + Arrays.toString(positions));
            }
        }
        this.documentId = documentId;
        this.positions = positions.clone();
    }

    public int documentId() {
        return documentId;
    }

    /** Raw occurrence count of the term in the document. */
    public int termFrequency() {
        return positions.length;
    }

    public int positionAt(int index) {
        return positions[index];
    }

    public int lastPosition() {
        return positions[positions.length - 1];
    }

    public int[] positions() {
        return positions.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Posting other)) {
            return false;
        }
        return documentId == other.documentId && Arrays.equals(positions, other.positions);
    }

    @Override
    public int hashCode() {
        return 31 * documentId + Arrays.hashCode(positions);
    }

    @Override
    public String toString() {
        return "Posting{doc=" + documentId + ", positions=" + Arrays.toString(positions) + "}";
    }
}
