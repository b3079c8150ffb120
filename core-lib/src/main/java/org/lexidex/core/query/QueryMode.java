package org.lexidex.core.query;

public enum QueryMode {
    /** Every distinct term must occur somewhere in the document. */
    FREE_TEXT,
    /** Terms must occur contiguously and in order; selected by wrapping the query in double quotes. */
    PHRASE
}
