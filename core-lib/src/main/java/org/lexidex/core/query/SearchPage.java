package org.lexidex.core.query;

import java.util.List;

/**
 * The top hits of one query together with the number of documents it matched before truncation.
 */
public record SearchPage(ParsedQuery query, int totalMatches, List<SearchHit> hits) {
    public SearchPage {
        hits = List.copyOf(hits);
    }
}
