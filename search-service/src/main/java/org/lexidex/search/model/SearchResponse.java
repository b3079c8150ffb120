package org.lexidex.search.model;

import java.util.List;

/**
 * @param totalResults number of matching documents before the limit was applied
 */
public record SearchResponse(
		String query,
		String mode,
		int totalResults,
		List<SearchResult> results
) {}
