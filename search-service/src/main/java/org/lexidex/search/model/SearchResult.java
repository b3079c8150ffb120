package org.lexidex.search.model;

import org.lexidex.core.query.SearchHit;

public record SearchResult(
		int documentId,
		String title,
		String path,
		String snippet,
		double score
) {
	public static SearchResult fromHit(SearchHit hit) {
		return new SearchResult(
				hit.documentId(),
				hit.metadata().title(),
				hit.metadata().path(),
				hit.metadata().snippet(),
				hit.score()
		);
	}
}
