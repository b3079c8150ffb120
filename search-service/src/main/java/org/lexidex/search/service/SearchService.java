package org.lexidex.search.service;

import org.lexidex.core.index.IndexBundle;
import org.lexidex.core.model.DocumentMetadata;
import org.lexidex.core.persistence.BundleLoadException;
import org.lexidex.core.query.QueryEngine;
import org.lexidex.core.query.SearchPage;
import org.lexidex.core.text.Normalizer;
import org.lexidex.search.indexer.BundleReader;
import org.lexidex.search.model.SearchResponse;
import org.lexidex.search.model.SearchResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Serves queries from the currently loaded bundle.
 *
 * <p>The bundle and its engine are swapped together in one step on {@link #reload()}; every request reads the
 * reference once, so it sees either the old or the new bundle, never a mix.</p>
 */
public class SearchService {
	private static final Logger logger = LoggerFactory.getLogger(SearchService.class);

	private record Served(IndexBundle bundle, QueryEngine engine) {}

	private final AtomicReference<Served> current = new AtomicReference<>();
	private final BundleReader bundleReader;
	private final Normalizer normalizer;
	private final int maxResults;
	private final int suggestLimit;

	public SearchService(BundleReader bundleReader, Normalizer normalizer, int maxResults, int suggestLimit) {
		if (maxResults <= 0 || suggestLimit <= 0) {
			throw new IllegalArgumentException("Result limits must be positive");
		}
		this.bundleReader = bundleReader;
		this.normalizer = normalizer;
		this.maxResults = maxResults;
		this.suggestLimit = suggestLimit;
	}

	/**
	 * Load the bundle and start serving it. On failure the previously served bundle, if any, stays in place.
	 */
	public SearchStats reload() throws IOException {
		IndexBundle bundle = bundleReader.read();
		QueryEngine engine;
		try {
			engine = new QueryEngine(normalizer, bundle);
		} catch (IllegalArgumentException e) {
			throw new BundleLoadException("Bundle at " + bundleReader.getSource()
					+ " was built with a different normalizer: " + e.getMessage(), e);
		}

		Served previous = current.getAndSet(new Served(bundle, engine));
		logger.info("{} index bundle: {} documents, {} unique terms, {} MB",
				previous == null ? "Loaded" : "Swapped in new", bundle.index().documentCount(), bundle.index().size(),
				String.format("%.2f", bundleReader.getSizeInMB()));
		return getStats();
	}

	public boolean isLoaded() {
		return current.get() != null;
	}

	/**
	 * Ranked search
	 *
	 * @param limit requested number of results; non-positive or larger than the maximum means the maximum
	 */
	public SearchResponse search(String query, int limit) {
		SearchPage page = served().engine().execute(query, clamp(limit, maxResults));
		List<SearchResult> results = page.hits().stream().map(SearchResult::fromHit).toList();

		logger.debug("Query '{}' ({}) matched {} documents, returning {}",
				query, page.query().mode(), page.totalMatches(), results.size());
		return new SearchResponse(query, page.query().mode().name().toLowerCase(Locale.ROOT), page.totalMatches(), results);
	}

	/**
	 * Vocabulary completions for a raw prefix.
	 *
	 * <p>Terms starting with the lowercased prefix come first. The prefix's last word is then normalized like a
	 * query term, so a complete word such as "running" also completes to its stem "run".</p>
	 */
	public List<String> suggest(String prefix, int limit) {
		Served served = served();
		if (prefix == null || prefix.isBlank()) {
			return List.of();
		}
		int count = clamp(limit, suggestLimit);
		String raw = prefix.trim().toLowerCase(Locale.ROOT);
		Set<String> suggestions = new LinkedHashSet<>(served.bundle().trie().suggest(raw, count));

		List<String> terms = normalizer.normalize(raw);
		if (suggestions.size() < count && !terms.isEmpty()) {
			String stemmed = terms.get(terms.size() - 1);
			if (!stemmed.equals(raw)) {
				suggestions.addAll(served.bundle().trie().suggest(stemmed, count));
			}
		}
		return suggestions.stream().limit(count).toList();
	}

	public Optional<DocumentMetadata> document(int documentId) {
		return served().bundle().documents().get(documentId);
	}

	public SearchStats getStats() {
		Served served = current.get();
		if (served == null) {
			return new SearchStats(false, 0, 0, null);
		}
		IndexBundle bundle = served.bundle();
		return new SearchStats(
				true,
				bundle.index().documentCount(),
				bundle.index().size(),
				Instant.ofEpochMilli(bundle.buildInfo().builtAtEpochMillis()).toString()
		);
	}

	private Served served() {
		Served served = current.get();
		if (served == null) {
			throw new IndexNotLoadedException();
		}
		return served;
	}

	private static int clamp(int requested, int maximum) {
		return requested > 0 ? Math.min(requested, maximum) : maximum;
	}
}
