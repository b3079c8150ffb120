package org.lexidex.indexing.service;

import org.lexidex.core.index.IndexBuildException;
import org.lexidex.core.index.IndexBuilder;
import org.lexidex.core.index.IndexBundle;
import org.lexidex.core.model.Document;
import org.lexidex.indexing.indexer.BundleWriter;
import org.lexidex.indexing.storage.CorpusReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Reads the corpus, builds a fresh bundle from it and persists the result.
 *
 * <p>Every rebuild starts from scratch; nothing is written unless the build completes.</p>
 */
public class IndexingService {
	private static final Logger logger = LoggerFactory.getLogger(IndexingService.class);

	private final CorpusReader corpusReader;
	private final IndexBuilder indexBuilder;
	private final BundleWriter bundleWriter;

	public IndexingService(CorpusReader corpusReader, IndexBuilder indexBuilder, BundleWriter bundleWriter) {
		this.corpusReader = corpusReader;
		this.indexBuilder = indexBuilder;
		this.bundleWriter = bundleWriter;
	}

	public IndexStats rebuild() throws IOException, IndexBuildException {
		long start = System.currentTimeMillis();
		logger.info("Rebuilding index from {}", corpusReader.getCorpusPath());

		List<Document> documents = corpusReader.readAll();
		IndexBundle bundle = indexBuilder.build(documents);
		Path written = bundleWriter.write(bundle);

		IndexStats stats = new IndexStats(
				bundle.buildInfo().documentCount(),
				bundle.buildInfo().vocabularySize(),
				bundle.buildInfo().totalTokens(),
				written
		);

		long duration = System.currentTimeMillis() - start;
		logger.info("Rebuilt index in {}ms: {} documents, {} unique terms, {} tokens",
				duration, stats.documentsIndexed(), stats.uniqueTerms(), stats.totalTokens());
		return stats;
	}
}
