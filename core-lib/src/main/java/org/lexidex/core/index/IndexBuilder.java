package org.lexidex.core.index;

import org.lexidex.core.model.Document;
import org.lexidex.core.model.DocumentMetadata;
import org.lexidex.core.text.Normalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;

/**
 * Builds an {@link IndexBundle} from an in-memory corpus in one deterministic pass.
 *
 * <p>Documents are processed in ascending id order whatever order they are supplied in. The building thread may be
 * interrupted to cancel; the build then fails and the caller starts over.</p>
 */
public class IndexBuilder {
	private static final Logger logger = LoggerFactory.getLogger(IndexBuilder.class);

	private final Normalizer normalizer;
	private final Clock clock;

	public IndexBuilder(Normalizer normalizer) {
		this(normalizer, Clock.systemUTC());
	}

	public IndexBuilder(Normalizer normalizer, Clock clock) {
		this.normalizer = Objects.requireNonNull(normalizer, "normalizer");
		this.clock = Objects.requireNonNull(clock, "clock");
	}

	/**
	 * Build the bundle for the given documents
	 *
	 * @throws DuplicateDocumentException if two documents share an id
	 * @throws IndexBuildException if the building thread was interrupted
	 */
	public IndexBundle build(Collection<Document> documents) throws IndexBuildException {
		List<Document> ordered = orderedUnique(documents);
		logger.info("Building index for {} documents", ordered.size());

		InvertedIndex.Builder indexBuilder = InvertedIndex.builder();
		Map<Integer, DocumentMetadata> store = new TreeMap<>();

		int processed = 0;
		for (Document document : ordered) {
			if (Thread.currentThread().isInterrupted()) {
				throw new IndexBuildException("Index build cancelled after " + processed + " of "
						+ ordered.size() + " documents");
			}
			List<String> terms = normalizer.normalize(document.rawText());
			indexBuilder.addDocument(document.id(), terms);
			store.put(document.id(), document.metadata());
			processed++;
			logger.debug("Indexed document {} with {} tokens", document.id(), terms.size());
		}

		InvertedIndex index = indexBuilder.build();
		PrefixTrie trie = buildTrie(index);
		BuildInfo info = new BuildInfo(index.documentCount(), index.size(), index.totalTokens(), clock.millis());

		IndexBundle bundle = new IndexBundle(normalizer.config(), index, trie, new DocumentStore(store), info);
		logger.info("Index built: {} documents, {} unique terms, {} tokens, {} trie nodes",
				info.documentCount(), info.vocabularySize(), info.totalTokens(), trie.nodeCount());
		return bundle;
	}

	private List<Document> orderedUnique(Collection<Document> documents) throws DuplicateDocumentException {
		Objects.requireNonNull(documents, "documents");
		Set<Integer> seen = new HashSet<>();
		List<Document> ordered = new ArrayList<>(documents.size());
		for (Document document : documents) {
			Objects.requireNonNull(document, "document");
			if (!seen.add(document.id())) {
				throw new DuplicateDocumentException(document.id());
			}
			ordered.add(document);
		}
		ordered.sort(Comparator.comparingInt(Document::id));
		return ordered;
	}

	private PrefixTrie buildTrie(InvertedIndex index) {
		PrefixTrie.Builder trieBuilder = PrefixTrie.builder();
		for (String term : index.vocabulary()) {
			trieBuilder.insert(term, index.totalTermFrequency(term));
		}
		return trieBuilder.build();
	}
}
