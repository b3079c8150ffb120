package org.lexidex.core.index;

import org.lexidex.core.text.NormalizerConfig;

import java.util.Objects;

/**
 * The jointly consistent output of one build pass: inverted index, prefix trie and document store, together with the
 * normalizer configuration they were built with.
 *
 * <p>Construction checks that the trie holds exactly the index vocabulary (weighted by total corpus frequency), that
 * the document store covers exactly the indexed documents, and that {@link BuildInfo} matches the index. A bundle
 * that exists is therefore consistent; it is never modified afterwards.</p>
 */
public record IndexBundle(
        NormalizerConfig normalizerConfig,
        InvertedIndex index,
        PrefixTrie trie,
        DocumentStore documents,
        BuildInfo buildInfo
) {
    public IndexBundle {
        Objects.requireNonNull(normalizerConfig, "normalizerConfig");
        Objects.requireNonNull(index, "index");
        Objects.requireNonNull(trie, "trie");
        Objects.requireNonNull(documents, "documents");
        Objects.requireNonNull(buildInfo, "buildInfo");

        if (!trie.terms().equals(index.vocabulary())) {
            throw new IllegalArgumentException("Trie vocabulary (" + trie.size()
                    + " terms) differs from index vocabulary (" + index.size() + " terms)");
        }
        for (String term : index.vocabulary()) {
            if (trie.weight(term) != index.totalTermFrequency(term)) {
                throw new IllegalArgumentException("Trie weight of '" + term + "' is " + trie.weight(term)
                        + " but the term occurs " + index.totalTermFrequency(term) + " times");
            }
        }
        if (!documents.ids().equals(index.documentIds())) {
            throw new IllegalArgumentException("Document store ids differ from indexed document ids");
        }
        if (buildInfo.documentCount() != index.documentCount()
                || buildInfo.vocabularySize() != index.size()
                || buildInfo.totalTokens() != index.totalTokens()) {
            throw new IllegalArgumentException("Build info " + buildInfo + " does not match " + index);
        }
    }
}
