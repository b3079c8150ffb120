package org.lexidex.core.persistence;

import org.lexidex.core.index.BuildInfo;
import org.lexidex.core.index.PrefixTrie;
import org.lexidex.core.model.DocumentMetadata;

import java.util.List;
import java.util.Map;

/**
 * JSON shape of a persisted {@link org.lexidex.core.index.IndexBundle}.
 */
public record BundleSnapshot(
        int formatVersion,
        NormalizerSnapshot normalizer,
        BuildInfo buildInfo,
        Map<Integer, Integer> documentLengths,
        Map<String, List<PostingSnapshot>> postings,
        List<PrefixTrie.Node> trie,
        Map<Integer, DocumentMetadata> documents
) {
    public record NormalizerSnapshot(int version, String stemmer, List<String> stopWords) {}

    public record PostingSnapshot(int doc, int[] positions) {}
}
