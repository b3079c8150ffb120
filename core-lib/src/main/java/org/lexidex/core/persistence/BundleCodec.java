package org.lexidex.core.persistence;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import org.lexidex.core.index.DocumentStore;
import org.lexidex.core.index.IndexBundle;
import org.lexidex.core.index.InvertedIndex;
import org.lexidex.core.index.Posting;
import org.lexidex.core.index.PrefixTrie;
import org.lexidex.core.text.NormalizerConfig;
import org.lexidex.core.text.StemmerType;

import java.io.Reader;
import java.io.Writer;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Converts bundles to and from their JSON snapshot.
 *
 * <p>Decoding rebuilds every structure through its validating factory, so a decoded bundle satisfies the same
 * invariants as a freshly built one; anything else is reported as a {@link BundleLoadException}.</p>
 */
public final class BundleCodec {
    public static final int FORMAT_VERSION = 1;

    private final Gson gson;

    public BundleCodec() {
        this(false);
    }

    public BundleCodec(boolean prettyPrinting) {
        GsonBuilder builder = new GsonBuilder().disableHtmlEscaping();
        if (prettyPrinting) {
            builder.setPrettyPrinting();
        }
        this.gson = builder.create();
    }

    public String encode(IndexBundle bundle) {
        return gson.toJson(toSnapshot(bundle));
    }

    public void encode(IndexBundle bundle, Writer writer) {
        gson.toJson(toSnapshot(bundle), writer);
    }

    public IndexBundle decode(String json) throws BundleLoadException {
        if (json == null || json.isBlank()) {
            throw new BundleLoadException("Bundle is empty");
        }
        try {
            return fromSnapshot(gson.fromJson(json, BundleSnapshot.class));
        } catch (JsonParseException e) {
            throw new BundleLoadException("Malformed bundle JSON: " + e.getMessage(), e);
        }
    }

    public IndexBundle decode(Reader reader) throws BundleLoadException {
        try {
            return fromSnapshot(gson.fromJson(reader, BundleSnapshot.class));
        } catch (JsonParseException e) {
            throw new BundleLoadException("Malformed bundle JSON: " + e.getMessage(), e);
        }
    }

    static BundleSnapshot toSnapshot(IndexBundle bundle) {
        NormalizerConfig config = bundle.normalizerConfig();
        BundleSnapshot.NormalizerSnapshot normalizer = new BundleSnapshot.NormalizerSnapshot(
                config.version(), config.stemmer().configName(), new ArrayList<>(config.stopWords()));

        Map<String, List<BundleSnapshot.PostingSnapshot>> postings = new TreeMap<>();
        for (Map.Entry<String, List<Posting>> entry : bundle.index().asMap().entrySet()) {
            List<BundleSnapshot.PostingSnapshot> list = new ArrayList<>(entry.getValue().size());
            for (Posting posting : entry.getValue()) {
                list.add(new BundleSnapshot.PostingSnapshot(posting.documentId(), posting.positions()));
            }
            postings.put(entry.getKey(), list);
        }

        return new BundleSnapshot(
                FORMAT_VERSION,
                normalizer,
                bundle.buildInfo(),
                new TreeMap<>(bundle.index().documentLengths()),
                postings,
                bundle.trie().nodes(),
                new TreeMap<>(bundle.documents().asMap())
        );
    }

    static IndexBundle fromSnapshot(BundleSnapshot snapshot) throws BundleLoadException {
        if (snapshot == null) {
            throw new BundleLoadException("Bundle is empty");
        }
        if (snapshot.formatVersion() != FORMAT_VERSION) {
            throw new BundleLoadException("Unsupported bundle format version " + snapshot.formatVersion()
                    + " (expected " + FORMAT_VERSION + ")");
        }
        requireSection(snapshot.normalizer(), "normalizer");
        requireSection(snapshot.buildInfo(), "buildInfo");
        requireSection(snapshot.documentLengths(), "documentLengths");
        requireSection(snapshot.postings(), "postings");
        requireSection(snapshot.trie(), "trie");
        requireSection(snapshot.documents(), "documents");

        try {
            BundleSnapshot.NormalizerSnapshot normalizer = snapshot.normalizer();
            NormalizerConfig config = new NormalizerConfig(
                    normalizer.version(),
                    StemmerType.fromName(normalizer.stemmer()),
                    normalizer.stopWords() == null ? new HashSet<>() : new HashSet<>(normalizer.stopWords()));

            Map<String, List<Posting>> postings = new TreeMap<>();
            for (Map.Entry<String, List<BundleSnapshot.PostingSnapshot>> entry : snapshot.postings().entrySet()) {
                List<BundleSnapshot.PostingSnapshot> stored = entry.getValue();
                if (stored == null) {
                    throw new IllegalArgumentException("Term '" + entry.getKey() + "' has no postings");
                }
                List<Posting> list = new ArrayList<>(stored.size());
                for (BundleSnapshot.PostingSnapshot posting : stored) {
                    if (posting == null) {
                        throw new IllegalArgumentException("Null posting for term '" + entry.getKey() + "'");
                    }
                    list.add(new Posting(posting.doc(), posting.positions()));
                }
                postings.put(entry.getKey(), list);
            }

            InvertedIndex index = InvertedIndex.of(postings, snapshot.documentLengths());
            PrefixTrie trie = PrefixTrie.fromNodes(snapshot.trie());
            DocumentStore documents = new DocumentStore(snapshot.documents());
            return new IndexBundle(config, index, trie, documents, snapshot.buildInfo());
        } catch (IllegalArgumentException | IllegalStateException | NullPointerException e) {
            throw new BundleLoadException("Inconsistent bundle: " + e.getMessage(), e);
        }
    }

    private static void requireSection(Object section, String name) throws BundleLoadException {
        if (section == null) {
            throw new BundleLoadException("Bundle is missing section '" + name + "'");
        }
    }
}
