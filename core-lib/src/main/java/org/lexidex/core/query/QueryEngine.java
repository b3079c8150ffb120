package org.lexidex.core.query;

import org.lexidex.core.index.IndexBundle;
import org.lexidex.core.index.InvertedIndex;
import org.lexidex.core.index.Posting;
import org.lexidex.core.model.DocumentMetadata;
import org.lexidex.core.text.Normalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Boolean and positional retrieval with TF-IDF ranking over one immutable {@link IndexBundle}.
 *
 * <p>A query wrapped in a pair of double quotes is a phrase query; anything else, including a query with an
 * unbalanced quote, is free text. Both modes require every distinct query term to be present (strict AND). A
 * document scores {@code sum(tf(t,d) * idf(t))} over the distinct query terms, with
 * {@code idf(t) = ln(N / (1 + df(t))) + 1}. Results are ordered by descending score, then ascending document id.</p>
 *
 * <p>Holds no mutable state; one instance can serve any number of threads.</p>
 */
public class QueryEngine {
    private static final Logger logger = LoggerFactory.getLogger(QueryEngine.class);

    private static final Comparator<ScoredDocument> RANKING =
            Comparator.comparingDouble(ScoredDocument::score).reversed()
                    .thenComparingInt(ScoredDocument::documentId);

    private final Normalizer normalizer;
    private final IndexBundle bundle;
    private final InvertedIndex index;

    /**
     * @throws IllegalArgumentException if the normalizer is configured differently from the one the bundle was
     *                                  built with
     */
    public QueryEngine(Normalizer normalizer, IndexBundle bundle) {
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer");
        this.bundle = Objects.requireNonNull(bundle, "bundle");
        if (!normalizer.config().equals(bundle.normalizerConfig())) {
            throw new IllegalArgumentException("Query normalizer " + normalizer.config()
                    + " does not match the bundle's " + bundle.normalizerConfig());
        }
        this.index = bundle.index();
    }

    public IndexBundle bundle() {
        return bundle;
    }

    public ParsedQuery parse(String rawQuery) {
        if (rawQuery == null) {
            return new ParsedQuery(QueryMode.FREE_TEXT, List.of());
        }
        String trimmed = rawQuery.trim();
        if (trimmed.length() >= 2 && trimmed.startsWith("\"") && trimmed.endsWith("\"")) {
            return new ParsedQuery(QueryMode.PHRASE, normalizer.normalize(trimmed.substring(1, trimmed.length() - 1)));
        }
        return new ParsedQuery(QueryMode.FREE_TEXT, normalizer.normalize(trimmed));
    }

    /**
     * Ranks matching documents without touching the document store.
     */
    public List<ScoredDocument> rank(String rawQuery) {
        return rank(parse(rawQuery));
    }

    public List<ScoredDocument> rank(ParsedQuery query) {
        if (query.isEmpty()) {
            return List.of();
        }
        List<String> distinct = query.distinctTerms();
        int[] candidates = intersect(distinct);
        if (query.mode() == QueryMode.PHRASE && query.terms().size() > 1) {
            candidates = Arrays.stream(candidates)
                    .filter(documentId -> containsPhrase(query.terms(), documentId))
                    .toArray();
        }

        Map<String, Double> idfs = new HashMap<>();
        for (String term : distinct) {
            idfs.put(term, idf(term));
        }

        List<ScoredDocument> results = new ArrayList<>(candidates.length);
        for (int documentId : candidates) {
            double score = 0.0;
            for (String term : distinct) {
                int tf = index.posting(term, documentId).map(Posting::termFrequency).orElse(0);
                score += tf * idfs.get(term);
            }
            results.add(new ScoredDocument(documentId, score));
        }
        results.sort(RANKING);

        logger.debug("{} query {} matched {} documents", query.mode(), query.terms(), results.size());
        return results;
    }

    /**
     * Ranks and joins the top results with their display metadata.
     *
     * @param limit maximum number of hits; {@code 0} or less returns every match
     */
    public List<SearchHit> search(String rawQuery, int limit) {
        return execute(rawQuery, limit).hits();
    }

    /**
     * Same as {@link #search(String, int)}, also reporting how the query was read and how many documents matched.
     */
    public SearchPage execute(String rawQuery, int limit) {
        ParsedQuery query = parse(rawQuery);
        List<ScoredDocument> ranked = rank(query);
        int count = limit > 0 ? Math.min(limit, ranked.size()) : ranked.size();
        List<SearchHit> hits = new ArrayList<>(count);
        for (ScoredDocument scored : ranked.subList(0, count)) {
            DocumentMetadata metadata = bundle.documents().get(scored.documentId())
                    .orElseThrow(() -> new IllegalStateException("No metadata for document " + scored.documentId()));
            hits.add(new SearchHit(scored.documentId(), scored.score(), metadata));
        }
        return new SearchPage(query, ranked.size(), hits);
    }

    /**
     * Smoothed inverse document frequency; finite and positive for every term of a non-empty corpus.
     */
    public double idf(String term) {
        int documentCount = index.documentCount();
        if (documentCount == 0) {
            return 0.0;
        }
        return Math.log((double) documentCount / (1 + index.documentFrequency(term))) + 1.0;
    }

    /**
     * Document ids containing every term, by merging the ascending posting lists shortest first.
     */
    int[] intersect(List<String> terms) {
        List<List<Posting>> lists = new ArrayList<>(terms.size());
        for (String term : terms) {
            List<Posting> postings = index.postings(term);
            if (postings.isEmpty()) {
                return new int[0];
            }
            lists.add(postings);
        }
        lists.sort(Comparator.comparingInt(List::size));

        int[] result = lists.get(0).stream().mapToInt(Posting::documentId).toArray();
        for (int l = 1; l < lists.size() && result.length > 0; l++) {
            List<Posting> other = lists.get(l);
            int[] merged = new int[Math.min(result.length, other.size())];
            int count = 0;
            int i = 0;
            int j = 0;
            while (i < result.length && j < other.size()) {
                int left = result[i];
                int right = other.get(j).documentId();
                if (left < right) {
                    i++;
                } else if (left > right) {
                    j++;
                } else {
                    merged[count++] = left;
                    i++;
                    j++;
                }
            }
            result = Arrays.copyOf(merged, count);
        }
        return result;
    }

    /**
     * Chained positional merge: keeps the end positions of the partial phrase and advances it one term at a time.
     */
    boolean containsPhrase(List<String> terms, int documentId) {
        Posting first = index.posting(terms.get(0), documentId).orElse(null);
        if (first == null) {
            return false;
        }
        int[] ends = first.positions();
        for (int t = 1; t < terms.size(); t++) {
            Posting next = index.posting(terms.get(t), documentId).orElse(null);
            if (next == null) {
                return false;
            }
            ends = followedBy(ends, next);
            if (ends.length == 0) {
                return false;
            }
        }
        return true;
    }

    private static int[] followedBy(int[] ends, Posting next) {
        int[] matched = new int[Math.min(ends.length, next.termFrequency())];
        int count = 0;
        int i = 0;
        int j = 0;
        while (i < ends.length && j < next.termFrequency()) {
            int wanted = ends[i] + 1;
            int position = next.positionAt(j);
            if (position < wanted) {
                j++;
            } else if (position > wanted) {
                i++;
            } else {
                matched[count++] = position;
                i++;
                j++;
            }
        }
        return Arrays.copyOf(matched, count);
    }
}
