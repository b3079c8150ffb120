package org.lexidex.core.query;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.lexidex.core.index.IndexBuilder;
import org.lexidex.core.index.IndexBundle;
import org.lexidex.core.model.Document;
import org.lexidex.core.text.Normalizer;
import org.lexidex.core.text.NormalizerConfig;
import org.lexidex.core.text.StemmerType;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class QueryEngineTest {
	private static final Normalizer NORMALIZER = new Normalizer(NormalizerConfig.of(StemmerType.NONE, Set.of("the")));

	private QueryEngine engine;

	@BeforeEach
	public void setUp() throws Exception {
		IndexBundle bundle = new IndexBuilder(NORMALIZER).build(List.of(
				Document.of(1, "the quick brown fox", "doc1"),
				Document.of(2, "the lazy dog", "doc2"),
				Document.of(3, "quick fox jumps", "doc3")
		));
		engine = new QueryEngine(NORMALIZER, bundle);
	}

	private static List<Integer> ids(List<ScoredDocument> results) {
		return results.stream().map(ScoredDocument::documentId).toList();
	}

	@Test
	public void testFreeTextIsBooleanAnd() {
		List<ScoredDocument> results = engine.rank("quick fox");

		assertEquals(List.of(1, 3), ids(results));
		assertEquals(results.get(0).score(), results.get(1).score(), 1e-9);
	}

	@Test
	public void testPhraseRequiresAdjacency() {
		assertEquals(List.of(3), ids(engine.rank("\"quick fox\"")));
		assertEquals(List.of(1), ids(engine.rank("\"brown fox\"")));
		assertTrue(engine.rank("\"fox quick\"").isEmpty());
	}

	@Test
	public void testStopWordsDoNotBreakAdjacency() {
		// "the" is removed before positions are assigned
		assertEquals(List.of(2), ids(engine.rank("\"the lazy the dog\"")));
	}

	@Test
	public void testQueryModes() {
		assertEquals(QueryMode.PHRASE, engine.parse("  \"quick fox\" ").mode());
		assertEquals(List.of("quick", "fox"), engine.parse("\"Quick, FOX\"").terms());
		assertEquals(QueryMode.FREE_TEXT, engine.parse("quick fox").mode());
		assertEquals(QueryMode.FREE_TEXT, engine.parse("\"quick fox").mode());
		assertEquals(QueryMode.FREE_TEXT, engine.parse("\"").mode());
	}

	@Test
	public void testUnbalancedQuoteIsFreeText() {
		assertEquals(List.of(1, 3), ids(engine.rank("\"quick fox")));
	}

	@Test
	public void testEmptyResults() {
		assertTrue(engine.rank("").isEmpty());
		assertTrue(engine.rank((String) null).isEmpty());
		assertTrue(engine.rank("the").isEmpty());
		assertTrue(engine.rank("\"\"").isEmpty());
		assertTrue(engine.rank("quick zebra").isEmpty());
		assertTrue(engine.rank("!!! ???").isEmpty());
	}

	@Test
	public void testSearchJoinsMetadataAndLimits() {
		List<SearchHit> hits = engine.search("fox", 1);

		assertEquals(1, hits.size());
		assertEquals(1, hits.get(0).documentId());
		assertEquals("doc1", hits.get(0).metadata().title());
		assertEquals(2, engine.search("fox", 0).size());
	}

	@Test
	public void testExecuteReportsMatchesBeyondTheLimit() {
		SearchPage page = engine.execute("\"quick fox\"", 5);
		assertEquals(QueryMode.PHRASE, page.query().mode());
		assertEquals(1, page.totalMatches());

		SearchPage truncated = engine.execute("fox", 1);
		assertEquals(2, truncated.totalMatches());
		assertEquals(1, truncated.hits().size());
		assertEquals(engine.search("fox", 1), truncated.hits());
	}

	@Test
	public void testIdfIsPositiveForUbiquitousTerm() throws Exception {
		IndexBundle bundle = new IndexBuilder(NORMALIZER).build(List.of(
				Document.of(1, "common alpha", "a"),
				Document.of(2, "common beta", "b"),
				Document.of(3, "common gamma", "c")
		));
		QueryEngine everywhere = new QueryEngine(NORMALIZER, bundle);

		double idf = everywhere.idf("common");
		assertTrue(idf > 0);
		assertTrue(Double.isFinite(idf));
		assertEquals(Math.log(3.0 / 4.0) + 1.0, idf, 1e-12);
		assertEquals(Math.log(3.0 / 1.0) + 1.0, everywhere.idf("unseen"), 1e-12);
	}

	@Test
	public void testRankingByTfIdfThenId() throws Exception {
		IndexBundle bundle = new IndexBuilder(NORMALIZER).build(List.of(
				Document.of(1, "apple banana apple", "a"),
				Document.of(2, "apple cherry", "b"),
				Document.of(3, "banana cherry", "c"),
				Document.of(4, "cherry", "d")
		));
		QueryEngine ranked = new QueryEngine(NORMALIZER, bundle);

		List<ScoredDocument> apple = ranked.rank("apple");
		assertEquals(List.of(1, 2), ids(apple));
		double idfApple = Math.log(4.0 / 3.0) + 1.0;
		assertEquals(2 * idfApple, apple.get(0).score(), 1e-9);
		assertEquals(idfApple, apple.get(1).score(), 1e-9);

		assertEquals(List.of(2, 3, 4), ids(ranked.rank("cherry")));

		List<ScoredDocument> results = ranked.rank("cherry banana apple cherry");
		assertTrue(results.isEmpty());

		List<ScoredDocument> any = ranked.rank("cherry");
		for (int i = 1; i < any.size(); i++) {
			assertTrue(any.get(i - 1).score() >= any.get(i).score());
			if (any.get(i - 1).score() == any.get(i).score()) {
				assertTrue(any.get(i - 1).documentId() < any.get(i).documentId());
			}
		}
	}

	@Test
	public void testDuplicateQueryTermsScoreOnce() {
		assertEquals(engine.rank("fox").get(0).score(), engine.rank("fox fox").get(0).score(), 1e-12);
	}

	@Test
	public void testPhraseWithRepeatedTerms() throws Exception {
		IndexBundle bundle = new IndexBuilder(NORMALIZER).build(List.of(
				Document.of(1, "new york new york city", "a"),
				Document.of(2, "york new city", "b"),
				Document.of(3, "new new york", "c")
		));
		QueryEngine phrases = new QueryEngine(NORMALIZER, bundle);

		assertEquals(List.of(1), ids(phrases.rank("\"new york new york\"")));
		assertEquals(List.of(1, 2), ids(phrases.rank("\"york new\"")).stream().sorted().toList());
		assertEquals(List.of(3), ids(phrases.rank("\"new new\"")));
		assertEquals(List.of(1, 3), ids(phrases.rank("\"new york\"")).stream().sorted().toList());
	}

	@Test
	public void testPhraseResultsAreAdjacentInEveryHit() {
		IndexBundle bundle = engine.bundle();
		for (ScoredDocument hit : engine.rank("\"quick fox\"")) {
			int[] quick = bundle.index().posting("quick", hit.documentId()).orElseThrow().positions();
			int[] fox = bundle.index().posting("fox", hit.documentId()).orElseThrow().positions();
			boolean adjacent = false;
			for (int p : quick) {
				for (int q : fox) {
					adjacent |= q == p + 1;
				}
			}
			assertTrue(adjacent);
		}
	}

	@Test
	public void testMismatchedNormalizerIsRejected() {
		Normalizer stemming = new Normalizer(NormalizerConfig.of(StemmerType.PORTER, Set.of("the")));

		assertThrows(IllegalArgumentException.class, () -> new QueryEngine(stemming, engine.bundle()));
	}

	@Test
	public void testIntersectionUsesAllLists() {
		assertArrayEquals(new int[]{1, 3}, engine.intersect(List.of("quick", "fox")));
		assertArrayEquals(new int[]{3}, engine.intersect(List.of("fox", "jumps", "quick")));
		assertArrayEquals(new int[0], engine.intersect(List.of("fox", "dog")));
	}
}
