package org.lexidex.core.index;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class InvertedIndexTest {

	private static InvertedIndex sampleIndex() {
		return InvertedIndex.builder()
				.addDocument(1, List.of("quick", "brown", "fox", "quick"))
				.addDocument(2, List.of("lazy", "dog"))
				.addDocument(5, List.of("quick", "fox", "jump"))
				.build();
	}

	@Test
	public void testPostingsArePositional() {
		InvertedIndex index = sampleIndex();

		List<Posting> quick = index.postings("quick");
		assertEquals(2, quick.size());
		assertEquals(1, quick.get(0).documentId());
		assertArrayEquals(new int[]{0, 3}, quick.get(0).positions());
		assertEquals(5, quick.get(1).documentId());
		assertArrayEquals(new int[]{0}, quick.get(1).positions());
	}

	@Test
	public void testFrequenciesAndLengths() {
		InvertedIndex index = sampleIndex();

		assertEquals(3, index.documentCount());
		assertEquals(2, index.documentFrequency("quick"));
		assertEquals(3, index.totalTermFrequency("quick"));
		assertEquals(0, index.documentFrequency("zebra"));
		assertEquals(0, index.totalTermFrequency("zebra"));
		assertEquals(4, index.documentLength(1));
		assertEquals(3, index.documentLength(5));
		assertEquals(9, index.totalTokens());
		assertEquals(Set.of("quick", "brown", "fox", "lazy", "dog", "jump"), index.vocabulary());
		assertThrows(IllegalArgumentException.class, () -> index.documentLength(3));
	}

	@Test
	public void testUnknownTermHasEmptyPostings() {
		InvertedIndex index = sampleIndex();

		assertTrue(index.postings("zebra").isEmpty());
		assertFalse(index.contains("zebra"));
		assertTrue(index.posting("zebra", 1).isEmpty());
	}

	@Test
	public void testPostingLookupByDocument() {
		InvertedIndex index = sampleIndex();

		assertEquals(2, index.posting("quick", 1).orElseThrow().termFrequency());
		assertEquals(1, index.posting("fox", 5).orElseThrow().termFrequency());
		assertTrue(index.posting("fox", 2).isEmpty());
	}

	@Test
	public void testEveryOccurrenceIsRecorded() {
		List<String> terms = List.of("a", "b", "a", "c", "a", "b");
		InvertedIndex index = InvertedIndex.builder().addDocument(7, terms).build();

		for (String term : Set.copyOf(terms)) {
			Posting posting = index.posting(term, 7).orElseThrow();
			int[] positions = posting.positions();
			for (int i = 1; i < positions.length; i++) {
				assertTrue(positions[i] > positions[i - 1]);
			}
			assertEquals(terms.stream().filter(term::equals).count(), positions.length);
			for (int position : positions) {
				assertEquals(term, terms.get(position));
			}
		}
	}

	@Test
	public void testEmptyDocumentCountsButAddsNoTerms() {
		InvertedIndex index = InvertedIndex.builder()
				.addDocument(1, List.of())
				.addDocument(2, List.of("word"))
				.build();

		assertEquals(2, index.documentCount());
		assertEquals(0, index.documentLength(1));
		assertEquals(1, index.size());
	}

	@Test
	public void testDocumentsMustArriveInAscendingOrder() {
		InvertedIndex.Builder builder = InvertedIndex.builder().addDocument(3, List.of("x"));

		assertThrows(IllegalArgumentException.class, () -> builder.addDocument(3, List.of("y")));
		assertThrows(IllegalArgumentException.class, () -> builder.addDocument(2, List.of("y")));
	}

	@Test
	public void testIndexIsReadOnly() {
		InvertedIndex index = sampleIndex();

		assertThrows(UnsupportedOperationException.class, () -> index.postings("quick").clear());
		assertThrows(UnsupportedOperationException.class, () -> index.asMap().remove("quick"));
		assertThrows(UnsupportedOperationException.class, () -> index.vocabulary().add("zebra"));
	}

	@Test
	public void testOfAcceptsBuiltData() {
		InvertedIndex index = sampleIndex();

		assertEquals(index, InvertedIndex.of(index.asMap(), index.documentLengths()));
	}

	@Test
	public void testOfRejectsInconsistentData() {
		Map<Integer, Integer> lengths = Map.of(1, 2, 2, 1);

		// descending postings
		assertThrows(IllegalArgumentException.class, () -> InvertedIndex.of(
				Map.of("a", List.of(new Posting(2, new int[]{0}), new Posting(1, new int[]{0, 1}))), lengths));
		// unknown document
		assertThrows(IllegalArgumentException.class, () -> InvertedIndex.of(
				Map.of("a", List.of(new Posting(9, new int[]{0}))), Map.of(1, 1)));
		// position outside document
		assertThrows(IllegalArgumentException.class, () -> InvertedIndex.of(
				Map.of("a", List.of(new Posting(1, new int[]{0, 5}), new Posting(2, new int[]{0}))), lengths));
		// term without postings
		assertThrows(IllegalArgumentException.class, () -> InvertedIndex.of(Map.of("a", List.of()), Map.of()));
	}

	@Test
	public void testOfRejectsSharedPositions() {
		// totals still add up: two terms on position 0, nothing on position 1
		Map<String, List<Posting>> postings = Map.of(
				"quick", List.of(new Posting(1, new int[]{0})),
				"fox", List.of(new Posting(1, new int[]{0})));

		IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
				() -> InvertedIndex.of(postings, Map.of(1, 2)));
		assertTrue(e.getMessage().contains("Position 0 of document 1"));

		Map<String, List<Posting>> valid = Map.of(
				"quick", List.of(new Posting(1, new int[]{0})),
				"fox", List.of(new Posting(1, new int[]{1})));
		assertEquals(2, InvertedIndex.of(valid, Map.of(1, 2)).totalTokens());
	}

	@Test
	public void testPostingRejectsUnsortedPositions() {
		assertThrows(IllegalArgumentException.class, () -> new Posting(1, new int[]{3, 3}));
		assertThrows(IllegalArgumentException.class, () -> new Posting(1, new int[]{4, 2}));
		assertThrows(IllegalArgumentException.class, () -> new Posting(1, new int[]{}));
		assertThrows(IllegalArgumentException.class, () -> new Posting(-1, new int[]{0}));
	}
}
