package org.lexidex.benchmarks;

import org.lexidex.core.model.Document;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Deterministic pseudo-text with a skewed word distribution, so that common words have long posting lists.
 */
final class SyntheticCorpus {
	private static final String[] SYLLABLES = {
			"ka", "lo", "mi", "ne", "ru", "sa", "ti", "vo", "ze", "pa", "qu", "ick", "fox", "an", "er", "ing"
	};

	private SyntheticCorpus() {}

	static List<String> vocabulary(int size, long seed) {
		Random random = new Random(seed);
		List<String> words = new ArrayList<>(size);
		while (words.size() < size) {
			StringBuilder word = new StringBuilder();
			int syllables = 1 + random.nextInt(4);
			for (int i = 0; i < syllables; i++) {
				word.append(SYLLABLES[random.nextInt(SYLLABLES.length)]);
			}
			words.add(word.toString());
		}
		return words;
	}

	static List<Document> documents(int count, int wordsPerDocument, List<String> vocabulary, long seed) {
		Random random = new Random(seed);
		List<Document> documents = new ArrayList<>(count);
		for (int id = 1; id <= count; id++) {
			StringBuilder text = new StringBuilder();
			for (int w = 0; w < wordsPerDocument; w++) {
				// squaring biases towards the head of the vocabulary
				double r = random.nextDouble();
				text.append(vocabulary.get((int) (r * r * vocabulary.size()))).append(' ');
			}
			documents.add(Document.of(id, text.toString(), "doc-" + id + ".txt"));
		}
		return documents;
	}
}
