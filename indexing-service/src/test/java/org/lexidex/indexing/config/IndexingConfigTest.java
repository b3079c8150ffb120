package org.lexidex.indexing.config;

import org.junit.jupiter.api.Test;
import org.lexidex.core.text.StemmerType;

import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

public class IndexingConfigTest {

	private static Properties baseProperties() {
		Properties p = new Properties();
		p.setProperty("corpus.path", "docs");
		p.setProperty("corpus.extension", ".txt");
		p.setProperty("corpus.snippet.length", "120");
		p.setProperty("index.output.path", "out");
		p.setProperty("index.output.filename", "bundle.json");
		p.setProperty("normalizer.stemmer", "english");
		p.setProperty("normalizer.stopwords.source", "none");
		p.setProperty("normalizer.stopwords.extra", "foo, Bar");
		return p;
	}

	@Test
	public void testFromProperties() {
		IndexingConfig cfg = IndexingConfig.from(baseProperties());

		assertEquals("docs", cfg.corpus().path());
		assertEquals(120, cfg.corpus().snippetLength());
		assertEquals("bundle.json", cfg.output().filename());
		assertFalse(cfg.output().prettyPrint());
		assertEquals(StemmerType.ENGLISH, cfg.normalizer().stemmer());
		assertTrue(cfg.normalizer().stopWords().contains("bar"));
	}

	@Test
	public void testMissingKeyFailsFast() {
		Properties p = baseProperties();
		p.remove("corpus.path");

		IllegalStateException e = assertThrows(IllegalStateException.class, () -> IndexingConfig.from(p));
		assertTrue(e.getMessage().contains("corpus.path"));
	}

	@Test
	public void testInvalidInteger() {
		Properties p = baseProperties();
		p.setProperty("corpus.snippet.length", "lots");

		assertThrows(IllegalStateException.class, () -> IndexingConfig.from(p));

		p.setProperty("corpus.snippet.length", "-3");
		assertThrows(IllegalStateException.class, () -> IndexingConfig.from(p));
	}

	@Test
	public void testUnknownStemmer() {
		Properties p = baseProperties();
		p.setProperty("normalizer.stemmer", "lancaster");

		assertThrows(IllegalStateException.class, () -> IndexingConfig.from(p));
	}
}
