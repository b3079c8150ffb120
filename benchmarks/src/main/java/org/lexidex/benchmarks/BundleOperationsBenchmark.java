package org.lexidex.benchmarks;

import org.lexidex.core.index.IndexBuildException;
import org.lexidex.core.index.IndexBuilder;
import org.lexidex.core.index.IndexBundle;
import org.lexidex.core.model.Document;
import org.lexidex.core.persistence.BundleCodec;
import org.lexidex.core.persistence.BundleLoadException;
import org.lexidex.core.query.QueryEngine;
import org.lexidex.core.text.Normalizer;
import org.lexidex.core.text.NormalizerConfig;
import org.lexidex.core.text.StemmerType;
import org.lexidex.core.text.StopWords;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.infra.Blackhole;

import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Benchmarks for the core bundle operations
 * Tests: build, free-text query, phrase query, suggest, encode, decode
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@State(Scope.Benchmark)
@Warmup(iterations = 3, time = 1)
@Measurement(iterations = 5, time = 1)
@Fork(1)
public class BundleOperationsBenchmark {

	private static final long SEED = 42L;

	@Param({"100", "1000", "5000"})
	private int corpusSize;

	private Normalizer normalizer;
	private List<Document> documents;
	private IndexBundle bundle;
	private QueryEngine engine;
	private BundleCodec codec;
	private String encoded;

	private String freeTextQuery;
	private String phraseQuery;

	@Setup(Level.Trial)
	public void setup() throws IndexBuildException {
		System.out.println("=== Bundle Operations Benchmark Setup (corpusSize=" + corpusSize + ") ===");

		normalizer = new Normalizer(NormalizerConfig.of(StemmerType.PORTER, StopWords.load(StopWords.DEFAULT_SOURCE)));
		List<String> vocabulary = SyntheticCorpus.vocabulary(2000, SEED);
		documents = SyntheticCorpus.documents(corpusSize, 200, vocabulary, SEED);

		bundle = new IndexBuilder(normalizer).build(documents);
		engine = new QueryEngine(normalizer, bundle);
		codec = new BundleCodec();
		encoded = codec.encode(bundle);

		freeTextQuery = vocabulary.get(0) + " " + vocabulary.get(1);
		phraseQuery = "\"" + documents.get(0).rawText().split(" ")[3] + " " + documents.get(0).rawText().split(" ")[4] + "\"";

		System.out.println("Bundle ready: " + bundle.index().size() + " unique terms, "
				+ (encoded.length() / 1024) + " KB encoded");
	}

	@Benchmark
	public IndexBundle benchmarkBuild() throws IndexBuildException {
		return new IndexBuilder(normalizer).build(documents);
	}

	@Benchmark
	public void benchmarkFreeTextQuery(Blackhole blackhole) {
		blackhole.consume(engine.search(freeTextQuery, 10));
	}

	@Benchmark
	public void benchmarkPhraseQuery(Blackhole blackhole) {
		blackhole.consume(engine.search(phraseQuery, 10));
	}

	@Benchmark
	public void benchmarkSuggest(Blackhole blackhole) {
		blackhole.consume(bundle.trie().suggest("ka", 10));
		blackhole.consume(bundle.trie().suggest("quick", 10));
	}

	@Benchmark
	public String benchmarkEncode() {
		return codec.encode(bundle);
	}

	@Benchmark
	public IndexBundle benchmarkDecode() throws BundleLoadException {
		return codec.decode(encoded);
	}
}
