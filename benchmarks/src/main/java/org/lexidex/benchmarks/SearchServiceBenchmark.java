package org.lexidex.benchmarks;

import org.lexidex.core.index.IndexBuilder;
import org.lexidex.core.text.Normalizer;
import org.lexidex.core.text.NormalizerConfig;
import org.lexidex.core.text.StemmerType;
import org.lexidex.core.text.StopWords;
import org.lexidex.indexing.indexer.JsonBundleWriter;
import org.lexidex.search.indexer.JsonBundleReader;
import org.lexidex.search.service.SearchService;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.infra.Blackhole;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

/**
 * Benchmarks for the search service over a persisted bundle
 * Tests: reload from disk, search while serving, concurrent search
 */
@BenchmarkMode(Mode.Throughput)
@OutputTimeUnit(TimeUnit.SECONDS)
@State(Scope.Benchmark)
@Warmup(iterations = 3, time = 1)
@Measurement(iterations = 5, time = 1)
@Fork(1)
public class SearchServiceBenchmark {

	private Path workDir;
	private SearchService searchService;
	private List<String> queries;

	@Param({"1000"})
	private int corpusSize;

	@Setup(Level.Trial)
	public void setup() throws Exception {
		System.out.println("=== Search Service Benchmark Setup (corpusSize=" + corpusSize + ") ===");

		workDir = Files.createTempDirectory("lexidex-bench");
		Normalizer normalizer = new Normalizer(NormalizerConfig.of(StemmerType.PORTER, StopWords.load(StopWords.DEFAULT_SOURCE)));
		List<String> vocabulary = SyntheticCorpus.vocabulary(2000, 7L);

		new JsonBundleWriter(workDir.toString(), "bundle.json")
				.write(new IndexBuilder(normalizer).build(SyntheticCorpus.documents(corpusSize, 150, vocabulary, 7L)));

		searchService = new SearchService(new JsonBundleReader(workDir.toString(), "bundle.json"), normalizer, 100, 10);
		searchService.reload();

		queries = List.of(
				vocabulary.get(0),
				vocabulary.get(0) + " " + vocabulary.get(2),
				"\"" + vocabulary.get(0) + " " + vocabulary.get(1) + "\"",
				vocabulary.get(1500)
		);
	}

	@TearDown(Level.Trial)
	public void tearDown() throws IOException {
		try (Stream<Path> paths = Files.walk(workDir)) {
			for (Path path : paths.sorted(Comparator.reverseOrder()).toList()) {
				Files.deleteIfExists(path);
			}
		}
	}

	@Benchmark
	public void benchmarkSearch(Blackhole blackhole) {
		for (String query : queries) {
			blackhole.consume(searchService.search(query, 10));
		}
	}

	@Benchmark
	@Threads(4)
	public void benchmarkConcurrentSearch(Blackhole blackhole) {
		for (String query : queries) {
			blackhole.consume(searchService.search(query, 10));
		}
	}

	@Benchmark
	@BenchmarkMode(Mode.AverageTime)
	@OutputTimeUnit(TimeUnit.MILLISECONDS)
	public void benchmarkReload(Blackhole blackhole) throws IOException {
		blackhole.consume(searchService.reload());
	}
}
