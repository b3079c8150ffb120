package org.lexidex.indexing.bootstrap;

import org.lexidex.core.index.IndexBuilder;
import org.lexidex.core.text.Normalizer;
import org.lexidex.indexing.config.IndexingConfig;
import org.lexidex.indexing.indexer.JsonBundleWriter;
import org.lexidex.indexing.service.IndexStats;
import org.lexidex.indexing.service.IndexingService;
import org.lexidex.indexing.storage.CorpusReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Application bootstrapper for the Indexing Service.
 *
 * <p>Loads configuration, wires the corpus reader, builder and bundle writer, and runs one full rebuild.</p>
 */
public final class IndexingBootstrap {
    private static final Logger logger = LoggerFactory.getLogger(IndexingBootstrap.class);

    private IndexingBootstrap() {}

    /**
     * Runs one rebuild.
     *
     * <p>On failure, logs the error and exits with code {@code 1}.</p>
     */
    public static void run(Map<String, String> overrides) {
        try {
            IndexStats stats = start(overrides);
            logger.info("Indexing finished: {} documents -> {}", stats.documentsIndexed(), stats.outputPath());
        } catch (Exception e) {
            logger.error("Indexing failed", e);
            System.exit(1);
        }
    }

    static IndexStats start(Map<String, String> overrides) throws Exception {
        IndexingConfig cfg = IndexingConfig.load(overrides);
        logConfiguration(cfg);
        return buildService(cfg).rebuild();
    }

    private static void logConfiguration(IndexingConfig cfg) {
        logger.info("Configuration:");
        logger.info("  Corpus: {} (*{}, snippet {} chars)",
                cfg.corpus().path(), cfg.corpus().extension(), cfg.corpus().snippetLength());
        logger.info("  Output: {}/{}", cfg.output().path(), cfg.output().filename());
        logger.info("  Normalizer: stemmer={}, stop words={}",
                cfg.normalizer().stemmer().configName(), cfg.normalizer().stopWords().size());
    }

    private static IndexingService buildService(IndexingConfig cfg) {
        CorpusReader reader = new CorpusReader(
            cfg.corpus().path(),
            cfg.corpus().extension(),
            cfg.corpus().snippetLength()
        );
        IndexBuilder builder = new IndexBuilder(new Normalizer(cfg.normalizer()));
        JsonBundleWriter writer = new JsonBundleWriter(
            cfg.output().path(),
            cfg.output().filename(),
            cfg.output().prettyPrint()
        );
        return new IndexingService(reader, builder, writer);
    }
}
