package org.lexidex.search.bootstrap;

import org.lexidex.core.text.Normalizer;
import org.lexidex.search.config.SearchConfig;
import org.lexidex.search.controller.SearchController;
import org.lexidex.search.indexer.JsonBundleReader;
import org.lexidex.search.service.SearchService;
import org.lexidex.search.web.SearchHttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.javalin.Javalin;

import java.io.IOException;

/**
 * Application bootstrapper for the Search Service.
 *
 * <p>Loads configuration, loads the index bundle, starts the HTTP API and registers a JVM shutdown hook. A missing
 * or unreadable bundle does not stop startup; queries answer 503 until {@code POST /index/reload} succeeds.</p>
 */
public final class SearchBootstrap {
    private static final Logger logger = LoggerFactory.getLogger(SearchBootstrap.class);

    private SearchBootstrap() {}

    /**
     * Starts the Search Service.
     *
     * <p>On startup failure, logs the error and exits with code {@code 1}.</p>
     */
    public static void run() {
        try {
            start();
        } catch (Exception e) {
            logger.error("Failed to start Search Service", e);
            System.exit(1);
        }
    }

    private static void start() {
        SearchConfig cfg = SearchConfig.load();
        SearchService service = buildService(cfg);
        loadInitialBundle(service);
        Javalin app = startHttp(cfg, service);
        addShutdownHook(app);
        logger.info("Search Service started successfully on port {}.", app.port());
    }

    private static SearchService buildService(SearchConfig cfg) {
        return new SearchService(
            new JsonBundleReader(cfg.index().path(), cfg.index().filename()),
            new Normalizer(cfg.normalizer()),
            cfg.maxResults(),
            cfg.suggestLimit()
        );
    }

    private static void loadInitialBundle(SearchService service) {
        try {
            service.reload();
        } catch (IOException e) {
            logger.warn("No index bundle served yet: {}", e.getMessage());
        }
    }

    private static Javalin startHttp(SearchConfig cfg, SearchService service) {
        SearchController controller = new SearchController(service, cfg.defaultLimit());
        return SearchHttpServer.start(cfg.serverPort(), controller);
    }

    private static void addShutdownHook(Javalin app) {
        Runtime.getRuntime().addShutdownHook(new Thread(() -> shutdown(app)));
    }

    private static void shutdown(Javalin app) {
        logger.info("Shutting down Search Service...");
        app.stop();
        logger.info("Search Service stopped.");
    }
}
