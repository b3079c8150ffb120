package org.lexidex.search.controller;

import com.google.gson.Gson;
import io.javalin.Javalin;
import io.javalin.http.Context;
import org.lexidex.core.model.DocumentMetadata;
import org.lexidex.search.model.SearchResponse;
import org.lexidex.search.service.IndexNotLoadedException;
import org.lexidex.search.service.SearchService;
import org.lexidex.search.service.SearchStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public class SearchController {
	private static final Logger logger = LoggerFactory.getLogger(SearchController.class);
	private static final Gson gson = new Gson();
	private final SearchService searchService;
	private final int defaultLimit;

	public SearchController(SearchService searchService, int defaultLimit) {
		this.searchService = searchService;
		this.defaultLimit = defaultLimit;
	}

	/**
	 * Register all routes with the Javalin app
	 */
	public void registerRoutes(Javalin app) {
		app.get("/health", this::handleHealth);

		app.get("/search", this::handleSearch);

		app.get("/suggest", this::handleSuggest);

		app.get("/documents/{id}", this::handleDocument);

		app.get("/stats", this::handleStats);

		app.post("/index/reload", this::handleReload);

		logger.info("Search routes registered");
	}

	/**
	 * GET /health
	 */
	private void handleHealth(Context ctx) {
		Map<String, Object> health = new HashMap<>();
		health.put("service", "search-service");
		health.put("status", "running");
		health.put("timestamp", System.currentTimeMillis());
		health.put("index_loaded", searchService.isLoaded());

		ctx.result(gson.toJson(health));
	}

	/**
	 * GET /search?q={query}&limit={limit}
	 * Free-text search, or a phrase search when the query is wrapped in double quotes
	 */
	private void handleSearch(Context ctx) {
		String query = ctx.queryParam("q");
		if (query == null || query.trim().isEmpty()) {
			error(ctx, 400, "Query parameter 'q' is required.");
			return;
		}

		Integer limit = parseLimit(ctx);
		if (limit == null) {
			return;
		}

		try {
			logger.info("Search request: q='{}', limit={}", query, limit);
			SearchResponse response = searchService.search(query, limit);
			ctx.status(200).result(gson.toJson(response));
			logger.info("Returned {} of {} search results", response.results().size(), response.totalResults());
		} catch (IndexNotLoadedException e) {
			notLoaded(ctx);
		} catch (Exception e) {
			error(ctx, 500, "Search failed: " + e.getMessage());
			logger.error("Search failed", e);
		}
	}

	/**
	 * GET /suggest?prefix={prefix}&limit={limit}
	 */
	private void handleSuggest(Context ctx) {
		Integer limit = parseLimit(ctx);
		if (limit == null) {
			return;
		}

		try {
			List<String> suggestions = searchService.suggest(ctx.queryParam("prefix"), limit);
			ctx.status(200).result(gson.toJson(suggestions));
		} catch (IndexNotLoadedException e) {
			notLoaded(ctx);
		} catch (Exception e) {
			error(ctx, 500, "Suggest failed: " + e.getMessage());
			logger.error("Suggest failed", e);
		}
	}

	/**
	 * GET /documents/{id}
	 */
	private void handleDocument(Context ctx) {
		int documentId;
		try {
			documentId = Integer.parseInt(ctx.pathParam("id"));
		} catch (NumberFormatException e) {
			error(ctx, 400, "Invalid document id. Must be an integer.");
			return;
		}

		try {
			Optional<DocumentMetadata> metadata = searchService.document(documentId);
			if (metadata.isEmpty()) {
				error(ctx, 404, "Document " + documentId + " not found.");
				return;
			}
			Map<String, Object> response = new HashMap<>();
			response.put("documentId", documentId);
			response.put("title", metadata.get().title());
			response.put("path", metadata.get().path());
			response.put("snippet", metadata.get().snippet());
			ctx.status(200).result(gson.toJson(response));
		} catch (IndexNotLoadedException e) {
			notLoaded(ctx);
		}
	}

	/**
	 * GET /stats
	 */
	private void handleStats(Context ctx) {
		SearchStats stats = searchService.getStats();
		ctx.status(200).result(gson.toJson(stats));
		logger.debug("Retrieved search statistics");
	}

	/**
	 * POST /index/reload
	 * Load the bundle from disk again; the current one keeps serving if that fails
	 */
	private void handleReload(Context ctx) {
		try {
			SearchStats stats = searchService.reload();
			ctx.status(200).result(gson.toJson(stats));
		} catch (Exception e) {
			error(ctx, 500, "Reload failed: " + e.getMessage());
			logger.error("Index reload failed", e);
		}
	}

	/**
	 * Limit from the query string, the default when absent, or null after answering 400
	 */
	private Integer parseLimit(Context ctx) {
		String limitStr = ctx.queryParam("limit");
		if (limitStr == null || limitStr.isEmpty()) {
			return defaultLimit;
		}
		try {
			return Integer.parseInt(limitStr);
		} catch (NumberFormatException e) {
			error(ctx, 400, "Invalid limit format. Must be an integer.");
			return null;
		}
	}

	private void notLoaded(Context ctx) {
		error(ctx, 503, "Index not loaded.");
		logger.warn("Rejected {} {}: index not loaded", ctx.method(), ctx.path());
	}

	private static void error(Context ctx, int status, String message) {
		Map<String, String> error = new HashMap<>();
		error.put("error", message);
		ctx.status(status).result(gson.toJson(error));
	}
}
