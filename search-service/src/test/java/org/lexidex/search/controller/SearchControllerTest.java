package org.lexidex.search.controller;

import com.google.gson.Gson;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import io.javalin.Javalin;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.lexidex.core.index.IndexBuilder;
import org.lexidex.core.model.Document;
import org.lexidex.core.persistence.BundleCodec;
import org.lexidex.core.text.Normalizer;
import org.lexidex.core.text.NormalizerConfig;
import org.lexidex.core.text.StemmerType;
import org.lexidex.search.indexer.JsonBundleReader;
import org.lexidex.search.service.SearchService;
import org.lexidex.search.web.SearchHttpServer;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class SearchControllerTest {
	private static final Normalizer NORMALIZER = new Normalizer(NormalizerConfig.of(StemmerType.NONE, Set.of("the")));
	private static final Gson gson = new Gson();

	@TempDir
	Path tempDir;

	private final HttpClient client = HttpClient.newHttpClient();
	private SearchService service;
	private Javalin app;

	@BeforeEach
	public void setUp() {
		service = new SearchService(new JsonBundleReader(tempDir.toString(), "bundle.json"), NORMALIZER, 10, 5);
		app = SearchHttpServer.start(0, new SearchController(service, 10));
	}

	@AfterEach
	public void tearDown() {
		app.stop();
	}

	private void writeBundle() throws Exception {
		Files.writeString(tempDir.resolve("bundle.json"), new BundleCodec().encode(new IndexBuilder(NORMALIZER).build(List.of(
				Document.of(1, "the quick brown fox", "doc1"),
				Document.of(2, "the lazy dog", "doc2"),
				Document.of(3, "quick fox jumps", "doc3")
		))));
	}

	private HttpResponse<String> get(String pathAndQuery) throws Exception {
		HttpRequest request = HttpRequest.newBuilder(URI.create("http://localhost:" + app.port() + pathAndQuery)).GET().build();
		return client.send(request, HttpResponse.BodyHandlers.ofString());
	}

	private HttpResponse<String> post(String path) throws Exception {
		HttpRequest request = HttpRequest.newBuilder(URI.create("http://localhost:" + app.port() + path))
				.POST(HttpRequest.BodyPublishers.noBody()).build();
		return client.send(request, HttpResponse.BodyHandlers.ofString());
	}

	private static String encode(String value) {
		return URLEncoder.encode(value, StandardCharsets.UTF_8);
	}

	@Test
	public void testUnloadedIndexAnswers503() throws Exception {
		assertEquals(503, get("/search?q=fox").statusCode());
		assertEquals(503, get("/suggest?prefix=f").statusCode());
		assertEquals(503, get("/documents/1").statusCode());

		HttpResponse<String> health = get("/health");
		assertEquals(200, health.statusCode());
		assertFalse(gson.fromJson(health.body(), JsonObject.class).get("index_loaded").getAsBoolean());
	}

	@Test
	public void testReloadThenSearch() throws Exception {
		assertEquals(500, post("/index/reload").statusCode());

		writeBundle();
		HttpResponse<String> reload = post("/index/reload");
		assertEquals(200, reload.statusCode());
		assertEquals(3, gson.fromJson(reload.body(), JsonObject.class).get("documentCount").getAsInt());

		HttpResponse<String> search = get("/search?q=" + encode("quick fox"));
		assertEquals(200, search.statusCode());
		JsonObject body = gson.fromJson(search.body(), JsonObject.class);
		assertEquals("free_text", body.get("mode").getAsString());
		assertEquals(2, body.get("totalResults").getAsInt());
		JsonArray results = body.getAsJsonArray("results");
		assertEquals(1, results.get(0).getAsJsonObject().get("documentId").getAsInt());
		assertEquals("doc1", results.get(0).getAsJsonObject().get("title").getAsString());

		JsonObject phrase = gson.fromJson(get("/search?q=" + encode("\"quick fox\"") + "&limit=1").body(), JsonObject.class);
		assertEquals("phrase", phrase.get("mode").getAsString());
		assertEquals(3, phrase.getAsJsonArray("results").get(0).getAsJsonObject().get("documentId").getAsInt());

		System.out.println("✅ Reload and search test passed!");
	}

	@Test
	public void testBadRequests() throws Exception {
		writeBundle();
		service.reload();

		assertEquals(400, get("/search").statusCode());
		assertEquals(400, get("/search?q=%20%20").statusCode());
		assertEquals(400, get("/search?q=fox&limit=many").statusCode());
		assertEquals(400, get("/suggest?prefix=f&limit=x").statusCode());
		assertEquals(400, get("/documents/abc").statusCode());

		HttpResponse<String> missing = get("/documents/99");
		assertEquals(404, missing.statusCode());
		assertTrue(gson.fromJson(missing.body(), JsonObject.class).has("error"));
	}

	@Test
	public void testSuggestAndDocument() throws Exception {
		writeBundle();
		service.reload();

		JsonArray suggestions = gson.fromJson(get("/suggest?prefix=QU").body(), JsonArray.class);
		assertEquals(1, suggestions.size());
		assertEquals("quick", suggestions.get(0).getAsString());
		assertEquals(0, gson.fromJson(get("/suggest?prefix=").body(), JsonArray.class).size());

		JsonObject document = gson.fromJson(get("/documents/2").body(), JsonObject.class);
		assertEquals("doc2", document.get("title").getAsString());

		JsonObject stats = gson.fromJson(get("/stats").body(), JsonObject.class);
		assertTrue(stats.get("loaded").getAsBoolean());
		assertEquals(6, stats.get("uniqueTerms").getAsInt());
	}
}
