package org.lexidex.search.indexer;

import org.lexidex.core.index.IndexBundle;
import org.lexidex.core.persistence.BundleCodec;
import org.lexidex.core.persistence.BundleLoadException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

public class JsonBundleReader implements BundleReader {
	private static final Logger logger = LoggerFactory.getLogger(JsonBundleReader.class);
	private final Path source;
	private final BundleCodec codec;

	public JsonBundleReader(String indexPath, String filename) {
		this.source = Paths.get(indexPath, filename);
		this.codec = new BundleCodec();
	}

	@Override
	public IndexBundle read() throws IOException {
		if (!Files.exists(source)) {
			throw new BundleLoadException("Index bundle not found: " + source);
		}

		IndexBundle bundle;
		try (BufferedReader reader = Files.newBufferedReader(source, StandardCharsets.UTF_8)) {
			bundle = codec.decode(reader);
		}

		logger.info("Loaded index bundle from {} ({} documents, {} unique terms)",
				source, bundle.buildInfo().documentCount(), bundle.buildInfo().vocabularySize());
		return bundle;
	}

	@Override
	public Path getSource() {
		return source;
	}

	@Override
	public double getSizeInMB() {
		try {
			if (Files.exists(source)) {
				return Files.size(source) / (1024.0 * 1024.0);
			}
		} catch (IOException e) {
			logger.warn("Failed to get bundle file size", e);
		}
		return 0.0;
	}
}
