package org.lexidex.indexing.indexer;

import org.lexidex.core.index.IndexBundle;
import org.lexidex.core.persistence.BundleCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;

/**
 * Writes the bundle as one JSON file. The file is written next to the target and then moved over it, so a reader
 * never sees a half-written bundle.
 */
public class JsonBundleWriter implements BundleWriter {
	private static final Logger logger = LoggerFactory.getLogger(JsonBundleWriter.class);
	private final Path outputDir;
	private final Path target;
	private final BundleCodec codec;

	public JsonBundleWriter(String outputPath, String filename) {
		this(outputPath, filename, false);
	}

	public JsonBundleWriter(String outputPath, String filename, boolean prettyPrint) {
		this.outputDir = Paths.get(outputPath);
		this.target = outputDir.resolve(filename);
		this.codec = new BundleCodec(prettyPrint);
	}

	@Override
	public Path write(IndexBundle bundle) throws IOException {
		Files.createDirectories(outputDir);
		Path temp = Files.createTempFile(outputDir, target.getFileName().toString(), ".tmp");

		try {
			try (BufferedWriter writer = Files.newBufferedWriter(temp, StandardCharsets.UTF_8)) {
				codec.encode(bundle, writer);
			}
			moveIntoPlace(temp);
		} catch (IOException | RuntimeException e) {
			Files.deleteIfExists(temp);
			throw e;
		}

		logger.info("Saved index bundle to {} ({} documents, {} terms, {} MB)",
				target, bundle.buildInfo().documentCount(), bundle.buildInfo().vocabularySize(),
				String.format("%.2f", getSizeInMB()));
		return target;
	}

	private void moveIntoPlace(Path temp) throws IOException {
		try {
			Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
		} catch (AtomicMoveNotSupportedException e) {
			logger.warn("Atomic move not supported in {}, replacing bundle non-atomically", outputDir);
			Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
		}
	}

	@Override
	public Path getTarget() {
		return target;
	}

	@Override
	public double getSizeInMB() {
		try {
			if (Files.exists(target)) {
				long bytes = Files.size(target);
				return bytes / (1024.0 * 1024.0);
			}
		} catch (IOException e) {
			logger.warn("Failed to get bundle file size", e);
		}
		return 0.0;
	}
}
