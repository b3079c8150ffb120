package org.lexidex.indexing.storage;

import org.lexidex.core.model.Document;
import org.lexidex.core.model.DocumentMetadata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Reads a flat directory of text files as a corpus.
 *
 * <p>Files are taken in file name order and numbered from 1, so the same directory always yields the same ids.</p>
 */
public class CorpusReader {
	private static final Logger logger = LoggerFactory.getLogger(CorpusReader.class);
	private final Path corpusPath;
	private final String extension;
	private final int snippetLength;

	public CorpusReader(String corpusPath, String extension, int snippetLength) {
		if (snippetLength < 0) {
			throw new IllegalArgumentException("Snippet length must not be negative: " + snippetLength);
		}
		this.corpusPath = Paths.get(corpusPath);
		this.extension = extension.toLowerCase(Locale.ROOT);
		this.snippetLength = snippetLength;
	}

	public Path getCorpusPath() {
		return corpusPath;
	}

	/**
	 * Matching files, sorted by file name
	 */
	public List<Path> listFiles() throws IOException {
		if (!Files.isDirectory(corpusPath)) {
			throw new IOException("Corpus directory not found: " + corpusPath);
		}

		try (Stream<Path> paths = Files.list(corpusPath)) {
			return paths
					.filter(Files::isRegularFile)
					.filter(p -> p.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(extension))
					.sorted(Comparator.comparing(p -> p.getFileName().toString()))
					.collect(Collectors.toList());
		}
	}

	/**
	 * Read every matching file as a document with ids 1..n
	 */
	public List<Document> readAll() throws IOException {
		List<Path> files = listFiles();
		List<Document> documents = new ArrayList<>(files.size());

		int id = 1;
		for (Path file : files) {
			documents.add(readDocument(id++, file));
		}

		logger.info("Read {} documents from {}", documents.size(), corpusPath);
		return documents;
	}

	private Document readDocument(int id, Path file) throws IOException {
		// malformed bytes are replaced rather than rejected
		String text = new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
		String title = file.getFileName().toString();
		logger.debug("Document {} <- {} ({} chars)", id, title, text.length());
		return new Document(id, text, new DocumentMetadata(title, file.toString(), snippet(text, snippetLength)));
	}

	/**
	 * Whitespace-collapsed prefix of the text
	 */
	public static String snippet(String text, int length) {
		String collapsed = text.replaceAll("\\s+", " ").trim();
		if (collapsed.length() <= length) {
			return collapsed;
		}
		int end = length;
		if (end > 0 && Character.isHighSurrogate(collapsed.charAt(end - 1))) {
			end--;
		}
		return collapsed.substring(0, end);
	}
}
