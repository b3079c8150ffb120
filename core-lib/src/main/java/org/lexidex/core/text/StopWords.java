package org.lexidex.core.text;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Loads stop word lists.
 *
 * <p>A source is one of {@code none}, {@code classpath:<resource>} or {@code file:<path>}. List files hold one word
 * per line; blank lines and lines starting with {@code #} are skipped.</p>
 */
public final class StopWords {
    private static final Logger logger = LoggerFactory.getLogger(StopWords.class);

    public static final String NONE = "none";
    public static final String CLASSPATH_PREFIX = "classpath:";
    public static final String FILE_PREFIX = "file:";
    public static final String DEFAULT_SOURCE = "classpath:stopwords/english.txt";

    private StopWords() {}

    /**
     * @throws IllegalStateException if the source is malformed or cannot be read
     */
    public static Set<String> load(String source) {
        if (source == null || source.trim().isEmpty()) {
            throw new IllegalStateException("Stop word source is required (use '" + NONE + "' for an empty list)");
        }
        String trimmed = source.trim();
        if (trimmed.equalsIgnoreCase(NONE)) {
            return new HashSet<>();
        }

        List<String> lines;
        if (trimmed.startsWith(CLASSPATH_PREFIX)) {
            lines = readResource(trimmed.substring(CLASSPATH_PREFIX.length()));
        } else if (trimmed.startsWith(FILE_PREFIX)) {
            lines = readFile(Path.of(trimmed.substring(FILE_PREFIX.length())));
        } else {
            throw new IllegalStateException("Unsupported stop word source: '" + source + "'");
        }

        Set<String> words = new HashSet<>();
        for (String line : lines) {
            String word = line.trim().toLowerCase(Locale.ROOT);
            if (!word.isEmpty() && !word.startsWith("#")) {
                words.add(word);
            }
        }
        logger.debug("Loaded {} stop words from {}", words.size(), trimmed);
        return words;
    }

    /**
     * Parse stop words from comma-separated string
     */
    public static Set<String> parseCsv(String stopWordsStr) {
        if (stopWordsStr == null || stopWordsStr.trim().isEmpty()) {
            return new HashSet<>();
        }

        String[] words = stopWordsStr.split(",");
        Set<String> stopWords = new HashSet<>();

        for (String word : words) {
            String cleaned = word.trim().toLowerCase(Locale.ROOT);
            if (!cleaned.isEmpty()) {
                stopWords.add(cleaned);
            }
        }

        return stopWords;
    }

    private static List<String> readResource(String resourceName) {
        try (InputStream in = StopWords.class.getClassLoader().getResourceAsStream(resourceName)) {
            if (in == null) {
                throw new IllegalStateException("Stop word resource not found on classpath: " + resourceName);
            }
            BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
            List<String> lines = new ArrayList<>();
            String line;
            while ((line = reader.readLine()) != null) {
                lines.add(line);
            }
            return lines;
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read stop word resource " + resourceName, e);
        }
    }

    private static List<String> readFile(Path path) {
        if (!Files.isRegularFile(path)) {
            throw new IllegalStateException("Stop word file not found: " + path);
        }
        try {
            return Files.readAllLines(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read stop word file " + path, e);
        }
    }
}
