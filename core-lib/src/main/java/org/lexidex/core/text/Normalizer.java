package org.lexidex.core.text;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns raw text into the ordered term stream that the index is built from and queries are matched against.
 *
 * <p>Lowercases, splits on anything that is not a letter, digit or underscore, drops stop words, then stems.
 * The index of a term in the returned list is its position. Instances hold only their immutable
 * {@link NormalizerConfig} and are safe to share between threads.</p>
 */
public final class Normalizer {
    private static final Pattern WORD_PATTERN = Pattern.compile("[\\p{L}\\p{M}\\p{N}_]+");

    private final NormalizerConfig config;

    public Normalizer(NormalizerConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    public NormalizerConfig config() {
        return config;
    }

    /**
     * Normalizes text into terms. Null or empty text, or text without word characters, gives an empty list.
     */
    public List<String> normalize(String text) {
        List<String> terms = new ArrayList<>();
        for (String token : tokenize(text)) {
            if (config.stopWords().contains(token)) {
                continue;
            }
            terms.add(config.stemmer().stem(token));
        }
        return terms;
    }

    /**
     * Lowercased word tokens before stop word removal and stemming.
     */
    public static List<String> tokenize(String text) {
        List<String> tokens = new ArrayList<>();
        if (text == null || text.isEmpty()) {
            return tokens;
        }
        Matcher matcher = WORD_PATTERN.matcher(text.toLowerCase(Locale.ROOT));
        while (matcher.find()) {
            tokens.add(matcher.group());
        }
        return tokens;
    }
}
