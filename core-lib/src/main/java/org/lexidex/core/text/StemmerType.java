package org.lexidex.core.text;

import org.tartarus.snowball.SnowballStemmer;
import org.tartarus.snowball.ext.EnglishStemmer;
import org.tartarus.snowball.ext.PorterStemmer;

import java.util.Arrays;
import java.util.Locale;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Stemming algorithms a {@link Normalizer} can be configured with. Exactly one is active per configuration.
 */
public enum StemmerType {
    /** Snowball port of the original Porter algorithm. */
    PORTER("porter", PorterStemmer::new),
    /** Snowball English (Porter2). */
    ENGLISH("english", EnglishStemmer::new),
    /** Identity; tokens are indexed as they come out of the tokenizer. */
    NONE("none", null);

    private final String configName;
    private final Supplier<SnowballStemmer> factory;

    StemmerType(String configName, Supplier<SnowballStemmer> factory) {
        this.configName = configName;
        this.factory = factory;
    }

    public String configName() {
        return configName;
    }

    /**
     * Stems a single lowercase token.
     *
     * <p>Snowball stemmers keep per-call buffers, so every call gets its own instance.</p>
     */
    public String stem(String token) {
        if (factory == null || token.isEmpty()) {
            return token;
        }
        SnowballStemmer stemmer = factory.get();
        stemmer.setCurrent(token);
        stemmer.stem();
        String stemmed = stemmer.getCurrent();
        return stemmed.isEmpty() ? token : stemmed;
    }

    /**
     * Resolves a configuration value such as {@code porter} or {@code NONE}.
     *
     * @throws IllegalStateException if the name matches no stemmer
     */
    public static StemmerType fromName(String name) {
        if (name == null) {
            throw new IllegalStateException("Stemmer name is required");
        }
        String wanted = name.trim().toLowerCase(Locale.ROOT);
        for (StemmerType type : values()) {
            if (type.configName.equals(wanted)) {
                return type;
            }
        }
        String known = Arrays.stream(values()).map(StemmerType::configName).collect(Collectors.joining(", "));
        throw new IllegalStateException("Unknown stemmer '" + name + "'. Expected one of: " + known);
    }
}
