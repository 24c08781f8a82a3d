package ch.lexcite.citation;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Languages in which Swiss legal citations are written.
 *
 * <p>German, French and Italian are official citation languages. English has no
 * distinct convention for court decisions and reuses the German prefix.</p>
 */
public enum Language {

    /**
     * German (primary language, used when no other signal is found).
     */
    DE("de"),

    /**
     * French.
     */
    FR("fr"),

    /**
     * Italian.
     */
    IT("it"),

    /**
     * English.
     */
    EN("en");

    private final String code;

    Language(String code) {
        this.code = code;
    }

    /**
     * Returns the two-letter ISO code used on the wire.
     *
     * @return lower-case language code
     */
    @JsonValue
    public String code() {
        return code;
    }

    /**
     * Parses a language code.
     *
     * @param code two-letter code, case-insensitive
     * @return the language
     * @throws IllegalArgumentException if the code is not supported
     */
    @JsonCreator
    public static Language fromCode(String code) {
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("Language code must not be blank");
        }
        String normalized = code.trim().toLowerCase(Locale.ROOT);
        for (Language language : values()) {
            if (language.code.equals(normalized)) {
                return language;
            }
        }
        throw new IllegalArgumentException("Unsupported language: " + code + ". Supported: de, fr, it, en");
    }
}
