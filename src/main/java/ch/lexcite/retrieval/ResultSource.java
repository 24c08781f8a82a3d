package ch.lexcite.retrieval;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Where a retrieval result came from.
 */
public enum ResultSource {
    API,
    CACHE,
    DATABASE;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
