package ch.lexcite.storage;

import java.util.Locale;

/**
 * Classes of cached data. Each class has its own time-to-live.
 */
public enum CacheType {
    /** Search result listings; upstream results change over time. */
    LISTING,
    /** Single records looked up by a stable identifier. */
    RECORD,
    /** Results served from the persistent store while a source is unavailable. */
    FALLBACK;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static CacheType fromValue(String value) {
        return valueOf(value.toUpperCase(Locale.ROOT));
    }
}
