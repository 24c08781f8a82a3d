package ch.lexcite.storage;

import org.jetbrains.annotations.Nullable;

/**
 * Filters for searching persisted decisions. Absent filters match everything.
 */
public record DecisionQuery(
    @Nullable String text,
    @Nullable CourtLevel courtLevel,
    @Nullable String canton,
    @Nullable String language,
    @Nullable String legalArea,
    @Nullable String chamber,
    @Nullable String dateFrom,
    @Nullable String dateTo,
    int limit,
    int offset
) {

    public static final int DEFAULT_LIMIT = 10;

    public DecisionQuery {
        if (limit <= 0) {
            limit = DEFAULT_LIMIT;
        }
        if (offset < 0) {
            offset = 0;
        }
    }

    public static DecisionQuery text(@Nullable String text, int limit) {
        return new DecisionQuery(text, null, null, null, null, null, null, null, limit, 0);
    }
}
