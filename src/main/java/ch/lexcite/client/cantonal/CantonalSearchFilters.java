package ch.lexcite.client.cantonal;

import java.util.List;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Pattern;

/**
 * Filters of a search on entscheidsuche.ch.
 *
 * @param query    Elasticsearch simple query string
 * @param courts   court identifiers as used in the hierarchy, e.g. {@code ZH_OG}
 * @param cantons  canton codes, e.g. {@code ZH}
 * @param language de, fr or it
 * @param dateFrom earliest decision date, ISO-8601
 * @param dateTo   latest decision date, ISO-8601
 * @param limit    page size, 1 to 50, default 10
 * @param offset   number of results to skip
 */
public record CantonalSearchFilters(
    String query,
    List<String> courts,
    List<String> cantons,
    @Pattern(regexp = "de|fr|it", message = "language must be one of de, fr, it")
    String language,
    @Pattern(regexp = "\\d{4}-\\d{2}-\\d{2}", message = "dateFrom must be an ISO date (YYYY-MM-DD)")
    String dateFrom,
    @Pattern(regexp = "\\d{4}-\\d{2}-\\d{2}", message = "dateTo must be an ISO date (YYYY-MM-DD)")
    String dateTo,
    @Min(value = 1, message = "limit must be at least 1")
    @Max(value = 50, message = "limit must be at most 50")
    Integer limit,
    @Min(value = 0, message = "offset must not be negative")
    Integer offset
) {

    public static final int DEFAULT_LIMIT = 10;
    public static final int MAX_LIMIT = 50;

    public CantonalSearchFilters {
        courts = courts == null ? List.of() : List.copyOf(courts);
        cantons = cantons == null ? List.of() : List.copyOf(cantons);
    }

    public static CantonalSearchFilters query(String query) {
        return new CantonalSearchFilters(query, null, null, null, null, null, null, null);
    }

    public int effectiveLimit() {
        if (limit == null || limit < 1) {
            return DEFAULT_LIMIT;
        }
        return Math.min(limit, MAX_LIMIT);
    }

    public int effectiveOffset() {
        return offset == null || offset < 0 ? 0 : offset;
    }

    public CantonalSearchFilters normalized() {
        return new CantonalSearchFilters(query, courts, cantons, language, dateFrom, dateTo, effectiveLimit(),
            effectiveOffset());
    }
}
