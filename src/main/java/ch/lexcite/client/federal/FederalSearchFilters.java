package ch.lexcite.client.federal;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Pattern;

/**
 * Filters of a federal decision search. Every field is optional.
 *
 * @param query     free text
 * @param language  de, fr or it
 * @param chamber   chamber numeral, I to V
 * @param legalArea legal area name
 * @param dateFrom  earliest decision date, ISO-8601
 * @param dateTo    latest decision date, ISO-8601
 * @param limit     page size, 1 to 50, default 10
 * @param offset    number of results to skip
 */
public record FederalSearchFilters(
    String query,
    @Pattern(regexp = "de|fr|it", message = "language must be one of de, fr, it")
    String language,
    @Pattern(regexp = "I|II|III|IV|V", message = "chamber must be one of I, II, III, IV, V")
    String chamber,
    String legalArea,
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

    public static FederalSearchFilters query(String query) {
        return new FederalSearchFilters(query, null, null, null, null, null, null, null);
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

    /**
     * @return the same filters with limit and offset resolved to their effective values
     */
    public FederalSearchFilters normalized() {
        return new FederalSearchFilters(query, language, chamber, legalArea, dateFrom, dateTo, effectiveLimit(),
            effectiveOffset());
    }
}
