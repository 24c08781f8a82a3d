package ch.lexcite.retrieval;

import java.util.List;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;

/**
 * Search over federal and cantonal decisions.
 *
 * @param query    free text
 * @param cantons  restricts the cantonal side to these canton codes
 * @param language de, fr or it
 * @param dateFrom earliest decision date, ISO-8601
 * @param dateTo   latest decision date, ISO-8601
 * @param limit    page size per source, 1 to 50
 */
public record UnifiedSearchRequest(
    @NotBlank(message = "query is required")
    String query,
    List<String> cantons,
    @Pattern(regexp = "de|fr|it", message = "language must be one of de, fr, it")
    String language,
    @Pattern(regexp = "\\d{4}-\\d{2}-\\d{2}", message = "dateFrom must be an ISO date (YYYY-MM-DD)")
    String dateFrom,
    @Pattern(regexp = "\\d{4}-\\d{2}-\\d{2}", message = "dateTo must be an ISO date (YYYY-MM-DD)")
    String dateTo,
    @Min(value = 1, message = "limit must be at least 1")
    @Max(value = 50, message = "limit must be at most 50")
    Integer limit
) {
}
