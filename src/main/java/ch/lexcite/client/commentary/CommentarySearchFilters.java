package ch.lexcite.client.commentary;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Pattern;

/**
 * Filters of a commentary search.
 *
 * @param query          free text
 * @param language       de, fr, it or en
 * @param legislativeAct legislative act id, see {@link CommentaryClient#listLegislativeActs}
 * @param sort           title, -title, date or -date
 * @param page           1-based page number
 */
public record CommentarySearchFilters(
    String query,
    @Pattern(regexp = "de|fr|it|en", message = "language must be one of de, fr, it, en")
    String language,
    String legislativeAct,
    @Pattern(regexp = "-?(title|date)", message = "sort must be one of title, -title, date, -date")
    String sort,
    @Min(value = 1, message = "page must be at least 1")
    Integer page
) {

    public static CommentarySearchFilters query(String query) {
        return new CommentarySearchFilters(query, null, null, null, null);
    }

    public CommentarySearchFilters withLegislativeAct(String actId) {
        return new CommentarySearchFilters(query, language, actId, sort, page);
    }
}
