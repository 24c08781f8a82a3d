package ch.lexcite.retrieval;

import com.fasterxml.jackson.annotation.JsonInclude;

import ch.lexcite.citation.ParsedCitation;

/**
 * Result of a lookup tool.
 *
 * @param found           whether the record exists
 * @param record          the record when found
 * @param fromCache       true when served from the cache
 * @param source          origin of the record, absent when nothing was fetched
 * @param degraded        true when served from the database because the source failed
 * @param invalidCitation parse result when the request carried a citation that is not valid
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record LookupResponse<T>(
    boolean found,
    T record,
    boolean fromCache,
    ResultSource source,
    boolean degraded,
    ParsedCitation invalidCitation
) {

    public static <T> LookupResponse<T> found(T record, ResultSource source) {
        return new LookupResponse<>(true, record, source == ResultSource.CACHE, source, source == ResultSource.DATABASE,
            null);
    }

    public static <T> LookupResponse<T> notFound() {
        return new LookupResponse<>(false, null, false, ResultSource.API, false, null);
    }

    public static <T> LookupResponse<T> invalid(ParsedCitation parsed) {
        return new LookupResponse<>(false, null, false, null, false, parsed);
    }
}
