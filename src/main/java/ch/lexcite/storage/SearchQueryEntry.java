package ch.lexcite.storage;

import java.time.Instant;

import org.jetbrains.annotations.Nullable;

/**
 * One executed external search.
 *
 * @param queryText       free-text query, if any
 * @param queryType       tool that ran the search
 * @param filters         filters as JSON
 * @param resultCount     number of results returned
 * @param executionTimeMs wall-clock time of the search
 * @param source          where the results came from (api, cache, database)
 * @param createdAt       time of the search, set by the log when absent
 */
public record SearchQueryEntry(
    @Nullable String queryText,
    String queryType,
    @Nullable String filters,
    int resultCount,
    long executionTimeMs,
    String source,
    @Nullable Instant createdAt
) {
}
