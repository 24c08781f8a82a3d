package ch.lexcite.retrieval;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Result of a search tool.
 *
 * @param results       records on this page
 * @param total         total number of matches reported by the source
 * @param fromCache     true when served from the cache
 * @param source        origin of the results
 * @param degraded      true when served from the database because a source failed
 * @param failedSources sources that failed, present only for partial results
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SearchResponse<T>(
    List<T> results,
    long total,
    boolean fromCache,
    ResultSource source,
    boolean degraded,
    List<String> failedSources
) {

    public SearchResponse {
        results = results == null ? List.of() : List.copyOf(results);
        failedSources = failedSources == null || failedSources.isEmpty() ? null : List.copyOf(failedSources);
    }
}
