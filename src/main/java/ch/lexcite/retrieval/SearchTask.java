package ch.lexcite.retrieval;

import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.Supplier;

import org.jetbrains.annotations.Nullable;

import ch.lexcite.storage.SearchPage;

/**
 * One cache-first search.
 *
 * @param tool       tool name, used for logging and the query log
 * @param cacheKey   cache key of the listing
 * @param recordType type of the listed records
 * @param queryText  free-text part of the query, for the query log
 * @param filtersJson filters as JSON, for the query log
 * @param fetch      fetches the listing from the source
 * @param persist    persists fetched records, may be null
 * @param fallback   searches the database when the source fails, may be null
 */
public record SearchTask<T>(
    String tool,
    String cacheKey,
    Class<T> recordType,
    @Nullable String queryText,
    @Nullable String filtersJson,
    Supplier<SearchPage<T>> fetch,
    @Nullable Consumer<List<T>> persist,
    @Nullable Supplier<SearchPage<T>> fallback
) {

    public SearchTask {
        Objects.requireNonNull(tool, "tool must not be null");
        Objects.requireNonNull(cacheKey, "cacheKey must not be null");
        Objects.requireNonNull(recordType, "recordType must not be null");
        Objects.requireNonNull(fetch, "fetch must not be null");
    }
}
