package ch.lexcite.retrieval;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

import org.jetbrains.annotations.Nullable;

import ch.lexcite.client.LookupResult;

/**
 * One cache-first lookup by identifier.
 *
 * @param tool       tool name, used for logging
 * @param cacheKey   cache key of the record
 * @param recordType type of the record
 * @param fetch      fetches the record from the source
 * @param persist    persists a fetched record and returns the stored version, may be null
 * @param fallback   reads the record from the database when the source fails, may be null
 */
public record LookupTask<T>(
    String tool,
    String cacheKey,
    Class<T> recordType,
    Supplier<LookupResult<T>> fetch,
    @Nullable UnaryOperator<T> persist,
    @Nullable Supplier<Optional<T>> fallback
) {

    public LookupTask {
        Objects.requireNonNull(tool, "tool must not be null");
        Objects.requireNonNull(cacheKey, "cacheKey must not be null");
        Objects.requireNonNull(recordType, "recordType must not be null");
        Objects.requireNonNull(fetch, "fetch must not be null");
    }
}
