package ch.lexcite.storage;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import org.jetbrains.annotations.NotNull;

/**
 * Keyed, TTL-bound cache of results fetched from external sources.
 *
 * <p>Expiry is lazy: reading an expired entry deletes it and reports a miss.
 * {@link #sweepExpired()} removes entries that are never read again. Failed
 * operations complete exceptionally with {@link StorageException}.</p>
 */
public interface CacheStore {

    /**
     * Reads a live entry and counts the hit.
     *
     * @param key cache key
     * @return the cached value, or empty on a miss or an expired entry
     */
    CompletableFuture<Optional<String>> get(@NotNull String key);

    /**
     * Writes an entry, replacing value, type and expiry of an existing one.
     * The hit count of an existing entry is kept.
     *
     * @param key   cache key
     * @param value serialized payload
     * @param type  data class
     * @param ttl   time-to-live from now
     */
    CompletableFuture<Void> set(@NotNull String key, @NotNull String value, @NotNull CacheType type, @NotNull Duration ttl);

    /**
     * Checks for a live entry without counting a hit.
     */
    CompletableFuture<Boolean> has(@NotNull String key);

    /**
     * @return true if an entry was removed
     */
    CompletableFuture<Boolean> delete(@NotNull String key);

    /**
     * @return number of entries removed
     */
    CompletableFuture<Integer> deleteByPrefix(@NotNull String prefix);

    /**
     * Removes every expired entry.
     *
     * @return number of entries removed
     */
    CompletableFuture<Integer> sweepExpired();

    /**
     * Removes least recently accessed entries until at most {@code maxEntries} remain.
     *
     * @return number of entries removed
     */
    CompletableFuture<Integer> trimToSize(int maxEntries);

    CompletableFuture<CacheStats> stats();

    /**
     * @param limit maximum number of entries
     * @return live entries ordered by hit count, highest first
     */
    CompletableFuture<List<CacheEntry>> mostAccessed(int limit);

    /**
     * @return number of entries removed
     */
    CompletableFuture<Integer> clear();
}
