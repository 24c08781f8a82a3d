package ch.lexcite.storage;

import java.util.Map;

/**
 * Cache diagnostics.
 *
 * @param totalEntries   rows in the cache, expired ones included
 * @param expiredEntries rows past their expiry that were not swept yet
 * @param totalHits      sum of hit counts
 * @param entriesByType  row count per cache type value
 */
public record CacheStats(long totalEntries, long expiredEntries, long totalHits, Map<String, Long> entriesByType) {

    public CacheStats {
        entriesByType = Map.copyOf(entriesByType);
    }
}
