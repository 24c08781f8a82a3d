package ch.lexcite.storage;

import java.time.Instant;

/**
 * A cached payload with its bookkeeping.
 *
 * @param key            cache key
 * @param type           data class
 * @param value          serialized payload
 * @param expiresAt      instant after which the entry is no longer served
 * @param hitCount       number of reads that returned this entry
 * @param lastAccessedAt last read, or creation time if never read
 * @param createdAt      first write
 */
public record CacheEntry(
    String key,
    CacheType type,
    String value,
    Instant expiresAt,
    long hitCount,
    Instant lastAccessedAt,
    Instant createdAt
) {

    public boolean isExpired(Instant now) {
        return now.isAfter(expiresAt);
    }
}
