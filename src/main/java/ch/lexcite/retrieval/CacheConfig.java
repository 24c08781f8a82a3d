package ch.lexcite.retrieval;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Cache lifetimes per data class and sweep settings.
 *
 * <pre>
 * lexcite.cache.listing-ttl=PT1H
 * lexcite.cache.record-ttl=PT24H
 * lexcite.cache.fallback-ttl=PT30M
 * lexcite.cache.sweep-interval=10m
 * lexcite.cache.max-entries=10000
 * </pre>
 */
@ConfigMapping(prefix = "lexcite.cache")
public interface CacheConfig {

    /**
     * TTL of search listings, which gain new results over time.
     */
    @WithDefault("PT1H")
    Duration listingTtl();

    /**
     * TTL of records looked up by a stable identifier.
     */
    @WithDefault("PT24H")
    Duration recordTtl();

    /**
     * TTL of results served from the database while a source is failing.
     */
    @WithDefault("PT30M")
    Duration fallbackTtl();

    @WithDefault("10m")
    String sweepInterval();

    @WithDefault("10000")
    int maxEntries();
}
