package ch.lexcite.retrieval;

import org.jboss.logging.Logger;

import ch.lexcite.storage.CacheStore;
import ch.lexcite.storage.StorageException;
import io.quarkus.scheduler.Scheduled;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

/**
 * Removes expired cache entries and trims the cache to its size bound.
 *
 * <p>Reads already ignore expired entries; the sweep keeps the table small.</p>
 */
@ApplicationScoped
public class CacheSweepJob {

    private static final Logger LOG = Logger.getLogger(CacheSweepJob.class);

    @Inject
    CacheStore cacheStore;

    @Inject
    CacheConfig cacheConfig;

    @Scheduled(every = "{lexcite.cache.sweep-interval}", delayed = "{lexcite.cache.sweep-interval}",
        concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    void sweep() {
        try {
            final int expired = RetrievalOrchestrator.await(cacheStore.sweepExpired());
            final int trimmed = RetrievalOrchestrator.await(cacheStore.trimToSize(cacheConfig.maxEntries()));
            if (expired > 0 || trimmed > 0) {
                LOG.infof("Cache sweep removed %d expired and %d least recently used entries", expired, trimmed);
            } else {
                LOG.debug("Cache sweep found nothing to remove");
            }
        } catch (StorageException e) {
            LOG.errorf(e, "Cache sweep failed");
        }
    }
}
