package ch.lexcite.retrieval;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;

import ch.lexcite.client.ExternalServiceException;
import ch.lexcite.client.LookupResult;
import ch.lexcite.storage.CacheStore;
import ch.lexcite.storage.CacheType;
import ch.lexcite.storage.SearchPage;
import ch.lexcite.storage.SearchQueryEntry;
import ch.lexcite.storage.SearchQueryLog;
import ch.lexcite.storage.StorageException;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

/**
 * Cache-first retrieval: cache check, then fetch, persist and cache.
 *
 * <p>Only successful fetches are cached. Fetched records are persisted before
 * they are cached; when persisting fails the data is still returned but not
 * cached, so the next read fetches again. A failed cache write is logged and
 * never fails the request. When a source fails, searches and lookups that
 * have a database fallback are served from it and flagged as degraded.</p>
 */
@ApplicationScoped
public class RetrievalOrchestrator {

    private static final Logger logger = LoggerFactory.getLogger(RetrievalOrchestrator.class);

    static final String MDC_TOOL = "retrieval.tool";
    static final String MDC_CACHE_KEY = "retrieval.cacheKey";

    private final CacheStore cacheStore;
    private final SearchQueryLog queryLog;
    private final ObjectMapper objectMapper;
    private final CacheConfig cacheConfig;

    @Inject
    public RetrievalOrchestrator(CacheStore cacheStore, SearchQueryLog queryLog, ObjectMapper objectMapper,
            CacheConfig cacheConfig) {
        this.cacheStore = cacheStore;
        this.queryLog = queryLog;
        this.objectMapper = objectMapper;
        this.cacheConfig = cacheConfig;
    }

    public <T> SearchResponse<T> search(SearchTask<T> task) {
        MDC.put(MDC_TOOL, task.tool());
        MDC.put(MDC_CACHE_KEY, task.cacheKey());
        try {
            JavaType payloadType = objectMapper.getTypeFactory()
                .constructParametricType(CachedSearch.class, task.recordType());
            Optional<CachedSearch<T>> cached = readCache(task.cacheKey(), payloadType);
            if (cached.isPresent()) {
                CachedSearch<T> hit = cached.get();
                logger.debug("Cache hit for {} ({} results)", task.tool(), hit.results().size());
                return new SearchResponse<>(hit.results(), hit.total(), true, ResultSource.CACHE,
                    hit.origin() == ResultSource.DATABASE, null);
            }

            long start = System.nanoTime();
            SearchPage<T> page;
            try {
                page = task.fetch().get();
            } catch (ExternalServiceException e) {
                return searchFallback(task, e, start);
            }

            if (persistAll(task, page.records())) {
                writeCache(task.cacheKey(), new CachedSearch<>(page.records(), page.total(), ResultSource.API),
                    CacheType.LISTING, cacheConfig.listingTtl());
            }
            logQuery(task, page.records().size(), start, ResultSource.API);
            return new SearchResponse<>(page.records(), page.total(), false, ResultSource.API, false, null);
        } finally {
            MDC.remove(MDC_TOOL);
            MDC.remove(MDC_CACHE_KEY);
        }
    }

    public <T> LookupResponse<T> lookup(LookupTask<T> task) {
        MDC.put(MDC_TOOL, task.tool());
        MDC.put(MDC_CACHE_KEY, task.cacheKey());
        try {
            Optional<T> cached = readCache(task.cacheKey(), objectMapper.constructType(task.recordType()));
            if (cached.isPresent()) {
                logger.debug("Cache hit for {}", task.tool());
                return LookupResponse.found(cached.get(), ResultSource.CACHE);
            }

            LookupResult<T> result;
            try {
                result = task.fetch().get();
            } catch (ExternalServiceException e) {
                return lookupFallback(task, e);
            }
            if (!result.found()) {
                logger.debug("{} found nothing, not caching", task.tool());
                return LookupResponse.notFound();
            }

            T record = result.record();
            if (task.persist() != null) {
                try {
                    record = task.persist().apply(record);
                } catch (StorageException e) {
                    logger.warn("Failed to persist result of {}, returning it uncached: {}", task.tool(),
                        e.getMessage());
                    return LookupResponse.found(record, ResultSource.API);
                }
            }
            writeCache(task.cacheKey(), record, CacheType.RECORD, cacheConfig.recordTtl());
            return LookupResponse.found(record, ResultSource.API);
        } finally {
            MDC.remove(MDC_TOOL);
            MDC.remove(MDC_CACHE_KEY);
        }
    }

    private <T> SearchResponse<T> searchFallback(SearchTask<T> task, ExternalServiceException failure, long start) {
        if (task.fallback() == null) {
            throw failure;
        }
        SearchPage<T> page;
        try {
            page = task.fallback().get();
        } catch (StorageException e) {
            logger.warn("Database fallback of {} failed: {}", task.tool(), e.getMessage());
            failure.addSuppressed(e);
            throw failure;
        }
        if (page.records().isEmpty()) {
            throw failure;
        }
        logger.warn("{} failed ({}: {}), serving {} results from the database", task.tool(), failure.kind(),
            failure.getMessage(), page.records().size());
        writeCache(task.cacheKey(), new CachedSearch<>(page.records(), page.total(), ResultSource.DATABASE),
            CacheType.FALLBACK, cacheConfig.fallbackTtl());
        logQuery(task, page.records().size(), start, ResultSource.DATABASE);
        return new SearchResponse<>(page.records(), page.total(), false, ResultSource.DATABASE, true, null);
    }

    private <T> LookupResponse<T> lookupFallback(LookupTask<T> task, ExternalServiceException failure) {
        if (task.fallback() == null) {
            throw failure;
        }
        Optional<T> stored;
        try {
            stored = task.fallback().get();
        } catch (StorageException e) {
            logger.warn("Database fallback of {} failed: {}", task.tool(), e.getMessage());
            failure.addSuppressed(e);
            throw failure;
        }
        if (stored.isEmpty()) {
            throw failure;
        }
        logger.warn("{} failed ({}: {}), serving the stored record", task.tool(), failure.kind(), failure.getMessage());
        return LookupResponse.found(stored.get(), ResultSource.DATABASE);
    }

    private <T> boolean persistAll(SearchTask<T> task, List<T> records) {
        if (task.persist() == null || records.isEmpty()) {
            return true;
        }
        try {
            task.persist().accept(records);
            return true;
        } catch (StorageException e) {
            logger.warn("Failed to persist {} results of {}, returning them uncached: {}", records.size(), task.tool(),
                e.getMessage());
            return false;
        }
    }

    private <T> Optional<T> readCache(String key, JavaType type) {
        Optional<String> payload;
        try {
            payload = await(cacheStore.get(key));
        } catch (StorageException e) {
            logger.warn("Cache read failed for {}, treating as miss: {}", key, e.getMessage());
            return Optional.empty();
        }
        if (payload.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(payload.get(), type));
        } catch (JsonProcessingException e) {
            logger.warn("Dropping unreadable cache entry {}: {}", key, e.getOriginalMessage());
            try {
                await(cacheStore.delete(key));
            } catch (StorageException deleteFailure) {
                logger.warn("Failed to delete cache entry {}: {}", key, deleteFailure.getMessage());
            }
            return Optional.empty();
        }
    }

    private void writeCache(String key, Object value, CacheType type, Duration ttl) {
        try {
            await(cacheStore.set(key, objectMapper.writeValueAsString(value), type, ttl));
        } catch (JsonProcessingException e) {
            logger.warn("Result for {} cannot be serialized, not caching: {}", key, e.getOriginalMessage());
        } catch (StorageException e) {
            logger.warn("Cache write failed for {}: {}", key, e.getMessage());
        }
    }

    private void logQuery(SearchTask<?> task, int resultCount, long startNanos, ResultSource source) {
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
        try {
            await(queryLog.record(new SearchQueryEntry(task.queryText(), task.tool(), task.filtersJson(), resultCount,
                elapsedMs, source.value(), null)));
        } catch (StorageException e) {
            logger.warn("Failed to record query of {}: {}", task.tool(), e.getMessage());
        }
    }

    /**
     * Waits for a store operation, rethrowing its unchecked failure unwrapped.
     */
    static <T> T await(CompletableFuture<T> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw e;
        }
    }
}
