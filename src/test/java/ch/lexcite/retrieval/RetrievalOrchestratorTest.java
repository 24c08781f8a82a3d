package ch.lexcite.retrieval;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.nio.file.Path;
import java.sql.Connection;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import java.util.function.Supplier;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.MDC;

import com.fasterxml.jackson.databind.ObjectMapper;

import ch.lexcite.client.ExternalServiceException;
import ch.lexcite.client.FailureKind;
import ch.lexcite.client.LookupResult;
import ch.lexcite.storage.CacheStore;
import ch.lexcite.storage.CacheType;
import ch.lexcite.storage.SearchPage;
import ch.lexcite.storage.SearchQueryEntry;
import ch.lexcite.storage.StorageException;
import ch.lexcite.storage.impl.MutableClock;
import ch.lexcite.storage.impl.SQLiteCacheStore;
import ch.lexcite.storage.impl.SQLiteConnectionManager;
import ch.lexcite.storage.impl.SQLiteSchemaMigrator;
import ch.lexcite.storage.impl.SQLiteSearchQueryLog;

class RetrievalOrchestratorTest {

    record Item(String id, String title) {}

    private static final CacheConfig CACHE_CONFIG = new CacheConfig() {
        @Override
        public Duration listingTtl() {
            return Duration.ofHours(1);
        }

        @Override
        public Duration recordTtl() {
            return Duration.ofHours(24);
        }

        @Override
        public Duration fallbackTtl() {
            return Duration.ofMinutes(30);
        }

        @Override
        public String sweepInterval() {
            return "10m";
        }

        @Override
        public int maxEntries() {
            return 100;
        }
    };

    @TempDir
    Path tempDir;

    private SQLiteConnectionManager connectionManager;
    private MutableClock clock;
    private SQLiteCacheStore cacheStore;
    private SQLiteSearchQueryLog queryLog;
    private RetrievalOrchestrator orchestrator;

    @BeforeEach
    void setUp() throws Exception {
        connectionManager = new SQLiteConnectionManager(tempDir.resolve("test.db").toString());
        try (Connection conn = connectionManager.createConnection()) {
            new SQLiteSchemaMigrator().migrateToLatest(conn);
        }
        clock = new MutableClock(Instant.parse("2024-03-01T10:00:00Z"));
        cacheStore = new SQLiteCacheStore(connectionManager, clock);
        queryLog = new SQLiteSearchQueryLog(connectionManager, clock);
        orchestrator = new RetrievalOrchestrator(cacheStore, queryLog, new ObjectMapper().findAndRegisterModules(),
            CACHE_CONFIG);
    }

    @AfterEach
    void tearDown() {
        if (connectionManager != null) {
            connectionManager.close();
        }
    }

    private static SearchTask<Item> searchTask(Supplier<SearchPage<Item>> fetch, Consumer<List<Item>> persist,
            Supplier<SearchPage<Item>> fallback) {
        return new SearchTask<>("search_items", "search:items:abc", Item.class, "Mietrecht", "{\"q\":\"Mietrecht\"}",
            fetch, persist, fallback);
    }

    private static SearchPage<Item> page(Item... items) {
        return new SearchPage<>(List.of(items), items.length);
    }

    private static ExternalServiceException unavailable() {
        return ExternalServiceException.httpError("federal", "search", 503, null);
    }

    @Nested
    @DisplayName("Searches")
    class Searches {

        @Test
        @DisplayName("A miss fetches, persists and caches; the next call is a cache hit")
        void missThenHit() {
            AtomicInteger fetches = new AtomicInteger();
            AtomicInteger persisted = new AtomicInteger();
            SearchTask<Item> task = searchTask(() -> {
                fetches.incrementAndGet();
                return page(new Item("a", "A"), new Item("b", "B"));
            }, records -> persisted.addAndGet(records.size()), null);

            SearchResponse<Item> first = orchestrator.search(task);
            SearchResponse<Item> second = orchestrator.search(task);

            assertFalse(first.fromCache());
            assertEquals(ResultSource.API, first.source());
            assertEquals(2, first.total());
            assertTrue(second.fromCache());
            assertEquals(ResultSource.CACHE, second.source());
            assertEquals(first.results(), second.results());
            assertEquals(1, fetches.get());
            assertEquals(2, persisted.get());
        }

        @Test
        void listingExpiresAfterListingTtl() {
            AtomicInteger fetches = new AtomicInteger();
            SearchTask<Item> task = searchTask(() -> {
                fetches.incrementAndGet();
                return page(new Item("a", "A"));
            }, null, null);

            orchestrator.search(task);
            clock.advance(Duration.ofMinutes(61));
            SearchResponse<Item> again = orchestrator.search(task);

            assertFalse(again.fromCache());
            assertEquals(2, fetches.get());
        }

        @Test
        @DisplayName("A failure without fallback propagates and is not cached")
        void failureIsNotCached() {
            ExternalServiceException failure = unavailable();
            SearchTask<Item> task = searchTask(() -> {
                throw failure;
            }, null, null);

            ExternalServiceException thrown = assertThrows(ExternalServiceException.class, () -> orchestrator.search(task));

            assertSame(failure, thrown);
            assertFalse(cacheStore.has(task.cacheKey()).join());
        }

        @Test
        @DisplayName("A failure with stored results is served degraded and cached with the fallback TTL")
        void databaseFallback() {
            AtomicInteger fetches = new AtomicInteger();
            SearchTask<Item> task = searchTask(() -> {
                fetches.incrementAndGet();
                throw unavailable();
            }, null, () -> page(new Item("stored", "Stored")));

            SearchResponse<Item> response = orchestrator.search(task);
            SearchResponse<Item> cached = orchestrator.search(task);
            clock.advance(Duration.ofMinutes(31));

            assertEquals(ResultSource.DATABASE, response.source());
            assertTrue(response.degraded());
            assertEquals("stored", response.results().get(0).id());
            assertTrue(cached.fromCache());
            assertTrue(cached.degraded());
            assertEquals(1, fetches.get());
            assertFalse(cacheStore.has(task.cacheKey()).join());
        }

        @Test
        void emptyFallbackRethrowsSourceFailure() {
            SearchTask<Item> task = searchTask(() -> {
                throw ExternalServiceException.timeout("cantonal", "search", null);
            }, null, SearchPage::empty);

            ExternalServiceException thrown = assertThrows(ExternalServiceException.class, () -> orchestrator.search(task));

            assertEquals(FailureKind.TIMEOUT, thrown.kind());
        }

        @Test
        void failingFallbackIsSuppressed() {
            SearchTask<Item> task = searchTask(() -> {
                throw unavailable();
            }, null, () -> {
                throw new StorageException("disk full");
            });

            ExternalServiceException thrown = assertThrows(ExternalServiceException.class, () -> orchestrator.search(task));

            assertEquals(1, thrown.getSuppressed().length);
        }

        @Test
        @DisplayName("Results whose persisting failed are returned but not cached")
        void persistFailure() {
            SearchTask<Item> task = searchTask(() -> page(new Item("a", "A")), records -> {
                throw new StorageException("locked");
            }, null);

            SearchResponse<Item> response = orchestrator.search(task);

            assertEquals(1, response.results().size());
            assertFalse(cacheStore.has(task.cacheKey()).join());
        }

        @Test
        void fetchedSearchesAreLogged() {
            orchestrator.search(searchTask(() -> page(new Item("a", "A")), null, null));

            List<SearchQueryEntry> recent = queryLog.recent(10).join();
            assertEquals(1, recent.size());
            assertEquals("search_items", recent.get(0).queryType());
            assertEquals("Mietrecht", recent.get(0).queryText());
            assertEquals("api", recent.get(0).source());
            assertEquals(1, recent.get(0).resultCount());
        }

        @Test
        void mdcIsClearedAfterwards() {
            orchestrator.search(searchTask(() -> page(new Item("a", "A")), null, null));

            assertNull(MDC.get(RetrievalOrchestrator.MDC_TOOL));
            assertNull(MDC.get(RetrievalOrchestrator.MDC_CACHE_KEY));
        }
    }

    @Nested
    @DisplayName("Lookups")
    class Lookups {

        private LookupTask<Item> lookupTask(Supplier<LookupResult<Item>> fetch, Supplier<Optional<Item>> fallback) {
            return new LookupTask<>("get_item", "record:item:a", Item.class, fetch,
                item -> new Item(item.id(), item.title() + " (stored)"), fallback);
        }

        @Test
        void foundRecordIsPersistedAndCached() {
            AtomicInteger fetches = new AtomicInteger();
            LookupTask<Item> task = lookupTask(() -> {
                fetches.incrementAndGet();
                return LookupResult.found(new Item("a", "A"));
            }, null);

            LookupResponse<Item> first = orchestrator.lookup(task);
            clock.advance(Duration.ofHours(23));
            LookupResponse<Item> second = orchestrator.lookup(task);

            assertTrue(first.found());
            assertEquals("A (stored)", first.record().title());
            assertEquals(ResultSource.API, first.source());
            assertTrue(second.fromCache());
            assertEquals(first.record(), second.record());
            assertEquals(1, fetches.get());
        }

        @Test
        @DisplayName("Not-found results are not cached")
        void notFoundIsNotCached() {
            LookupTask<Item> task = lookupTask(LookupResult::notFound, null);

            LookupResponse<Item> response = orchestrator.lookup(task);

            assertFalse(response.found());
            assertNull(response.record());
            assertFalse(cacheStore.has(task.cacheKey()).join());
        }

        @Test
        @DisplayName("A failing source falls back to the stored record without caching it")
        void storedRecordFallback() {
            LookupTask<Item> task = lookupTask(() -> {
                throw unavailable();
            }, () -> Optional.of(new Item("a", "Stored")));

            LookupResponse<Item> response = orchestrator.lookup(task);

            assertTrue(response.found());
            assertEquals(ResultSource.DATABASE, response.source());
            assertTrue(response.degraded());
            assertFalse(cacheStore.has(task.cacheKey()).join());
        }

        @Test
        void missingStoredRecordRethrows() {
            LookupTask<Item> task = lookupTask(() -> {
                throw ExternalServiceException.rateLimited("federal", "getById", Duration.ofSeconds(3));
            }, Optional::empty);

            ExternalServiceException thrown = assertThrows(ExternalServiceException.class, () -> orchestrator.lookup(task));

            assertEquals(FailureKind.RATE_LIMITED, thrown.kind());
        }

        @Test
        void unreadableCacheEntryIsDroppedAndRefetched() {
            cacheStore.set("record:item:a", "not json", CacheType.RECORD, Duration.ofHours(1)).join();
            LookupTask<Item> task = lookupTask(() -> LookupResult.found(new Item("a", "A")), null);

            LookupResponse<Item> response = orchestrator.lookup(task);

            assertFalse(response.fromCache());
            assertEquals("A (stored)", response.record().title());
        }
    }

    @Nested
    @DisplayName("Cache write failures")
    class CacheWriteFailures {

        private CacheStore failingCache;
        private RetrievalOrchestrator failingOrchestrator;

        @BeforeEach
        void setUp() {
            failingCache = mock(CacheStore.class);
            when(failingCache.get(anyString())).thenReturn(CompletableFuture.completedFuture(Optional.empty()));
            when(failingCache.set(anyString(), anyString(), any(), any()))
                .thenReturn(CompletableFuture.failedFuture(new StorageException("disk I/O error")));
            failingOrchestrator = new RetrievalOrchestrator(failingCache, queryLog,
                new ObjectMapper().findAndRegisterModules(), CACHE_CONFIG);
        }

        @Test
        @DisplayName("Fetched search results are returned when the cache write fails")
        void searchSurvivesCacheWriteFailure() {
            AtomicInteger persisted = new AtomicInteger();
            SearchTask<Item> task = searchTask(() -> page(new Item("a", "A"), new Item("b", "B")),
                records -> persisted.addAndGet(records.size()), null);

            SearchResponse<Item> response = failingOrchestrator.search(task);

            assertEquals(ResultSource.API, response.source());
            assertFalse(response.fromCache());
            assertFalse(response.degraded());
            assertEquals(List.of(new Item("a", "A"), new Item("b", "B")), response.results());
            assertEquals(2, persisted.get());
            verify(failingCache, times(1)).set(eq(task.cacheKey()), anyString(), eq(CacheType.LISTING), any());
            assertEquals(1, queryLog.recent(10).join().size());
        }

        @Test
        @DisplayName("A fetched record is returned when the cache write fails")
        void lookupSurvivesCacheWriteFailure() {
            LookupTask<Item> task = new LookupTask<>("get_item", "record:item:a", Item.class,
                () -> LookupResult.found(new Item("a", "A")), item -> new Item(item.id(), item.title() + " (stored)"),
                null);

            LookupResponse<Item> response = failingOrchestrator.lookup(task);

            assertTrue(response.found());
            assertEquals(ResultSource.API, response.source());
            assertEquals("A (stored)", response.record().title());
            verify(failingCache, times(1)).set(eq("record:item:a"), anyString(), eq(CacheType.RECORD), any());
        }
    }
}
