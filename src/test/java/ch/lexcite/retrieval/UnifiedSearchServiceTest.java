package ch.lexcite.retrieval;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mockito;

import ch.lexcite.client.ExternalServiceException;
import ch.lexcite.client.cantonal.CantonalSearchFilters;
import ch.lexcite.client.federal.FederalSearchFilters;
import ch.lexcite.storage.CourtLevel;
import ch.lexcite.storage.DecisionRecord;

class UnifiedSearchServiceTest {

    private FederalDecisionService federalService;
    private CantonalDecisionService cantonalService;
    private UnifiedSearchService service;

    @BeforeEach
    void setUp() {
        federalService = mock(FederalDecisionService.class);
        cantonalService = mock(CantonalDecisionService.class);
        service = new UnifiedSearchService(federalService, cantonalService);
    }

    private static DecisionRecord decision(String id, CourtLevel level) {
        return DecisionRecord.builder(id, level).title(id).build();
    }

    private static SearchResponse<DecisionRecord> response(ResultSource source, boolean degraded,
            DecisionRecord... records) {
        return new SearchResponse<>(List.of(records), records.length, source == ResultSource.CACHE, source, degraded,
            null);
    }

    private static UnifiedSearchRequest request() {
        return new UnifiedSearchRequest("Mietrecht", List.of("ZH"), "de", null, null, 5);
    }

    @Test
    void mergesBothSourcesFederalFirst() {
        when(federalService.search(any())).thenReturn(response(ResultSource.API, false,
            decision("6B_1/2021", CourtLevel.FEDERAL)));
        when(cantonalService.search(any())).thenReturn(response(ResultSource.API, false,
            decision("ZH_OG_1", CourtLevel.CANTONAL), decision("ZH_OG_2", CourtLevel.CANTONAL)));

        SearchResponse<DecisionRecord> merged = service.search(request());

        assertEquals(3, merged.results().size());
        assertEquals("6B_1/2021", merged.results().get(0).externalId());
        assertEquals(3, merged.total());
        assertFalse(merged.degraded());
        assertNull(merged.failedSources());
    }

    @Test
    void passesFiltersToBothSides() {
        when(federalService.search(any())).thenReturn(response(ResultSource.API, false));
        when(cantonalService.search(any())).thenReturn(response(ResultSource.API, false));

        service.search(request());

        ArgumentCaptor<FederalSearchFilters> federal = ArgumentCaptor.forClass(FederalSearchFilters.class);
        ArgumentCaptor<CantonalSearchFilters> cantonal = ArgumentCaptor.forClass(CantonalSearchFilters.class);
        Mockito.verify(federalService).search(federal.capture());
        Mockito.verify(cantonalService).search(cantonal.capture());
        assertEquals("Mietrecht", federal.getValue().query());
        assertEquals(5, federal.getValue().limit());
        assertEquals(List.of("ZH"), cantonal.getValue().cantons());
        assertEquals("de", cantonal.getValue().language());
    }

    @Test
    @DisplayName("One failing source yields the other's results, degraded")
    void partialFailure() {
        when(federalService.search(any())).thenThrow(ExternalServiceException.timeout("federal", "search", null));
        when(cantonalService.search(any())).thenReturn(response(ResultSource.API, false,
            decision("ZH_OG_1", CourtLevel.CANTONAL)));

        SearchResponse<DecisionRecord> merged = service.search(request());

        assertEquals(1, merged.results().size());
        assertTrue(merged.degraded());
        assertEquals(List.of(UnifiedSearchService.FEDERAL), merged.failedSources());
    }

    @Test
    void bothFailingThrowsFirstFailure() {
        ExternalServiceException federalFailure = ExternalServiceException.httpError("federal", "search", 503, null);
        when(federalService.search(any())).thenThrow(federalFailure);
        when(cantonalService.search(any())).thenThrow(ExternalServiceException.timeout("cantonal", "search", null));

        ExternalServiceException thrown = assertThrows(ExternalServiceException.class, () -> service.search(request()));

        assertSame(federalFailure, thrown);
        assertEquals(1, thrown.getSuppressed().length);
    }

    @Nested
    @DisplayName("Merging")
    class Merging {

        @Test
        void duplicatesAreDroppedByExternalId() {
            SearchResponse<DecisionRecord> merged = UnifiedSearchService.merge(List.of(
                response(ResultSource.API, false, decision("CH_BGE_1", CourtLevel.FEDERAL)),
                response(ResultSource.API, false, decision("CH_BGE_1", CourtLevel.FEDERAL),
                    decision("ZH_OG_1", CourtLevel.CANTONAL))), List.of());

            assertEquals(2, merged.results().size());
            assertEquals(3, merged.total());
        }

        @Test
        void cachedOnlyWhenEveryPartWasCached() {
            SearchResponse<DecisionRecord> allCached = UnifiedSearchService.merge(List.of(
                response(ResultSource.CACHE, false), response(ResultSource.CACHE, false)), List.of());
            SearchResponse<DecisionRecord> mixed = UnifiedSearchService.merge(List.of(
                response(ResultSource.CACHE, false), response(ResultSource.API, false)), List.of());

            assertTrue(allCached.fromCache());
            assertEquals(ResultSource.CACHE, allCached.source());
            assertFalse(mixed.fromCache());
            assertEquals(ResultSource.API, mixed.source());
        }

        @Test
        void databaseOnlyResultsAreDegraded() {
            SearchResponse<DecisionRecord> merged = UnifiedSearchService.merge(List.of(
                response(ResultSource.DATABASE, true), response(ResultSource.DATABASE, true)), List.of());

            assertEquals(ResultSource.DATABASE, merged.source());
            assertTrue(merged.degraded());
        }
    }
}
