package ch.lexcite.retrieval;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ch.lexcite.client.cantonal.CantonalSearchFilters;
import ch.lexcite.client.federal.FederalSearchFilters;
import ch.lexcite.storage.DecisionRecord;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

/**
 * Searches federal and cantonal decisions in parallel and merges the results.
 *
 * <p>When one source fails the other's results are returned with the failed
 * source listed. The request fails only when both sources fail.</p>
 */
@ApplicationScoped
public class UnifiedSearchService {

    private static final Logger logger = LoggerFactory.getLogger(UnifiedSearchService.class);

    static final String FEDERAL = "federal";
    static final String CANTONAL = "cantonal";

    private final FederalDecisionService federalService;
    private final CantonalDecisionService cantonalService;

    @Inject
    public UnifiedSearchService(FederalDecisionService federalService, CantonalDecisionService cantonalService) {
        this.federalService = federalService;
        this.cantonalService = cantonalService;
    }

    public SearchResponse<DecisionRecord> search(UnifiedSearchRequest request) {
        FederalSearchFilters federalFilters = new FederalSearchFilters(request.query(), request.language(), null,
            null, request.dateFrom(), request.dateTo(), request.limit(), null);
        CantonalSearchFilters cantonalFilters = new CantonalSearchFilters(request.query(), null, request.cantons(),
            request.language(), request.dateFrom(), request.dateTo(), request.limit(), null);

        Map<String, CompletableFuture<SearchResponse<DecisionRecord>>> futures = new LinkedHashMap<>();
        futures.put(FEDERAL, supply(() -> federalService.search(federalFilters)));
        futures.put(CANTONAL, supply(() -> cantonalService.search(cantonalFilters)));

        List<SearchResponse<DecisionRecord>> responses = new ArrayList<>();
        List<String> failedSources = new ArrayList<>();
        RuntimeException firstFailure = null;
        for (Map.Entry<String, CompletableFuture<SearchResponse<DecisionRecord>>> entry : futures.entrySet()) {
            try {
                responses.add(RetrievalOrchestrator.await(entry.getValue()));
            } catch (RuntimeException e) {
                logger.warn("Unified search: {} source failed: {}", entry.getKey(), e.getMessage());
                failedSources.add(entry.getKey());
                if (firstFailure == null) {
                    firstFailure = e;
                } else {
                    firstFailure.addSuppressed(e);
                }
            }
        }
        if (responses.isEmpty()) {
            throw firstFailure;
        }
        return merge(responses, failedSources);
    }

    private static CompletableFuture<SearchResponse<DecisionRecord>> supply(
            Supplier<SearchResponse<DecisionRecord>> search) {
        return CompletableFuture.supplyAsync(search);
    }

    /**
     * Concatenates the partial results, dropping records already returned by an earlier source.
     */
    static SearchResponse<DecisionRecord> merge(List<SearchResponse<DecisionRecord>> responses,
            List<String> failedSources) {
        Map<String, DecisionRecord> byId = new LinkedHashMap<>();
        long total = 0;
        boolean allCached = true;
        boolean degraded = !failedSources.isEmpty();
        for (SearchResponse<DecisionRecord> response : responses) {
            response.results().forEach(record -> byId.putIfAbsent(record.externalId(), record));
            total += response.total();
            allCached &= response.fromCache();
            degraded |= response.degraded();
        }
        ResultSource source = allCached ? ResultSource.CACHE : ResultSource.API;
        if (responses.stream().allMatch(r -> r.source() == ResultSource.DATABASE)) {
            source = ResultSource.DATABASE;
        }
        return new SearchResponse<>(new ArrayList<>(byId.values()), total, allCached, source, degraded, failedSources);
    }
}
