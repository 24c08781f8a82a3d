package ch.lexcite.retrieval;

import com.fasterxml.jackson.databind.ObjectMapper;

import ch.lexcite.client.cantonal.CantonalCourtClient;
import ch.lexcite.client.cantonal.CantonalSearchFilters;
import ch.lexcite.storage.DecisionQuery;
import ch.lexcite.storage.DecisionRecord;
import ch.lexcite.storage.DecisionStore;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

/**
 * Cantonal decision retrieval tools backed by entscheidsuche.ch.
 */
@ApplicationScoped
public class CantonalDecisionService {

    static final String SEARCH_TOOL = "search_cantonal_decisions";
    static final String GET_TOOL = "get_cantonal_decision";

    private final CantonalCourtClient client;
    private final DecisionStore decisionStore;
    private final RetrievalOrchestrator orchestrator;
    private final ObjectMapper objectMapper;

    @Inject
    public CantonalDecisionService(CantonalCourtClient client, DecisionStore decisionStore,
            RetrievalOrchestrator orchestrator, ObjectMapper objectMapper) {
        this.client = client;
        this.decisionStore = decisionStore;
        this.orchestrator = orchestrator;
        this.objectMapper = objectMapper;
    }

    public SearchResponse<DecisionRecord> search(CantonalSearchFilters filters) {
        CantonalSearchFilters normalized = filters.normalized();
        String filtersJson = CacheKeys.canonicalJson(normalized, objectMapper);
        return orchestrator.search(new SearchTask<>(
            SEARCH_TOOL,
            CacheKeys.CANTONAL_SEARCH + CacheKeys.sha256(filtersJson),
            DecisionRecord.class,
            normalized.query(),
            filtersJson,
            () -> client.search(normalized),
            records -> RetrievalOrchestrator.await(decisionStore.upsertAll(records)),
            () -> RetrievalOrchestrator.await(decisionStore.search(toQuery(normalized)))));
    }

    public LookupResponse<DecisionRecord> getDecision(String signature) {
        String id = signature.trim();
        return orchestrator.lookup(new LookupTask<>(
            GET_TOOL,
            CacheKeys.record(CacheKeys.CANTONAL_DECISION, id),
            DecisionRecord.class,
            () -> client.getDecision(id),
            record -> RetrievalOrchestrator.await(decisionStore.upsert(record)),
            () -> RetrievalOrchestrator.await(decisionStore.findByExternalId(id))));
    }

    /**
     * The database filters by one canton only; with several cantons the fallback matches all.
     */
    static DecisionQuery toQuery(CantonalSearchFilters filters) {
        String canton = filters.cantons().size() == 1 ? filters.cantons().get(0) : null;
        return new DecisionQuery(filters.query(), null, canton, filters.language(), null, null, filters.dateFrom(),
            filters.dateTo(), filters.effectiveLimit(), filters.effectiveOffset());
    }
}
