package ch.lexcite.retrieval;

import java.util.Locale;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.ObjectMapper;

import ch.lexcite.citation.CitationParser;
import ch.lexcite.citation.CitationType;
import ch.lexcite.citation.CourtDecision;
import ch.lexcite.citation.ParsedCitation;
import ch.lexcite.client.LookupResult;
import ch.lexcite.client.cantonal.CantonalCourtClient;
import ch.lexcite.client.federal.FederalCourtClient;
import ch.lexcite.client.federal.FederalSearchFilters;
import ch.lexcite.storage.CourtLevel;
import ch.lexcite.storage.DecisionQuery;
import ch.lexcite.storage.DecisionRecord;
import ch.lexcite.storage.DecisionStore;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

/**
 * Federal Supreme Court retrieval tools.
 */
@ApplicationScoped
public class FederalDecisionService {

    private static final Logger logger = LoggerFactory.getLogger(FederalDecisionService.class);

    static final String SEARCH_TOOL = "search_federal_decisions";
    static final String GET_TOOL = "get_federal_decision";

    private final FederalCourtClient federalClient;
    private final CantonalCourtClient cantonalClient;
    private final DecisionStore decisionStore;
    private final RetrievalOrchestrator orchestrator;
    private final CitationParser citationParser;
    private final ObjectMapper objectMapper;

    @Inject
    public FederalDecisionService(FederalCourtClient federalClient, CantonalCourtClient cantonalClient,
            DecisionStore decisionStore, RetrievalOrchestrator orchestrator, CitationParser citationParser,
            ObjectMapper objectMapper) {
        this.federalClient = federalClient;
        this.cantonalClient = cantonalClient;
        this.decisionStore = decisionStore;
        this.orchestrator = orchestrator;
        this.citationParser = citationParser;
        this.objectMapper = objectMapper;
    }

    public SearchResponse<DecisionRecord> search(FederalSearchFilters filters) {
        FederalSearchFilters normalized = filters.normalized();
        String filtersJson = CacheKeys.canonicalJson(normalized, objectMapper);
        return orchestrator.search(new SearchTask<>(
            SEARCH_TOOL,
            CacheKeys.FEDERAL_SEARCH + CacheKeys.sha256(filtersJson),
            DecisionRecord.class,
            normalized.query(),
            filtersJson,
            () -> federalClient.search(normalized),
            records -> RetrievalOrchestrator.await(decisionStore.upsertAll(records)),
            () -> RetrievalOrchestrator.await(decisionStore.search(toQuery(normalized)))));
    }

    /**
     * Looks up a decision by citation (BGE, ATF or DTF form) or by decision id.
     *
     * <p>Citations are validated first; an invalid citation yields a not-found
     * response carrying the parse errors and suggestions. When the federal API
     * does not know a citation, entscheidsuche.ch is searched for it.</p>
     */
    public LookupResponse<DecisionRecord> getDecision(String reference) {
        String input = reference.trim();
        if (citationParser.detectType(input) != CitationType.COURT_DECISION) {
            return orchestrator.lookup(new LookupTask<>(
                GET_TOOL,
                CacheKeys.record(CacheKeys.FEDERAL_DECISION, input),
                DecisionRecord.class,
                () -> federalClient.getById(input),
                record -> RetrievalOrchestrator.await(decisionStore.upsert(record)),
                () -> RetrievalOrchestrator.await(decisionStore.findByExternalId(input))));
        }

        ParsedCitation parsed = citationParser.parse(input);
        if (!parsed.valid()) {
            logger.debug("Rejected citation '{}': {}", input, parsed.errors());
            return LookupResponse.invalid(parsed);
        }
        CourtDecision decision = (CourtDecision) parsed.citation();
        String canonical = canonicalCitation(decision);
        return orchestrator.lookup(new LookupTask<>(
            GET_TOOL,
            CacheKeys.record(CacheKeys.FEDERAL_DECISION, canonical),
            DecisionRecord.class,
            () -> fetchByCitation(decision, canonical),
            record -> RetrievalOrchestrator.await(decisionStore.upsert(record)),
            () -> RetrievalOrchestrator.await(decisionStore.findByCitation(canonical))));
    }

    private LookupResult<DecisionRecord> fetchByCitation(CourtDecision decision, String canonical) {
        LookupResult<DecisionRecord> result = federalClient.getByCitation(decision);
        if (result.found()) {
            return result;
        }
        logger.debug("Federal API has no {}, searching entscheidsuche.ch", canonical);
        Optional<DecisionRecord> match = cantonalClient.searchBge(decision).records().stream()
            .filter(record -> record.citation() != null && record.citation().equalsIgnoreCase(canonical))
            .findFirst();
        return match.map(LookupResult::found).orElseGet(LookupResult::notFound);
    }

    /**
     * @return the language-independent identity of a published decision, e.g. {@code BGE 147 IV 73}
     */
    static String canonicalCitation(CourtDecision decision) {
        return String.format(Locale.ROOT, "BGE %d %s %d", decision.volume(), decision.chamber().name(),
            decision.page());
    }

    static DecisionQuery toQuery(FederalSearchFilters filters) {
        return new DecisionQuery(filters.query(), CourtLevel.FEDERAL, null, filters.language(), filters.legalArea(),
            filters.chamber(), filters.dateFrom(), filters.dateTo(), filters.effectiveLimit(),
            filters.effectiveOffset());
    }
}
