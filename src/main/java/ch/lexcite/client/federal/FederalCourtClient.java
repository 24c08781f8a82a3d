package ch.lexcite.client.federal;

import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

import org.eclipse.microprofile.rest.client.inject.RestClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ch.lexcite.citation.Chamber;
import ch.lexcite.citation.CourtDecision;
import ch.lexcite.client.LookupResult;
import ch.lexcite.client.RequestThrottle;
import ch.lexcite.client.ResilientApiClient;
import ch.lexcite.client.SourcesConfig;
import ch.lexcite.storage.CourtLevel;
import ch.lexcite.storage.DecisionRecord;
import ch.lexcite.storage.SearchPage;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

/**
 * Client of the Federal Supreme Court decision API.
 */
@ApplicationScoped
public class FederalCourtClient extends ResilientApiClient {

    private static final Logger logger = LoggerFactory.getLogger(FederalCourtClient.class);

    public static final String SERVICE = "federal";

    static final String COURT_NAME = "Bundesgericht";

    @Inject
    @RestClient
    FederalCourtApi api;

    @Inject
    SourcesConfig sourcesConfig;

    private RequestThrottle throttle;

    @PostConstruct
    void initialize() {
        throttle = new RequestThrottle(SERVICE, sourcesConfig.federal().requestsPerMinute());
        logger.info("Federal court client limited to one request every {} ms", throttle.minIntervalMillis());
    }

    @Override
    protected String service() {
        return SERVICE;
    }

    @Override
    protected RequestThrottle throttle() {
        return throttle;
    }

    public SearchPage<DecisionRecord> search(FederalSearchFilters filters) {
        FederalSearchFilters f = filters.normalized();
        FederalCourtApi.DecisionPage page = invoke("search", () -> api.search(f.query(), f.language(), f.chamber(),
            f.legalArea(), f.dateFrom(), f.dateTo(), f.limit(), f.offset()));
        return toSearchPage(page);
    }

    /**
     * Looks up a published decision. The consideration of the citation is ignored.
     */
    public LookupResult<DecisionRecord> getByCitation(CourtDecision citation) {
        LookupResult<FederalCourtApi.DecisionEnvelope> result = lookup("getByCitation",
            () -> api.byCitation(citation.volume(), citation.chamber().name(), citation.page()));
        return toLookupResult(result);
    }

    public LookupResult<DecisionRecord> getById(String decisionId) {
        LookupResult<FederalCourtApi.DecisionEnvelope> result = lookup("getById", () -> api.byId(decisionId));
        return toLookupResult(result);
    }

    /**
     * @param limit   number of decisions, capped at 50
     * @param chamber restricts to one chamber, may be null
     */
    public List<DecisionRecord> recent(int limit, Chamber chamber) {
        int capped = Math.max(1, Math.min(limit, FederalSearchFilters.MAX_LIMIT));
        FederalCourtApi.DecisionPage page = invoke("recent",
            () -> api.recent(capped, chamber == null ? null : chamber.name()));
        return toSearchPage(page).records();
    }

    private static LookupResult<DecisionRecord> toLookupResult(LookupResult<FederalCourtApi.DecisionEnvelope> result) {
        if (!result.found() || result.record().data() == null) {
            return LookupResult.notFound();
        }
        return LookupResult.found(toRecord(result.record().data()));
    }

    static SearchPage<DecisionRecord> toSearchPage(FederalCourtApi.DecisionPage page) {
        if (page == null || page.data() == null) {
            return SearchPage.empty();
        }
        List<DecisionRecord> records = page.data().stream()
            .filter(decision -> decision.decisionId() != null)
            .map(FederalCourtClient::toRecord)
            .toList();
        long total = page.meta() != null && page.meta().total() != null ? page.meta().total() : page.data().size();
        return new SearchPage<>(records, total);
    }

    static DecisionRecord toRecord(FederalCourtApi.Decision decision) {
        return DecisionRecord.builder(decision.decisionId(), CourtLevel.FEDERAL)
            .court(COURT_NAME)
            .canton("CH")
            .citation(decision.bgeReference())
            .chamber(decision.chamber())
            .title(decision.title())
            .summary(decision.summary())
            .decisionDate(decision.decisionDate())
            .language(decision.language())
            .legalAreas(legalAreas(decision.legalAreas()))
            .fullText(decision.fullText())
            .sourceUrl(decision.sourceUrl())
            .build();
    }

    static Set<String> legalAreas(List<String> areas) {
        if (areas == null) {
            return Set.of();
        }
        return areas.stream().filter(Objects::nonNull).collect(Collectors.toSet());
    }
}
