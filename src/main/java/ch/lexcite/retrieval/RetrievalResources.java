package ch.lexcite.retrieval;

import org.jboss.logging.Logger;

import ch.lexcite.client.cantonal.CantonalSearchFilters;
import ch.lexcite.client.commentary.CommentarySearchFilters;
import ch.lexcite.client.commentary.LegislativeAct;
import ch.lexcite.client.federal.FederalSearchFilters;
import ch.lexcite.storage.CommentaryRecord;
import ch.lexcite.storage.DecisionRecord;
import jakarta.inject.Inject;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;

/**
 * Legal source retrieval tools.
 *
 * <h2>Endpoints:</h2>
 * <ul>
 *   <li>{@code POST /tools/search_federal_decisions} - Search Federal Supreme Court decisions</li>
 *   <li>{@code POST /tools/get_federal_decision} - Look up a decision by BGE citation or id</li>
 *   <li>{@code POST /tools/search_cantonal_decisions} - Search cantonal decisions on entscheidsuche.ch</li>
 *   <li>{@code POST /tools/get_cantonal_decision} - Look up a cantonal decision by signature</li>
 *   <li>{@code POST /tools/unified_search} - Search federal and cantonal decisions in parallel</li>
 *   <li>{@code POST /tools/search_commentaries} - Search onlinekommentar.ch</li>
 *   <li>{@code POST /tools/get_commentary} - Fetch one commentary</li>
 *   <li>{@code POST /tools/commentary_for_article} - Commentaries on a statute article</li>
 *   <li>{@code POST /tools/list_legislative_acts} - Statutes with published commentaries</li>
 * </ul>
 */
@Path("/tools")
@Consumes(MediaType.APPLICATION_JSON)
@Produces(MediaType.APPLICATION_JSON)
public class RetrievalResources {

    private static final Logger LOG = Logger.getLogger(RetrievalResources.class);

    @Inject
    FederalDecisionService federalService;

    @Inject
    CantonalDecisionService cantonalService;

    @Inject
    UnifiedSearchService unifiedSearchService;

    @Inject
    CommentaryService commentaryService;

    @POST
    @Path("/search_federal_decisions")
    public SearchResponse<DecisionRecord> searchFederalDecisions(@NotNull @Valid final FederalSearchFilters filters) {
        LOG.debugf("search_federal_decisions: %s", filters);
        return federalService.search(filters);
    }

    @POST
    @Path("/get_federal_decision")
    public LookupResponse<DecisionRecord> getFederalDecision(@Valid final GetFederalDecisionRequest request) {
        return federalService.getDecision(request.reference());
    }

    @POST
    @Path("/search_cantonal_decisions")
    public SearchResponse<DecisionRecord> searchCantonalDecisions(@NotNull @Valid final CantonalSearchFilters filters) {
        LOG.debugf("search_cantonal_decisions: %s", filters);
        return cantonalService.search(filters);
    }

    @POST
    @Path("/get_cantonal_decision")
    public LookupResponse<DecisionRecord> getCantonalDecision(@Valid final GetCantonalDecisionRequest request) {
        return cantonalService.getDecision(request.signature());
    }

    @POST
    @Path("/unified_search")
    public SearchResponse<DecisionRecord> unifiedSearch(@Valid final UnifiedSearchRequest request) {
        final SearchResponse<DecisionRecord> response = unifiedSearchService.search(request);
        if (response.failedSources() != null) {
            LOG.infof("unified_search returned partial results, failed sources: %s", response.failedSources());
        }
        return response;
    }

    @POST
    @Path("/search_commentaries")
    public SearchResponse<CommentaryRecord> searchCommentaries(@NotNull @Valid final CommentarySearchFilters filters) {
        return commentaryService.search(filters);
    }

    @POST
    @Path("/get_commentary")
    public LookupResponse<CommentaryRecord> getCommentary(@Valid final GetCommentaryRequest request) {
        return commentaryService.getCommentary(request.id());
    }

    @POST
    @Path("/commentary_for_article")
    public SearchResponse<CommentaryRecord> commentaryForArticle(@Valid final CommentaryForArticleRequest request) {
        return commentaryService.commentaryForArticle(request.citation(), request.language());
    }

    @POST
    @Path("/list_legislative_acts")
    public SearchResponse<LegislativeAct> listLegislativeActs(@Valid final ListLegislativeActsRequest request) {
        return commentaryService.listLegislativeActs(request == null ? null : request.language());
    }
}
