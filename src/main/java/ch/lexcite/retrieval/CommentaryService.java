package ch.lexcite.retrieval;

import java.util.List;
import java.util.Locale;

import com.fasterxml.jackson.databind.ObjectMapper;

import ch.lexcite.citation.CitationParser;
import ch.lexcite.citation.CitationType;
import ch.lexcite.citation.InvalidCitationException;
import ch.lexcite.citation.ParsedCitation;
import ch.lexcite.citation.Statute;
import ch.lexcite.client.commentary.CommentaryClient;
import ch.lexcite.client.commentary.CommentarySearchFilters;
import ch.lexcite.client.commentary.LegislativeAct;
import ch.lexcite.storage.CommentaryRecord;
import ch.lexcite.storage.CommentaryStore;
import ch.lexcite.storage.SearchPage;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

/**
 * Commentary retrieval tools backed by onlinekommentar.ch.
 */
@ApplicationScoped
public class CommentaryService {

    static final String SEARCH_TOOL = "search_commentaries";
    static final String GET_TOOL = "get_commentary";
    static final String ARTICLE_TOOL = "commentary_for_article";
    static final String ACTS_TOOL = "list_legislative_acts";

    private final CommentaryClient client;
    private final CommentaryStore commentaryStore;
    private final RetrievalOrchestrator orchestrator;
    private final CitationParser citationParser;
    private final ObjectMapper objectMapper;

    @Inject
    public CommentaryService(CommentaryClient client, CommentaryStore commentaryStore,
            RetrievalOrchestrator orchestrator, CitationParser citationParser, ObjectMapper objectMapper) {
        this.client = client;
        this.commentaryStore = commentaryStore;
        this.orchestrator = orchestrator;
        this.citationParser = citationParser;
        this.objectMapper = objectMapper;
    }

    public SearchResponse<CommentaryRecord> search(CommentarySearchFilters filters) {
        String filtersJson = CacheKeys.canonicalJson(filters, objectMapper);
        return orchestrator.search(new SearchTask<>(
            SEARCH_TOOL,
            CacheKeys.COMMENTARY_SEARCH + CacheKeys.sha256(filtersJson),
            CommentaryRecord.class,
            filters.query(),
            filtersJson,
            () -> client.search(filters),
            records -> RetrievalOrchestrator.await(commentaryStore.upsertAll(records)),
            null));
    }

    public LookupResponse<CommentaryRecord> getCommentary(String id) {
        String commentaryId = id.trim();
        return orchestrator.lookup(new LookupTask<>(
            GET_TOOL,
            CacheKeys.record(CacheKeys.COMMENTARY, commentaryId),
            CommentaryRecord.class,
            () -> client.getCommentary(commentaryId),
            record -> RetrievalOrchestrator.await(commentaryStore.upsert(record)),
            () -> RetrievalOrchestrator.await(commentaryStore.findByExternalId(commentaryId))));
    }

    /**
     * Finds commentaries on the article a statute citation points to.
     *
     * @param citation statute citation in any supported language, e.g. {@code Art. 97 Abs. 1 OR}
     * @param language preferred commentary language, may be null
     * @throws InvalidCitationException if the citation is not a valid statute citation
     */
    public SearchResponse<CommentaryRecord> commentaryForArticle(String citation, String language) {
        ParsedCitation parsed = citationParser.parse(citation);
        if (!parsed.valid() || parsed.type() != CitationType.STATUTE) {
            throw new InvalidCitationException(parsed);
        }
        Statute statute = (Statute) parsed.citation();
        String filtersJson = CacheKeys.canonicalJson(new ArticleFilters(parsed.normalized(), language), objectMapper);
        return orchestrator.search(new SearchTask<>(
            ARTICLE_TOOL,
            CacheKeys.COMMENTARY_SEARCH + CacheKeys.sha256(filtersJson),
            CommentaryRecord.class,
            parsed.normalized(),
            filtersJson,
            () -> client.commentaryForArticle(statute, language),
            records -> RetrievalOrchestrator.await(commentaryStore.upsertAll(records)),
            null));
    }

    public SearchResponse<LegislativeAct> listLegislativeActs(String language) {
        String normalized = language == null || language.isBlank() ? null : language.toLowerCase(Locale.ROOT);
        return orchestrator.search(new SearchTask<>(
            ACTS_TOOL,
            CacheKeys.legislativeActs(normalized),
            LegislativeAct.class,
            null,
            normalized == null ? null : "{\"language\":\"" + normalized + "\"}",
            () -> {
                List<LegislativeAct> acts = client.listLegislativeActs(normalized);
                return new SearchPage<>(acts, acts.size());
            },
            null,
            null));
    }

    record ArticleFilters(String statute, String language) {
    }
}
