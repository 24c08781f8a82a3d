package ch.lexcite.client.commentary;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

import org.eclipse.microprofile.rest.client.inject.RestClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import ch.lexcite.citation.Language;
import ch.lexcite.citation.Statute;
import ch.lexcite.client.ExternalServiceException;
import ch.lexcite.client.FailureKind;
import ch.lexcite.client.LookupResult;
import ch.lexcite.client.RequestThrottle;
import ch.lexcite.client.ResilientApiClient;
import ch.lexcite.client.SourcesConfig;
import ch.lexcite.storage.CommentaryRecord;
import ch.lexcite.storage.SearchPage;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

/**
 * Client of onlinekommentar.ch, the open access commentary platform.
 *
 * <p>Keeps a map from statute abbreviations (in every language) to legislative
 * act ids, filled from the act list, so that a statute citation can be turned
 * into a filtered commentary search.</p>
 */
@ApplicationScoped
public class CommentaryClient extends ResilientApiClient {

    private static final Logger logger = LoggerFactory.getLogger(CommentaryClient.class);

    public static final String SERVICE = "commentary";

    private static final Pattern COMMENTARY_ID = Pattern.compile("^[a-zA-Z0-9-]+$");

    @Inject
    @RestClient
    OnlinekommentarApi api;

    @Inject
    SourcesConfig sourcesConfig;

    @Inject
    ObjectMapper objectMapper;

    private RequestThrottle throttle;

    private final Map<String, String> actIdsByAbbreviation = new ConcurrentHashMap<>();

    @PostConstruct
    void initialize() {
        throttle = new RequestThrottle(SERVICE, sourcesConfig.commentary().requestsPerMinute());
        logger.info("Onlinekommentar client limited to one request every {} ms", throttle.minIntervalMillis());
    }

    @Override
    protected String service() {
        return SERVICE;
    }

    @Override
    protected RequestThrottle throttle() {
        return throttle;
    }

    public SearchPage<CommentaryRecord> search(CommentarySearchFilters filters) {
        JsonNode response = invoke("search", () -> unwrap("search", api.search(blankToNull(filters.query()),
            filters.language(), filters.legislativeAct(), filters.sort(), filters.page())));
        return toSearchPage(response);
    }

    /**
     * @throws IllegalArgumentException if the id contains characters other than letters, digits and dashes
     */
    public LookupResult<CommentaryRecord> getCommentary(String id) {
        if (id == null || !COMMENTARY_ID.matcher(id).matches()) {
            throw new IllegalArgumentException("Invalid commentary ID: " + id);
        }
        LookupResult<JsonNode> result = lookup("getCommentary", () -> unwrap("getCommentary", api.commentary(id)));
        if (!result.found() || !result.record().isObject()) {
            return LookupResult.notFound();
        }
        return LookupResult.found(toRecord(result.record()));
    }

    /**
     * Lists the legislative acts and refreshes the abbreviation map.
     *
     * @param language restricts the list to one language, may be null
     */
    public List<LegislativeAct> listLegislativeActs(String language) {
        JsonNode response = invoke("listLegislativeActs",
            () -> unwrap("listLegislativeActs", api.legislativeActs(language)));
        List<LegislativeAct> acts = new ArrayList<>();
        if (response == null || !response.isArray()) {
            return acts;
        }
        for (JsonNode node : response) {
            try {
                LegislativeAct act = objectMapper.treeToValue(node, LegislativeAct.class);
                if (act.id() != null) {
                    acts.add(act);
                }
            } catch (JsonProcessingException e) {
                throw ExternalServiceException.generic(SERVICE, "listLegislativeActs", e);
            }
        }
        rememberActs(acts);
        return acts;
    }

    /**
     * Finds commentaries on one statute article.
     *
     * <p>The statute abbreviation is resolved to a legislative act id through the
     * act list, which is fetched once when the map has no entry for the statute.</p>
     *
     * @param statute  validated statute citation
     * @param language preferred commentary language, may be null
     * @throws IllegalArgumentException if onlinekommentar.ch has no act for the statute
     */
    public SearchPage<CommentaryRecord> commentaryForArticle(Statute statute, String language) {
        Optional<String> actId = resolveAct(statute);
        if (actId.isEmpty()) {
            listLegislativeActs(null);
            actId = resolveAct(statute);
        }
        if (actId.isEmpty()) {
            throw new IllegalArgumentException("No commentaries available for statute "
                + statute.code().abbreviation(Language.DE).orElse(statute.code().name()));
        }
        return search(new CommentarySearchFilters(articleQuery(statute), language, actId.get(), null, null));
    }

    /**
     * @return the article part of the search, e.g. {@code Art. 97 Abs. 1 lit. a}
     */
    static String articleQuery(Statute statute) {
        StringBuilder query = new StringBuilder("Art. ").append(statute.articleLabel());
        if (statute.paragraph() != null) {
            query.append(" Abs. ").append(statute.paragraph());
        }
        if (statute.letter() != null) {
            query.append(" lit. ").append(statute.letter());
        }
        return query.toString();
    }

    Optional<String> resolveAct(Statute statute) {
        for (Language language : Language.values()) {
            Optional<String> abbreviation = statute.code().abbreviation(language);
            if (abbreviation.isPresent()) {
                String id = actIdsByAbbreviation.get(abbreviation.get().toLowerCase(Locale.ROOT));
                if (id != null) {
                    return Optional.of(id);
                }
            }
        }
        return Optional.empty();
    }

    void rememberActs(List<LegislativeAct> acts) {
        for (LegislativeAct act : acts) {
            for (String abbreviation : act.abbreviations()) {
                actIdsByAbbreviation.put(abbreviation.toLowerCase(Locale.ROOT), act.id());
            }
        }
    }

    /**
     * Strips the {@code {success, data}} envelope when present.
     */
    private static JsonNode unwrap(String operation, JsonNode response) {
        if (response == null || response.isNull()) {
            return null;
        }
        if (response.isObject() && response.path("success").isBoolean() && !response.path("success").asBoolean()) {
            String error = response.path("error").asText("unknown error");
            if (error.toLowerCase(Locale.ROOT).contains("not found")) {
                throw ExternalServiceException.notFound(SERVICE, operation);
            }
            throw new ExternalServiceException(FailureKind.GENERIC, SERVICE, operation, null, null,
                SERVICE + " reported an error on " + operation + ": " + error, null);
        }
        if (response.isObject() && response.has("data") && !response.get("data").isNull()) {
            return response.get("data");
        }
        return response;
    }

    static SearchPage<CommentaryRecord> toSearchPage(JsonNode response) {
        if (response == null) {
            return SearchPage.empty();
        }
        List<CommentaryRecord> records = new ArrayList<>();
        for (JsonNode node : response.path("commentaries")) {
            if (node.hasNonNull("id")) {
                records.add(toRecord(node));
            }
        }
        long total = response.path("count").asLong(records.size());
        return new SearchPage<>(records, total);
    }

    static CommentaryRecord toRecord(JsonNode node) {
        List<String> authors = new ArrayList<>();
        node.path("authors").forEach(author -> authors.add(author.asText()));
        JsonNode act = node.path("legislative_act");
        String actAbbreviation = act.isObject() ? textOrNull(act.path("abbreviation")) : textOrNull(act);
        return new CommentaryRecord(
            node.path("id").asText(),
            textOrNull(node.path("title")),
            authors,
            actAbbreviation,
            textOrNull(node.path("language")),
            textOrNull(node.path("abstract")),
            textOrNull(node.path("content")),
            textOrNull(node.path("url")),
            textOrNull(node.path("updated")),
            null);
    }

    private static String textOrNull(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull() || node.isContainerNode()) {
            return null;
        }
        String text = node.asText();
        return text.isBlank() ? null : text;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
