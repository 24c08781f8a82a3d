package ch.lexcite.client.cantonal;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.eclipse.microprofile.rest.client.inject.RestClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

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
 * Client of entscheidsuche.ch, which indexes cantonal and federal decisions.
 *
 * <p>Hits are normalized into {@link DecisionRecord}s: court name and canton
 * come from {@link CourtDirectory}, multilingual titles and abstracts are
 * resolved to the decision language with a de, fr, it fallback.</p>
 */
@ApplicationScoped
public class CantonalCourtClient extends ResilientApiClient {

    private static final Logger logger = LoggerFactory.getLogger(CantonalCourtClient.class);

    public static final String SERVICE = "cantonal";

    static final String DOCS_BASE_URL = "https://entscheidsuche.ch/docs/";

    private static final Pattern BGE_REFERENCE = Pattern.compile("(\\d{2,3})\\s+(I{1,3}|IV|V)\\s+(\\d+)");
    private static final List<String> LANGUAGE_FALLBACK = List.of("de", "fr", "it");
    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    @Inject
    @RestClient
    EntscheidsucheApi api;

    @Inject
    SourcesConfig sourcesConfig;

    private RequestThrottle throttle;

    @PostConstruct
    void initialize() {
        throttle = new RequestThrottle(SERVICE, sourcesConfig.cantonal().requestsPerMinute());
        logger.info("Entscheidsuche client limited to one request every {} ms", throttle.minIntervalMillis());
    }

    @Override
    protected String service() {
        return SERVICE;
    }

    @Override
    protected RequestThrottle throttle() {
        return throttle;
    }

    public SearchPage<DecisionRecord> search(CantonalSearchFilters filters) {
        ObjectNode body = buildQuery(filters.normalized());
        JsonNode response = invoke("search", () -> api.search(body));
        return toSearchPage(response);
    }

    /**
     * Searches the federal supreme court spiders for a published decision.
     */
    public SearchPage<DecisionRecord> searchBge(CourtDecision citation) {
        String phrase = "\"" + citation.volume() + " " + citation.chamber().name() + " " + citation.page() + "\"";
        return search(new CantonalSearchFilters(phrase, List.of("CH_BGer", "CH_BGE"), null, null, null, null, 10, 0));
    }

    /**
     * Fetches one decision by its signature.
     *
     * @return not found when the signature names no known document
     */
    public LookupResult<DecisionRecord> getDecision(String signature) {
        Optional<String> spider = CourtDirectory.spiderOf(signature);
        if (spider.isEmpty()) {
            logger.warn("Cannot derive court from signature {}", signature);
            return LookupResult.notFound();
        }
        LookupResult<JsonNode> result = lookup("getDecision", () -> api.document(spider.get(), signature));
        if (!result.found() || !result.record().isObject()) {
            return LookupResult.notFound();
        }
        return LookupResult.found(normalize(signature, result.record()));
    }

    /**
     * Builds the Elasticsearch request body. Conditions are combined with a
     * bool/must clause when there is more than one.
     */
    static ObjectNode buildQuery(CantonalSearchFilters filters) {
        List<ObjectNode> must = new ArrayList<>();

        if (filters.query() != null && !filters.query().isBlank()) {
            ObjectNode simple = NODES.objectNode();
            simple.putObject("simple_query_string")
                .put("query", filters.query())
                .put("default_operator", "and");
            must.add(simple);
        }
        if (!filters.courts().isEmpty()) {
            must.add(terms("hierarchy", filters.courts()));
        }
        if (!filters.cantons().isEmpty()) {
            must.add(terms("hierarchy", filters.cantons()));
        }
        if (filters.language() != null && !filters.language().isBlank()) {
            ObjectNode term = NODES.objectNode();
            term.putObject("term").put("attachment.language", filters.language());
            must.add(term);
        }
        if (filters.dateFrom() != null || filters.dateTo() != null) {
            ObjectNode range = NODES.objectNode();
            ObjectNode date = range.putObject("range").putObject("date");
            if (filters.dateFrom() != null) {
                date.put("gte", filters.dateFrom());
            }
            if (filters.dateTo() != null) {
                date.put("lte", filters.dateTo());
            }
            must.add(range);
        }

        ObjectNode body = NODES.objectNode();
        body.put("size", filters.effectiveLimit());
        body.put("from", filters.effectiveOffset());
        body.putArray("sort").addObject().put("date", "desc");
        if (must.size() == 1) {
            body.set("query", must.get(0));
        } else if (must.size() > 1) {
            ArrayNode clauses = body.putObject("query").putObject("bool").putArray("must");
            must.forEach(clauses::add);
        }
        return body;
    }

    private static ObjectNode terms(String field, List<String> values) {
        ObjectNode node = NODES.objectNode();
        ArrayNode array = node.putObject("terms").putArray(field);
        values.forEach(array::add);
        return node;
    }

    static SearchPage<DecisionRecord> toSearchPage(JsonNode response) {
        if (response == null || !response.has("hits")) {
            return SearchPage.empty();
        }
        JsonNode hits = response.get("hits");
        JsonNode total = hits.path("total");
        long count = total.isNumber() ? total.asLong() : total.path("value").asLong(0);

        List<DecisionRecord> records = new ArrayList<>();
        for (JsonNode hit : hits.path("hits")) {
            String id = hit.path("_id").asText("");
            if (id.isEmpty()) {
                continue;
            }
            records.add(normalize(id, hit.path("_source")));
        }
        return new SearchPage<>(records, count);
    }

    static DecisionRecord normalize(String id, JsonNode source) {
        List<String> hierarchy = new ArrayList<>();
        source.path("hierarchy").forEach(node -> hierarchy.add(node.asText()));

        String spider = hierarchy.size() > 1 ? hierarchy.get(1) : CourtDirectory.spiderOf(id).orElse("");
        String cantonCode = hierarchy.isEmpty() ? "" : hierarchy.get(0);
        Optional<CourtDirectory.Court> court = CourtDirectory.bySpider(spider);

        JsonNode attachment = source.path("attachment");
        String language = textOrNull(attachment.path("language"));
        if (language == null) {
            language = "de";
        }

        String firstReference = source.path("reference").isArray() && source.path("reference").size() > 0
            ? source.path("reference").get(0).asText()
            : null;
        String title = localized(source.path("title"), language);
        if (title == null) {
            title = firstReference != null ? firstReference : id;
        }
        String summary = localized(source.path("abstract"), language);

        String bgeReference = null;
        if (CourtDirectory.isFederalSupremeCourt(spider)) {
            Matcher matcher = BGE_REFERENCE.matcher(title + " " + id);
            if (matcher.find()) {
                bgeReference = "BGE " + matcher.group(1) + " " + matcher.group(2) + " " + matcher.group(3);
            }
        }

        String sourceUrl = textOrNull(attachment.path("content_url"));
        if (sourceUrl == null && !spider.isEmpty()) {
            sourceUrl = DOCS_BASE_URL + spider + "/" + id;
        }

        CourtLevel level = court.map(CourtDirectory.Court::level)
            .orElse("CH".equals(cantonCode) ? CourtLevel.FEDERAL : CourtLevel.CANTONAL);
        String canton = court.map(CourtDirectory.Court::canton)
            .orElse(cantonCode.isEmpty() ? null : cantonCode);

        return DecisionRecord.builder(id, level)
            .court(court.map(CourtDirectory.Court::name).orElse(spider.isEmpty() ? "Unknown" : spider))
            .canton(canton)
            .citation(bgeReference != null ? bgeReference : firstReference)
            .title(title)
            .summary(summary)
            .decisionDate(textOrNull(source.path("date")))
            .language(language)
            .fullText(textOrNull(attachment.path("content")))
            .sourceUrl(sourceUrl)
            .build();
    }

    private static String localized(JsonNode values, String language) {
        if (!values.isObject()) {
            return textOrNull(values);
        }
        String preferred = textOrNull(values.path(language));
        if (preferred != null) {
            return preferred;
        }
        for (String fallback : LANGUAGE_FALLBACK) {
            String text = textOrNull(values.path(fallback));
            if (text != null) {
                return text;
            }
        }
        return null;
    }

    private static String textOrNull(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull() || node.isContainerNode()) {
            return null;
        }
        String text = node.asText();
        return text.isBlank() ? null : text;
    }
}
