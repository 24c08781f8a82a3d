package ch.lexcite.client.cantonal;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import ch.lexcite.storage.CourtLevel;
import ch.lexcite.storage.DecisionRecord;
import ch.lexcite.storage.SearchPage;

class CantonalCourtClientTest {

    private final ObjectMapper mapper = new ObjectMapper();

    private JsonNode json(String text) throws Exception {
        return mapper.readTree(text.replace('\'', '"'));
    }

    @Nested
    @DisplayName("Query building")
    class QueryBuilding {

        @Test
        void singleConditionIsUsedDirectly() {
            ObjectNode body = CantonalCourtClient.buildQuery(CantonalSearchFilters.query("Mietrecht").normalized());

            assertEquals("Mietrecht", body.at("/query/simple_query_string/query").asText());
            assertEquals("and", body.at("/query/simple_query_string/default_operator").asText());
            assertFalse(body.path("query").has("bool"));
            assertEquals(10, body.path("size").asInt());
            assertEquals(0, body.path("from").asInt());
            assertEquals("desc", body.at("/sort/0/date").asText());
        }

        @Test
        void severalConditionsAreCombinedWithMust() {
            CantonalSearchFilters filters = new CantonalSearchFilters("Kündigung", null, List.of("ZH", "BE"), "de",
                "2020-01-01", null, 25, 50);

            ObjectNode body = CantonalCourtClient.buildQuery(filters.normalized());

            JsonNode must = body.at("/query/bool/must");
            assertEquals(4, must.size());
            assertEquals("ZH", must.get(1).at("/terms/hierarchy/0").asText());
            assertEquals("BE", must.get(1).at("/terms/hierarchy/1").asText());
            assertEquals("de", must.get(2).at("/term/attachment.language").asText());
            assertEquals("2020-01-01", must.get(3).at("/range/date/gte").asText());
            assertTrue(must.get(3).at("/range/date/lte").isMissingNode());
            assertEquals(25, body.path("size").asInt());
            assertEquals(50, body.path("from").asInt());
        }

        @Test
        void noConditionsMeansNoQuery() {
            ObjectNode body = CantonalCourtClient.buildQuery(CantonalSearchFilters.query(" ").normalized());

            assertFalse(body.has("query"));
        }

        @Test
        void limitIsCapped() {
            CantonalSearchFilters filters = new CantonalSearchFilters(null, null, null, null, null, null, 500, null);

            assertEquals(50, CantonalCourtClient.buildQuery(filters.normalized()).path("size").asInt());
        }
    }

    @Nested
    @DisplayName("Response normalization")
    class Normalization {

        @Test
        void totalAsNumberOrObject() throws Exception {
            SearchPage<DecisionRecord> legacy = CantonalCourtClient.toSearchPage(
                json("{'hits':{'total':7,'hits':[{'_id':'ZH_OG_001_LB-1','_source':{'hierarchy':['ZH','ZH_OG']}}]}}"));
            SearchPage<DecisionRecord> current = CantonalCourtClient.toSearchPage(
                json("{'hits':{'total':{'value':12,'relation':'eq'},'hits':[]}}"));

            assertEquals(7, legacy.total());
            assertEquals(1, legacy.records().size());
            assertEquals(12, current.total());
            assertTrue(current.records().isEmpty());
        }

        @Test
        void hitsWithoutIdAreSkipped() throws Exception {
            SearchPage<DecisionRecord> page = CantonalCourtClient.toSearchPage(
                json("{'hits':{'total':2,'hits':[{'_source':{}},{'_id':'','_source':{}}]}}"));

            assertTrue(page.records().isEmpty());
            assertEquals(SearchPage.empty().total(), CantonalCourtClient.toSearchPage(null).total());
        }

        @Test
        void cantonalDecision() throws Exception {
            DecisionRecord record = CantonalCourtClient.normalize("ZH_OG_001_LB230012",
                json("{'hierarchy':['ZH','ZH_OG'],'date':'2023-05-12','title':{'fr':'Bail à loyer'},"
                    + "'abstract':{'de':'Kündigung','fr':'Résiliation'},"
                    + "'attachment':{'language':'fr','content':'Texte intégral'},'reference':['LB230012']}"));

            assertEquals(CourtLevel.CANTONAL, record.courtLevel());
            assertEquals("Obergericht Zürich", record.court());
            assertEquals("ZH", record.canton());
            assertEquals("Bail à loyer", record.title());
            assertEquals("Résiliation", record.summary());
            assertEquals("2023-05-12", record.decisionDate());
            assertEquals("LB230012", record.citation());
            assertEquals("Texte intégral", record.fullText());
            assertEquals(CantonalCourtClient.DOCS_BASE_URL + "ZH_OG/ZH_OG_001_LB230012", record.sourceUrl());
        }

        @Test
        @DisplayName("Titles fall back to de, fr, it when the decision language has none")
        void titleLanguageFallback() throws Exception {
            DecisionRecord record = CantonalCourtClient.normalize("GE_CJ_001_X",
                json("{'hierarchy':['GE','GE_CJ'],'title':{'it':'Titolo','fr':'Titre'},'attachment':{'language':'en'}}"));

            assertEquals("Titre", record.title());
            assertEquals("en", record.language());
        }

        @Test
        void federalDecisionGetsBgeCitation() throws Exception {
            DecisionRecord record = CantonalCourtClient.normalize("CH_BGE_007_147-IV-73",
                json("{'hierarchy':['CH','CH_BGE'],'title':{'de':'BGE 147 IV 73'},"
                    + "'attachment':{'content_url':'https://entscheidsuche.ch/docs/CH_BGE/x.html'}}"));

            assertEquals(CourtLevel.FEDERAL, record.courtLevel());
            assertEquals("BGE 147 IV 73", record.citation());
            assertEquals("https://entscheidsuche.ch/docs/CH_BGE/x.html", record.sourceUrl());
            assertEquals("de", record.language());
        }

        @Test
        void unknownCourtKeepsSpiderAndCanton() throws Exception {
            DecisionRecord record = CantonalCourtClient.normalize("NW_OG_001_A",
                json("{'hierarchy':['NW','NW_OG']}"));

            assertEquals("NW_OG", record.court());
            assertEquals("NW", record.canton());
            assertEquals(CourtLevel.CANTONAL, record.courtLevel());
            assertEquals("NW_OG_001_A", record.title());
            assertNull(record.citation());
        }
    }

    @Test
    void spiderIsDerivedFromSignature() {
        assertEquals("CH_BGer", CourtDirectory.spiderOf("CH_BGer_004_4A-120-2022").orElseThrow());
        assertTrue(CourtDirectory.spiderOf("nounderscore").isEmpty());
        assertTrue(CourtDirectory.spiderOf(null).isEmpty());
    }
}
