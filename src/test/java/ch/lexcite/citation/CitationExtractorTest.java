package ch.lexcite.citation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Set;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class CitationExtractorTest {

    private static final String TEXT =
        "Nach BGE 147 IV 73 E. 4.1 und Art. 97 Abs. 1 OR hat das Obergericht (ZH-2023-145) entschieden.";

    private CitationExtractor extractor;

    @BeforeEach
    void setUp() {
        extractor = new CitationExtractor();
    }

    @Test
    void extractsAllKindsWithPositions() {
        ExtractionResult result = extractor.extract(TEXT, null, true);

        assertEquals(3, result.citations().size());
        ExtractedCitation first = result.citations().get(0);
        assertEquals("BGE 147 IV 73 E. 4.1", first.text());
        assertEquals(CitationType.COURT_DECISION, first.type());
        assertEquals(TEXT.indexOf("BGE"), first.start());
        assertEquals(first.start() + first.text().length(), first.end());
        assertEquals(TEXT.substring(first.start(), first.end()), first.text());

        assertEquals(CitationType.STATUTE, result.citations().get(1).type());
        assertEquals(CitationType.CANTONAL_DECISION, result.citations().get(2).type());
    }

    @Test
    void statisticsCountByTypeAndValidity() {
        ExtractionResult result = extractor.extract(TEXT + " Siehe auch BGE 147 IX 1.", null, true);

        assertEquals(4, result.statistics().total());
        assertEquals(2, result.statistics().byType().get("court_decision"));
        assertEquals(3, result.statistics().valid());
        assertEquals(1, result.statistics().invalid());
    }

    @Test
    void filtersByType() {
        ExtractionResult result = extractor.extract(TEXT, Set.of(CitationType.STATUTE), true);

        assertEquals(1, result.citations().size());
        assertEquals("Art. 97 Abs. 1 OR", result.citations().get(0).text());
        assertTrue(result.citations().get(0).valid());
    }

    @Test
    void withoutValidationNoVerdictIsGiven() {
        ExtractionResult result = extractor.extract(TEXT, null, false);

        assertNull(result.citations().get(0).valid());
        assertEquals(0, result.statistics().valid());
        assertEquals(0, result.statistics().invalid());
    }

    @Test
    void emptyText() {
        ExtractionResult result = extractor.extract("", null, true);

        assertTrue(result.citations().isEmpty());
        assertFalse(result.statistics().total() > 0);
    }
}
