package ch.lexcite.citation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class CitationParserTest {

    private CitationParser parser;

    @BeforeEach
    void setUp() {
        parser = new CitationParser();
    }

    @Test
    void validCitationHasNoSuggestions() {
        ParsedCitation parsed = parser.parse("  DTF 145 II 32 ");

        assertTrue(parsed.valid());
        assertEquals("DTF 145 II 32", parsed.rawText());
        assertEquals(Language.IT, parsed.language());
        assertEquals("DTF 145 II 32", parsed.normalized());
        assertTrue(parsed.suggestions().isEmpty());
    }

    @Test
    @DisplayName("Malformed citations yield between two and four suggestions")
    void malformedCitationsGetSuggestions() {
        for (String input : List.of("BGE 147 XX 73", "Art.97 OR", "ZH-2023", "gibberish", "BSK OR")) {
            ParsedCitation parsed = parser.parse(input);

            assertFalse(parsed.valid(), input);
            assertFalse(parsed.errors().isEmpty(), input);
            assertTrue(parsed.suggestions().size() >= 2 && parsed.suggestions().size() <= 4, input);
        }
    }

    @Test
    void statuteSuggestionsFollowDetectedLanguage() {
        ParsedCitation parsed = parser.parse("art. 97 al. 1 XYZ");

        assertEquals(Language.FR, parsed.language());
        assertTrue(parsed.suggestions().contains("Example: art. 97 al. 1 CO"));
    }

    @Test
    void nullInputIsAnUnknownCitation() {
        ParsedCitation parsed = parser.parse(null);

        assertFalse(parsed.valid());
        assertEquals(CitationType.UNKNOWN, parsed.type());
    }

    @Nested
    @DisplayName("Language detection")
    class LanguageDetection {

        @Test
        void paragraphMarkerOutranksCourtPrefix() {
            assertEquals(Language.IT, parser.detectLanguage("Art. 8 cpv. 1 BV BGE 140 I 2"));
        }

        @Test
        void courtPrefix() {
            assertEquals(Language.FR, parser.detectLanguage("ATF 140 I 2"));
        }

        @Test
        void statuteAbbreviation() {
            assertEquals(Language.FR, parser.detectLanguage("art. 41 CO"));
            assertEquals(Language.DE, parser.detectLanguage("Art. 41 OR"));
            assertEquals(Language.IT, parser.detectLanguage("art. 8 Cost"));
        }

        @Test
        void germanIsTheDefault() {
            assertEquals(Language.DE, parser.detectLanguage("nothing to see"));
        }
    }

    @Nested
    @DisplayName("Type detection")
    class TypeDetection {

        @Test
        void leadingArticleMarkerWins() {
            assertEquals(CitationType.STATUTE, parser.detectType("Art. 41 OR (BGE 130 III 182)"));
        }

        @Test
        void leadingCourtPrefixWins() {
            assertEquals(CitationType.COURT_DECISION, parser.detectType("BGE 130 III 182 zu Art. 41 OR"));
        }

        @Test
        void otherKinds() {
            assertEquals(CitationType.CANTONAL_DECISION, parser.detectType("BE_2022_17"));
            assertEquals(CitationType.DOCTRINE, parser.detectType("BSK OR I-Wiegand, Art. 97 N 12"));
            assertEquals(CitationType.UNKNOWN, parser.detectType("6B_123/2020"));
        }
    }

    @Test
    void parseMultipleReturnsDistinctCitationsInOrder() {
        String text = "Gemäss BGE 147 IV 73 und Art. 97 Abs. 1 OR gilt, wie in BGE 147 IV 73 festgehalten, ...";

        List<ParsedCitation> parsed = parser.parseMultiple(text);

        assertEquals(2, parsed.size());
        assertEquals("BGE 147 IV 73", parsed.get(0).rawText());
        assertEquals("Art. 97 Abs. 1 OR", parsed.get(1).rawText());
        assertTrue(parsed.stream().allMatch(ParsedCitation::valid));
    }

    @Test
    void countingIncludesRepetitions() {
        String text = "BGE 147 IV 73; BGE 147 IV 73; art. 41 CO";

        assertTrue(parser.containsCitations(text));
        assertEquals(3, parser.countCitations(text));
        assertFalse(parser.containsCitations("no citations here"));
    }
}
