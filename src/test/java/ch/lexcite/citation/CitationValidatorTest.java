package ch.lexcite.citation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class CitationValidatorTest {

    private CitationValidator validator;

    @BeforeEach
    void setUp() {
        validator = new CitationValidator();
    }

    @Nested
    @DisplayName("Court decisions")
    class CourtDecisions {

        @Test
        @DisplayName("BGE 147 IV 73 is valid and normalized unchanged")
        void validGermanDecision() {
            ValidationResult result = validator.validate("BGE 147 IV 73");

            assertTrue(result.valid());
            assertEquals(CitationType.COURT_DECISION, result.type());
            assertEquals(Language.DE, result.language());
            assertEquals("BGE 147 IV 73", result.normalized());
            CourtDecision decision = assertInstanceOf(CourtDecision.class, result.citation());
            assertEquals(147, decision.volume());
            assertEquals(Chamber.IV, decision.chamber());
            assertEquals(73, decision.page());
        }

        @Test
        void prefixDeterminesLanguage() {
            assertEquals(Language.FR, validator.validate("ATF 140 III 86").language());
            assertEquals(Language.IT, validator.validate("DTF 140 III 86").language());
        }

        @Test
        void considerationIsKept() {
            ValidationResult result = validator.validate("ATF 140 III 86 consid. 2.1");

            assertTrue(result.valid());
            assertEquals("ATF 140 III 86 consid. 2.1", result.normalized());
            assertEquals("2.1", ((CourtDecision) result.citation()).consideration());
        }

        @Test
        void lowerCaseInputIsNormalized() {
            ValidationResult result = validator.validate("bge 147 iv 73");

            assertTrue(result.valid());
            assertEquals("BGE 147 IV 73", result.normalized());
        }

        @Test
        void unknownChamberIsAnError() {
            ValidationResult result = validator.validate("BGE 147 VI 73");

            assertFalse(result.valid());
            assertTrue(result.errors().get(0).contains("Invalid chamber"));
            assertNull(result.citation());
        }

        @Test
        void unusualVolumeIsOnlyAWarning() {
            ValidationResult result = validator.validate("BGE 250 II 10");

            assertTrue(result.valid());
            assertEquals(1, result.warnings().size());
            assertTrue(result.warnings().get(0).contains("Unusual volume"));
        }

        @Test
        void zeroPageIsAnError() {
            ValidationResult result = validator.validate("BGE 147 IV 0");

            assertFalse(result.valid());
            assertTrue(result.errors().get(0).contains("page"));
        }

        @Test
        void incompleteDecisionIsRejected() {
            ValidationResult result = validator.validate("BGE 147");

            assertFalse(result.valid());
            assertEquals(CitationType.COURT_DECISION, result.type());
            assertTrue(result.errors().get(0).startsWith("Invalid BGE citation format"));
        }
    }

    @Nested
    @DisplayName("Statutes")
    class Statutes {

        @Test
        @DisplayName("Art.97 OR is rejected for the missing space")
        void missingSpaceAfterMarker() {
            ValidationResult result = validator.validate("Art.97 OR");

            assertFalse(result.valid());
            assertEquals(CitationType.STATUTE, result.type());
            assertTrue(result.errors().get(0).contains("Missing space"));
        }

        @Test
        void fullGermanStatute() {
            ValidationResult result = validator.validate("Art. 97 Abs. 1 lit. a OR");

            assertTrue(result.valid());
            Statute statute = assertInstanceOf(Statute.class, result.citation());
            assertEquals(StatuteCode.OR, statute.code());
            assertEquals(97, statute.article());
            assertEquals(1, statute.paragraph());
            assertEquals("a", statute.letter());
            assertEquals("Art. 97 Abs. 1 lit. a OR", result.normalized());
        }

        @Test
        void frenchMarkersSelectFrench() {
            ValidationResult result = validator.validate("art. 41 al. 1 CO");

            assertTrue(result.valid());
            assertEquals(Language.FR, result.language());
            assertEquals(StatuteCode.OR, ((Statute) result.citation()).code());
        }

        @Test
        void articleSuffixIsParsed() {
            ValidationResult result = validator.validate("Art. 261bis StGB");

            assertTrue(result.valid());
            assertEquals("261bis", ((Statute) result.citation()).articleLabel());
        }

        @Test
        void unknownStatuteCode() {
            ValidationResult result = validator.validate("Art. 12 XYZ");

            assertFalse(result.valid());
            assertTrue(result.errors().contains("Unknown statute code: XYZ"));
        }

        @Test
        void abbreviationOfAnotherLanguageIsAnError() {
            ValidationResult result = validator.validate("Art. 97 Abs. 1 CO");

            assertFalse(result.valid());
            assertTrue(result.errors().get(0).contains("Use 'OR'"));
        }

        @Test
        void markerCasingIsAWarning() {
            ValidationResult result = validator.validate("art. 97 Abs. 1 OR");

            assertTrue(result.valid());
            assertEquals(1, result.warnings().size());
        }

        @Test
        void trailingCourtReferenceIsIgnoredWithWarning() {
            ValidationResult result = validator.validate("Art. 41 OR (BGE 130 III 182)");

            assertTrue(result.valid());
            assertEquals("Art. 41 OR", result.normalized());
            assertTrue(result.warnings().get(0).contains("BGE 130 III 182"));
        }

        @Test
        void italianNumberWithSharedAbbreviation() {
            ValidationResult result = validator.validate("art. 97 n. 2 CO");

            assertTrue(result.valid(), result.errors().toString());
            assertEquals(Language.IT, result.language());
            assertEquals("art. 97 n. 2 CO", result.normalized());
            assertEquals(Integer.valueOf(2), ((Statute) result.citation()).number());
        }

        @Test
        void englishCitationIsAccepted() {
            ValidationResult result = validator.validate("Art. 97 para. 1 CO");

            assertTrue(result.valid());
            assertEquals(Language.EN, result.language());
        }
    }

    @Test
    void cantonalDecision() {
        ValidationResult result = validator.validate("zh-2023-145");

        assertTrue(result.valid());
        assertEquals(CitationType.CANTONAL_DECISION, result.type());
        CantonalDecision decision = assertInstanceOf(CantonalDecision.class, result.citation());
        assertEquals("ZH", decision.court());
        assertEquals(2023, decision.year());
    }

    @Test
    void doctrine() {
        ValidationResult result = validator.validate("BSK OR I-Wiegand, Art. 97 N 12");

        assertTrue(result.valid());
        assertEquals(CitationType.DOCTRINE, result.type());
        assertEquals("BSK OR I-Wiegand, Art. 97 N 12", result.normalized());
    }

    @Test
    void frenchCommentarySeries() {
        ValidationResult result = validator.validate("CR CO I-Thévenoz, art. 97 N 12");

        assertTrue(result.valid());
        assertEquals(Language.FR, result.language());
    }

    @Test
    void emptyInput() {
        ValidationResult result = validator.validate("   ");

        assertFalse(result.valid());
        assertEquals(CitationType.UNKNOWN, result.type());
    }

    @Test
    void unrecognisedInput() {
        ValidationResult result = validator.validate("see the judgment of last year");

        assertFalse(result.valid());
        assertEquals(CitationValidator.UNKNOWN_TYPE_ERROR, result.errors().get(0));
    }
}
