package ch.lexcite.citation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class CitationStandardizerTest {

    private CitationStandardizer standardizer;

    @BeforeEach
    void setUp() {
        standardizer = new CitationStandardizer();
    }

    @Test
    void rewritesCitationsIntoTargetLanguage() {
        String text = "Selon ATF 147 IV 73 et art. 41 al. 1 CO, la demande est rejetée.";

        StandardizationResult result = standardizer.standardize(text, Language.DE, StandardizeStyle.SHORT);

        assertEquals("Selon BGE 147 IV 73 et Art. 41 Abs. 1 OR, la demande est rejetée.", result.text());
        assertEquals(2, result.replacements().size());
        assertEquals(2, result.found());
        assertEquals(2, result.standardized());
    }

    @Test
    void replacementPositionsReferToTheOriginalText() {
        String text = "art. 41 CO und art. 97 CO";

        StandardizationResult result = standardizer.standardize(text, Language.DE, StandardizeStyle.SHORT);

        assertEquals("Art. 41 OR und Art. 97 OR", result.text());
        StandardizationResult.Replacement second = result.replacements().get(1);
        assertEquals("art. 97 CO", text.substring(second.start(), second.end()));
    }

    @Test
    void invalidCitationsAreLeftUnchanged() {
        String text = "Vgl. BGE 147 IX 73 und BGE 147 IV 73.";

        StandardizationResult result = standardizer.standardize(text, Language.FR, StandardizeStyle.SHORT);

        assertEquals("Vgl. BGE 147 IX 73 und ATF 147 IV 73.", result.text());
        assertEquals(1, result.standardized());
    }

    @Test
    void longStyleAddsStatuteName() {
        StandardizationResult result = standardizer.standardize("Art. 97 OR", Language.DE, StandardizeStyle.LONG);

        assertTrue(result.text().startsWith("Art. 97 OR (Obligationenrecht"), result.text());
    }

    @Test
    void citationsAlreadyInTargetFormAreNotReplacements() {
        StandardizationResult result = standardizer.standardize("BGE 147 IV 73", Language.DE, StandardizeStyle.SHORT);

        assertEquals("BGE 147 IV 73", result.text());
        assertTrue(result.replacements().isEmpty());
        assertEquals(1, result.standardized());
    }
}
