package ch.lexcite.citation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ProvisionLocatorTest {

    private ProvisionLocator locator;

    @BeforeEach
    void setUp() {
        locator = new ProvisionLocator();
    }

    @Test
    void locatesProvisionInRequestedLanguage() {
        ProvisionReference reference = locator.locate("OR", "97", 1, null, Language.FR);

        assertEquals(StatuteCode.OR, reference.statute());
        assertEquals("CO", reference.abbreviation());
        assertEquals("220", reference.srNumber());
        assertEquals("art. 97 al. 1 CO", reference.reference());
        assertEquals("https://www.fedlex.admin.ch/eli/cc/220/fr", reference.fedlexUrl());
    }

    @Test
    void acceptsAbbreviationsOfAnyLanguageAndSuffixes() {
        ProvisionReference reference = locator.locate("CP", "261BIS", null, "A", Language.DE);

        assertEquals(StatuteCode.STGB, reference.statute());
        assertEquals("Art. 261bis lit. a StGB", reference.reference());
        assertEquals("https://www.fedlex.admin.ch/eli/cc/311.0/de", reference.fedlexUrl());
    }

    @Test
    void rejectsUnknownStatute() {
        assertThrows(IllegalArgumentException.class, () -> locator.locate("XYZ", "1", null, null, Language.DE));
    }

    @Test
    void rejectsMalformedArticle() {
        assertThrows(IllegalArgumentException.class, () -> locator.locate("OR", "abc", null, null, Language.DE));
        assertThrows(IllegalArgumentException.class, () -> locator.locate("OR", "0", null, null, Language.DE));
    }
}
