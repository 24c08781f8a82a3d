package ch.lexcite.citation;

import java.util.Objects;

/**
 * Cantonal court case number such as {@code ZH-2023-145}.
 *
 * @param court      court or canton prefix (two to four letters)
 * @param year       year of registration
 * @param caseNumber running case number
 * @param sourceLanguage language the citation appeared in
 * @param rawText    original input
 */
public record CantonalDecision(
    String court,
    int year,
    String caseNumber,
    Language sourceLanguage,
    String rawText
) implements Citation {

    public CantonalDecision {
        Objects.requireNonNull(court, "court must not be null");
        Objects.requireNonNull(caseNumber, "caseNumber must not be null");
        Objects.requireNonNull(sourceLanguage, "sourceLanguage must not be null");
        Objects.requireNonNull(rawText, "rawText must not be null");
    }

    /**
     * @return case reference with hyphen separators
     */
    public String reference() {
        return court + "-" + year + "-" + caseNumber;
    }

    @Override
    public CitationType type() {
        return CitationType.CANTONAL_DECISION;
    }
}
