package ch.lexcite.citation;

/**
 * A parsed legal reference.
 *
 * <p>Implementations are immutable records, one per citation kind, each holding
 * only the components that kind has. Re-rendering a citation in another
 * language goes through {@link CitationFormatter} and never changes the
 * citation itself.</p>
 *
 * @see CourtDecision
 * @see Statute
 * @see CantonalDecision
 * @see Doctrine
 * @see UnknownCitation
 */
public interface Citation {

    /**
     * @return the kind of reference
     */
    CitationType type();

    /**
     * @return language the citation was written in
     */
    Language sourceLanguage();

    /**
     * @return the original input text, untouched
     */
    String rawText();
}
