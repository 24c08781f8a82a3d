package ch.lexcite.citation;

/**
 * Raised when a citation cannot be rendered in the requested language.
 */
public class CitationFormatException extends RuntimeException {

    public CitationFormatException(final String message) {
        super(message);
    }
}
