package ch.lexcite.citation;

import java.util.List;

/**
 * Raised at the tool boundary when an operation needs a valid citation.
 *
 * <p>Carries the parse result so the caller receives errors and suggestions.</p>
 */
public class InvalidCitationException extends RuntimeException {

    private final ParsedCitation parsed;

    public InvalidCitationException(final ParsedCitation parsed) {
        super(parsed.errors().isEmpty()
            ? "Invalid citation: " + parsed.rawText()
            : "Invalid citation '" + parsed.rawText() + "': " + String.join("; ", parsed.errors()));
        this.parsed = parsed;
    }

    public ParsedCitation parsed() {
        return parsed;
    }

    public List<String> suggestions() {
        return parsed.suggestions();
    }
}
