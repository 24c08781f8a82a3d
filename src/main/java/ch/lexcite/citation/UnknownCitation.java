package ch.lexcite.citation;

import java.util.Objects;

/**
 * Input that could not be classified.
 *
 * @param sourceLanguage best-effort language guess
 * @param rawText        original input
 */
public record UnknownCitation(Language sourceLanguage, String rawText) implements Citation {

    public UnknownCitation {
        Objects.requireNonNull(sourceLanguage, "sourceLanguage must not be null");
        Objects.requireNonNull(rawText, "rawText must not be null");
    }

    @Override
    public CitationType type() {
        return CitationType.UNKNOWN;
    }
}
