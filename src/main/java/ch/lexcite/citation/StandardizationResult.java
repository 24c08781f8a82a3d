package ch.lexcite.citation;

import java.util.List;

/**
 * A document with its citations rewritten into one language and style.
 *
 * @param text         rewritten text
 * @param language     target language
 * @param style        output style
 * @param replacements applied replacements, in text order of the input
 * @param found        citations found
 * @param standardized citations rewritten
 * @param skipped      citations left unchanged because they are invalid or have no rendering
 */
public record StandardizationResult(
    String text,
    Language language,
    StandardizeStyle style,
    List<Replacement> replacements,
    int found,
    int standardized,
    int skipped
) {

    public StandardizationResult {
        replacements = List.copyOf(replacements);
    }

    /**
     * @param original    citation as found
     * @param replacement rendered citation
     * @param start       start offset in the input text
     * @param end         end offset in the input text
     * @param type        citation kind
     */
    public record Replacement(String original, String replacement, int start, int end, CitationType type) {}
}
