package ch.lexcite.citation;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.jetbrains.annotations.Nullable;

/**
 * A citation found in running text.
 *
 * @param text       citation as it appears in the text
 * @param type       citation kind
 * @param language   detected language
 * @param start      start offset, inclusive
 * @param end        end offset, exclusive
 * @param valid      validation outcome, absent when validation was not requested
 * @param normalized normalized form, absent when invalid or not validated
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ExtractedCitation(
    String text,
    CitationType type,
    Language language,
    int start,
    int end,
    @Nullable Boolean valid,
    @Nullable String normalized
) {
}
