package ch.lexcite.citation;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.jetbrains.annotations.Nullable;

/**
 * A citation rendered in one target language.
 *
 * @param citation      canonical citation string
 * @param language      target language
 * @param type          citation kind
 * @param fullReference citation followed by the statute title, when requested and known
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record FormattedCitation(
    String citation,
    Language language,
    CitationType type,
    @Nullable String fullReference
) {
}
