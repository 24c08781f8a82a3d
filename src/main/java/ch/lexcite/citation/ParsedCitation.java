package ch.lexcite.citation;

import java.util.List;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.jetbrains.annotations.Nullable;

/**
 * Result of parsing a single citation.
 *
 * <p>Malformed input never raises; it yields {@code valid == false} with errors
 * and two to four correction suggestions.</p>
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record ParsedCitation(
    String rawText,
    CitationType type,
    Language language,
    boolean valid,
    @JsonProperty("components") @Nullable Citation citation,
    @Nullable String normalized,
    List<String> errors,
    List<String> warnings,
    List<String> suggestions
) {

    public ParsedCitation {
        Objects.requireNonNull(rawText, "rawText must not be null");
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(language, "language must not be null");
        errors = errors == null ? List.of() : List.copyOf(errors);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
        suggestions = suggestions == null ? List.of() : List.copyOf(suggestions);
    }

    /**
     * @return the parsed components, or an {@link UnknownCitation} carrying the raw text
     */
    @JsonIgnore
    public Citation componentsOrUnknown() {
        return citation != null ? citation : new UnknownCitation(language, rawText);
    }
}
