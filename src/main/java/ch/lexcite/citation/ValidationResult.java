package ch.lexcite.citation;

import java.util.List;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.jetbrains.annotations.Nullable;

/**
 * Outcome of validating a citation string.
 *
 * @param valid      true when no errors were found
 * @param type       detected citation kind
 * @param language   detected citation language
 * @param normalized canonical rendering in the detected language, absent when the input could not be parsed
 * @param citation   parsed components, absent when the input could not be parsed
 * @param errors     hard failures
 * @param warnings   findings that do not invalidate the citation
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record ValidationResult(
    boolean valid,
    CitationType type,
    Language language,
    @Nullable String normalized,
    @JsonProperty("components") @Nullable Citation citation,
    List<String> errors,
    List<String> warnings
) {

    public ValidationResult {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(language, "language must not be null");
        errors = errors == null ? List.of() : List.copyOf(errors);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    static ValidationResult failure(CitationType type, Language language, String error) {
        return new ValidationResult(false, type, language, null, null, List.of(error), List.of());
    }
}
