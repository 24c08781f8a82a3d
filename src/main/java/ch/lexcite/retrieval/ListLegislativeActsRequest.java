package ch.lexcite.retrieval;

import jakarta.validation.constraints.Pattern;

public record ListLegislativeActsRequest(
    @Pattern(regexp = "de|fr|it|en", message = "language must be one of de, fr, it, en")
    String language
) {
}
