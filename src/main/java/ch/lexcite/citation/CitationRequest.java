package ch.lexcite.citation;

import jakarta.validation.constraints.NotBlank;

public record CitationRequest(
    @NotBlank(message = "Citation is required")
    String citation
) {
}
