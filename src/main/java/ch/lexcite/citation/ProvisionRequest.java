package ch.lexcite.citation;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;

public record ProvisionRequest(
    @NotBlank(message = "Statute is required")
    String statute,

    @NotBlank(message = "Article is required")
    String article,

    @Positive(message = "Paragraph must be positive")
    Integer paragraph,

    String letter,

    String language
) {
}
