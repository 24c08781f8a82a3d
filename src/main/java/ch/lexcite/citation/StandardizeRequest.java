package ch.lexcite.citation;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public record StandardizeRequest(
    @NotNull(message = "Text is required")
    String text,

    @NotBlank(message = "Target language is required")
    String targetLanguage,

    String style
) {
}
