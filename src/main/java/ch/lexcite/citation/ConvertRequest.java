package ch.lexcite.citation;

import jakarta.validation.constraints.NotBlank;

public record ConvertRequest(
    @NotBlank(message = "Citation is required")
    String citation,

    @NotBlank(message = "Target language is required")
    String targetLanguage,

    /**
     * When true the response also lists the citation in every language that has a rendering.
     */
    Boolean allTranslations
) {
}
