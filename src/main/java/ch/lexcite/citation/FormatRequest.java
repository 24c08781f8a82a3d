package ch.lexcite.citation;

import jakarta.validation.constraints.NotBlank;

public record FormatRequest(
    @NotBlank(message = "Citation is required")
    String citation,

    @NotBlank(message = "Target language is required")
    String targetLanguage,

    Boolean fullStatuteName,

    Boolean includeSrNumber
) {
    public FormatRequest(final String citation, final String targetLanguage) {
        this(citation, targetLanguage, null, null);
    }

    FormatOptions options() {
        return new FormatOptions(Boolean.TRUE.equals(fullStatuteName), Boolean.TRUE.equals(includeSrNumber));
    }
}
