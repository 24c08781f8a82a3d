package ch.lexcite.citation;

import java.util.List;

import jakarta.validation.constraints.NotNull;

public record ExtractRequest(
    @NotNull(message = "Text is required")
    String text,

    List<String> includeTypes,

    Boolean validate
) {
}
