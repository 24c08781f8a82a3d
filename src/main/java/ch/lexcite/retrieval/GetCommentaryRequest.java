package ch.lexcite.retrieval;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;

public record GetCommentaryRequest(
    @NotBlank(message = "id is required")
    @Pattern(regexp = "[a-zA-Z0-9-]+", message = "id may only contain letters, digits and dashes")
    String id
) {
}
