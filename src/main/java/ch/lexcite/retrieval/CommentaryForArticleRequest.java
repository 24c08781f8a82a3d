package ch.lexcite.retrieval;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;

/**
 * @param citation statute citation, e.g. {@code Art. 97 Abs. 1 OR} or {@code art. 41 CO}
 * @param language preferred commentary language
 */
public record CommentaryForArticleRequest(
    @NotBlank(message = "citation is required")
    String citation,
    @Pattern(regexp = "de|fr|it|en", message = "language must be one of de, fr, it, en")
    String language
) {
}
