package ch.lexcite.retrieval;

import jakarta.validation.constraints.NotBlank;

/**
 * @param reference BGE, ATF or DTF citation, or a decision id
 */
public record GetFederalDecisionRequest(
    @NotBlank(message = "reference is required")
    String reference
) {
}
