package ch.lexcite.retrieval;

import jakarta.validation.constraints.NotBlank;

public record GetCantonalDecisionRequest(
    @NotBlank(message = "signature is required")
    String signature
) {
}
