package com.witty.domain.formalize.model;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public record IngestedText(
        @NotBlank String originalText,
        @NotNull NormalizedText normalized
) {}
