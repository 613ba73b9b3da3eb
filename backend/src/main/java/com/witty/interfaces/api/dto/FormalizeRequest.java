package com.witty.interfaces.api.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record FormalizeRequest(
        @NotBlank(message = "Text is required")
        String text,

        @Pattern(regexp = "(?i)default|strict", message = "Privacy mode must be default or strict")
        String privacyMode,

        Boolean reproducibleMode,

        String salt,

        Boolean retrievalEnabled,

        @Min(value = 1, message = "top_k_symbolizations must be at least 1")
        @Max(value = 20, message = "top_k_symbolizations must not exceed 20")
        Integer topKSymbolizations
) {}
