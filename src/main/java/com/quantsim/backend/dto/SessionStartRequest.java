package com.quantsim.backend.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;

public record SessionStartRequest(
        @NotBlank String strategy,
        String symbol,
        String interval,
        String feedUrl,
        @Positive Double initialCash
) {}
