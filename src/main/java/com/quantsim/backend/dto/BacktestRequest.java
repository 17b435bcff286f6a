package com.quantsim.backend.dto;

import com.quantsim.backend.model.Bar;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

import java.util.List;

public record BacktestRequest(
        String symbol,
        @NotBlank String strategy,
        @Positive Double initialCash,
        @NotEmpty List<@NotNull Bar> bars,
        @Positive Integer trials
) {}
