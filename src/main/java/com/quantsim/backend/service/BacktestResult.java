package com.quantsim.backend.service;

import com.quantsim.backend.model.PortfolioState;
import com.quantsim.backend.model.RiskState;
import com.quantsim.backend.model.Trade;

import java.util.List;
import java.util.Map;

public record BacktestResult(
        String symbol,
        String strategy,
        PortfolioState portfolio,
        List<Trade> trades,
        long barsProcessed,
        RiskState riskState,
        Map<String, Long> rejections
) {}
