package com.quantsim.backend.dto;

import com.quantsim.backend.model.EquityPoint;
import com.quantsim.backend.model.Position;
import com.quantsim.backend.model.RiskState;
import com.quantsim.backend.model.Trade;
import com.quantsim.backend.service.PerformanceReportService.PerformanceSummary;

import java.util.List;
import java.util.Map;

public record BacktestResponse(
        String symbol,
        String strategy,
        long barsProcessed,
        double finalCash,
        RiskState riskState,
        List<Position> positions,
        List<EquityPoint> equityCurve,
        List<Trade> trades,
        Map<String, Long> rejections,
        PerformanceSummary summary
) {}
