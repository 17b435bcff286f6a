package com.quantsim.backend.service;

import com.quantsim.backend.model.EquityPoint;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Summary statistics over an equity curve. Rendering and plotting live elsewhere.
 */
@Service
@RequiredArgsConstructor
public class PerformanceReportService {

    private static final double PERIODS_PER_YEAR = 252.0;

    private final DeflatedSharpeCalculator deflatedSharpeCalculator;

    public record PerformanceSummary(
            int bars,
            int trades,
            double startEquity,
            double finalEquity,
            double totalReturn,
            double sharpe,
            double deflatedSharpe,
            double hitRate,
            double maxDrawdown
    ) {}

    public PerformanceSummary summarize(List<EquityPoint> equityCurve, int tradeCount) {
        return summarize(equityCurve, tradeCount, 1);
    }

    /**
     * @param trials number of strategy configurations evaluated to arrive at this one;
     *               drives the deflated Sharpe penalty
     */
    public PerformanceSummary summarize(List<EquityPoint> equityCurve, int tradeCount, int trials) {
        if (equityCurve.isEmpty()) {
            return new PerformanceSummary(0, tradeCount, 0.0, 0.0, 0.0, 0.0, 0.0, 0.0, 0.0);
        }
        double start = equityCurve.get(0).equity();
        double end = equityCurve.get(equityCurve.size() - 1).equity();
        List<Double> returns = returns(equityCurve);
        double sharpe = sharpe(returns);
        return new PerformanceSummary(
                equityCurve.size(),
                tradeCount,
                start,
                end,
                start == 0 ? 0.0 : (end - start) / start,
                sharpe,
                deflatedSharpeCalculator.deflate(sharpe, returns.size(), trials),
                hitRate(returns),
                maxDrawdown(equityCurve)
        );
    }

    double sharpe(List<Double> returns) {
        if (returns.size() < 2) {
            return 0.0;
        }
        double mean = returns.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
        double variance = returns.stream().mapToDouble(r -> Math.pow(r - mean, 2)).sum() / (returns.size() - 1);
        double stdDev = Math.sqrt(variance);
        return stdDev == 0 ? 0.0 : mean / stdDev * Math.sqrt(PERIODS_PER_YEAR);
    }

    double hitRate(List<Double> returns) {
        if (returns.isEmpty()) {
            return 0.0;
        }
        long positive = returns.stream().filter(r -> r > 0).count();
        return (double) positive / returns.size();
    }

    /**
     * Most negative {@code (equity - runningMax) / runningMax}; zero for a curve that never falls.
     */
    double maxDrawdown(List<EquityPoint> equityCurve) {
        double peak = Double.NEGATIVE_INFINITY;
        double maxDrawdown = 0.0;
        for (EquityPoint point : equityCurve) {
            peak = Math.max(peak, point.equity());
            if (peak > 0) {
                maxDrawdown = Math.min(maxDrawdown, (point.equity() - peak) / peak);
            }
        }
        return maxDrawdown;
    }

    private List<Double> returns(List<EquityPoint> equityCurve) {
        List<Double> returns = new ArrayList<>();
        for (int i = 1; i < equityCurve.size(); i++) {
            double previous = equityCurve.get(i - 1).equity();
            if (previous != 0) {
                returns.add(equityCurve.get(i).equity() / previous - 1);
            }
        }
        return returns;
    }
}
