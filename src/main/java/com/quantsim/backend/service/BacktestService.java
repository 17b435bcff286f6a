package com.quantsim.backend.service;

import com.quantsim.backend.config.SimulationProperties;
import com.quantsim.backend.dto.BacktestRequest;
import com.quantsim.backend.dto.BacktestResponse;
import com.quantsim.backend.strategy.Strategy;
import com.quantsim.backend.strategy.StrategyFactory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;

@Slf4j
@Service
@RequiredArgsConstructor
public class BacktestService {

    private final BacktestEngine backtestEngine;
    private final StrategyFactory strategyFactory;
    private final PerformanceReportService performanceReportService;
    private final SimulationProperties properties;

    public BacktestResponse runBacktest(BacktestRequest request) {
        String symbol = request.symbol() == null || request.symbol().isBlank()
                ? properties.getBacktest().getSymbol()
                : request.symbol();
        double initialCash = request.initialCash() != null
                ? request.initialCash()
                : properties.getBacktest().getInitialCash();
        Strategy strategy = strategyFactory.create(request.strategy());
        log.info("Running backtest {} on {} over {} bars with initial cash {}",
                strategy.name(), symbol, request.bars().size(), initialCash);

        BacktestResult result = backtestEngine.run(symbol, request.bars(), strategy, initialCash);
        int trials = request.trials() != null ? request.trials() : 1;
        PerformanceReportService.PerformanceSummary summary = performanceReportService.summarize(
                result.portfolio().equityCurve(), result.trades().size(), trials);
        log.info("Backtest metrics -> Trades: {} | Sharpe: {} | Deflated Sharpe: {} | Hit Rate: {} | Max DD: {}%",
                summary.trades(),
                String.format("%.3f", summary.sharpe()),
                String.format("%.3f", summary.deflatedSharpe()),
                String.format("%.2f", summary.hitRate()),
                String.format("%.2f", summary.maxDrawdown() * 100));
        return new BacktestResponse(
                result.symbol(),
                result.strategy(),
                result.barsProcessed(),
                result.portfolio().cash(),
                result.riskState(),
                new ArrayList<>(result.portfolio().positions().values()),
                result.portfolio().equityCurve(),
                result.trades(),
                result.rejections(),
                summary
        );
    }
}
