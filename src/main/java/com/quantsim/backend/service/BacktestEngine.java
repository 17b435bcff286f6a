package com.quantsim.backend.service;

import com.quantsim.backend.config.SimulationProperties;
import com.quantsim.backend.exception.BadRequestException;
import com.quantsim.backend.model.Bar;
import com.quantsim.backend.model.Portfolio;
import com.quantsim.backend.model.PortfolioState;
import com.quantsim.backend.service.risk.RiskManager;
import com.quantsim.backend.strategy.Strategy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Synchronous replay of a finite bar sequence through a fresh {@link TradingPipeline}.
 * Each call owns its own portfolio, risk manager and ledger.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BacktestEngine {

    private final SimulationProperties properties;
    private final PositionSizer positionSizer;
    private final MetricsService metricsService;
    private final AlertService alertService;

    public BacktestResult run(String symbol, List<Bar> bars, Strategy strategy) {
        return run(symbol, bars, strategy, properties.getBacktest().getInitialCash());
    }

    public BacktestResult run(String symbol, List<Bar> bars, Strategy strategy, double initialCash) {
        List<Bar> ordered = ordered(bars);
        TradingPipeline pipeline = newPipeline(symbol, strategy, initialCash);
        Map<String, Long> rejections = new LinkedHashMap<>();
        for (Bar bar : ordered) {
            BarOutcome outcome = pipeline.process(bar);
            if (outcome.rejection() != null) {
                rejections.merge(outcome.rejection(), 1L, Long::sum);
            }
        }
        PortfolioState finalState = pipeline.snapshot();
        if (finalState.equityCurve().isEmpty()) {
            log.info("Backtest {} on {} completed with no bars", strategy.name(), symbol);
        } else {
            log.info("Backtest {} on {} completed. Bars: {} | Trades: {} | Final equity: {}",
                    strategy.name(), symbol, pipeline.getBarsProcessed(), pipeline.trades().size(),
                    String.format("%.2f", finalState.equityCurve().get(finalState.equityCurve().size() - 1).equity()));
        }
        return new BacktestResult(
                symbol,
                strategy.name(),
                finalState,
                List.copyOf(pipeline.trades()),
                pipeline.getBarsProcessed(),
                pipeline.getRiskManager().getState(),
                rejections
        );
    }

    TradingPipeline newPipeline(String symbol, Strategy strategy, double initialCash) {
        SimulationProperties.Backtest backtest = properties.getBacktest();
        SimulationProperties.Risk risk = properties.getRisk();
        return new TradingPipeline(
                symbol,
                strategy,
                new Portfolio(initialCash),
                new RiskManager(risk.getMaxDailyLossPct(), risk.getMaxPositionPct()),
                positionSizer,
                new PaperBroker(backtest.getFeeRate(), new SlippageModel(backtest.getSlippagePct(), backtest.getSlippageAbs())),
                metricsService,
                alertService
        );
    }

    private List<Bar> ordered(List<Bar> bars) {
        List<Bar> sorted = new ArrayList<>(bars);
        for (Bar bar : sorted) {
            if (bar == null || bar.getTimestamp() == null) {
                throw new BadRequestException("Every bar needs a timestamp");
            }
        }
        sorted.sort(Comparator.comparing(Bar::getTimestamp));
        for (int i = 1; i < sorted.size(); i++) {
            if (!sorted.get(i).getTimestamp().isAfter(sorted.get(i - 1).getTimestamp())) {
                throw new BadRequestException("Duplicate bar timestamp " + sorted.get(i).getTimestamp());
            }
        }
        return sorted;
    }
}
