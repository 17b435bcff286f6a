package com.quantsim.backend.service;

import com.quantsim.backend.exception.SimulationException;
import com.quantsim.backend.model.Bar;
import com.quantsim.backend.model.EquityPoint;
import com.quantsim.backend.model.ExecutionResult;
import com.quantsim.backend.model.Order;
import com.quantsim.backend.model.OrderType;
import com.quantsim.backend.model.Portfolio;
import com.quantsim.backend.model.PortfolioState;
import com.quantsim.backend.model.Signal;
import com.quantsim.backend.model.Trade;
import com.quantsim.backend.service.risk.RiskManager;
import com.quantsim.backend.strategy.Strategy;
import com.quantsim.backend.util.OrderIdGenerator;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Per-bar signal, risk, size, risk, fill, update sequence shared by the backtest
 * engine and the live paper runner.
 * <p>
 * Owns the run's portfolio, risk manager and broker ledger. Not thread-safe:
 * bars must be processed one at a time in ascending timestamp order. A bar is
 * either fully applied (fill, strategy callback, equity point) or rejected
 * before anything is mutated.
 */
@Slf4j
public class TradingPipeline {

    static final String REJECT_INVALID_SIGNAL = "invalid_signal";
    static final String REJECT_INVALID_SIZE = "invalid_size";
    static final String REJECT_HALTED = "halted";
    static final String REJECT_POSITION_CAP = "position_cap";
    static final String REJECT_STRATEGY_ERROR = "strategy_error";

    @Getter
    private final String symbol;
    @Getter
    private final Strategy strategy;
    private final Portfolio portfolio;
    @Getter
    private final RiskManager riskManager;
    private final PositionSizer positionSizer;
    private final PaperBroker broker;
    private final MetricsService metricsService;
    private final AlertService alertService;
    private final OrderIdGenerator orderIds = new OrderIdGenerator();
    @Getter
    private long barsProcessed;

    public TradingPipeline(String symbol,
                           Strategy strategy,
                           Portfolio portfolio,
                           RiskManager riskManager,
                           PositionSizer positionSizer,
                           PaperBroker broker,
                           MetricsService metricsService,
                           AlertService alertService) {
        this.symbol = symbol;
        this.strategy = strategy;
        this.portfolio = portfolio;
        this.riskManager = riskManager;
        this.positionSizer = positionSizer;
        this.broker = broker;
        this.metricsService = metricsService;
        this.alertService = alertService;
    }

    public BarOutcome process(Bar bar) {
        PortfolioState snapshot = portfolio.snapshot();
        requireAscending(bar, snapshot);
        double price = bar.getClose();

        Signal signal = generate(bar, snapshot);
        Signal approved = null;
        String rejection = null;
        if (signal != null) {
            metricsService.recordSignal(strategy.name());
            boolean wasHalted = riskManager.isHalted();
            Decision decision = decide(signal, snapshot, price);
            approved = decision.signal();
            rejection = decision.rejection();
            if (!wasHalted && riskManager.isHalted()) {
                metricsService.recordHalt(symbol);
                alertService.sendAlert("RISK_HALT", "Max daily loss breached for " + symbol
                        + " at " + bar.getTimestamp() + "; trading halted for the rest of the session");
            }
            if (rejection != null) {
                metricsService.recordReject(rejection);
            }
        }

        Trade trade = null;
        if (approved != null) {
            trade = fill(approved, bar);
            portfolio.applyFill(trade);
            metricsService.recordFill(symbol, trade.notional());
            notifyFill(approved);
            log.info("Filled {} {} {} @ {} fee={}", trade.getSide(), trade.getQuantity(), symbol, trade.getPrice(), trade.getFee());
        }

        double equity = portfolio.markToMarket(Map.of(symbol, price));
        portfolio.recordEquity(new EquityPoint(bar.getTimestamp(), equity));
        barsProcessed++;
        log.debug("Bar {} close={} equity={}", bar.getTimestamp(), price, equity);
        return new BarOutcome(bar.getTimestamp(), signal, trade, rejection, equity);
    }

    public PortfolioState snapshot() {
        return portfolio.snapshot();
    }

    public List<Trade> trades() {
        return broker.getTrades();
    }

    private Signal generate(Bar bar, PortfolioState snapshot) {
        try {
            return strategy.generateSignal(bar, snapshot);
        } catch (RuntimeException e) {
            log.warn("Strategy {} failed on bar {}: {}", strategy.name(), bar.getTimestamp(), e.getMessage(), e);
            metricsService.recordReject(REJECT_STRATEGY_ERROR);
            return null;
        }
    }

    private Decision decide(Signal signal, PortfolioState snapshot, double price) {
        if (signal.getSide() == null || !Double.isFinite(signal.getSize())) {
            log.warn("Discarding malformed signal {} for {}", signal, symbol);
            return Decision.rejected(REJECT_INVALID_SIGNAL);
        }
        Optional<Signal> requested = riskManager.approveRequested(signal, snapshot, price, symbol);
        if (requested.isEmpty()) {
            return Decision.rejected(riskRejection());
        }
        double size = positionSizer.size(requested.get(), snapshot, price, symbol);
        if (!Double.isFinite(size) || size <= 0) {
            log.debug("Sizer returned {} for {} at price {}; no trade", size, symbol, price);
            return Decision.rejected(REJECT_INVALID_SIZE);
        }
        Optional<Signal> sized = riskManager.approveSized(requested.get().withSize(size), snapshot, price, symbol);
        if (sized.isEmpty()) {
            return Decision.rejected(riskRejection());
        }
        return Decision.approved(sized.get());
    }

    private String riskRejection() {
        return riskManager.getLastOutcome() == RiskManager.Outcome.HALTED ? REJECT_HALTED : REJECT_POSITION_CAP;
    }

    private Trade fill(Signal signal, Bar bar) {
        Order order = Order.builder()
                .id(orderIds.next())
                .symbol(symbol)
                .side(signal.getSide())
                .quantity(Math.abs(signal.getSize()))
                .type(OrderType.MARKET)
                .price(bar.getClose())
                .timestamp(bar.getTimestamp())
                .build();
        ExecutionResult result = broker.execute(order, bar.getClose());
        if (!result.success() || result.trade() == null) {
            throw new SimulationException("Paper broker did not fill order " + order.getId() + ": " + result.message());
        }
        return result.trade();
    }

    private void notifyFill(Signal signal) {
        try {
            strategy.onFill(signal);
        } catch (RuntimeException e) {
            log.warn("Strategy {} onFill failed: {}", strategy.name(), e.getMessage(), e);
        }
    }

    private void requireAscending(Bar bar, PortfolioState snapshot) {
        if (bar.getTimestamp() == null) {
            throw new SimulationException("Bar without timestamp");
        }
        List<EquityPoint> curve = snapshot.equityCurve();
        if (!curve.isEmpty() && !bar.getTimestamp().isAfter(curve.get(curve.size() - 1).timestamp())) {
            throw new SimulationException("Bar at " + bar.getTimestamp() + " is not after last processed bar "
                    + curve.get(curve.size() - 1).timestamp());
        }
    }

    private record Decision(Signal signal, String rejection) {
        static Decision approved(Signal signal) {
            return new Decision(signal, null);
        }

        static Decision rejected(String reason) {
            return new Decision(null, reason);
        }
    }
}
