package com.quantsim.backend.service.risk;

import com.quantsim.backend.model.PortfolioState;
import com.quantsim.backend.model.RiskState;
import com.quantsim.backend.model.Signal;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.Optional;

/**
 * Per-run risk gate owning the {@link RiskState} machine.
 * <p>
 * The engine consults it twice per signal: {@link #approveRequested} on the
 * strategy's raw size before sizing, and {@link #approveSized} on the sizer's
 * output. Both phases run the same checks against the same instance, so a halt
 * raised in either phase holds for the rest of the run. {@code HALTED} never
 * returns to {@code NORMAL}.
 */
@Slf4j
public class RiskManager {

    private final MaxDailyLossRule dailyLossRule;
    private final MaxPositionRule positionRule;
    private RiskState state = RiskState.NORMAL;
    private Outcome lastOutcome = Outcome.APPROVED;

    public enum Phase {
        REQUESTED,
        SIZED
    }

    public enum Outcome {
        APPROVED,
        ADJUSTED,
        HALTED,
        BLOCKED
    }

    public RiskManager(double maxDailyLossPct, double maxPositionPct) {
        this(new MaxDailyLossRule(maxDailyLossPct), new MaxPositionRule(maxPositionPct));
    }

    public RiskManager(MaxDailyLossRule dailyLossRule, MaxPositionRule positionRule) {
        this.dailyLossRule = dailyLossRule;
        this.positionRule = positionRule;
    }

    /**
     * First gate, on the size the strategy asked for. Catches oversized explicit
     * requests and trips the drawdown halt before any sizing work.
     */
    public Optional<Signal> approveRequested(Signal signal, PortfolioState portfolio, double price, String symbol) {
        return approve(signal, portfolio, price, symbol, Phase.REQUESTED);
    }

    /**
     * Second gate, on the size computed by the position sizer, which ignores any
     * cap applied in the first phase.
     */
    public Optional<Signal> approveSized(Signal signal, PortfolioState portfolio, double price, String symbol) {
        return approve(signal, portfolio, price, symbol, Phase.SIZED);
    }

    /**
     * Evaluates the drawdown gate, then the halt state, then the position cap.
     *
     * @return the approved (possibly capped) signal, or empty when rejected
     */
    public Optional<Signal> approve(Signal signal, PortfolioState portfolio, double price, String symbol, Phase phase) {
        double currentEquity = portfolio.totalValue(Map.of(symbol, price));
        if (!dailyLossRule.validate(portfolio, currentEquity)) {
            if (state != RiskState.HALTED) {
                log.error("Max daily loss {} breached at equity {}; halting trading for {}",
                        dailyLossRule.getMaxLossPct(), currentEquity, symbol);
            }
            state = RiskState.HALTED;
            lastOutcome = Outcome.HALTED;
            return Optional.empty();
        }
        if (state == RiskState.HALTED) {
            log.debug("Trading halted; rejecting {} signal for {} ({})", signal.getSide(), symbol, phase);
            lastOutcome = Outcome.HALTED;
            return Optional.empty();
        }
        Optional<Signal> adjusted = positionRule.adjust(portfolio, symbol, signal, price);
        if (adjusted.isEmpty()) {
            log.warn("Position cap not computable for {} at price {} ({}); blocking signal", symbol, price, phase);
            lastOutcome = Outcome.BLOCKED;
            return adjusted;
        }
        if (adjusted.get().getSize() != signal.getSize()) {
            log.info("Signal size for {} capped from {} to {} ({})", symbol, signal.getSize(), adjusted.get().getSize(), phase);
            lastOutcome = Outcome.ADJUSTED;
        } else {
            lastOutcome = Outcome.APPROVED;
        }
        return adjusted;
    }

    public RiskState getState() {
        return state;
    }

    public boolean isHalted() {
        return state == RiskState.HALTED;
    }

    public Outcome getLastOutcome() {
        return lastOutcome;
    }
}
