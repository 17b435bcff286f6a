package com.quantsim.backend.service.risk;

import com.quantsim.backend.model.PortfolioState;
import com.quantsim.backend.model.Signal;

import java.util.Map;
import java.util.Optional;

/**
 * Caps a signal's size at {@code maxPct} of marked equity for one symbol.
 */
public class MaxPositionRule {

    private final double maxPct;

    public MaxPositionRule(double maxPct) {
        this.maxPct = maxPct;
    }

    /**
     * @return the signal unchanged when within the cap, a capped copy when above
     * it, or empty when the cap cannot be computed (non-positive price, equity or cap)
     */
    public Optional<Signal> adjust(PortfolioState portfolio, String symbol, Signal signal, double price) {
        if (!(price > 0)) {
            return Optional.empty();
        }
        double equity = portfolio.totalValue(Map.of(symbol, price));
        if (!(equity > 0)) {
            return Optional.empty();
        }
        double maxQuantity = maxQuantity(equity, price);
        if (!(maxQuantity > 0)) {
            return Optional.empty();
        }
        if (Math.abs(signal.getSize()) <= maxQuantity) {
            return Optional.of(signal);
        }
        return Optional.of(signal.withSize(maxQuantity));
    }

    public double maxQuantity(double equity, double price) {
        return (maxPct * equity) / price;
    }
}
