package com.quantsim.backend.strategy;

import com.quantsim.backend.model.Bar;
import com.quantsim.backend.model.PortfolioState;
import com.quantsim.backend.model.Signal;

import java.util.List;

/**
 * Signal-generating strategy driven one bar at a time by the backtest engine or
 * the live paper runner. Instances may keep per-run state and are never shared
 * between runs.
 */
public interface Strategy {

    /**
     * Returns a signal for this bar, or {@code null} to stay flat. Must not mutate
     * the portfolio snapshot.
     */
    Signal generateSignal(Bar bar, PortfolioState portfolio);

    void onFill(Signal signal);

    /**
     * Trains the strategy on history. Model-backed strategies override this;
     * rule-based ones have nothing to fit.
     */
    default void fit(List<Bar> history) {
    }

    String name();
}
