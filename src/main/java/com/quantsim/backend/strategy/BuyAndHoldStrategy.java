package com.quantsim.backend.strategy;

import com.quantsim.backend.model.Bar;
import com.quantsim.backend.model.PortfolioState;
import com.quantsim.backend.model.Side;
import com.quantsim.backend.model.Signal;

/**
 * Buys on the first bar and holds. Retries on later bars until a fill is confirmed.
 */
public class BuyAndHoldStrategy implements Strategy {

    public static final String NAME = "buy-and-hold";

    private boolean filled;

    @Override
    public Signal generateSignal(Bar bar, PortfolioState portfolio) {
        if (filled) {
            return null;
        }
        return Signal.builder()
                .timestamp(bar.getTimestamp())
                .side(Side.BUY)
                .confidence(1.0)
                .build();
    }

    @Override
    public void onFill(Signal signal) {
        filled = true;
    }

    @Override
    public String name() {
        return NAME;
    }
}
