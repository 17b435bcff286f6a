package com.quantsim.backend.service;

import com.quantsim.backend.model.Signal;
import com.quantsim.backend.model.Trade;

import java.time.Instant;

/**
 * What happened to one bar: the strategy's signal (if any), the fill (if any),
 * the rejection reason when a signal did not trade, and the equity recorded.
 */
public record BarOutcome(
        Instant timestamp,
        Signal signal,
        Trade trade,
        String rejection,
        double equity
) {

    public boolean traded() {
        return trade != null;
    }
}
