package com.quantsim.backend.service;

import com.quantsim.backend.model.Side;

/**
 * Adverse price adjustment applied to simulated fills: buys pay up, sells give up.
 * A sell never fills below zero.
 */
public record SlippageModel(double pct, double abs) {

    public static final SlippageModel NONE = new SlippageModel(0.0, 0.0);

    public double apply(Side side, double price) {
        if (side == Side.BUY) {
            return price * (1 + pct) + abs;
        }
        return Math.max(0.0, price * (1 - pct) - abs);
    }
}
