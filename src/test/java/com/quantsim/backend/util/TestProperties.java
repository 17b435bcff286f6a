package com.quantsim.backend.util;

import com.quantsim.backend.config.SimulationProperties;

public final class TestProperties {

    private TestProperties() {}

    /**
     * Defaults with the given sizing fraction, zero backtest fees and the standard
     * 20% daily loss / 50% position limits.
     */
    public static SimulationProperties withFraction(double fraction) {
        SimulationProperties properties = new SimulationProperties();
        properties.getSizing().setFraction(fraction);
        properties.getBacktest().setFeeRate(0.0);
        properties.getRisk().setMaxDailyLossPct(0.2);
        properties.getRisk().setMaxPositionPct(0.5);
        return properties;
    }
}
