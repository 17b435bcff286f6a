package com.quantsim.backend.service.risk;

import com.quantsim.backend.model.EquityPoint;
import com.quantsim.backend.model.PortfolioState;

/**
 * Drawdown gate measured from the first point of the equity curve.
 */
public class MaxDailyLossRule {

    private final double maxLossPct;

    public MaxDailyLossRule(double maxLossPct) {
        this.maxLossPct = maxLossPct;
    }

    /**
     * @return {@code true} while the drawdown from the first recorded equity stays
     * below the limit; always {@code true} before any equity has been recorded
     */
    public boolean validate(PortfolioState portfolio, double currentEquity) {
        if (portfolio.equityCurve().isEmpty()) {
            return true;
        }
        EquityPoint start = portfolio.equityCurve().get(0);
        double startEquity = start.equity();
        if (startEquity <= 0) {
            return true;
        }
        double drawdown = (startEquity - currentEquity) / startEquity;
        return drawdown < maxLossPct;
    }

    public double getMaxLossPct() {
        return maxLossPct;
    }
}
