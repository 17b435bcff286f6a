package com.quantsim.backend.service;

import com.quantsim.backend.config.SimulationProperties;
import com.quantsim.backend.config.SimulationProperties.EquityBasis;
import com.quantsim.backend.model.PortfolioState;
import com.quantsim.backend.model.Position;
import com.quantsim.backend.model.Signal;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Map;

@Service
@Slf4j
@RequiredArgsConstructor
public class PositionSizer {

    private final SimulationProperties properties;

    /**
     * Sizes a signal with the configured fraction and equity basis.
     *
     * @return target quantity, or NaN when {@code price <= 0}; callers must check
     */
    public double size(Signal signal, PortfolioState portfolio, double price, String symbol) {
        SimulationProperties.Sizing sizing = properties.getSizing();
        if (sizing.getEquityBasis() == EquityBasis.MARK_TO_MARKET) {
            double equity = portfolio.totalValue(Map.of(symbol, price));
            return fractionOf(equity, sizing.getFraction(), price);
        }
        return fixedFractional(signal, portfolio, sizing.getFraction(), price);
    }

    /**
     * {@code (cash + sum(avgPrice * qty)) * fraction / price}. Uses cost basis, so it
     * lags marked equity when positions have moved.
     */
    public double fixedFractional(Signal signal, PortfolioState portfolio, double fraction, double price) {
        double equity = portfolio.cash();
        for (Position position : portfolio.positions().values()) {
            equity += position.getAvgPrice() * position.getQuantity();
        }
        return fractionOf(equity, fraction, price);
    }

    private double fractionOf(double equity, double fraction, double price) {
        if (!(price > 0)) {
            log.warn("Cannot size at non-positive price {}", price);
            return Double.NaN;
        }
        double size = (equity * fraction) / price;
        log.debug("Fixed fractional size={} for equity={} fraction={}", size, equity, fraction);
        return size;
    }
}
