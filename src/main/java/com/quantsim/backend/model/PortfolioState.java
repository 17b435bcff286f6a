package com.quantsim.backend.model;

import java.util.List;
import java.util.Map;

/**
 * Read-only view of a portfolio handed to strategies, risk rules and reporting.
 * Positions are copies; mutating them has no effect on the live portfolio.
 */
public record PortfolioState(
        double cash,
        Map<String, Position> positions,
        List<EquityPoint> equityCurve
) {

    public PortfolioState {
        positions = positions == null ? Map.of() : Map.copyOf(positions);
        equityCurve = equityCurve == null ? List.of() : List.copyOf(equityCurve);
    }

    /**
     * Cash plus the marked value of every position, falling back to the average
     * price for symbols without a mark.
     */
    public double totalValue(Map<String, Double> marks) {
        double value = cash;
        for (Map.Entry<String, Position> entry : positions.entrySet()) {
            Position position = entry.getValue();
            Double mark = marks == null ? null : marks.get(entry.getKey());
            value += position.marketValue(mark != null ? mark : position.getAvgPrice());
        }
        return value;
    }

    public double quantity(String symbol) {
        Position position = positions.get(symbol);
        return position == null ? 0.0 : position.getQuantity();
    }
}
