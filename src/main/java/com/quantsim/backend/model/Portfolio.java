package com.quantsim.backend.model;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Mutable cash-and-positions book owned by a single backtest run or live session.
 * <p>
 * Not thread-safe: callers must apply at most one bar at a time. Quantities are
 * long-only and floored at zero on oversell; the oversold quantity is still
 * credited to cash in full.
 */
@Slf4j
public class Portfolio {

    @Getter
    private double cash;
    private final Map<String, Position> positions = new LinkedHashMap<>();
    private final List<EquityPoint> equityCurve = new ArrayList<>();

    public Portfolio(double initialCash) {
        this.cash = initialCash;
    }

    public void updatePosition(String symbol, Side side, double qty, double price) {
        Position position = positions.computeIfAbsent(symbol, key -> new Position(key, 0.0, price));
        if (side == Side.BUY) {
            double totalCost = position.getAvgPrice() * position.getQuantity() + qty * price;
            double newQuantity = position.getQuantity() + qty;
            position.setQuantity(newQuantity);
            if (newQuantity > 0) {
                position.setAvgPrice(totalCost / newQuantity);
            }
            cash -= qty * price;
        } else {
            double remaining = position.getQuantity() - qty;
            if (remaining < 0) {
                log.debug("Oversell on {}: held={} sold={}, clamping to zero", symbol, position.getQuantity(), qty);
                remaining = 0.0;
            }
            position.setQuantity(remaining);
            cash += qty * price;
        }
        log.debug("Updated position {}: qty={} avgPrice={} cash={}", symbol, position.getQuantity(), position.getAvgPrice(), cash);
    }

    /**
     * Applies an executed trade: the position update plus the fee charged by the broker.
     */
    public void applyFill(Trade trade) {
        updatePosition(trade.getSymbol(), trade.getSide(), trade.getQuantity(), trade.getPrice());
        cash -= trade.getFee();
    }

    public double markToMarket(Map<String, Double> marks) {
        double value = cash;
        for (Map.Entry<String, Position> entry : positions.entrySet()) {
            Position position = entry.getValue();
            Double mark = marks == null ? null : marks.get(entry.getKey());
            value += position.getQuantity() * (mark != null ? mark : position.getAvgPrice());
        }
        return value;
    }

    public void recordEquity(EquityPoint point) {
        if (!equityCurve.isEmpty()) {
            EquityPoint last = equityCurve.get(equityCurve.size() - 1);
            if (!point.timestamp().isAfter(last.timestamp())) {
                throw new IllegalStateException("Equity point at " + point.timestamp()
                        + " is not after last recorded " + last.timestamp());
            }
        }
        equityCurve.add(point);
    }

    public PortfolioState snapshot() {
        Map<String, Position> copies = new LinkedHashMap<>();
        positions.forEach((symbol, position) -> copies.put(symbol, position.copy()));
        return new PortfolioState(cash, copies, equityCurve);
    }
}
