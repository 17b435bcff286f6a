package com.quantsim.backend.strategy;

import com.quantsim.backend.model.Bar;
import com.quantsim.backend.model.PortfolioState;
import com.quantsim.backend.model.Position;
import com.quantsim.backend.model.Side;
import com.quantsim.backend.model.Signal;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Simple moving average crossover.
 * <p>
 * BUY when the fast average crosses above the slow one, SELL when it crosses
 * below while something is held, nothing otherwise. Confidence grows with the
 * relative spread between the two averages and is capped at 1.
 */
@Slf4j
public class MovingAverageCrossStrategy implements Strategy {

    public static final String NAME = "ma-cross";

    private final int fastPeriod;
    private final int slowPeriod;
    private final Deque<Double> closes = new ArrayDeque<>();
    private Double previousSpread;
    private int fills;

    public MovingAverageCrossStrategy(int fastPeriod, int slowPeriod) {
        if (fastPeriod <= 0 || slowPeriod <= fastPeriod) {
            throw new IllegalArgumentException("Require 0 < fastPeriod < slowPeriod, got "
                    + fastPeriod + "/" + slowPeriod);
        }
        this.fastPeriod = fastPeriod;
        this.slowPeriod = slowPeriod;
    }

    @Override
    public Signal generateSignal(Bar bar, PortfolioState portfolio) {
        closes.addLast(bar.getClose());
        if (closes.size() > slowPeriod) {
            closes.removeFirst();
        }
        if (closes.size() < slowPeriod) {
            return null;
        }
        double fast = average(fastPeriod);
        double slow = average(slowPeriod);
        double spread = fast - slow;
        Double prior = previousSpread;
        previousSpread = spread;
        if (prior == null) {
            return null;
        }
        Side side = null;
        if (prior <= 0 && spread > 0) {
            side = Side.BUY;
        } else if (prior >= 0 && spread < 0) {
            side = Side.SELL;
        }
        if (side == null) {
            return null;
        }
        if (side == Side.SELL && !holdsAnything(portfolio)) {
            log.debug("MA down-cross at {} ignored, nothing held", bar.getTimestamp());
            return null;
        }
        double confidence = slow == 0 ? 0.0 : Math.min(1.0, Math.abs(spread) / Math.abs(slow) * 100);
        log.debug("MA cross {} at {} fast={} slow={}", side, bar.getTimestamp(), fast, slow);
        return Signal.builder()
                .timestamp(bar.getTimestamp())
                .side(side)
                .confidence(confidence)
                .size(0.0)
                .build();
    }

    @Override
    public void onFill(Signal signal) {
        fills++;
        log.info("Executed {} signal from {} (fills={})", signal.getSide(), NAME, fills);
    }

    @Override
    public void fit(List<Bar> history) {
        log.info("{} is rule-based; fit over {} bars is a no-op", NAME, history.size());
    }

    @Override
    public String name() {
        return NAME;
    }

    private boolean holdsAnything(PortfolioState portfolio) {
        return portfolio.positions().values().stream().mapToDouble(Position::getQuantity).sum() > 0;
    }

    private double average(int period) {
        double sum = 0.0;
        int count = 0;
        var iterator = closes.descendingIterator();
        while (iterator.hasNext() && count < period) {
            sum += iterator.next();
            count++;
        }
        return sum / count;
    }
}
