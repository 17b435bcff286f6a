package com.quantsim.backend.service;

import com.quantsim.backend.model.ExecutionResult;
import com.quantsim.backend.model.Order;
import com.quantsim.backend.model.Trade;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Always-filling simulated broker. Every order fills in full at the mark price
 * (adjusted by the slippage model) and is charged {@code |qty| * price * feeRate}.
 * No rejection, latency or partial fills are modelled.
 */
@Slf4j
public class PaperBroker {

    private final double feeRate;
    private final SlippageModel slippage;
    private final List<Trade> trades = new ArrayList<>();

    public PaperBroker(double feeRate) {
        this(feeRate, SlippageModel.NONE);
    }

    public PaperBroker(double feeRate, SlippageModel slippage) {
        if (feeRate < 0) {
            throw new IllegalArgumentException("feeRate must be >= 0, got " + feeRate);
        }
        this.feeRate = feeRate;
        this.slippage = slippage;
    }

    public ExecutionResult execute(Order order, double markPrice) {
        double fillPrice = slippage.apply(order.getSide(), markPrice);
        double fee = Math.abs(order.getQuantity()) * fillPrice * feeRate;
        Trade trade = Trade.builder()
                .orderId(order.getId())
                .symbol(order.getSymbol())
                .side(order.getSide())
                .quantity(order.getQuantity())
                .price(fillPrice)
                .fee(fee)
                .timestamp(order.getTimestamp())
                .build();
        trades.add(trade);
        log.debug("Paper fill for order {} {} {} @ {} fee={}", order.getId(), order.getSide(), order.getQuantity(), fillPrice, fee);
        return ExecutionResult.filled(trade);
    }

    public List<Trade> getTrades() {
        return Collections.unmodifiableList(trades);
    }

    public double getFeeRate() {
        return feeRate;
    }
}
