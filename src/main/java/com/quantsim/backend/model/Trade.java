package com.quantsim.backend.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class Trade {
    String orderId;
    String symbol;
    Side side;
    double quantity;
    double price;
    double fee;
    Instant timestamp;

    public double notional() {
        return quantity * price;
    }
}
