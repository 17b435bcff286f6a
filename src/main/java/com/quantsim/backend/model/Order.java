package com.quantsim.backend.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class Order {
    String id;
    String symbol;
    Side side;
    double quantity;
    @Builder.Default
    OrderType type = OrderType.MARKET;
    Double price;
    Instant timestamp;
}
