package com.quantsim.backend.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class Position {
    private String symbol;
    private double quantity;
    private double avgPrice;

    public double marketValue(double markPrice) {
        return quantity * markPrice;
    }

    public Position copy() {
        return new Position(symbol, quantity, avgPrice);
    }
}
