package com.quantsim.backend.model;

public record ExecutionResult(boolean success, Trade trade, String message) {

    public static ExecutionResult filled(Trade trade) {
        return new ExecutionResult(true, trade, "FILLED");
    }
}
