package com.quantsim.backend.model;

import java.time.Instant;
import java.util.List;

public record LiveSessionState(
        String sessionId,
        String symbol,
        Instant startTime,
        Instant stopTime,
        SessionStatus status,
        RiskState riskState,
        long barsProcessed,
        PortfolioState portfolio,
        List<Trade> trades
) {

    public enum SessionStatus {
        RUNNING,
        STOPPED
    }
}
