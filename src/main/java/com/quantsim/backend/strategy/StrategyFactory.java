package com.quantsim.backend.strategy;

import com.quantsim.backend.exception.BadRequestException;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

@Component
public class StrategyFactory {

    private static final int DEFAULT_FAST = 5;
    private static final int DEFAULT_SLOW = 20;

    public Strategy create(String name) {
        if (name == null || name.isBlank()) {
            throw new BadRequestException("Strategy name is required");
        }
        return switch (name.trim().toLowerCase(Locale.ROOT)) {
            case MovingAverageCrossStrategy.NAME -> new MovingAverageCrossStrategy(DEFAULT_FAST, DEFAULT_SLOW);
            case BuyAndHoldStrategy.NAME -> new BuyAndHoldStrategy();
            default -> throw new BadRequestException("Unknown strategy: " + name + ", expected one of " + available());
        };
    }

    public List<String> available() {
        return List.of(MovingAverageCrossStrategy.NAME, BuyAndHoldStrategy.NAME);
    }
}
