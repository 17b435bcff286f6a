package com.quantsim.backend.service.marketdata;

import com.quantsim.backend.model.Bar;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.Random;

/**
 * Degraded-mode feed producing noisy bars around a base price of 100.
 * Timestamps come from the clock and are forced strictly ascending.
 */
public class SyntheticBarSource implements BarSource {

    private static final double BASE_PRICE = 100.0;

    private final Random random;
    private final Clock clock;
    private Instant lastTimestamp;

    public SyntheticBarSource() {
        this(new Random(), Clock.systemUTC());
    }

    public SyntheticBarSource(Random random, Clock clock) {
        this.random = random;
        this.clock = clock;
    }

    @Override
    public synchronized Optional<Bar> poll() {
        Instant now = clock.instant();
        if (lastTimestamp != null && !now.isAfter(lastTimestamp)) {
            now = lastTimestamp.plusMillis(1);
        }
        lastTimestamp = now;
        double price = BASE_PRICE + random.nextGaussian();
        return Optional.of(Bar.builder()
                .timestamp(now)
                .open(price - 0.1)
                .high(price + 0.2)
                .low(price - 0.3)
                .close(price)
                .volume(random.nextDouble() * 5)
                .build());
    }

    @Override
    public String name() {
        return "synthetic";
    }
}
