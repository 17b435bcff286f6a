package com.quantsim.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Directional trade intent emitted by a strategy for one bar.
 * <p>
 * {@code size} is a magnitude; direction is carried by {@code side}. Sizing and
 * risk stages overwrite it, and a size of zero means nothing to trade.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Signal {
    private Instant timestamp;
    private Side side;
    @Builder.Default
    private double confidence = 1.0;
    private double size;

    public Signal withSize(double newSize) {
        return toBuilder().size(newSize).build();
    }
}
