package com.quantsim.backend.util;

import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Time-based order ids, {@code ord-<utc yyyyMMddHHmmssSSSSSS>-<seq>}. The sequence
 * keeps ids unique when several orders share a clock tick.
 */
public final class OrderIdGenerator {

    private static final DateTimeFormatter FORMAT = DateTimeFormatter.ofPattern("yyyyMMddHHmmssSSSSSS")
            .withZone(ZoneOffset.UTC);

    private final String prefix;
    private final Clock clock;
    private final AtomicLong sequence = new AtomicLong();

    public OrderIdGenerator() {
        this("ord", Clock.systemUTC());
    }

    public OrderIdGenerator(String prefix, Clock clock) {
        this.prefix = prefix;
        this.clock = clock;
    }

    public String next() {
        return prefix + "-" + FORMAT.format(clock.instant()) + "-" + sequence.incrementAndGet();
    }
}
