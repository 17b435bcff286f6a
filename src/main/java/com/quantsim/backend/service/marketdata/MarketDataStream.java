package com.quantsim.backend.service.marketdata;

import com.quantsim.backend.model.Bar;

import java.util.function.Consumer;

/**
 * Unbounded, time-ascending bar feed. Transient failures are absorbed by the
 * stream itself; subscribers only ever see bars.
 */
public interface MarketDataStream {

    /**
     * Starts delivering bars to {@code consumer} on a stream-owned thread.
     *
     * @return handle whose {@code close()} stops delivery and releases the connection
     */
    AutoCloseable subscribe(Consumer<Bar> consumer);
}
