package com.quantsim.backend.service.marketdata;

import com.quantsim.backend.model.Bar;

import java.io.IOException;
import java.util.Optional;

/**
 * One-shot poll of the latest bar from some feed.
 */
public interface BarSource extends AutoCloseable {

    /**
     * @return the latest available bar, or empty when the feed has nothing yet
     * @throws IOException on a transport or payload failure worth retrying
     */
    Optional<Bar> poll() throws IOException;

    String name();

    @Override
    default void close() {
    }
}
