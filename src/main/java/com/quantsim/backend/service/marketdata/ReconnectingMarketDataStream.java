package com.quantsim.backend.service.marketdata;

import com.quantsim.backend.model.Bar;
import com.quantsim.backend.service.AlertService;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Polling stream over a {@link BarSource} that reconnects after a fixed delay on
 * I/O failure and, after {@code maxConsecutiveFailures} failures in a row, switches
 * for good to a fallback source (normally {@link SyntheticBarSource}).
 * <p>
 * Only bars strictly newer than the last delivered one reach the subscriber.
 * Delivery happens on the subscription's single scheduler thread, so a slow
 * consumer pauses polling rather than piling up concurrent callbacks.
 */
@Slf4j
public class ReconnectingMarketDataStream implements MarketDataStream {

    private final Supplier<BarSource> primary;
    private final Supplier<BarSource> fallback;
    private final long pollIntervalMs;
    private final long reconnectDelayMs;
    private final int maxConsecutiveFailures;
    private final AlertService alertService;

    public ReconnectingMarketDataStream(Supplier<BarSource> primary,
                                        Supplier<BarSource> fallback,
                                        long pollIntervalMs,
                                        long reconnectDelayMs,
                                        int maxConsecutiveFailures,
                                        AlertService alertService) {
        this.primary = primary;
        this.fallback = fallback;
        this.pollIntervalMs = pollIntervalMs;
        this.reconnectDelayMs = reconnectDelayMs;
        this.maxConsecutiveFailures = maxConsecutiveFailures;
        this.alertService = alertService;
    }

    @Override
    public AutoCloseable subscribe(Consumer<Bar> consumer) {
        Subscription subscription = new Subscription(consumer);
        subscription.start();
        return subscription;
    }

    private final class Subscription implements AutoCloseable {

        private final Consumer<Bar> consumer;
        private final ScheduledExecutorService scheduler;
        private volatile boolean closed;
        private BarSource source;
        private boolean degraded;
        private int consecutiveFailures;
        private Instant lastTimestamp;

        private Subscription(Consumer<Bar> consumer) {
            this.consumer = consumer;
            this.scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
                Thread thread = new Thread(runnable, "market-data-stream");
                thread.setDaemon(true);
                return thread;
            });
        }

        private void start() {
            scheduler.execute(this::connect);
        }

        private void connect() {
            try {
                source = primary.get();
                log.info("Market data stream connected to {}", source.name());
                scheduleNext(0);
            } catch (RuntimeException e) {
                log.warn("Market data source unavailable: {}", e.getMessage());
                degrade("source could not be created: " + e.getMessage());
                scheduleNext(0);
            }
        }

        private void pollOnce() {
            if (closed) {
                return;
            }
            long delay = pollIntervalMs;
            try {
                Optional<Bar> bar = source.poll();
                consecutiveFailures = 0;
                bar.filter(this::isNew).ifPresent(this::deliver);
            } catch (IOException e) {
                consecutiveFailures++;
                log.warn("Market data poll failed on {} ({}/{}): {}",
                        source.name(), consecutiveFailures, maxConsecutiveFailures, e.getMessage());
                if (!degraded && consecutiveFailures >= maxConsecutiveFailures) {
                    degrade(consecutiveFailures + " consecutive failures");
                } else {
                    delay = reconnectDelayMs;
                }
            } catch (RuntimeException e) {
                if (closed) {
                    return;
                }
                log.error("Market data subscriber failed on bar: {}", e.getMessage(), e);
            }
            scheduleNext(delay);
        }

        private boolean isNew(Bar bar) {
            return bar.getTimestamp() != null && (lastTimestamp == null || bar.getTimestamp().isAfter(lastTimestamp));
        }

        private void deliver(Bar bar) {
            lastTimestamp = bar.getTimestamp();
            consumer.accept(bar);
        }

        private void degrade(String reason) {
            BarSource failed = source;
            source = fallback.get();
            degraded = true;
            consecutiveFailures = 0;
            closeQuietly(failed);
            alertService.sendAlert("MARKET_DATA_DEGRADED",
                    "Live market data unavailable (" + reason + "); switched to " + source.name() + " feed");
        }

        private void scheduleNext(long delayMs) {
            if (closed) {
                return;
            }
            try {
                scheduler.schedule(this::pollOnce, delayMs, TimeUnit.MILLISECONDS);
            } catch (RejectedExecutionException e) {
                log.debug("Market data scheduler already shut down");
            }
        }

        @Override
        public void close() {
            if (closed) {
                return;
            }
            closed = true;
            scheduler.shutdownNow();
            try {
                if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                    log.warn("Market data stream thread did not stop within 5s");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            closeQuietly(source);
            log.info("Market data stream closed");
        }

        private void closeQuietly(BarSource barSource) {
            if (barSource == null) {
                return;
            }
            try {
                barSource.close();
            } catch (Exception e) {
                log.warn("Failed to close market data source {}: {}", barSource.name(), e.getMessage());
            }
        }
    }
}
