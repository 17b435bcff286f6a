package com.quantsim.backend.service.live;

import com.quantsim.backend.exception.SimulationException;
import com.quantsim.backend.model.Bar;
import com.quantsim.backend.model.LiveSessionState;
import com.quantsim.backend.model.LiveSessionState.SessionStatus;
import com.quantsim.backend.service.BarOutcome;
import com.quantsim.backend.service.TradingPipeline;
import com.quantsim.backend.service.marketdata.MarketDataStream;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Drives a {@link TradingPipeline} from a live {@link MarketDataStream}.
 * <p>
 * The stream callback only enqueues into a bounded queue; a single worker thread
 * drains it and applies bars strictly in arrival order, one at a time. When the
 * queue is full the callback blocks, which pauses the stream's polling. Stopping
 * closes the subscription, lets the bar in progress finish, and discards bars
 * still queued, so no bar is ever half applied.
 */
@Slf4j
public class LivePaperRunner {

    private static final long WORKER_POLL_MS = 100;
    private static final long STOP_TIMEOUT_MS = 10_000;

    private final String sessionId;
    private final TradingPipeline pipeline;
    private final MarketDataStream stream;
    private final BlockingQueue<Bar> queue;
    private final Clock clock;
    private final Object stateLock = new Object();
    private final Thread worker;

    private volatile boolean running;
    private AutoCloseable subscription;
    private Instant startTime;
    private Instant stopTime;

    public LivePaperRunner(String sessionId, TradingPipeline pipeline, MarketDataStream stream, int queueCapacity) {
        this(sessionId, pipeline, stream, queueCapacity, Clock.systemUTC());
    }

    public LivePaperRunner(String sessionId, TradingPipeline pipeline, MarketDataStream stream, int queueCapacity, Clock clock) {
        this.sessionId = sessionId;
        this.pipeline = pipeline;
        this.stream = stream;
        this.queue = new ArrayBlockingQueue<>(queueCapacity);
        this.clock = clock;
        this.worker = new Thread(this::drain, "paper-session-" + sessionId);
        this.worker.setDaemon(true);
    }

    public synchronized void start() {
        if (startTime != null) {
            throw new SimulationException("Session " + sessionId + " already started");
        }
        startTime = clock.instant();
        running = true;
        worker.start();
        subscription = stream.subscribe(this::enqueue);
        log.info("Paper session {} started on {} with strategy {}", sessionId, pipeline.getSymbol(), pipeline.getStrategy().name());
    }

    /**
     * Cancels the stream subscription and waits for the worker to finish its current bar.
     *
     * @return final session state
     */
    public LiveSessionState stop() {
        synchronized (this) {
            if (!running) {
                return state();
            }
            running = false;
        }
        closeSubscription();
        try {
            worker.join(STOP_TIMEOUT_MS);
            if (worker.isAlive()) {
                log.warn("Paper session {} worker still busy after {}ms", sessionId, STOP_TIMEOUT_MS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        int discarded = queue.size();
        queue.clear();
        synchronized (stateLock) {
            stopTime = clock.instant();
        }
        LiveSessionState finalState = state();
        log.info("Paper session {} stopped after {} bars, {} trades, {} queued bars discarded",
                sessionId, finalState.barsProcessed(), finalState.trades().size(), discarded);
        return finalState;
    }

    public LiveSessionState state() {
        synchronized (stateLock) {
            return new LiveSessionState(
                    sessionId,
                    pipeline.getSymbol(),
                    startTime,
                    stopTime,
                    running ? SessionStatus.RUNNING : SessionStatus.STOPPED,
                    pipeline.getRiskManager().getState(),
                    pipeline.getBarsProcessed(),
                    pipeline.snapshot(),
                    List.copyOf(pipeline.trades())
            );
        }
    }

    public boolean isRunning() {
        return running;
    }

    public String getSessionId() {
        return sessionId;
    }

    int queuedBars() {
        return queue.size();
    }

    private void enqueue(Bar bar) {
        if (!running) {
            return;
        }
        try {
            queue.put(bar);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.debug("Paper session {} dropped bar {} during shutdown", sessionId, bar.getTimestamp());
        }
    }

    private void drain() {
        while (running) {
            Bar bar;
            try {
                bar = queue.poll(WORKER_POLL_MS, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            if (bar != null) {
                handle(bar);
            }
        }
        log.debug("Paper session {} worker exited", sessionId);
    }

    private void handle(Bar bar) {
        synchronized (stateLock) {
            try {
                BarOutcome outcome = pipeline.process(bar);
                log.info("Live bar handled at {} equity={}{}", bar.getTimestamp(),
                        String.format("%.2f", outcome.equity()),
                        outcome.rejection() != null ? " rejected=" + outcome.rejection() : "");
            } catch (SimulationException e) {
                log.warn("Paper session {} skipped bar {}: {}", sessionId, bar.getTimestamp(), e.getMessage());
            } catch (RuntimeException e) {
                log.error("Paper session {} failed on bar {}: {}", sessionId, bar.getTimestamp(), e.getMessage(), e);
            }
        }
    }

    private void closeSubscription() {
        AutoCloseable current;
        synchronized (this) {
            current = subscription;
            subscription = null;
        }
        if (current == null) {
            return;
        }
        try {
            current.close();
        } catch (Exception e) {
            log.warn("Paper session {} failed to close market data subscription: {}", sessionId, e.getMessage());
        }
    }
}
