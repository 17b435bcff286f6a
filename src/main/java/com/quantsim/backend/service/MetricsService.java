package com.quantsim.backend.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
public class MetricsService {

    static final int MAX_SERIES_POINTS = 1000;

    private final MeterRegistry meterRegistry;

    private final AtomicLong signalsGenerated = new AtomicLong();
    private final AtomicLong fills = new AtomicLong();
    private final AtomicLong halts = new AtomicLong();
    private final ConcurrentHashMap<String, AtomicLong> rejectsByReason = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Deque<Double>> series = new ConcurrentHashMap<>();

    public void recordSignal(String strategy) {
        signalsGenerated.incrementAndGet();
        Counter.builder("signals_generated_total")
                .tag("strategy", strategy == null ? "unknown" : strategy)
                .register(meterRegistry)
                .increment();
    }

    public void recordReject(String reason) {
        rejectsByReason.computeIfAbsent(reason, key -> new AtomicLong()).incrementAndGet();
        Counter.builder("signals_rejected_total")
                .tag("reason", reason)
                .register(meterRegistry)
                .increment();
    }

    public void recordFill(String symbol, double notional) {
        fills.incrementAndGet();
        Counter.builder("orders_filled_total")
                .tag("symbol", symbol)
                .register(meterRegistry)
                .increment();
        DistributionSummary.builder("fill_notional")
                .tag("symbol", symbol)
                .register(meterRegistry)
                .record(notional);
        record("fill_notional", notional);
    }

    public void recordHalt(String symbol) {
        halts.incrementAndGet();
        Counter.builder("risk_halts_total")
                .tag("symbol", symbol)
                .register(meterRegistry)
                .increment();
    }

    /**
     * Appends a value to an in-memory series holding the latest {@value #MAX_SERIES_POINTS} points.
     */
    public void record(String name, double value) {
        Deque<Double> points = series.computeIfAbsent(name, key -> new ArrayDeque<>());
        synchronized (points) {
            points.addLast(value);
            while (points.size() > MAX_SERIES_POINTS) {
                points.removeFirst();
            }
        }
    }

    public List<Double> series(String name) {
        Deque<Double> points = series.get(name);
        if (points == null) {
            return new ArrayList<>();
        }
        synchronized (points) {
            return new ArrayList<>(points);
        }
    }

    public long signalsGenerated() {
        return signalsGenerated.get();
    }

    public long fills() {
        return fills.get();
    }

    public long halts() {
        return halts.get();
    }

    public Map<String, Long> rejectCounts() {
        return rejectsByReason.entrySet().stream()
                .collect(Collectors.toMap(Map.Entry::getKey, entry -> entry.getValue().get()));
    }
}
