package com.quantsim.backend.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Operator alerts. Delivered through the log; the last few are kept for status queries.
 */
@Slf4j
@Service
public class AlertService {

    private static final int MAX_RECENT = 50;

    private final Deque<Alert> recent = new ArrayDeque<>();

    public record Alert(String type, String message, Instant timestamp) {}

    public void sendAlert(String type, String message) {
        log.warn("ALERT [{}]: {}", type, message);
        synchronized (recent) {
            recent.addFirst(new Alert(type, message, Instant.now()));
            while (recent.size() > MAX_RECENT) {
                recent.removeLast();
            }
        }
    }

    public List<Alert> recentAlerts() {
        synchronized (recent) {
            return new ArrayList<>(recent);
        }
    }
}
