package com.quantsim.backend.service.live;

import com.quantsim.backend.config.SimulationProperties;
import com.quantsim.backend.dto.SessionStartRequest;
import com.quantsim.backend.exception.BadRequestException;
import com.quantsim.backend.exception.NotFoundException;
import com.quantsim.backend.model.LiveSessionState;
import com.quantsim.backend.model.Portfolio;
import com.quantsim.backend.service.AlertService;
import com.quantsim.backend.service.MetricsService;
import com.quantsim.backend.service.PaperBroker;
import com.quantsim.backend.service.PositionSizer;
import com.quantsim.backend.service.TradingPipeline;
import com.quantsim.backend.service.marketdata.MarketDataStream;
import com.quantsim.backend.service.marketdata.MarketDataStreamFactory;
import com.quantsim.backend.service.risk.RiskManager;
import com.quantsim.backend.strategy.Strategy;
import com.quantsim.backend.strategy.StrategyFactory;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of live paper sessions. Each session gets its own portfolio, risk
 * manager, broker ledger and stream subscription; nothing is shared between them.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LivePaperSessionService {

    private final SimulationProperties properties;
    private final StrategyFactory strategyFactory;
    private final PositionSizer positionSizer;
    private final MetricsService metricsService;
    private final AlertService alertService;
    private final MarketDataStreamFactory streamFactory;

    private final Map<String, LivePaperRunner> sessions = new ConcurrentHashMap<>();

    public LiveSessionState start(SessionStartRequest request) {
        SimulationProperties.Live live = properties.getLive();
        String symbol = orDefault(request.symbol(), live.getSymbol());
        String interval = orDefault(request.interval(), live.getInterval());
        String feedUrl = resolveFeedUrl(request.feedUrl(), live);
        double initialCash = request.initialCash() != null ? request.initialCash() : live.getInitialCash();
        Strategy strategy = strategyFactory.create(request.strategy());

        SimulationProperties.Risk risk = properties.getRisk();
        TradingPipeline pipeline = new TradingPipeline(
                symbol,
                strategy,
                new Portfolio(initialCash),
                new RiskManager(risk.getMaxDailyLossPct(), risk.getMaxPositionPct()),
                positionSizer,
                new PaperBroker(properties.getBroker().getFeeRate()),
                metricsService,
                alertService
        );
        MarketDataStream stream = streamFactory.create(symbol, interval, feedUrl);
        String sessionId = UUID.randomUUID().toString();
        LivePaperRunner runner = new LivePaperRunner(sessionId, pipeline, stream, live.getQueueCapacity());
        sessions.put(sessionId, runner);
        runner.start();
        return runner.state();
    }

    public LiveSessionState status(String sessionId) {
        return find(sessionId).state();
    }

    /**
     * Stops the session and forgets it; the returned state is the last one available.
     */
    public LiveSessionState stop(String sessionId) {
        LivePaperRunner runner = sessions.remove(sessionId);
        if (runner == null) {
            throw new NotFoundException("Paper session not found: " + sessionId);
        }
        return runner.stop();
    }

    public List<LiveSessionState> list() {
        List<LiveSessionState> states = new ArrayList<>();
        sessions.values().forEach(runner -> states.add(runner.state()));
        return states;
    }

    @PreDestroy
    void shutdown() {
        sessions.values().stream()
                .filter(LivePaperRunner::isRunning)
                .forEach(runner -> {
                    log.info("Stopping paper session {} on shutdown", runner.getSessionId());
                    runner.stop();
                });
    }

    private LivePaperRunner find(String sessionId) {
        LivePaperRunner runner = sessions.get(sessionId);
        if (runner == null) {
            throw new NotFoundException("Paper session not found: " + sessionId);
        }
        return runner;
    }

    private String resolveFeedUrl(String requested, SimulationProperties.Live live) {
        if (requested == null || requested.isBlank() || requested.equals(live.getFeedUrl())) {
            return live.getFeedUrl();
        }
        if (!live.getAllowedFeedUrls().contains(requested)) {
            throw new BadRequestException("Feed url is not allowed: " + requested);
        }
        return requested;
    }

    private String orDefault(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value;
    }
}
