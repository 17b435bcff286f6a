package com.quantsim.backend.service.live;

import com.quantsim.backend.config.SimulationProperties;
import com.quantsim.backend.dto.SessionStartRequest;
import com.quantsim.backend.exception.BadRequestException;
import com.quantsim.backend.exception.NotFoundException;
import com.quantsim.backend.model.Bar;
import com.quantsim.backend.model.LiveSessionState;
import com.quantsim.backend.model.RiskState;
import com.quantsim.backend.service.AlertService;
import com.quantsim.backend.service.MetricsService;
import com.quantsim.backend.service.PositionSizer;
import com.quantsim.backend.service.marketdata.MarketDataStream;
import com.quantsim.backend.service.marketdata.MarketDataStreamFactory;
import com.quantsim.backend.strategy.StrategyFactory;
import com.quantsim.backend.util.TestBarFactory;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class LivePaperSessionServiceTest {

    private final SimulationProperties properties = new SimulationProperties();
    private final MarketDataStreamFactory streamFactory = mock(MarketDataStreamFactory.class);
    private final AtomicReference<Consumer<Bar>> subscriber = new AtomicReference<>();
    private LivePaperSessionService service;

    @BeforeEach
    void setUp() {
        MarketDataStream stream = consumer -> {
            subscriber.set(consumer);
            return () -> subscriber.set(null);
        };
        when(streamFactory.create(anyString(), anyString(), any())).thenReturn(stream);
        service = new LivePaperSessionService(properties, new StrategyFactory(), new PositionSizer(properties),
                new MetricsService(new SimpleMeterRegistry()), new AlertService(), streamFactory);
    }

    @AfterEach
    void tearDown() {
        service.shutdown();
    }

    @Test
    void startsSessionWithConfiguredDefaults() {
        LiveSessionState state = service.start(new SessionStartRequest("ma-cross", null, null, null, null));

        assertThat(state.sessionId()).isNotBlank();
        assertThat(state.symbol()).isEqualTo("BTCUSDT");
        assertThat(state.status()).isEqualTo(LiveSessionState.SessionStatus.RUNNING);
        assertThat(state.riskState()).isEqualTo(RiskState.NORMAL);
        assertThat(state.portfolio().cash()).isEqualTo(10_000.0);
        verify(streamFactory).create(eq("BTCUSDT"), eq("1m"), eq(""));
        assertThat(service.list()).hasSize(1);
    }

    @Test
    void requestOverridesDefaults() {
        properties.getLive().setAllowedFeedUrls(List.of("http://feed.local"));
        LiveSessionState state = service.start(
                new SessionStartRequest("buy-and-hold", "ETHUSDT", "5m", "http://feed.local", 2_500.0));

        assertThat(state.symbol()).isEqualTo("ETHUSDT");
        assertThat(state.portfolio().cash()).isEqualTo(2_500.0);
        verify(streamFactory).create("ETHUSDT", "5m", "http://feed.local");
    }

    @Test
    void statusReflectsProcessedBarsAndStopReturnsFinalState() throws Exception {
        LiveSessionState started = service.start(new SessionStartRequest("buy-and-hold", "BTC", null, null, null));

        subscriber.get().accept(TestBarFactory.bar(0, 100));
        long deadline = System.currentTimeMillis() + 5_000;
        while (service.status(started.sessionId()).barsProcessed() < 1 && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        LiveSessionState stopped = service.stop(started.sessionId());

        assertThat(stopped.barsProcessed()).isEqualTo(1);
        assertThat(stopped.trades()).hasSize(1);
        assertThat(stopped.status()).isEqualTo(LiveSessionState.SessionStatus.STOPPED);
        assertThat(subscriber.get()).isNull();
        assertThatThrownBy(() -> service.status(started.sessionId())).isInstanceOf(NotFoundException.class);
        assertThat(service.list()).isEmpty();
    }

    @Test
    void feedUrlOutsideAllowListIsRejected() {
        properties.getLive().setAllowedFeedUrls(List.of("http://feed.local"));

        assertThatThrownBy(() -> service.start(
                new SessionStartRequest("ma-cross", null, null, "http://169.254.169.254/latest", null)))
                .isInstanceOf(BadRequestException.class)
                .hasMessageContaining("Feed url is not allowed");
        assertThat(service.list()).isEmpty();
        verify(streamFactory, never()).create(anyString(), anyString(), any());
    }

    @Test
    void blankFeedUrlFallsBackToConfiguredOne() {
        properties.getLive().setFeedUrl("http://configured.feed");

        service.start(new SessionStartRequest("ma-cross", null, null, " ", null));

        verify(streamFactory).create("BTCUSDT", "1m", "http://configured.feed");
    }

    @Test
    void unknownSessionIsNotFound() {
        assertThatThrownBy(() -> service.status("missing")).isInstanceOf(NotFoundException.class);
        assertThatThrownBy(() -> service.stop("missing")).isInstanceOf(NotFoundException.class);
    }

    @Test
    void unknownStrategyIsRejectedBeforeAnythingStarts() {
        assertThatThrownBy(() -> service.start(new SessionStartRequest("nope", null, null, null, null)))
                .isInstanceOf(BadRequestException.class);
        assertThat(service.list()).isEmpty();
    }
}
