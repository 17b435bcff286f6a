package com.quantsim.backend.service;

import com.quantsim.backend.config.SimulationProperties;
import com.quantsim.backend.dto.BacktestRequest;
import com.quantsim.backend.dto.BacktestResponse;
import com.quantsim.backend.exception.BadRequestException;
import com.quantsim.backend.model.RiskState;
import com.quantsim.backend.strategy.StrategyFactory;
import com.quantsim.backend.util.TestBarFactory;
import com.quantsim.backend.util.TestProperties;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class BacktestServiceTest {

    private final SimulationProperties properties = TestProperties.withFraction(0.1);
    private final BacktestService service = new BacktestService(
            new BacktestEngine(properties, new PositionSizer(properties),
                    new MetricsService(new SimpleMeterRegistry()), new AlertService()),
            new StrategyFactory(),
            new PerformanceReportService(new DeflatedSharpeCalculator()),
            properties);

    @Test
    void buyAndHoldReportsPositionsAndSummary() {
        BacktestRequest request = new BacktestRequest("BTC", "buy-and-hold", 10_000.0,
                TestBarFactory.bars(100, 110, 120), null);

        BacktestResponse response = service.runBacktest(request);

        assertThat(response.strategy()).isEqualTo("buy-and-hold");
        assertThat(response.barsProcessed()).isEqualTo(3);
        assertThat(response.trades()).hasSize(1);
        assertThat(response.finalCash()).isCloseTo(9_000.0, within(1e-9));
        assertThat(response.positions()).singleElement()
                .satisfies(position -> assertThat(position.getQuantity()).isCloseTo(10.0, within(1e-9)));
        assertThat(response.equityCurve()).hasSize(3);
        assertThat(response.summary().finalEquity()).isCloseTo(9_000.0 + 10 * 120, within(1e-9));
        assertThat(response.riskState()).isEqualTo(RiskState.NORMAL);
    }

    @Test
    void fallsBackToConfiguredSymbolAndCash() {
        BacktestResponse response = service.runBacktest(
                new BacktestRequest(null, "ma-cross", null, TestBarFactory.flatBars(3, 100), null));

        assertThat(response.symbol()).isEqualTo("asset");
        assertThat(response.finalCash()).isEqualTo(10_000.0);
    }

    @Test
    void trialsDeflateReportedSharpe() {
        BacktestResponse single = service.runBacktest(new BacktestRequest("BTC", "buy-and-hold", 10_000.0,
                TestBarFactory.bars(100, 104, 103, 108, 110, 109, 115), null));
        BacktestResponse many = service.runBacktest(new BacktestRequest("BTC", "buy-and-hold", 10_000.0,
                TestBarFactory.bars(100, 104, 103, 108, 110, 109, 115), 50));

        assertThat(single.summary().deflatedSharpe()).isEqualTo(single.summary().sharpe());
        assertThat(many.summary().sharpe()).isEqualTo(single.summary().sharpe());
        assertThat(many.summary().deflatedSharpe()).isLessThan(many.summary().sharpe());
    }

    @Test
    void unknownStrategyIsRejected() {
        assertThatThrownBy(() -> service.runBacktest(new BacktestRequest("BTC", "nope", null, TestBarFactory.flatBars(1, 100), null)))
                .isInstanceOf(BadRequestException.class);
    }
}
