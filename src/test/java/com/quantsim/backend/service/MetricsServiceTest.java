package com.quantsim.backend.service;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class MetricsServiceTest {

    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private final MetricsService metricsService = new MetricsService(registry);

    @Test
    void countsSignalsRejectsFillsAndHalts() {
        metricsService.recordSignal("ma-cross");
        metricsService.recordSignal("ma-cross");
        metricsService.recordReject("halted");
        metricsService.recordReject("position_cap");
        metricsService.recordReject("halted");
        metricsService.recordFill("BTC", 1_000);
        metricsService.recordHalt("BTC");

        assertThat(metricsService.signalsGenerated()).isEqualTo(2);
        assertThat(metricsService.rejectCounts()).containsEntry("halted", 2L).containsEntry("position_cap", 1L);
        assertThat(metricsService.fills()).isEqualTo(1);
        assertThat(metricsService.halts()).isEqualTo(1);
        assertThat(registry.get("signals_generated_total").tag("strategy", "ma-cross").counter().count()).isEqualTo(2.0);
        assertThat(registry.get("signals_rejected_total").tag("reason", "halted").counter().count()).isEqualTo(2.0);
        assertThat(registry.get("risk_halts_total").counter().count()).isEqualTo(1.0);
    }

    @Test
    void keepsNamedSeries() {
        metricsService.record("latency", 1.5);
        metricsService.record("latency", 2.5);
        metricsService.recordFill("BTC", 900);

        assertThat(metricsService.series("latency")).containsExactly(1.5, 2.5);
        assertThat(metricsService.series("fill_notional")).containsExactly(900.0);
        assertThat(metricsService.series("missing")).isEmpty();
    }

    @Test
    void seriesKeepsOnlyLatestPoints() {
        int total = MetricsService.MAX_SERIES_POINTS + 100;
        for (int i = 0; i < total; i++) {
            metricsService.recordFill("BTC", i);
        }

        assertThat(metricsService.series("fill_notional"))
                .hasSize(MetricsService.MAX_SERIES_POINTS)
                .startsWith(100.0)
                .endsWith((double) (total - 1));
        assertThat(registry.get("fill_notional").tag("symbol", "BTC").summary().count()).isEqualTo(total);
        assertThat(metricsService.fills()).isEqualTo(total);
    }
}
