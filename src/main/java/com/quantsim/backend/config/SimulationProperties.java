package com.quantsim.backend.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

@Configuration
@ConfigurationProperties(prefix = "quantsim")
@Data
@Validated
public class SimulationProperties {

    @Valid
    private Backtest backtest = new Backtest();
    @Valid
    private Sizing sizing = new Sizing();
    @Valid
    private Risk risk = new Risk();
    @Valid
    private Broker broker = new Broker();
    @Valid
    private Live live = new Live();

    @Data
    public static class Backtest {
        @Positive
        private double initialCash = 10_000.0;

        @PositiveOrZero
        private double feeRate = 0.0;

        @PositiveOrZero
        private double slippagePct = 0.0;

        @PositiveOrZero
        private double slippageAbs = 0.0;

        @NotBlank
        private String symbol = "asset";
    }

    @Data
    public static class Sizing {
        @Positive
        @DecimalMax("1.0")
        private double fraction = 0.01;

        private EquityBasis equityBasis = EquityBasis.COST_BASIS;
    }

    /**
     * Which equity figure fixed-fractional sizing scales from.
     */
    public enum EquityBasis {
        /** Cash plus positions at average entry price; lags the market. */
        COST_BASIS,
        /** Cash plus positions at the current bar's mark. */
        MARK_TO_MARKET
    }

    @Data
    public static class Risk {
        @Positive
        @DecimalMax("1.0")
        private double maxDailyLossPct = 0.2;

        @PositiveOrZero
        private double maxPositionPct = 0.5;
    }

    @Data
    public static class Broker {
        @PositiveOrZero
        private double feeRate = 0.0005;
    }

    @Data
    public static class Live {
        @NotBlank
        private String symbol = "BTCUSDT";

        @NotBlank
        private String interval = "1m";

        @Positive
        private double initialCash = 10_000.0;

        /** Blank means the synthetic generator is used from the start. */
        private String feedUrl = "";

        /** Feed urls a session request may pick besides {@link #feedUrl}. */
        private List<String> allowedFeedUrls = new ArrayList<>();

        @Min(10)
        private long pollIntervalMs = 1000;

        @Min(100)
        private long reconnectDelayMs = 5000;

        @Min(1)
        private int maxConsecutiveFailures = 5;

        @Min(1)
        private int queueCapacity = 1024;
    }
}
