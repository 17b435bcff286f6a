package com.quantsim.backend.service.marketdata;

import com.quantsim.backend.config.SimulationProperties;
import com.quantsim.backend.service.AlertService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

@Component
@RequiredArgsConstructor
public class MarketDataStreamFactory {

    private final SimulationProperties properties;
    private final AlertService alertService;

    /**
     * Builds a reconnecting stream for {@code symbol}. A blank feed url goes straight
     * to the synthetic generator.
     */
    public MarketDataStream create(String symbol, String interval, String feedUrl) {
        SimulationProperties.Live live = properties.getLive();
        Supplier<BarSource> primary = feedUrl == null || feedUrl.isBlank()
                ? SyntheticBarSource::new
                : () -> new HttpKlineBarSource(feedUrl, symbol, interval);
        return new ReconnectingMarketDataStream(
                primary,
                SyntheticBarSource::new,
                live.getPollIntervalMs(),
                live.getReconnectDelayMs(),
                live.getMaxConsecutiveFailures(),
                alertService
        );
    }
}
