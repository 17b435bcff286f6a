package com.quantsim.backend.service.marketdata;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.quantsim.backend.model.Bar;
import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Polls a Binance-compatible {@code /api/v3/klines} endpoint for the most recent
 * closed kline. Each kline is an array
 * {@code [openTime, open, high, low, close, volume, closeTime, ...]} with prices as strings.
 */
@Slf4j
public class HttpKlineBarSource implements BarSource {

    private final OkHttpClient client;
    private final HttpUrl klinesUrl;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public HttpKlineBarSource(String baseUrl, String symbol, String interval) {
        this(new OkHttpClient.Builder()
                .connectTimeout(5, TimeUnit.SECONDS)
                .readTimeout(10, TimeUnit.SECONDS)
                .build(), baseUrl, symbol, interval);
    }

    public HttpKlineBarSource(OkHttpClient client, String baseUrl, String symbol, String interval) {
        HttpUrl base = HttpUrl.parse(baseUrl);
        if (base == null) {
            throw new IllegalArgumentException("Invalid market data url: " + baseUrl);
        }
        this.client = client;
        this.klinesUrl = base.newBuilder()
                .addPathSegments("api/v3/klines")
                .addQueryParameter("symbol", symbol)
                .addQueryParameter("interval", interval)
                .addQueryParameter("limit", "2")
                .build();
    }

    @Override
    public Optional<Bar> poll() throws IOException {
        Request request = new Request.Builder().url(klinesUrl).get().build();
        try (Response response = client.newCall(request).execute()) {
            ResponseBody body = response.body();
            if (!response.isSuccessful() || body == null) {
                throw new IOException("Kline request failed with HTTP " + response.code());
            }
            return parse(body.string());
        }
    }

    Optional<Bar> parse(String payload) throws IOException {
        JsonNode root = objectMapper.readTree(payload);
        if (!root.isArray()) {
            throw new IOException("Unexpected kline payload: " + abbreviate(payload));
        }
        if (root.isEmpty()) {
            return Optional.empty();
        }
        // with limit=2 the last entry is the still-open kline
        JsonNode kline = root.size() > 1 ? root.get(root.size() - 2) : root.get(0);
        if (!kline.isArray() || kline.size() < 6) {
            throw new IOException("Malformed kline: " + abbreviate(kline.toString()));
        }
        try {
            return Optional.of(Bar.builder()
                    .timestamp(Instant.ofEpochMilli(kline.get(0).asLong()))
                    .open(Double.parseDouble(kline.get(1).asText()))
                    .high(Double.parseDouble(kline.get(2).asText()))
                    .low(Double.parseDouble(kline.get(3).asText()))
                    .close(Double.parseDouble(kline.get(4).asText()))
                    .volume(Double.parseDouble(kline.get(5).asText()))
                    .build());
        } catch (NumberFormatException e) {
            throw new IOException("Non-numeric kline field: " + abbreviate(kline.toString()), e);
        }
    }

    @Override
    public String name() {
        return klinesUrl.host();
    }

    @Override
    public void close() {
        client.dispatcher().executorService().shutdown();
        client.connectionPool().evictAll();
        log.debug("Closed kline source {}", klinesUrl.host());
    }

    private String abbreviate(String text) {
        return text.length() > 200 ? text.substring(0, 200) + "..." : text;
    }
}
