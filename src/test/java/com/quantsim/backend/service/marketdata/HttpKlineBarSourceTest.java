package com.quantsim.backend.service.marketdata;

import com.github.tomakehurst.wiremock.WireMockServer;
import com.quantsim.backend.model.Bar;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Instant;
import java.util.Optional;

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.configureFor;
import static com.github.tomakehurst.wiremock.client.WireMock.equalTo;
import static com.github.tomakehurst.wiremock.client.WireMock.get;
import static com.github.tomakehurst.wiremock.client.WireMock.getRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.stubFor;
import static com.github.tomakehurst.wiremock.client.WireMock.urlPathEqualTo;
import static com.github.tomakehurst.wiremock.client.WireMock.verify;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HttpKlineBarSourceTest {

    private static final WireMockServer wireMock = new WireMockServer(0);

    private HttpKlineBarSource source;

    @BeforeAll
    static void startWireMock() {
        wireMock.start();
        configureFor("localhost", wireMock.port());
    }

    @AfterAll
    static void stopWireMock() {
        wireMock.stop();
    }

    @BeforeEach
    void setUp() {
        wireMock.resetAll();
        source = new HttpKlineBarSource("http://localhost:" + wireMock.port(), "BTCUSDT", "1m");
    }

    @Test
    void returnsLastClosedKline() throws IOException {
        stubFor(get(urlPathEqualTo("/api/v3/klines")).willReturn(aResponse()
                .withHeader("Content-Type", "application/json")
                .withBody("[[1704153600000,\"42000.1\",\"42100.0\",\"41900.5\",\"42050.2\",\"12.5\",1704153659999],"
                        + "[1704153660000,\"42050.2\",\"42060.0\",\"42040.0\",\"42055.0\",\"1.0\",1704153719999]]")));

        Optional<Bar> bar = source.poll();

        assertThat(bar).isPresent();
        assertThat(bar.get().getTimestamp()).isEqualTo(Instant.ofEpochMilli(1704153600000L));
        assertThat(bar.get().getOpen()).isEqualTo(42000.1);
        assertThat(bar.get().getHigh()).isEqualTo(42100.0);
        assertThat(bar.get().getLow()).isEqualTo(41900.5);
        assertThat(bar.get().getClose()).isEqualTo(42050.2);
        assertThat(bar.get().getVolume()).isEqualTo(12.5);
        verify(getRequestedFor(urlPathEqualTo("/api/v3/klines"))
                .withQueryParam("symbol", equalTo("BTCUSDT"))
                .withQueryParam("interval", equalTo("1m"))
                .withQueryParam("limit", equalTo("2")));
    }

    @Test
    void emptyPayloadMeansNoBarYet() throws IOException {
        stubFor(get(urlPathEqualTo("/api/v3/klines")).willReturn(aResponse().withBody("[]")));

        assertThat(source.poll()).isEmpty();
    }

    @Test
    void serverErrorIsRetryableIOException() {
        stubFor(get(urlPathEqualTo("/api/v3/klines")).willReturn(aResponse().withStatus(503)));

        assertThatThrownBy(() -> source.poll()).isInstanceOf(IOException.class).hasMessageContaining("503");
    }

    @Test
    void malformedPayloadIsIOException() {
        assertThatThrownBy(() -> source.parse("{\"code\":-1121}")).isInstanceOf(IOException.class);
        assertThatThrownBy(() -> source.parse("[[1704153600000,\"x\",\"1\",\"1\",\"1\",\"1\"]]")).isInstanceOf(IOException.class);
        assertThatThrownBy(() -> source.parse("[[1704153600000]]")).isInstanceOf(IOException.class);
    }
}
