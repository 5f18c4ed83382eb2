package com.gapfill.ws;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gapfill.config.DataType;
import com.gapfill.config.FetcherProperties;
import com.gapfill.config.Subscription;
import java.time.Duration;
import java.util.EnumSet;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.Disposable;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.atLeast;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;

class PolygonWsClientTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private FetcherProperties properties;
    private PolygonWsClient client;

    @BeforeEach
    void setUp() {
        properties = new FetcherProperties();
        properties.setApiKey("KEY");
        properties.setWsServers("wss://socket.polygon.io/");
        Subscription subscription = new Subscription(EnumSet.of(DataType.BARS, DataType.TRADES), List.of("aapl"));
        client = new PolygonWsClient(objectMapper, properties, subscription);
    }

    @Test
    void failedConnectIsRetried() {
        properties.setWsServers("ws://127.0.0.1:1");
        PolygonWsClient unreachable = spy(new PolygonWsClient(
                objectMapper,
                properties,
                new Subscription(EnumSet.of(DataType.BARS), List.of()),
                Duration.ofMillis(20),
                Duration.ofMillis(50)));

        Disposable subscription = unreachable.stream().subscribe();
        try {
            // two URI builds per attempt: one to connect, one for the connect log line
            verify(unreachable, timeout(10_000).atLeast(8)).buildUri();
        } finally {
            subscription.dispose();
        }
    }

    @Test
    void connectsToStocksCluster() {
        assertThat(client.buildUri().toString()).isEqualTo("wss://socket.polygon.io/stocks");
    }

    @Test
    void controlMessagesCarryKeyAndChannels() throws Exception {
        JsonNode auth = objectMapper.readTree(client.authMessage());
        JsonNode subscribe = objectMapper.readTree(client.subscribeMessage());

        assertThat(auth.get("action").asText()).isEqualTo("auth");
        assertThat(auth.get("params").asText()).isEqualTo("KEY");
        assertThat(subscribe.get("action").asText()).isEqualTo("subscribe");
        assertThat(subscribe.get("params").asText()).isEqualTo("AM.AAPL,T.AAPL");
    }

    @Test
    void decodesMixedFrame() {
        String frame = "[{\"ev\":\"AM\",\"sym\":\"AAPL\",\"v\":4110,\"av\":9470157,\"op\":130.5,\"vw\":130.8,"
                + "\"o\":130.7,\"c\":130.9,\"h\":131.0,\"l\":130.6,\"a\":130.7,\"z\":42,\"n\":17,"
                + "\"s\":1609772400000,\"e\":1609772460000},"
                + "{\"ev\":\"T\",\"sym\":\"AAPL\",\"x\":4,\"i\":\"52983525029461\",\"z\":3,\"p\":130.85,"
                + "\"s\":100,\"c\":[14,41],\"t\":1609772401234},"
                + "{\"ev\":\"XQ\",\"sym\":\"AAPL\"}]";

        List<PolygonEvent> events = client.decode(frame);

        assertThat(events).hasSize(2);
        AggregateEvent bar = (AggregateEvent) events.get(0);
        assertThat(bar.getSymbol()).isEqualTo("AAPL");
        assertThat(bar.getStartMs()).isEqualTo(1609772400000L);
        assertThat(bar.getClose()).isEqualTo(130.9);
        assertThat(bar.getTradeCount()).isEqualTo(17L);
        TradeEvent trade = (TradeEvent) events.get(1);
        assertThat(trade.getSize()).isEqualTo(100L);
        assertThat(trade.getConditions()).containsExactly(14, 41);
    }

    @Test
    void decodesStatusEvent() {
        List<PolygonEvent> events = client.decode(
                "[{\"ev\":\"status\",\"status\":\"connected\",\"message\":\"Connected Successfully\"}]");

        assertThat(events).singleElement().isInstanceOfSatisfying(StatusEvent.class, status -> {
            assertThat(status.isConnected()).isTrue();
            assertThat(status.getMessage()).isEqualTo("Connected Successfully");
        });
    }

    @Test
    void malformedFrameYieldsNothing() {
        assertThat(client.decode("{not json")).isEmpty();
        assertThat(client.decode("")).isEmpty();
    }
}
