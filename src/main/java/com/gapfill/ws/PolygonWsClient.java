package com.gapfill.ws;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gapfill.config.FetcherProperties;
import com.gapfill.config.Subscription;
import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.client.ReactorNettyWebSocketClient;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.util.retry.Retry;

@Component
public class PolygonWsClient {

    private static final Logger log = LoggerFactory.getLogger(PolygonWsClient.class);
    private static final String STOCKS_CLUSTER = "/stocks";

    private static final Duration MIN_BACKOFF = Duration.ofSeconds(2);
    private static final Duration MAX_BACKOFF = Duration.ofSeconds(30);

    private final ReactorNettyWebSocketClient client;
    private final ObjectMapper objectMapper;
    private final FetcherProperties properties;
    private final Subscription subscription;
    private final Duration minBackoff;
    private final Duration maxBackoff;

    @Autowired
    public PolygonWsClient(ObjectMapper objectMapper, FetcherProperties properties, Subscription subscription) {
        this(objectMapper, properties, subscription, MIN_BACKOFF, MAX_BACKOFF);
    }

    PolygonWsClient(
            ObjectMapper objectMapper,
            FetcherProperties properties,
            Subscription subscription,
            Duration minBackoff,
            Duration maxBackoff
    ) {
        this.client = new ReactorNettyWebSocketClient();
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.subscription = subscription;
        this.minBackoff = minBackoff;
        this.maxBackoff = maxBackoff;
    }

    /**
     * Live events. Every (re)connection starts with a {@code connected} status event. A
     * failed connect, a dropped session and a clean close all lead to a reconnect.
     */
    public Flux<PolygonEvent> stream() {
        return Flux.defer(() -> {
                    URI uri = buildUri();
                    Sinks.Many<PolygonEvent> sink = Sinks.many().multicast().onBackpressureBuffer();
                    AtomicReference<Disposable> connection = new AtomicReference<>();
                    Mono<Void> session = client.execute(uri, webSocketSession -> {
                        Mono<Void> handshake = webSocketSession.send(Flux.just(authMessage(), subscribeMessage())
                                .map(webSocketSession::textMessage));
                        Mono<Void> inbound = webSocketSession.receive()
                                .map(WebSocketMessage::getPayloadAsText)
                                .flatMapIterable(this::decode)
                                .doOnNext(event -> sink.emitNext(event, Sinks.EmitFailureHandler.FAIL_FAST))
                                .doOnComplete(() -> sink.tryEmitError(new IllegalStateException("websocket closed")))
                                .then();
                        return Mono.when(handshake, inbound);
                    });
                    return sink.asFlux()
                            .doOnSubscribe(sub -> connection.set(session.subscribe(null, err -> {
                                log.debug("WS_SESSION_END reason={}", err.getMessage());
                                sink.tryEmitError(err);
                            })))
                            .doFinally(signal -> {
                                Disposable active = connection.get();
                                if (active != null) {
                                    active.dispose();
                                }
                            });
                })
                .doOnSubscribe(sub -> log.info("WS_CONNECT url={} channels={}", buildUri(), subscription.channels()))
                .retryWhen(Retry.backoff(Long.MAX_VALUE, minBackoff)
                        .maxBackoff(maxBackoff)
                        .doBeforeRetry(signal -> log.warn("WS_RECONNECT attempt={} reason={}",
                                signal.totalRetries() + 1,
                                signal.failure() == null ? "unknown" : signal.failure().getMessage())));
    }

    URI buildUri() {
        String servers = properties.getWsServers();
        if (servers.endsWith("/")) {
            servers = servers.substring(0, servers.length() - 1);
        }
        return URI.create(servers + STOCKS_CLUSTER);
    }

    String authMessage() {
        return controlMessage("auth", properties.getApiKey());
    }

    String subscribeMessage() {
        return controlMessage("subscribe", subscription.channels());
    }

    /**
     * Splits a frame (a JSON array of events, or a single event) into typed events. Events
     * of unknown type and undecodable frames are dropped.
     */
    List<PolygonEvent> decode(String payload) {
        List<PolygonEvent> events = new ArrayList<>();
        if (payload == null || payload.isBlank()) {
            return events;
        }
        try {
            JsonNode root = objectMapper.readTree(payload);
            if (root.isArray()) {
                for (JsonNode node : root) {
                    addEvent(node, events);
                }
            } else {
                addEvent(root, events);
            }
        } catch (Exception ex) {
            log.warn("WS_PARSE_FAIL payload={}", payload, ex);
        }
        return events;
    }

    private void addEvent(JsonNode node, List<PolygonEvent> events) throws JsonProcessingException {
        Class<? extends PolygonEvent> type = eventClass(node.path("ev").asText(""));
        if (type == null) {
            return;
        }
        events.add(objectMapper.treeToValue(node, type));
    }

    private Class<? extends PolygonEvent> eventClass(String ev) {
        switch (ev) {
            case PolygonEvent.AGGREGATE_MINUTE:
                return AggregateEvent.class;
            case PolygonEvent.QUOTE:
                return QuoteEvent.class;
            case PolygonEvent.TRADE:
                return TradeEvent.class;
            case PolygonEvent.STATUS:
                return StatusEvent.class;
            default:
                return null;
        }
    }

    private String controlMessage(String action, String params) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("action", action);
        node.put("params", params);
        try {
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("cannot encode " + action + " message", ex);
        }
    }
}
