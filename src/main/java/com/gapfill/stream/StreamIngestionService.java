package com.gapfill.stream;

import com.gapfill.ws.PolygonEvent;
import com.gapfill.ws.PolygonWsClient;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Subscribes to the live stream at startup. Events of one symbol are routed in order; a
 * failing event is logged and skipped.
 */
@Service
@Order(2)
public class StreamIngestionService implements ApplicationRunner, DisposableBean {

    private static final Logger log = LoggerFactory.getLogger(StreamIngestionService.class);
    private static final String STATUS_GROUP = "_STATUS";

    private final PolygonWsClient wsClient;
    private final StreamRouter router;
    private Disposable subscription;

    public StreamIngestionService(PolygonWsClient wsClient, StreamRouter router) {
        this.wsClient = wsClient;
        this.router = router;
    }

    @Override
    public void run(ApplicationArguments args) {
        subscription = wsClient.stream()
                .groupBy(this::resolveGroup)
                .flatMap(grouped -> grouped.concatMap(event -> Mono.fromRunnable(() -> router.route(event))
                                .subscribeOn(Schedulers.boundedElastic())
                                .onErrorResume(ex -> {
                                    log.error("STREAM_EVENT_ERROR group={} ev={}", grouped.key(), event.getEventType(), ex);
                                    return Mono.empty();
                                })),
                        Integer.MAX_VALUE)
                .onErrorContinue((throwable, o) -> log.error("STREAM_PIPELINE_ERROR payload={}", o, throwable))
                .subscribe();
    }

    @Override
    public void destroy() {
        if (subscription != null && !subscription.isDisposed()) {
            subscription.dispose();
        }
    }

    private String resolveGroup(PolygonEvent event) {
        String symbol = event.getSymbol();
        if (symbol == null || symbol.isBlank()) {
            return STATUS_GROUP;
        }
        return symbol.toUpperCase(Locale.ROOT);
    }
}
