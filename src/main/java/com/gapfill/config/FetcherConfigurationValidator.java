package com.gapfill.config;

import com.gapfill.backfill.QueryStartParser;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Rejects configurations the fetcher cannot run with before the stream is opened.
 */
@Component
@Order(1)
public class FetcherConfigurationValidator implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(FetcherConfigurationValidator.class);

    private final FetcherProperties properties;
    private final Subscription subscription;

    public FetcherConfigurationValidator(FetcherProperties properties, Subscription subscription) {
        this.properties = properties;
        this.subscription = subscription;
    }

    @Override
    public void run(ApplicationArguments args) {
        validate();
    }

    public void validate() {
        Instant queryStart = properties.hasQueryStart() ? QueryStartParser.parse(properties.getQueryStart()) : null;
        log.info("FETCHER_CONFIG dataTypes={} symbols={} queryStart={} baseUrl={} wsServers={} ceiling={}",
                subscription.getDataTypes(),
                subscription.isAllSymbols() ? "*" : properties.getSymbols(),
                queryStart == null ? "store" : queryStart,
                properties.getBaseUrl(),
                properties.getWsServers(),
                properties.getBackfill().resolveConcurrencyCeiling(Runtime.getRuntime().availableProcessors()));
    }
}
