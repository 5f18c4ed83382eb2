package com.gapfill.rest;

import com.gapfill.config.FetcherProperties;
import com.gapfill.error.FetchException;
import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientException;
import org.springframework.web.util.UriComponentsBuilder;

/**
 * Historical aggregates endpoint. Calls block, so only backfill worker threads use it.
 */
@Component
public class PolygonRestClient {

    private static final Logger log = LoggerFactory.getLogger(PolygonRestClient.class);
    private static final String AGGS_PATH = "/v2/aggs/ticker/{symbol}/range/1/minute/{from}/{to}";
    private static final int PAGE_LIMIT = 50_000;
    private static final int MAX_PAGES = 1_000;
    private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(60);

    private final WebClient webClient;
    private final FetcherProperties properties;

    public PolygonRestClient(WebClient polygonWebClient, FetcherProperties properties) {
        this.webClient = polygonWebClient;
        this.properties = properties;
    }

    /**
     * Minute bars with a start time in {@code [from, to)}, oldest first.
     */
    public List<AggregateBar> fetchMinuteBars(String symbol, Instant from, Instant to) {
        URI first = UriComponentsBuilder.fromUriString(properties.getBaseUrl())
                .path(AGGS_PATH)
                .queryParam("adjusted", true)
                .queryParam("sort", "asc")
                .queryParam("limit", PAGE_LIMIT)
                .queryParam("apiKey", properties.getApiKey())
                .buildAndExpand(symbol, from.toEpochMilli(), to.toEpochMilli() - 1)
                .encode()
                .toUri();
        return fetchPages(symbol, first, from, to);
    }

    private List<AggregateBar> fetchPages(String symbol, URI first, Instant from, Instant to) {
        List<AggregateBar> bars = new ArrayList<>();
        URI next = first;
        int pages = 0;
        while (next != null) {
            if (++pages > MAX_PAGES) {
                throw new FetchException(symbol, "too many result pages for " + from + " .. " + to);
            }
            AggregatesResponse page = get(symbol, next);
            if (page.isError()) {
                throw new FetchException(symbol, "aggregates error: "
                        + (page.getError() != null ? page.getError() : page.getMessage()));
            }
            if (page.getResults() != null) {
                for (AggregateBar bar : page.getResults()) {
                    if (bar.getStartMs() == null) {
                        continue;
                    }
                    if (bar.getStartMs() >= from.toEpochMilli() && bar.getStartMs() < to.toEpochMilli()) {
                        bars.add(bar);
                    }
                }
            }
            next = nextPage(page.getNextUrl());
        }
        log.debug("REST_AGGS symbol={} from={} to={} bars={} pages={}", symbol, from, to, bars.size(), pages);
        return bars;
    }

    private AggregatesResponse get(String symbol, URI uri) {
        try {
            AggregatesResponse response = webClient.get()
                    .uri(uri)
                    .accept(MediaType.APPLICATION_JSON)
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, resp -> resp.bodyToMono(String.class)
                            .defaultIfEmpty("")
                            .map(body -> new FetchException(symbol,
                                    "HTTP " + resp.statusCode().value() + " " + body)))
                    .bodyToMono(AggregatesResponse.class)
                    .block(REQUEST_TIMEOUT);
            if (response == null) {
                throw new FetchException(symbol, "empty aggregates response");
            }
            return response;
        } catch (FetchException ex) {
            throw ex;
        } catch (WebClientException | IllegalStateException ex) {
            throw new FetchException(symbol, "aggregates request failed: " + ex.getMessage(), ex);
        }
    }

    private URI nextPage(String nextUrl) {
        if (nextUrl == null || nextUrl.isBlank()) {
            return null;
        }
        return UriComponentsBuilder.fromUriString(nextUrl)
                .replaceQueryParam("apiKey", properties.getApiKey())
                .build(true)
                .toUri();
    }
}
