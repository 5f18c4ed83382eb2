package com.gapfill.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

@Configuration
public class WebClientConfig {

    private static final int MAX_IN_MEMORY_BYTES = 32 * 1024 * 1024;

    @Bean
    public WebClient polygonWebClient(WebClient.Builder builder, FetcherProperties properties) {
        return builder
                .baseUrl(properties.getBaseUrl())
                .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(MAX_IN_MEMORY_BYTES))
                .build();
    }
}
