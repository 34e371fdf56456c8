package com.pmsuite.orchestrator.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * WebClient used by the service proxy for aggregation calls. Timeouts are
 * applied per call by the proxy, not on the connector.
 */
@Configuration
public class WebClientConfig {

    @Bean
    public WebClient backendWebClient(WebClient.Builder builder) {
        return builder
                .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(2 * 1024 * 1024))
                .build();
    }
}
