package com.tribrid.studio.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

/**
 * HTTP client for the Training Control API.
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
public class WebClientConfig {

    private final ControlApiConfig controlApiConfig;

    @Bean
    public WebClient trainingControlWebClient(WebClient.Builder builder) {
        log.info("Training Control API at {}{}", controlApiConfig.getBaseUrl(), controlApiConfig.getBasePath());
        return builder
                .baseUrl(controlApiConfig.getBaseUrl())
                .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(controlApiConfig.getMaxInMemorySizeBytes()))
                .filter(logRequest())
                .build();
    }

    private static ExchangeFilterFunction logRequest() {
        return ExchangeFilterFunction.ofRequestProcessor(request -> {
            log.debug("--> {} {}", request.method(), request.url());
            return Mono.just(request);
        });
    }
}
