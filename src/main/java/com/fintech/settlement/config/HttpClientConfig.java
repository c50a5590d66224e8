package com.fintech.settlement.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.ClientHttpRequestInterceptor;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.web.client.RestTemplate;

/**
 * HTTP client used by the provider adapters. Timeouts are always bounded so a slow provider
 * surfaces as a retryable failure rather than a hung worker.
 */
@Configuration
@Slf4j
public class HttpClientConfig {

    @Bean
    public RestTemplate providerRestTemplate(RestTemplateBuilder builder, SettlementProperties properties) {
        SettlementProperties.Http http = properties.getHttp();
        RestTemplate restTemplate = builder
                .setConnectTimeout(http.getConnectTimeout())
                .setReadTimeout(http.getReadTimeout())
                .additionalInterceptors(loggingInterceptor())
                .build();

        log.info("Provider RestTemplate configured with connectTimeout={}, readTimeout={}",
                http.getConnectTimeout(), http.getReadTimeout());
        return restTemplate;
    }

    private ClientHttpRequestInterceptor loggingInterceptor() {
        return (request, body, execution) -> {
            long startTime = System.currentTimeMillis();
            ClientHttpResponse response = execution.execute(request, body);
            log.debug("Provider call {} {} -> {} in {}ms",
                    request.getMethod(), request.getURI(), response.getStatusCode(),
                    System.currentTimeMillis() - startTime);
            return response;
        };
    }
}
