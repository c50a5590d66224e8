package com.fintech.settlement.config;

import com.fintech.settlement.exception.MalformedCallbackException;
import com.fintech.settlement.exception.ProviderRejectedException;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Circuit breakers guarding the payment providers, one instance per provider name.
 * <p>
 * States:
 * - CLOSED: calls pass through
 * - OPEN: the provider keeps failing, calls fail fast with ProviderUnavailable
 * - HALF_OPEN: probing whether the provider has recovered
 * <p>
 * A rejection is a business answer from a healthy provider and does not count as a failure.
 */
@Configuration
public class ResilienceConfig {

    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry() {
        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
                .slidingWindowSize(10)
                .failureRateThreshold(50)
                .waitDurationInOpenState(Duration.ofSeconds(30))
                .permittedNumberOfCallsInHalfOpenState(3)
                .automaticTransitionFromOpenToHalfOpenEnabled(true)
                .ignoreExceptions(ProviderRejectedException.class, MalformedCallbackException.class)
                .build();

        return CircuitBreakerRegistry.of(config);
    }
}
