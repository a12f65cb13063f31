package com.koni.glucose.infrastructure.resilience;

import com.koni.glucose.domain.exception.RemoteServiceUnavailableException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Configuration of the circuit breaker guarding the Tidepool API.
 *
 * Circuit Breaker States:
 * - CLOSED: Normal operation, requests pass through
 * - OPEN: Failure threshold exceeded, requests fail fast
 * - HALF_OPEN: Testing if service recovered, limited requests allowed
 *
 * Calls are never retried; the breaker only stops new calls while the
 * service is unreachable.
 */
@Configuration
public class CircuitBreakerConfiguration {

    public static final String TIDEPOOL = "tidepool";

    /**
     * Creates CircuitBreakerConfig for the Tidepool API.
     *
     * Configuration:
     * - Sliding window: 10 requests (COUNT_BASED)
     * - Failure threshold: 50%
     * - Wait duration in OPEN state: 30 seconds
     * - Permitted calls in HALF_OPEN: 3
     * - Only transport failures count; rejected logins and HTTP errors do not
     *
     * @return CircuitBreakerConfig with custom settings
     */
    @Bean
    public CircuitBreakerConfig tidepoolCircuitBreakerConfig() {
        return CircuitBreakerConfig.custom()
            .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
            .slidingWindowSize(10)
            .failureRateThreshold(50.0f)
            .waitDurationInOpenState(Duration.ofSeconds(30))
            .permittedNumberOfCallsInHalfOpenState(3)
            .automaticTransitionFromOpenToHalfOpenEnabled(true)
            .recordExceptions(RemoteServiceUnavailableException.class)
            .build();
    }

    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry(CircuitBreakerConfig config) {
        return CircuitBreakerRegistry.of(config);
    }

    /**
     * Creates the CircuitBreaker instance used by the Tidepool client.
     */
    @Bean
    public CircuitBreaker tidepoolCircuitBreaker(CircuitBreakerRegistry registry) {
        return registry.circuitBreaker(TIDEPOOL);
    }
}
