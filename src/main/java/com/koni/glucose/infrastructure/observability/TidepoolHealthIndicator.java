package com.koni.glucose.infrastructure.observability;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Health indicator for the Tidepool API, based on the state of its circuit breaker.
 *
 * The remote service is not called: a health probe must not log in on
 * behalf of anyone. Returns DOWN while the breaker is OPEN or FORCED_OPEN,
 * UP otherwise.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TidepoolHealthIndicator implements HealthIndicator {

    private final CircuitBreaker tidepoolCircuitBreaker;

    @Override
    public Health health() {
        CircuitBreaker.State state = tidepoolCircuitBreaker.getState();
        CircuitBreaker.Metrics metrics = tidepoolCircuitBreaker.getMetrics();

        boolean open = state == CircuitBreaker.State.OPEN || state == CircuitBreaker.State.FORCED_OPEN;
        if (open) {
            log.warn("Tidepool health check reports DOWN: circuitBreaker={}", state);
        }
        Health.Builder builder = open ? Health.down() : Health.up();

        return builder
                .withDetail("circuitBreaker", state.name())
                .withDetail("failureRate", metrics.getFailureRate())
                .withDetail("failedCalls", metrics.getNumberOfFailedCalls())
                .withDetail("notPermittedCalls", metrics.getNumberOfNotPermittedCalls())
                .build();
    }
}
