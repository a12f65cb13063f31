package com.koni.glucose.infrastructure.observability;

import io.micrometer.observation.ObservationRegistry;
import io.micrometer.observation.aop.ObservedAspect;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.EnableAspectJAutoProxy;

/**
 * Configuration for enabling observation aspects.
 * This enables the @Observed annotation on the report query handler.
 */
@Configuration
@EnableAspectJAutoProxy
public class ObservationAspectConfiguration {

    /**
     * Creates the ObservedAspect bean that wraps @Observed methods in an observation.
     */
    @Bean
    public ObservedAspect observedAspect(ObservationRegistry observationRegistry) {
        return new ObservedAspect(observationRegistry);
    }
}
