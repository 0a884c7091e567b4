package com.openforge.parley.router;

import com.openforge.parley.config.ParleyProperties;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Builds the router with its reserved handlers and registers every other
 * {@link IntentHandler} bean in between, in bean order.
 */
@Configuration
public class RouterConfig {

    /** Used when no monitoring system provides a registry of its own. */
    @Bean
    @ConditionalOnMissingBean(MeterRegistry.class)
    public MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }

    @Bean
    public IntentRouter intentRouter(ParleyProperties properties,
                                     List<IntentHandler> handlers,
                                     MeterRegistry meterRegistry) {
        IntentRouter router = new IntentRouter(
                new ClarificationHandler(properties.router().clarificationThreshold()),
                new FallbackHandler(),
                meterRegistry);
        handlers.forEach(router::register);
        return router;
    }
}
