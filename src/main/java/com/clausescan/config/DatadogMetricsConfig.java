package com.clausescan.config;

import io.micrometer.core.instrument.Clock;
import io.micrometer.core.instrument.config.MeterFilter;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.micrometer.statsd.StatsdConfig;
import io.micrometer.statsd.StatsdFlavor;
import io.micrometer.statsd.StatsdMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;

/**
 * DogStatsD export for the application's own meters.
 *
 * <p>Registers two registries and lets Spring Boot compose them: a DogStatsD registry that only
 * ships {@code clausescan.*} meters, tagged with the deployment environment, and an in-memory
 * registry that keeps every meter visible on the actuator metrics endpoint. Connection settings
 * come from {@code clausescan.datadog.*}. Only active when datadog.enabled=true.
 */
@Configuration
@ConditionalOnProperty(name = "datadog.enabled", havingValue = "true", matchIfMissing = false)
public class DatadogMetricsConfig {

    private static final Logger logger = LoggerFactory.getLogger(DatadogMetricsConfig.class);

    static final String PROPERTY_PREFIX = "clausescan.datadog";
    static final String METER_PREFIX = "clausescan.";

    @Bean
    public StatsdConfig dogStatsdConfig(Environment environment) {
        return new StatsdConfig() {
            @Override
            public String prefix() {
                return PROPERTY_PREFIX;
            }

            @Override
            public String get(String key) {
                return environment.getProperty(key);
            }

            @Override
            public StatsdFlavor flavor() {
                return StatsdFlavor.DATADOG;
            }
        };
    }

    @Bean
    public StatsdMeterRegistry datadogMeterRegistry(StatsdConfig dogStatsdConfig,
                                                    @Value("${clausescan.datadog.env:local}") String env) {
        StatsdMeterRegistry registry = new StatsdMeterRegistry(dogStatsdConfig, Clock.SYSTEM);
        registry.config()
                .commonTags("env", env)
                .meterFilter(applicationMetersOnly());
        logger.info("DogStatsD export to {}:{} (env={}, step={})",
                dogStatsdConfig.host(), dogStatsdConfig.port(), env, dogStatsdConfig.step());
        return registry;
    }

    @Bean
    public SimpleMeterRegistry actuatorMeterRegistry() {
        return new SimpleMeterRegistry();
    }

    // JVM and HTTP server meters stay local; the agent collects those itself
    static MeterFilter applicationMetersOnly() {
        return MeterFilter.denyUnless(id -> id.getName().startsWith(METER_PREFIX));
    }
}
