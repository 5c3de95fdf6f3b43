package com.clausescan.config;

import com.clausescan.processing.catalog.PatternCatalog;
import com.clausescan.processing.catalog.PatternCatalogLoader;
import com.clausescan.processing.detect.KeyPointDetectorRegistry;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

/**
 * Loads the pattern catalog once at startup. A broken catalog fails the application context.
 */
@Configuration
public class CatalogConfig {

    @Bean
    public PatternCatalog patternCatalog(
            ResourceLoader resourceLoader,
            ObjectMapper objectMapper,
            @Value("${clausescan.catalog.location:classpath:catalog/pattern-catalog.json}") String location) {
        Resource resource = resourceLoader.getResource(location);
        return new PatternCatalogLoader(objectMapper).load(resource);
    }

    @Bean
    public KeyPointDetectorRegistry keyPointDetectorRegistry() {
        return KeyPointDetectorRegistry.standard();
    }
}
