package com.clausescan.observability;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import javax.annotation.Nonnull;
import java.util.function.Supplier;

/**
 * Stub implementation when Datadog is disabled.
 */
@Service
@ConditionalOnProperty(name = "datadog.enabled", havingValue = "false", matchIfMissing = true)
public class TracingServiceStub implements TracingServiceInterface {

    @Override
    public <T> T trace(@Nonnull String spanName, @Nonnull Supplier<T> operation) {
        return operation.get();
    }
}
