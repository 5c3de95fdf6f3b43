package com.clausescan.observability;

import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import javax.annotation.Nonnull;
import java.util.function.Supplier;

/**
 * Creates OpenTelemetry spans around analysis flows. Uses GlobalOpenTelemetry, which the Datadog
 * agent configures when attached. Only active when datadog.enabled=true.
 */
@Service
@ConditionalOnProperty(name = "datadog.enabled", havingValue = "true", matchIfMissing = false)
public class TracingService implements TracingServiceInterface {

    private static final Logger logger = LoggerFactory.getLogger(TracingService.class);
    private final Tracer tracer;

    public TracingService() {
        this.tracer = GlobalOpenTelemetry.getTracer("com.clausescan", "1.0.0");
        logger.info("TracingService initialized with OpenTelemetry tracer");
    }

    @Override
    public <T> T trace(@Nonnull String spanName, @Nonnull Supplier<T> operation) {
        Span span = tracer.spanBuilder(spanName).startSpan();
        try (Scope scope = span.makeCurrent()) {
            return operation.get();
        } catch (RuntimeException e) {
            markFailed(span, e);
            throw e;
        } finally {
            span.end();
        }
    }

    private static void markFailed(Span span, RuntimeException e) {
        span.recordException(e);
        span.setAttribute("error", true);
        span.setAttribute("error.message", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
    }
}
