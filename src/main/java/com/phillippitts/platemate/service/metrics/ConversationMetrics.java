package com.phillippitts.platemate.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Metrics for generative chat API exchanges.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Round-trip latency per exchange kind (priming, query)</li>
 *   <li>Success and failure counts, failures tagged by class</li>
 * </ul>
 *
 * <p>Exposed via Micrometer at /actuator/metrics.
 */
@Component
public class ConversationMetrics {

    private static final String METRIC_PREFIX = "platemate.conversation";

    private final MeterRegistry registry;

    public ConversationMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Records API round-trip latency.
     *
     * @param exchange      exchange kind (priming, query)
     * @param durationNanos duration in nanoseconds
     */
    public void recordLatency(String exchange, long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".latency")
                .description("Generative chat API round-trip time")
                .tag("exchange", exchange)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    public void incrementSuccess(String exchange) {
        Counter.builder(METRIC_PREFIX + ".success")
                .description("Number of successful chat exchanges")
                .tag("exchange", exchange)
                .register(registry)
                .increment();
    }

    /**
     * @param exchange exchange kind (priming, query)
     * @param failure  failure class (transient, empty_or_unsafe)
     */
    public void incrementFailure(String exchange, String failure) {
        Counter.builder(METRIC_PREFIX + ".failure")
                .description("Number of failed chat exchanges")
                .tag("exchange", exchange)
                .tag("failure", failure)
                .register(registry)
                .increment();
    }

    public void incrementRejectedBusy() {
        Counter.builder(METRIC_PREFIX + ".rejected")
                .description("Requests rejected because another was in flight")
                .register(registry)
                .increment();
    }
}
