package com.phillippitts.voiceinventory.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Micrometer instrumentation for extraction rounds and entity resolution.
 *
 * <p>All metrics are exposed at /actuator/prometheus.
 */
@Component
public class ExtractionMetrics {

    private static final String METRIC_PREFIX = "voiceinventory.extraction";

    private final MeterRegistry registry;

    public ExtractionMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * @param model model identifier
     * @param durationNanos duration of the model call including retries
     */
    public void recordLatency(String model, long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".latency")
                .description("Time taken by one extraction round")
                .tag("model", model)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    public void incrementSuccess(String model, boolean lowConfidence) {
        Counter.builder(METRIC_PREFIX + ".success")
                .description("Number of successful extractions")
                .tag("model", model)
                .tag("confidence", lowConfidence ? "low" : "normal")
                .register(registry)
                .increment();
    }

    /**
     * @param reason failure kind (network, rate_limited, ...)
     */
    public void incrementFailure(String model, String reason) {
        Counter.builder(METRIC_PREFIX + ".failure")
                .description("Number of failed extractions")
                .tag("model", model)
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void incrementRetry(String model) {
        Counter.builder(METRIC_PREFIX + ".retry")
                .description("Number of retried model calls")
                .tag("model", model)
                .register(registry)
                .increment();
    }

    /**
     * @param entityKind resolved entity kind (equipment, vendor, location)
     * @param outcome found, ambiguous, not_found or needs_confirmation
     */
    public void recordResolution(String entityKind, String outcome) {
        Counter.builder(METRIC_PREFIX + ".resolution")
                .description("Entity resolution outcomes")
                .tag("entity", entityKind)
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }
}
