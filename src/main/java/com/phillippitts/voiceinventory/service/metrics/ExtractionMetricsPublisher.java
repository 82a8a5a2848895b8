package com.phillippitts.voiceinventory.service.metrics;

import com.phillippitts.voiceinventory.domain.EntityKind;
import com.phillippitts.voiceinventory.exception.ExtractionException;
import com.phillippitts.voiceinventory.service.resolution.Resolution;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Locale;

/**
 * Null-safe front for {@link ExtractionMetrics}, so extraction code runs unchanged without a
 * meter registry.
 *
 * @see ExtractionMetrics
 */
public final class ExtractionMetricsPublisher {

    private static final Logger LOG = LogManager.getLogger(ExtractionMetricsPublisher.class);

    /**
     * Shared no-op instance for tests and wiring without metrics.
     */
    public static final ExtractionMetricsPublisher NOOP = new ExtractionMetricsPublisher(null);

    private final ExtractionMetrics metrics;

    /**
     * @param metrics metrics tracking service (nullable for test mode)
     */
    public ExtractionMetricsPublisher(ExtractionMetrics metrics) {
        this.metrics = metrics;
        if (metrics == null) {
            LOG.debug("ExtractionMetricsPublisher created without metrics (test mode)");
        }
    }

    public void recordSuccess(String model, long durationNanos, boolean lowConfidence) {
        if (metrics == null) {
            return;
        }
        metrics.recordLatency(model, durationNanos);
        metrics.incrementSuccess(model, lowConfidence);
    }

    public void recordFailure(String model, ExtractionException.Kind kind) {
        if (metrics == null) {
            return;
        }
        metrics.incrementFailure(model, kind.name().toLowerCase(Locale.ROOT));
    }

    public void recordRetry(String model) {
        if (metrics == null) {
            return;
        }
        metrics.incrementRetry(model);
    }

    public void recordResolution(EntityKind kind, Resolution<?> resolution) {
        if (metrics == null) {
            return;
        }
        String outcome;
        if (resolution instanceof Resolution.Found<?>) {
            outcome = "found";
        } else if (resolution instanceof Resolution.Ambiguous<?>) {
            outcome = "ambiguous";
        } else if (resolution instanceof Resolution.NeedsConfirmation<?>) {
            outcome = "needs_confirmation";
        } else {
            outcome = "not_found";
        }
        metrics.recordResolution(kind.name().toLowerCase(Locale.ROOT), outcome);
    }

    public boolean isEnabled() {
        return metrics != null;
    }
}
