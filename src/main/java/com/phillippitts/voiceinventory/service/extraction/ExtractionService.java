package com.phillippitts.voiceinventory.service.extraction;

import com.phillippitts.voiceinventory.config.properties.ExtractionProperties;
import com.phillippitts.voiceinventory.exception.ExtractionException;
import com.phillippitts.voiceinventory.service.metrics.ExtractionMetricsPublisher;
import com.phillippitts.voiceinventory.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;

/**
 * Runs one extraction round against the generative model: builds the prompts, calls the model with
 * bounded retries for transient failures, and parses the reply.
 *
 * <p><b>Retries:</b> {@code NETWORK} and {@code RATE_LIMITED} failures are retried up to
 * {@code extraction.max-attempts} total attempts with exponential backoff
 * ({@code extraction.initial-backoff-ms} doubling, capped at {@code extraction.max-backoff-ms}).
 * Every surfaced {@link ExtractionException} carries the request transcript.
 *
 * <p><b>Cancellation:</b> an interrupt before an attempt or during backoff surfaces as
 * {@code CANCELLED}.
 */
public class ExtractionService {

    private static final Logger LOG = LogManager.getLogger(ExtractionService.class);

    /**
     * Blocking delay between attempts; replaced in tests.
     */
    @FunctionalInterface
    public interface Sleeper {
        void sleep(long millis) throws InterruptedException;
    }

    private final GenerativeModelClient client;
    private final ExtractionPromptBuilder promptBuilder;
    private final ExtractionResponseParser parser;
    private final ExtractionProperties properties;
    private final ExtractionMetricsPublisher metrics;
    private final Sleeper sleeper;

    public ExtractionService(GenerativeModelClient client,
                             ExtractionPromptBuilder promptBuilder,
                             ExtractionResponseParser parser,
                             ExtractionProperties properties,
                             ExtractionMetricsPublisher metrics) {
        this(client, promptBuilder, parser, properties, metrics, Thread::sleep);
    }

    public ExtractionService(GenerativeModelClient client,
                             ExtractionPromptBuilder promptBuilder,
                             ExtractionResponseParser parser,
                             ExtractionProperties properties,
                             ExtractionMetricsPublisher metrics,
                             Sleeper sleeper) {
        this.client = Objects.requireNonNull(client, "client must not be null");
        this.promptBuilder = Objects.requireNonNull(promptBuilder, "promptBuilder must not be null");
        this.parser = Objects.requireNonNull(parser, "parser must not be null");
        this.properties = Objects.requireNonNull(properties, "properties must not be null");
        this.metrics = metrics != null ? metrics : ExtractionMetricsPublisher.NOOP;
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
    }

    /**
     * @throws ExtractionException if the round fails after retries, with the transcript attached
     */
    public ExtractionResult extract(ExtractionRequest request) {
        Objects.requireNonNull(request, "request must not be null");
        String model = client.modelName();
        String systemPrompt = promptBuilder.systemPrompt();
        String userPrompt = promptBuilder.userPrompt(request);
        int maxAttempts = properties.getMaxAttempts();
        long startTime = System.nanoTime();

        for (int attempt = 1; ; attempt++) {
            if (Thread.currentThread().isInterrupted()) {
                throw cancelled(request, null);
            }
            try {
                ExtractionResult result = parser.parse(client.generate(systemPrompt, userPrompt));
                boolean lowConfidence = result.confidence() < properties.getLowConfidenceThreshold();
                metrics.recordSuccess(model, System.nanoTime() - startTime, lowConfidence);
                LOG.debug("Extraction succeeded in {} ms (attempt={}, updates={}, confidence={})",
                        TimeUtils.elapsedMillis(startTime), attempt, result.updates().size(), result.confidence());
                return result;
            } catch (ExtractionException e) {
                if (!e.getKind().isTransient() || attempt >= maxAttempts) {
                    metrics.recordFailure(model, e.getKind());
                    LOG.warn("Extraction failed after {} attempt(s): {}", attempt, e.getMessage());
                    throw e.withTranscript(request.transcript());
                }
                long delay = TimeUtils.backoffMillis(properties.getInitialBackoffMs(),
                        properties.getMaxBackoffMs(), attempt);
                LOG.warn("Extraction attempt {}/{} failed ({}), retrying in {} ms",
                        attempt, maxAttempts, e.getKind(), delay);
                metrics.recordRetry(model);
                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw cancelled(request, ie);
                }
            }
        }
    }

    private static ExtractionException cancelled(ExtractionRequest request, Throwable cause) {
        return new ExtractionException(ExtractionException.Kind.CANCELLED, "Extraction cancelled",
                request.transcript(), cause);
    }
}
