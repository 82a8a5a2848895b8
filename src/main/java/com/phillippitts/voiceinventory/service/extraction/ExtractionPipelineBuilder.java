package com.phillippitts.voiceinventory.service.extraction;

import com.phillippitts.voiceinventory.config.properties.ExtractionProperties;
import com.phillippitts.voiceinventory.service.capture.CaptureController;
import com.phillippitts.voiceinventory.service.context.InputSanitizer;
import com.phillippitts.voiceinventory.service.context.IntentDetector;
import com.phillippitts.voiceinventory.service.metrics.ExtractionMetricsPublisher;
import com.phillippitts.voiceinventory.service.persistence.EntityDirectory;
import com.phillippitts.voiceinventory.service.persistence.TaskPersister;
import com.phillippitts.voiceinventory.service.resolution.EntityResolver;
import com.phillippitts.voiceinventory.service.speech.SpokenOutput;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Clock;
import java.util.Objects;
import java.util.concurrent.Executor;

/**
 * Builder for {@link ExtractionPipeline}, which has too many collaborators for a readable constructor.
 *
 * <pre>{@code
 * ExtractionPipeline pipeline = ExtractionPipelineBuilder.builder()
 *     .extractionService(extractionService)
 *     .resolver(resolver)
 *     .directory(store)
 *     .persister(persister)
 *     .intentDetector(intentDetector)
 *     .sanitizer(sanitizer)
 *     .captureController(captureController)
 *     .spokenOutput(spokenOutput)
 *     .publisher(publisher)
 *     .executor(extractionExecutor)
 *     .properties(extractionProperties)
 *     .build();
 * }</pre>
 *
 * <p>{@code metrics} defaults to {@link ExtractionMetricsPublisher#NOOP} and {@code clock} to the
 * system clock; everything else is required.
 */
public final class ExtractionPipelineBuilder {

    ExtractionService extractionService;
    EntityResolver resolver;
    EntityDirectory directory;
    TaskPersister persister;
    IntentDetector intentDetector;
    InputSanitizer sanitizer;
    CaptureController captureController;
    SpokenOutput spokenOutput;
    ApplicationEventPublisher publisher;
    Executor executor;
    ExtractionProperties properties;
    ExtractionMetricsPublisher metrics = ExtractionMetricsPublisher.NOOP;
    Clock clock = Clock.systemDefaultZone();

    private ExtractionPipelineBuilder() {
        // Private constructor - use builder() factory method
    }

    public static ExtractionPipelineBuilder builder() {
        return new ExtractionPipelineBuilder();
    }

    public ExtractionPipelineBuilder extractionService(ExtractionService extractionService) {
        this.extractionService = extractionService;
        return this;
    }

    public ExtractionPipelineBuilder resolver(EntityResolver resolver) {
        this.resolver = resolver;
        return this;
    }

    public ExtractionPipelineBuilder directory(EntityDirectory directory) {
        this.directory = directory;
        return this;
    }

    public ExtractionPipelineBuilder persister(TaskPersister persister) {
        this.persister = persister;
        return this;
    }

    public ExtractionPipelineBuilder intentDetector(IntentDetector intentDetector) {
        this.intentDetector = intentDetector;
        return this;
    }

    public ExtractionPipelineBuilder sanitizer(InputSanitizer sanitizer) {
        this.sanitizer = sanitizer;
        return this;
    }

    public ExtractionPipelineBuilder captureController(CaptureController captureController) {
        this.captureController = captureController;
        return this;
    }

    public ExtractionPipelineBuilder spokenOutput(SpokenOutput spokenOutput) {
        this.spokenOutput = spokenOutput;
        return this;
    }

    public ExtractionPipelineBuilder publisher(ApplicationEventPublisher publisher) {
        this.publisher = publisher;
        return this;
    }

    /**
     * @param executor runs extraction rounds; must run one round at a time
     */
    public ExtractionPipelineBuilder executor(Executor executor) {
        this.executor = executor;
        return this;
    }

    public ExtractionPipelineBuilder properties(ExtractionProperties properties) {
        this.properties = properties;
        return this;
    }

    /**
     * @param metrics metrics publisher (optional, null means no metrics)
     */
    public ExtractionPipelineBuilder metrics(ExtractionMetricsPublisher metrics) {
        this.metrics = metrics != null ? metrics : ExtractionMetricsPublisher.NOOP;
        return this;
    }

    public ExtractionPipelineBuilder clock(Clock clock) {
        this.clock = clock;
        return this;
    }

    /**
     * @throws NullPointerException if a required dependency is missing
     */
    public ExtractionPipeline build() {
        Objects.requireNonNull(extractionService, "extractionService is required");
        Objects.requireNonNull(resolver, "resolver is required");
        Objects.requireNonNull(directory, "directory is required");
        Objects.requireNonNull(persister, "persister is required");
        Objects.requireNonNull(intentDetector, "intentDetector is required");
        Objects.requireNonNull(sanitizer, "sanitizer is required");
        Objects.requireNonNull(captureController, "captureController is required");
        Objects.requireNonNull(spokenOutput, "spokenOutput is required");
        Objects.requireNonNull(publisher, "publisher is required");
        Objects.requireNonNull(executor, "executor is required");
        Objects.requireNonNull(properties, "properties is required");
        Objects.requireNonNull(clock, "clock is required");
        return new ExtractionPipeline(this);
    }
}
