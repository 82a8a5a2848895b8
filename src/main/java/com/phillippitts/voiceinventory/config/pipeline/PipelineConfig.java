package com.phillippitts.voiceinventory.config.pipeline;

import com.phillippitts.voiceinventory.config.properties.CaptureProperties;
import com.phillippitts.voiceinventory.config.properties.ExtractionProperties;
import com.phillippitts.voiceinventory.config.properties.GeminiProperties;
import com.phillippitts.voiceinventory.config.properties.IntentProperties;
import com.phillippitts.voiceinventory.config.properties.ResolutionProperties;
import com.phillippitts.voiceinventory.service.capture.CaptureController;
import com.phillippitts.voiceinventory.service.capture.CaptureStateMachine;
import com.phillippitts.voiceinventory.service.capture.DefaultCaptureController;
import com.phillippitts.voiceinventory.service.capture.RemoteRecognitionEngine;
import com.phillippitts.voiceinventory.service.capture.TranscriptPostProcessor;
import com.phillippitts.voiceinventory.service.context.InputSanitizer;
import com.phillippitts.voiceinventory.service.context.IntentDetector;
import com.phillippitts.voiceinventory.service.extraction.ExtractionPipeline;
import com.phillippitts.voiceinventory.service.extraction.ExtractionPipelineBuilder;
import com.phillippitts.voiceinventory.service.extraction.ExtractionPromptBuilder;
import com.phillippitts.voiceinventory.service.extraction.ExtractionResponseParser;
import com.phillippitts.voiceinventory.service.extraction.ExtractionService;
import com.phillippitts.voiceinventory.service.extraction.GeminiGenerativeModelClient;
import com.phillippitts.voiceinventory.service.extraction.GenerativeModelClient;
import com.phillippitts.voiceinventory.service.metrics.ExtractionMetrics;
import com.phillippitts.voiceinventory.service.metrics.ExtractionMetricsPublisher;
import com.phillippitts.voiceinventory.service.persistence.InMemoryInventoryStore;
import com.phillippitts.voiceinventory.service.persistence.TaskPersister;
import com.phillippitts.voiceinventory.service.resolution.EntityResolver;
import com.phillippitts.voiceinventory.service.speech.LoggingSpokenOutput;
import com.phillippitts.voiceinventory.service.speech.SpokenOutput;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;

/**
 * Wires the voice pipeline explicitly: capture, extraction, resolution and storage.
 */
@Configuration
public class PipelineConfig {

    @Bean
    public InMemoryInventoryStore inventoryStore() {
        return new InMemoryInventoryStore();
    }

    @Bean
    public TaskPersister taskPersister(InMemoryInventoryStore inventoryStore) {
        return new TaskPersister(inventoryStore, inventoryStore);
    }

    @Bean
    public EntityResolver entityResolver(ResolutionProperties properties) {
        return new EntityResolver(properties);
    }

    @Bean
    public IntentDetector intentDetector(IntentProperties properties) {
        return new IntentDetector(properties);
    }

    @Bean
    public InputSanitizer inputSanitizer(ExtractionProperties properties) {
        return new InputSanitizer(properties.getMaxInputLength());
    }

    @Bean
    public CaptureStateMachine captureStateMachine() {
        return new CaptureStateMachine();
    }

    @Bean
    public RemoteRecognitionEngine recognitionEngine() {
        return new RemoteRecognitionEngine();
    }

    @Bean
    public TranscriptPostProcessor transcriptPostProcessor(CaptureProperties properties) {
        return new TranscriptPostProcessor(properties.getCorrections());
    }

    /**
     * Recoverable recognizer errors restart after {@code capture.restart-delay-ms} on the capture pool.
     */
    @Bean
    public CaptureController captureController(RemoteRecognitionEngine recognitionEngine,
                                               CaptureStateMachine captureStateMachine,
                                               ApplicationEventPublisher publisher,
                                               @Qualifier("captureExecutor") Executor captureExecutor,
                                               TranscriptPostProcessor transcriptPostProcessor,
                                               CaptureProperties properties) {
        Executor restartExecutor = CompletableFuture.delayedExecutor(
                properties.getRestartDelayMs(), TimeUnit.MILLISECONDS, captureExecutor);
        return new DefaultCaptureController(recognitionEngine, captureStateMachine, publisher,
                captureExecutor, restartExecutor, transcriptPostProcessor, properties.getMaxConsecutiveErrors());
    }

    @Bean
    public RestTemplate geminiRestTemplate(RestTemplateBuilder builder, GeminiProperties properties) {
        return builder
                .setConnectTimeout(Duration.ofMillis(properties.getConnectTimeoutMs()))
                .setReadTimeout(Duration.ofMillis(properties.getReadTimeoutMs()))
                .build();
    }

    @Bean
    public GenerativeModelClient generativeModelClient(@Qualifier("geminiRestTemplate") RestTemplate restTemplate,
                                                       GeminiProperties properties) {
        return new GeminiGenerativeModelClient(restTemplate, properties);
    }

    @Bean
    public ExtractionMetricsPublisher extractionMetricsPublisher(ObjectProvider<ExtractionMetrics> metrics) {
        return new ExtractionMetricsPublisher(metrics.getIfAvailable());
    }

    @Bean
    public ExtractionService extractionService(GenerativeModelClient generativeModelClient,
                                               ExtractionProperties properties,
                                               ExtractionMetricsPublisher metricsPublisher) {
        return new ExtractionService(generativeModelClient, new ExtractionPromptBuilder(),
                new ExtractionResponseParser(), properties, metricsPublisher);
    }

    @Bean
    public SpokenOutput spokenOutput() {
        return new LoggingSpokenOutput();
    }

    @Bean
    public ExtractionPipeline extractionPipeline(ExtractionService extractionService,
                                                 EntityResolver entityResolver,
                                                 InMemoryInventoryStore inventoryStore,
                                                 TaskPersister taskPersister,
                                                 IntentDetector intentDetector,
                                                 InputSanitizer inputSanitizer,
                                                 CaptureController captureController,
                                                 SpokenOutput spokenOutput,
                                                 ApplicationEventPublisher publisher,
                                                 @Qualifier("extractionExecutor") Executor extractionExecutor,
                                                 ExtractionProperties properties,
                                                 ExtractionMetricsPublisher metricsPublisher) {
        return ExtractionPipelineBuilder.builder()
                .extractionService(extractionService)
                .resolver(entityResolver)
                .directory(inventoryStore)
                .persister(taskPersister)
                .intentDetector(intentDetector)
                .sanitizer(inputSanitizer)
                .captureController(captureController)
                .spokenOutput(spokenOutput)
                .publisher(publisher)
                .executor(extractionExecutor)
                .properties(properties)
                .metrics(metricsPublisher)
                .build();
    }
}
