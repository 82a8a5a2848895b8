package com.phillippitts.voiceinventory;

import com.phillippitts.voiceinventory.domain.EntityKind;
import com.phillippitts.voiceinventory.service.capture.CaptureController;
import com.phillippitts.voiceinventory.service.capture.CaptureState;
import com.phillippitts.voiceinventory.service.capture.RemoteRecognitionEngine;
import com.phillippitts.voiceinventory.service.extraction.ExtractionPipeline;
import com.phillippitts.voiceinventory.service.health.GenerativeModelHealthIndicator;
import com.phillippitts.voiceinventory.service.persistence.InMemoryInventoryStore;
import com.phillippitts.voiceinventory.service.task.TaskKind;
import com.phillippitts.voiceinventory.testutil.ScriptedModelClient;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.actuate.health.Status;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;
import org.springframework.test.context.ActiveProfiles;

import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

@Tag("integration")
@ActiveProfiles("test")
@SpringBootTest
class VoiceInventoryApplicationTests {

    @Autowired
    private CaptureController captureController;

    @Autowired
    private RemoteRecognitionEngine recognitionEngine;

    @Autowired
    private ExtractionPipeline pipeline;

    @Autowired
    private ScriptedModelClient model;

    @Autowired
    private InMemoryInventoryStore store;

    @Autowired
    private GenerativeModelHealthIndicator healthIndicator;

    @AfterEach
    void tearDown() {
        pipeline.abandon();
    }

    @Test
    void contextLoads() {
        assertThat(healthIndicator.health().getStatus()).isEqualTo(Status.UP);
    }

    @Test
    void stoppedCaptureFeedsActiveTaskUntilSaved() {
        // Arrange
        pipeline.beginTask(TaskKind.LOCATION_CREATION, Map.of());
        pipeline.registerSnapshotSource(() -> Map.of("building", "North"));
        model.reply("{\"updates\": {\"name\": \"Ward Z\", \"floor\": \"2\"}, "
                + "\"reply\": \"Got it.\", \"confidence\": 0.9}");

        // Act: one recognizer chunk, then the operator stops
        captureController.startCapture();
        recognitionEngine.deliverResult("new room ward Z on the second floor", 0.85);
        await().atMost(Duration.ofSeconds(5))
                .until(() -> captureController.currentState() instanceof CaptureState.PartialResult);
        String text = captureController.stopCapture();

        // Assert
        assertThat(text).isEqualTo("new room ward Z on the second floor");
        await().atMost(Duration.ofSeconds(5))
                .until(() -> "Ward Z".equals(pipeline.currentFieldSnapshot().get("name")));
        assertThat(pipeline.currentFieldSnapshot()).containsEntry("building", "North").containsEntry("floor", "2");

        String id = pipeline.confirmActiveTask();
        assertThat(store.findById(EntityKind.LOCATION, id)).isPresent();
        assertThat(pipeline.isTaskActive()).isFalse();
    }

    @TestConfiguration
    static class ScriptedModelConfiguration {

        @Bean
        @Primary
        ScriptedModelClient scriptedModelClient() {
            return new ScriptedModelClient();
        }
    }
}
