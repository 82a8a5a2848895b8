package com.phillippitts.voiceinventory.service.extraction;

import com.phillippitts.voiceinventory.config.properties.ExtractionProperties;
import com.phillippitts.voiceinventory.config.properties.IntentProperties;
import com.phillippitts.voiceinventory.config.properties.ResolutionProperties;
import com.phillippitts.voiceinventory.domain.EntityKind;
import com.phillippitts.voiceinventory.domain.Equipment;
import com.phillippitts.voiceinventory.domain.InventoryRecord;
import com.phillippitts.voiceinventory.domain.Location;
import com.phillippitts.voiceinventory.domain.NamedEntity;
import com.phillippitts.voiceinventory.domain.Vendor;
import com.phillippitts.voiceinventory.exception.ExtractionException;
import com.phillippitts.voiceinventory.exception.PersistenceException;
import com.phillippitts.voiceinventory.exception.TaskNotReadyException;
import com.phillippitts.voiceinventory.service.capture.CaptureState;
import com.phillippitts.voiceinventory.service.capture.event.CaptureStateChangedEvent;
import com.phillippitts.voiceinventory.service.context.InputSanitizer;
import com.phillippitts.voiceinventory.service.context.IntentDetector;
import com.phillippitts.voiceinventory.service.extraction.event.ExtractionStateChangedEvent;
import com.phillippitts.voiceinventory.service.persistence.InMemoryInventoryStore;
import com.phillippitts.voiceinventory.service.persistence.InventoryRepository;
import com.phillippitts.voiceinventory.service.persistence.TaskPersister;
import com.phillippitts.voiceinventory.service.resolution.EntityResolver;
import com.phillippitts.voiceinventory.service.resolution.Resolution;
import com.phillippitts.voiceinventory.service.task.TaskKind;
import com.phillippitts.voiceinventory.testutil.EventCapturingPublisher;
import com.phillippitts.voiceinventory.testutil.FakeCaptureController;
import com.phillippitts.voiceinventory.testutil.QueuedExecutor;
import com.phillippitts.voiceinventory.testutil.RecordingSpokenOutput;
import com.phillippitts.voiceinventory.testutil.ScriptedModelClient;
import com.phillippitts.voiceinventory.testutil.SyncExecutor;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

class ExtractionPipelineTest {

    private ScriptedModelClient model;
    private InMemoryInventoryStore store;
    private EventCapturingPublisher publisher;
    private RecordingSpokenOutput spoken;
    private FakeCaptureController capture;
    private ExtractionPipeline pipeline;

    @BeforeEach
    void setUp() {
        model = new ScriptedModelClient();
        store = new InMemoryInventoryStore();
        publisher = new EventCapturingPublisher();
        spoken = new RecordingSpokenOutput();
        capture = new FakeCaptureController();
        pipeline = pipeline(new SyncExecutor(), store);
    }

    @AfterEach
    void clearInterrupt() {
        Thread.interrupted();
    }

    private ExtractionPipeline pipeline(Executor executor, InventoryRepository repository) {
        return pipeline(executor, repository, model);
    }

    private ExtractionPipeline pipeline(Executor executor, InventoryRepository repository,
                                        GenerativeModelClient client) {
        ExtractionProperties properties = ExtractionProperties.defaults();
        ExtractionService service = new ExtractionService(client, new ExtractionPromptBuilder(),
                new ExtractionResponseParser(), properties, null, millis -> { });
        return ExtractionPipelineBuilder.builder()
                .extractionService(service)
                .resolver(new EntityResolver(ResolutionProperties.defaults()))
                .directory(store)
                .persister(new TaskPersister(repository, store))
                .intentDetector(new IntentDetector(IntentProperties.defaults()))
                .sanitizer(new InputSanitizer(properties.getMaxInputLength()))
                .captureController(capture)
                .spokenOutput(spoken)
                .publisher(publisher)
                .executor(executor)
                .properties(properties)
                .clock(Clock.fixed(Instant.parse("2024-06-01T10:00:00Z"), ZoneOffset.UTC))
                .build();
    }

    private List<ExtractionState> states() {
        return publisher.eventsOfType(ExtractionStateChangedEvent.class).stream()
                .map(ExtractionStateChangedEvent::state)
                .toList();
    }

    private ExtractionState lastState() {
        List<ExtractionState> all = states();
        return all.get(all.size() - 1);
    }

    private ResolvedData lastExtracted() {
        List<ExtractionState> all = states();
        for (int i = all.size() - 1; i >= 0; i--) {
            if (all.get(i) instanceof ExtractionState.Extracted extracted) {
                return extracted.data();
            }
        }
        throw new AssertionError("No Extracted state published");
    }

    private String storeVendor(String name) {
        return store.insert(new Vendor(null, name, name, null, null, null, null, null, false, false, true));
    }

    @Test
    void shouldStartTaskAndPublishMissingFields() {
        // Act
        ResolvedData data = pipeline.beginTask(TaskKind.EQUIPMENT_CREATION, Map.of());

        // Assert
        assertThat(pipeline.isTaskActive()).isTrue();
        assertThat(data.missingFields()).containsExactly("name", "category", "location");
        assertThat(data.readyForConfirmation()).isFalse();
        assertThat(states()).singleElement().isInstanceOf(ExtractionState.Extracted.class);
    }

    @Test
    void shouldRejectSecondTask() {
        pipeline.beginTask(TaskKind.VENDOR_CREATION, null);

        assertThatThrownBy(() -> pipeline.beginTask(TaskKind.LOCATION_CREATION, null))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void shouldMergeModelUpdatesAndAutoSettleFoundReference() {
        // Arrange
        String wardId = store.insert(Location.minimal("Ward B"));
        pipeline.beginTask(TaskKind.EQUIPMENT_CREATION, Map.of());
        model.reply("{\"updates\": {\"name\": \"Suction pump\", \"category\": \"Aspiration\", "
                + "\"location\": \"ward b\"}, \"reply\": \"**Saved** the details.\", \"confidence\": 0.95}");

        // Act
        pipeline.submit("new suction pump, aspiration, in ward B", null);

        // Assert
        ResolvedData data = lastExtracted();
        assertThat(data.fields()).containsEntry("name", "Suction pump").containsEntry("location", "ward b");
        assertThat(data.settledReferences()).containsEntry("location", wardId);
        assertThat(data.resolutions()).isEmpty();
        assertThat(data.readyForConfirmation()).isTrue();
        assertThat(data.lowConfidence()).isFalse();
        assertThat(spoken.last()).isEqualTo("Saved the details.");
        assertThat(model.lastUserPrompt()).contains("Today: 2024-06-01").contains("in ward B");
        assertThat(states()).extracting(s -> s.getClass().getSimpleName())
                .containsExactly("Extracted", "Processing", "Extracted");
    }

    @Test
    void shouldRequireChoiceForAmbiguousReferenceThenSave() {
        // Arrange
        String wardId = store.insert(Location.minimal("Ward B"));
        String srlId = storeVendor("Medika Srl");
        storeVendor("Medika Service");
        pipeline.beginTask(TaskKind.EQUIPMENT_CREATION, Map.of());
        model.reply("{\"updates\": {\"name\": \"Monitor\", \"category\": \"Monitoring\", \"location\": \"Ward B\", "
                + "\"supplier\": \"Medika\"}, \"reply\": \"Which Medika?\", \"confidence\": 0.9}");
        pipeline.submit("monitor in ward B from Medika", null);

        // Act & Assert: not ready while the supplier is ambiguous
        ResolvedData data = lastExtracted();
        assertThat(data.resolutions().get("supplier")).isInstanceOf(Resolution.Ambiguous.class);
        assertThat(((Resolution.Ambiguous<NamedEntity>) data.resolutions().get("supplier")).candidates())
                .extracting(NamedEntity::name)
                .containsExactly("Medika Service", "Medika Srl");
        TaskNotReadyException notReady = catchThrowableOfType(pipeline::confirmActiveTask, TaskNotReadyException.class);
        assertThat(notReady.getUnresolvedReferences()).containsExactly("supplier");
        assertThat(notReady.getMissingFields()).isEmpty();

        // Act: operator picks one, then confirms
        ResolvedData afterChoice = pipeline.selectCandidate("supplier", srlId);
        String recordId = pipeline.confirmActiveTask();

        // Assert
        assertThat(afterChoice.fields()).containsEntry("supplier", "Medika Srl");
        assertThat(afterChoice.readyForConfirmation()).isTrue();
        Equipment saved = (Equipment) store.findById(EntityKind.EQUIPMENT, recordId).orElseThrow();
        assertThat(saved.locationId()).isEqualTo(wardId);
        assertThat(saved.supplierId()).isEqualTo(srlId);
        assertThat(pipeline.isTaskActive()).isFalse();
        assertThat(lastState()).isEqualTo(new ExtractionState.Idle());
        assertThat(capture.cancelCount()).isEqualTo(1);
        assertThat(spoken.last()).isEqualTo(ExtractionPipeline.SAVED_REPLY);
    }

    @Test
    void shouldCreateMissingLocationInline() {
        // Arrange
        pipeline.beginTask(TaskKind.EQUIPMENT_CREATION, Map.of());
        model.reply("{\"updates\": {\"location\": \"Garden Room\"}, \"reply\": \"\", \"confidence\": 0.9}");
        pipeline.submit("it is in the garden room", null);
        assertThat(lastExtracted().resolutions().get("location")).isInstanceOf(Resolution.NotFound.class);

        // Act
        ResolvedData data = pipeline.createMissingEntity("location");

        // Assert
        String locationId = data.settledReferences().get("location");
        NamedEntity created = store.findById(EntityKind.LOCATION, locationId).orElseThrow();
        assertThat(created.name()).isEqualTo("Garden Room");
        assertThat(created.needsCompletion()).isTrue();
        assertThat(data.unresolvedReferences()).isEmpty();
    }

    @Test
    void shouldRefuseInlineEquipmentCreation() {
        pipeline.beginTask(TaskKind.MAINTENANCE_EVENT, Map.of());
        pipeline.applySnapshot(Map.of("equipment", "the old ventilator"));

        assertThatThrownBy(() -> pipeline.createMissingEntity("equipment")).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> pipeline.createMissingEntity("description"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldRejectUnknownCandidate() {
        pipeline.beginTask(TaskKind.EQUIPMENT_CREATION, Map.of("location", "Ward B"));

        assertThatThrownBy(() -> pipeline.selectCandidate("location", "missing-id"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldAbandonTaskOnSpokenCancelWithoutCallingModel() {
        // Arrange
        pipeline.beginTask(TaskKind.VENDOR_CREATION, Map.of());

        // Act
        pipeline.submit("never mind", null);

        // Assert
        assertThat(model.callCount()).isZero();
        assertThat(pipeline.isTaskActive()).isFalse();
        assertThat(lastState()).isEqualTo(new ExtractionState.Idle());
        assertThat(capture.cancelCount()).isEqualTo(1);
        assertThat(spoken.last()).isEqualTo(ExtractionPipeline.CANCELLED_REPLY);
    }

    @Test
    void shouldListWhatIsMissingOnSpokenProceed() {
        // Arrange
        pipeline.beginTask(TaskKind.EQUIPMENT_CREATION, Map.of("name", "Pump", "location", "Nowhere"));

        // Act
        pipeline.submit("that's all", null);

        // Assert
        assertThat(model.callCount()).isZero();
        assertThat(spoken.last()).isEqualTo("Still missing: Category. Please confirm: Location.");
        assertThat(pipeline.isTaskActive()).isTrue();
    }

    @Test
    void shouldAnnounceReadinessOnSpokenProceed() {
        pipeline.beginTask(TaskKind.LOCATION_CREATION, Map.of("name", "Ward B"));

        pipeline.submit("done", null);

        assertThat(spoken.last()).isEqualTo(ExtractionPipeline.READY_REPLY);
        assertThat(lastExtracted().reply()).isEqualTo(ExtractionPipeline.READY_REPLY);
    }

    @Test
    void shouldRequirePerformerWhenOperatorReportsWork() {
        // Arrange
        pipeline.beginTask(TaskKind.MAINTENANCE_EVENT, Map.of("equipmentId", "eq-1"));
        model.reply("{\"updates\": {\"type\": \"replacement\", \"description\": \"Battery replaced\"}, "
                + "\"reply\": \"Who did the work?\", \"confidence\": 0.9}");

        // Act
        pipeline.submit("the technician replaced the battery", null);

        // Assert
        assertThat(lastExtracted().missingFields()).containsExactly("performedBy");
        assertThat(model.lastUserPrompt()).contains("reporting work done by someone else");
    }

    @Test
    void shouldPublishRetryableErrorWithTranscriptOnModelFailure() {
        // Arrange
        pipeline.beginTask(TaskKind.LOCATION_CREATION, Map.of());
        model.fail(ExtractionException.Kind.MALFORMED_RESPONSE);

        // Act
        pipeline.submit("ward C on the first floor", null);

        // Assert
        assertThat(lastState()).isInstanceOf(ExtractionState.Error.class);
        ExtractionState.Error error = (ExtractionState.Error) lastState();
        assertThat(error.kind()).isEqualTo(ExtractionException.Kind.MALFORMED_RESPONSE);
        assertThat(error.transcript()).isEqualTo("ward C on the first floor");
        assertThat(error.retryable()).isTrue();
        assertThat(pipeline.isTaskActive()).isTrue();
    }

    @Test
    void shouldFlagLowConfidenceRound() {
        pipeline.beginTask(TaskKind.LOCATION_CREATION, Map.of());
        model.reply("{\"updates\": {\"name\": \"Ward D\"}, \"reply\": \"Ok.\", \"confidence\": 0.3}");

        pipeline.submit("ward D maybe", null);

        ResolvedData data = lastExtracted();
        assertThat(data.lowConfidence()).isTrue();
        assertThat(data.warnings()).contains("Low confidence (0.30): please check the values");
        assertThat(data.fields()).containsEntry("name", "Ward D");
    }

    @Test
    void shouldWarnWhenModelListsFilledFieldAsMissing() {
        pipeline.beginTask(TaskKind.LOCATION_CREATION, Map.of());
        model.reply("{\"updates\": {\"name\": \"Ward D\"}, \"reply\": \"Which floor?\", "
                + "\"confidence\": 0.9, \"missingFields\": [\"Name\"]}");

        pipeline.submit("ward D", null);

        ResolvedData data = lastExtracted();
        assertThat(data.missingFields()).isEmpty();
        assertThat(data.warnings()).containsExactly("Model still considers missing: Name");
    }

    @Test
    void shouldAcceptModelMissingFieldsThatMatchTask() {
        assertThat(ExtractionPipeline.disputedMissingFields(List.of("Equipment ", "type"), List.of("equipment", "type")))
                .isEmpty();
        assertThat(ExtractionPipeline.disputedMissingFields(List.of(), List.of("equipment"))).isEmpty();
        assertThat(ExtractionPipeline.disputedMissingFields(List.of("date", "type"), List.of("type")))
                .containsExactly("date");
    }

    @Test
    void shouldApplySnapshotBeforeExtraction() {
        // Arrange
        pipeline.beginTask(TaskKind.LOCATION_CREATION, Map.of("name", "Ward B", "floor", "1"));
        model.reply("{\"updates\": {\"building\": \"North\"}, \"reply\": \"Ok.\", \"confidence\": 0.9}");

        // Act
        pipeline.submit("north building", Map.of("floor", "", "name", "Ward B2"));

        // Assert
        assertThat(pipeline.currentFieldSnapshot())
                .containsEntry("name", "Ward B2")
                .containsEntry("building", "North")
                .doesNotContainKey("floor");
        assertThat(model.lastUserPrompt()).contains("Name: Ward B2");
    }

    @Test
    void shouldKeepTaskWhenSavingFails() {
        // Arrange
        InventoryRepository failing = new InventoryRepository() {
            @Override
            public String insert(InventoryRecord record) {
                throw new PersistenceException("Location", "Storage unavailable");
            }

            @Override
            public void update(InventoryRecord record) {
            }
        };
        ExtractionPipeline failingPipeline = pipeline(new SyncExecutor(), failing);
        failingPipeline.beginTask(TaskKind.LOCATION_CREATION, Map.of("name", "Ward B"));

        // Act & Assert
        assertThatThrownBy(failingPipeline::confirmActiveTask)
                .isInstanceOf(PersistenceException.class)
                .hasMessage("Storage unavailable");
        assertThat(failingPipeline.isTaskActive()).isTrue();
        assertThat(failingPipeline.currentFieldSnapshot()).containsEntry("name", "Ward B");
        assertThat(capture.cancelCount()).isZero();
        assertThat(failingPipeline.applySnapshot(Map.of("floor", "2")).fields()).containsEntry("floor", "2");
    }

    @Test
    void shouldDropQueuedRoundsOnAbandon() {
        // Arrange
        QueuedExecutor queue = new QueuedExecutor();
        ExtractionPipeline queued = pipeline(queue, store);
        queued.beginTask(TaskKind.LOCATION_CREATION, Map.of());
        model.reply("{\"updates\": {\"name\": \"Ward B\"}, \"confidence\": 0.9}");
        queued.submit("ward B", null);

        // Act
        queued.abandon();
        queue.runAll();

        // Assert
        assertThat(model.callCount()).isZero();
        assertThat(states()).noneMatch(s -> s instanceof ExtractionState.Processing);
        assertThat(queued.isTaskActive()).isFalse();
    }

    @Test
    void shouldDiscardResultOfRoundSupersededWhileModelWasRunning() {
        // Arrange
        ExtractionPipeline[] holder = new ExtractionPipeline[1];
        GenerativeModelClient abandoningClient = new GenerativeModelClient() {
            @Override
            public String generate(String systemPrompt, String userPrompt) {
                holder[0].abandon();
                return "{\"updates\": {\"name\": \"Ward B\"}, \"reply\": \"Ok.\", \"confidence\": 0.9}";
            }

            @Override
            public String modelName() {
                return "abandoning";
            }
        };
        holder[0] = pipeline(new SyncExecutor(), store, abandoningClient);
        holder[0].beginTask(TaskKind.LOCATION_CREATION, Map.of());
        publisher.clear();

        // Act
        holder[0].submit("ward B", null);

        // Assert
        assertThat(states()).extracting(s -> s.getClass().getSimpleName()).containsExactly("Processing", "Idle");
        assertThat(spoken.spoken()).isEmpty();
    }

    @Test
    void shouldAutoSubmitCaptureResultWithRegisteredSnapshot() {
        // Arrange
        pipeline.beginTask(TaskKind.LOCATION_CREATION, Map.of());
        pipeline.registerSnapshotSource(() -> Map.of("floor", "3"));
        model.reply("{\"updates\": {\"name\": \"Ward E\"}, \"reply\": \"Ok.\", \"confidence\": 0.9}");
        CaptureState.Result result = new CaptureState.Result(UUID.randomUUID(), "ward E", 0.9);

        // Act
        pipeline.onCaptureStateChanged(new CaptureStateChangedEvent(result, Instant.now()));

        // Assert
        assertThat(pipeline.currentFieldSnapshot()).containsEntry("name", "Ward E").containsEntry("floor", "3");
    }

    @Test
    void shouldNotSubmitEmptyCaptureResult() {
        pipeline.beginTask(TaskKind.LOCATION_CREATION, Map.of());
        publisher.clear();

        pipeline.onCaptureStateChanged(new CaptureStateChangedEvent(
                new CaptureState.Result(UUID.randomUUID(), "", 0.0), Instant.now()));

        assertThat(model.callCount()).isZero();
        assertThat(states()).isEmpty();
        assertThat(pipeline.isTaskActive()).isTrue();
    }

    @Test
    void shouldIgnoreCaptureEventsWithoutTask() {
        pipeline.onCaptureStateChanged(new CaptureStateChangedEvent(
                new CaptureState.Result(UUID.randomUUID(), "ward E", 0.9), Instant.now()));
        pipeline.onCaptureStateChanged(new CaptureStateChangedEvent(new CaptureState.Idle(), Instant.now()));

        assertThat(model.callCount()).isZero();
        assertThat(states()).isEmpty();
    }

    @Test
    void shouldReportFullQueueAsRateLimited() {
        // Arrange
        ExtractionPipeline saturated = pipeline(command -> {
            throw new RejectedExecutionException("full");
        }, store);
        saturated.beginTask(TaskKind.LOCATION_CREATION, Map.of());

        // Act
        ExtractionException thrown = catchThrowableOfType(() -> saturated.submit("ward F", null),
                ExtractionException.class);

        // Assert
        assertThat(thrown.getKind()).isEqualTo(ExtractionException.Kind.RATE_LIMITED);
        assertThat(thrown.getTranscript()).isEqualTo("ward F");
    }

    @Test
    void shouldRequireActiveTaskForSubmit() {
        assertThatThrownBy(() -> pipeline.submit("hello", null)).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(pipeline::confirmActiveTask).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void shouldAllowAbandonWithoutTask() {
        pipeline.abandon();

        assertThat(lastState()).isEqualTo(new ExtractionState.Idle());
        assertThat(pipeline.currentFieldSnapshot()).isEmpty();
    }
}
