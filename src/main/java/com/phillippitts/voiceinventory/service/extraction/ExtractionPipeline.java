package com.phillippitts.voiceinventory.service.extraction;

import com.phillippitts.voiceinventory.domain.Location;
import com.phillippitts.voiceinventory.domain.NamedEntity;
import com.phillippitts.voiceinventory.domain.Vendor;
import com.phillippitts.voiceinventory.exception.ExtractionException;
import com.phillippitts.voiceinventory.exception.TaskNotReadyException;
import com.phillippitts.voiceinventory.service.capture.CaptureController;
import com.phillippitts.voiceinventory.service.capture.CaptureState;
import com.phillippitts.voiceinventory.service.capture.event.CaptureStateChangedEvent;
import com.phillippitts.voiceinventory.service.context.ChatExchange;
import com.phillippitts.voiceinventory.service.context.ConversationContext;
import com.phillippitts.voiceinventory.service.context.InputSanitizer;
import com.phillippitts.voiceinventory.service.context.IntentDetector;
import com.phillippitts.voiceinventory.service.context.SpeakerHint;
import com.phillippitts.voiceinventory.service.context.SpeakerInference;
import com.phillippitts.voiceinventory.service.context.UserIntent;
import com.phillippitts.voiceinventory.service.extraction.event.ExtractionStateChangedEvent;
import com.phillippitts.voiceinventory.service.metrics.ExtractionMetricsPublisher;
import com.phillippitts.voiceinventory.service.persistence.EntityDirectory;
import com.phillippitts.voiceinventory.service.persistence.TaskPersister;
import com.phillippitts.voiceinventory.service.resolution.EntityResolver;
import com.phillippitts.voiceinventory.service.resolution.Resolution;
import com.phillippitts.voiceinventory.service.speech.SpokenOutput;
import com.phillippitts.voiceinventory.service.speech.SpokenTextFormatter;
import com.phillippitts.voiceinventory.service.task.ActiveTask;
import com.phillippitts.voiceinventory.service.task.MergeOutcome;
import com.phillippitts.voiceinventory.service.task.TaskField;
import com.phillippitts.voiceinventory.service.task.TaskFactory;
import com.phillippitts.voiceinventory.service.task.TaskKind;
import com.phillippitts.voiceinventory.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.event.EventListener;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.Future;
import java.util.concurrent.FutureTask;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Turns finalized transcripts into field updates on the active task and drives the task to
 * confirmation.
 *
 * <p><b>Rounds:</b> each submitted transcript becomes one round on the extraction executor
 * (single worker, so rounds for a task never overlap and later transcripts queue). A round sanitizes
 * the transcript, checks it for local proceed/cancel intents, otherwise calls the model outside the
 * lock, then merges the updates and resolves every spoken entity reference.
 *
 * <p><b>Cancellation:</b> abandon and confirm bump a generation counter and cancel queued rounds.
 * A round whose generation is stale when it reacquires the lock is discarded.
 *
 * <p><b>Threading:</b> all access to the {@link ConversationContext} and the active task happens under
 * one lock. State events are published after that lock is released, in production order.
 *
 * @see ExtractionPipelineBuilder
 */
public class ExtractionPipeline {

    private static final Logger LOG = LogManager.getLogger(ExtractionPipeline.class);

    static final String SAVED_REPLY = "Saved.";
    static final String CANCELLED_REPLY = "Cancelled.";
    static final String READY_REPLY = "Everything required is filled in. Confirm to save.";

    private final ExtractionService extractionService;
    private final EntityResolver resolver;
    private final EntityDirectory directory;
    private final TaskPersister persister;
    private final IntentDetector intentDetector;
    private final InputSanitizer sanitizer;
    private final CaptureController captureController;
    private final SpokenOutput spokenOutput;
    private final ApplicationEventPublisher publisher;
    private final Executor executor;
    private final ExtractionMetricsPublisher metrics;
    private final Clock clock;
    private final double lowConfidenceThreshold;

    private final ConversationContext context;
    private final ReentrantLock lock = new ReentrantLock();
    private final ReentrantLock publishLock = new ReentrantLock(true);
    private final AtomicLong generation = new AtomicLong();
    private final Set<Future<?>> pending = ConcurrentHashMap.newKeySet();
    private volatile ExtractionState currentState = new ExtractionState.Idle();
    private volatile Supplier<Map<String, ?>> snapshotSource;

    ExtractionPipeline(ExtractionPipelineBuilder builder) {
        this.extractionService = builder.extractionService;
        this.resolver = builder.resolver;
        this.directory = builder.directory;
        this.persister = builder.persister;
        this.intentDetector = builder.intentDetector;
        this.sanitizer = builder.sanitizer;
        this.captureController = builder.captureController;
        this.spokenOutput = builder.spokenOutput;
        this.publisher = builder.publisher;
        this.executor = builder.executor;
        this.metrics = builder.metrics;
        this.clock = builder.clock;
        this.lowConfidenceThreshold = builder.properties.getLowConfidenceThreshold();
        this.context = new ConversationContext(builder.properties.getHistorySize());
    }

    /**
     * Starts a task, optionally pre-filled (for example with the equipment id when registering
     * maintenance from an equipment screen).
     *
     * @throws IllegalStateException if a task is already active
     * @throws IllegalArgumentException if an initial value is unknown or mistyped
     */
    public ResolvedData beginTask(TaskKind kind, Map<String, ?> initialValues) {
        Objects.requireNonNull(kind, "kind must not be null");
        List<ExtractionState> states = new ArrayList<>();
        lock.lock();
        try {
            ActiveTask task = TaskFactory.create(kind, initialValues);
            context.startTask(task);
            ResolvedData data = snapshot(task, settleReferences(task), "", 1.0, false, List.of());
            states.add(new ExtractionState.Extracted(data));
            LOG.info("Task started (task={}, kind={})", task.id(), kind);
            return data;
        } finally {
            publishAndUnlock(states);
        }
    }

    /**
     * Applies the caller's current field state, then queues the transcript for extraction.
     *
     * @param snapshot authoritative field values from the presentation layer, or {@code null}
     * @throws IllegalStateException if no task is active
     * @throws ExtractionException with kind {@code RATE_LIMITED} if the extraction queue is full
     */
    public void submit(String transcript, Map<String, ?> snapshot) {
        long round;
        lock.lock();
        try {
            ActiveTask task = requireActiveTask();
            if (snapshot != null) {
                MergeOutcome outcome = task.applySnapshot(snapshot);
                if (!outcome.warnings().isEmpty()) {
                    LOG.warn("Snapshot warnings (task={}): {}", task.id(), outcome.warnings());
                }
            }
            round = generation.get();
        } finally {
            lock.unlock();
        }

        FutureTask<Void> future = new FutureTask<Void>(() -> runRound(transcript, round), null) {
            @Override
            protected void done() {
                pending.remove(this);
            }
        };
        pending.add(future);
        try {
            executor.execute(future);
        } catch (RejectedExecutionException e) {
            pending.remove(future);
            throw new ExtractionException(ExtractionException.Kind.RATE_LIMITED,
                    "Too many transcripts waiting for extraction", transcript, e);
        }
    }

    /**
     * Settles a reference field to an operator-chosen stored record.
     *
     * @throws IllegalArgumentException if the field is not a reference field or the record does not exist
     */
    public ResolvedData selectCandidate(String fieldKey, String entityId) {
        List<ExtractionState> states = new ArrayList<>();
        lock.lock();
        try {
            ActiveTask task = requireActiveTask();
            TaskField field = requireReferenceField(task, fieldKey);
            NamedEntity entity = directory.findById(field.reference(), entityId)
                    .orElseThrow(() -> new IllegalArgumentException(
                            "No " + field.reference() + " with id " + entityId));
            task.merge(Map.of(field.key(), entity.name()));
            task.pinReference(field.key(), entity.id());
            LOG.info("Reference settled by operator (task={}, field={}, record={})", task.id(), fieldKey, entity.id());
            ResolvedData data = snapshot(task, settleReferences(task), "", 1.0, false, List.of());
            states.add(new ExtractionState.Extracted(data));
            return data;
        } finally {
            publishAndUnlock(states);
        }
    }

    /**
     * Creates a minimal vendor or location from the spoken name of a reference field and settles the
     * field to it. The new record is flagged as needing completion.
     *
     * @throws IllegalStateException if the field is empty or refers to equipment
     */
    public ResolvedData createMissingEntity(String fieldKey) {
        List<ExtractionState> states = new ArrayList<>();
        lock.lock();
        try {
            ActiveTask task = requireActiveTask();
            TaskField field = requireReferenceField(task, fieldKey);
            String name = task.text(field.key());
            if (name == null) {
                throw new IllegalStateException("Field '" + fieldKey + "' has no value");
            }
            NamedEntity minimal = switch (field.reference()) {
                case VENDOR -> Vendor.minimal(name);
                case LOCATION -> Location.minimal(name);
                case EQUIPMENT -> throw new IllegalStateException(
                        "Equipment cannot be created inline; register it as a new equipment task");
            };
            String id = directory.create(minimal);
            task.pinReference(field.key(), id);
            LOG.info("Created {} inline (task={}, field={}, record={})", field.reference(), task.id(), fieldKey, id);
            ResolvedData data = snapshot(task, settleReferences(task), "", 1.0, false, List.of());
            states.add(new ExtractionState.Extracted(data));
            return data;
        } finally {
            publishAndUnlock(states);
        }
    }

    /**
     * Applies authoritative manual edits without a transcript.
     */
    public ResolvedData applySnapshot(Map<String, ?> snapshot) {
        List<ExtractionState> states = new ArrayList<>();
        lock.lock();
        try {
            ActiveTask task = requireActiveTask();
            MergeOutcome outcome = task.applySnapshot(snapshot);
            ResolvedData data = snapshot(task, settleReferences(task), "", 1.0, false, outcome.warnings());
            states.add(new ExtractionState.Extracted(data));
            return data;
        } finally {
            publishAndUnlock(states);
        }
    }

    /**
     * Saves the active task and resets the conversation.
     *
     * @return id of the stored record
     * @throws TaskNotReadyException if required fields are empty or references are unsettled
     * @throws com.phillippitts.voiceinventory.exception.PersistenceException if saving fails; the task
     *         stays active with its values
     */
    public String confirmActiveTask() {
        List<ExtractionState> states = new ArrayList<>();
        String recordId;
        lock.lock();
        try {
            ActiveTask task = requireActiveTask();
            settleReferences(task);
            List<String> missing = task.missingRequiredFields(context.speakerHint());
            List<String> unresolved = task.unresolvedReferences();
            if (!missing.isEmpty() || !unresolved.isEmpty()) {
                throw new TaskNotReadyException(missing, unresolved);
            }
            task.markConfirmed();
            try {
                recordId = persister.persist(task);
            } catch (RuntimeException e) {
                task.rollbackToCollecting();
                LOG.warn("Saving task {} failed, back to collecting: {}", task.id(), e.getMessage());
                throw e;
            }
            generation.incrementAndGet();
            cancelPending(true);
            context.reset();
            states.add(new ExtractionState.Idle());
            LOG.info("Task confirmed and saved (task={}, kind={}, record={})", task.id(), task.kind(), recordId);
        } finally {
            publishAndUnlock(states);
        }
        captureController.cancelCapture();
        speak(SAVED_REPLY);
        return recordId;
    }

    /**
     * Abandons the active task (if any), cancels in-flight extraction, releases the microphone and
     * resets the conversation. Also used when the operator navigates away.
     */
    public void abandon() {
        List<ExtractionState> states = new ArrayList<>();
        lock.lock();
        try {
            abandonLocked(true, states);
        } finally {
            publishAndUnlock(states);
        }
        captureController.cancelCapture();
    }

    /**
     * Collected values of the active task, empty if none.
     */
    public Map<String, Object> currentFieldSnapshot() {
        lock.lock();
        try {
            return context.activeTask().map(ActiveTask::fieldValues).orElse(Map.of());
        } finally {
            lock.unlock();
        }
    }

    public boolean isTaskActive() {
        lock.lock();
        try {
            return context.activeTask().isPresent();
        } finally {
            lock.unlock();
        }
    }

    public ExtractionState currentState() {
        return currentState;
    }

    /**
     * Registers the source of field snapshots sent along with auto-submitted capture results.
     */
    public void registerSnapshotSource(Supplier<Map<String, ?>> source) {
        this.snapshotSource = source;
    }

    @EventListener
    public void onCaptureStateChanged(CaptureStateChangedEvent event) {
        if (!(event.state() instanceof CaptureState.Result result)) {
            return;
        }
        if (result.text() == null || result.text().isBlank()) {
            LOG.debug("Empty capture result; nothing to submit");
            return;
        }
        if (!isTaskActive()) {
            LOG.debug("Capture result with no active task; ignoring");
            return;
        }
        Supplier<Map<String, ?>> source = snapshotSource;
        try {
            submit(result.text(), source != null ? source.get() : null);
        } catch (RuntimeException e) {
            LOG.warn("Auto-submit of capture result failed: {}", e.getMessage());
        }
    }

    void runRound(String rawTranscript, long round) {
        try {
            if (!publishIfCurrent(round, new ExtractionState.Processing(rawTranscript))) {
                return;
            }
            InputSanitizer.SanitizedInput input = sanitizer.sanitize(rawTranscript);
            UserIntent intent = intentDetector.detect(input.text());
            if (intent == UserIntent.CANCEL) {
                cancelFromRound(round);
                return;
            }
            PreparedRound prepared = prepareRound(round, input.text(), intent);
            if (prepared == null) {
                return;
            }
            ExtractionResult result = extractionService.extract(prepared.request());
            applyResult(round, prepared, input.suspicious(), result);
        } catch (ExtractionException e) {
            ExtractionException failure = e.withTranscript(rawTranscript);
            if (publishIfCurrent(round, ExtractionState.Error.from(failure))) {
                LOG.warn("Extraction round failed (kind={}, transcript='{}'): {}",
                        failure.getKind(), LogSanitizer.preview(rawTranscript), failure.getMessage());
            } else {
                LOG.debug("Dropped failure of a cancelled round (kind={})", failure.getKind());
            }
        } catch (RuntimeException e) {
            LOG.error("Unexpected failure in extraction round", e);
            publishIfCurrent(round, new ExtractionState.Idle());
        }
    }

    private PreparedRound prepareRound(long round, String text, UserIntent intent) {
        List<ExtractionState> states = new ArrayList<>();
        PreparedRound prepared = null;
        String reply = null;
        lock.lock();
        try {
            ActiveTask task = currentTask(round);
            if (task != null && intent == UserIntent.PROCEED) {
                Map<String, Resolution<NamedEntity>> resolutions = settleReferences(task);
                reply = proceedReply(task);
                context.addExchange(ChatExchange.user(text));
                context.addExchange(ChatExchange.assistant(reply));
                states.add(new ExtractionState.Extracted(snapshot(task, resolutions, reply, 1.0, false, List.of())));
                LOG.info("Proceed requested (task={}, ready={})", task.id(), READY_REPLY.equals(reply));
            } else if (task != null) {
                SpeakerHint hint = context.updateSpeakerHint(SpeakerInference.infer(text));
                ExtractionRequest request = ExtractionRequest.of(task, context.recentExchanges(), hint, text,
                        LocalDate.now(clock));
                prepared = new PreparedRound(task.id(), text, request);
            }
        } finally {
            publishAndUnlock(states);
        }
        speak(reply);
        return prepared;
    }

    private void applyResult(long round, PreparedRound prepared, boolean suspicious, ExtractionResult result) {
        List<ExtractionState> states = new ArrayList<>();
        String reply = null;
        lock.lock();
        try {
            ActiveTask task = currentTask(round);
            if (task == null || !task.id().equals(prepared.taskId())) {
                LOG.debug("Discarding result of a superseded round");
            } else {
                MergeOutcome outcome = task.merge(result.updates());
                List<String> warnings = new ArrayList<>(outcome.warnings());
                if (suspicious) {
                    warnings.add("Input looked unusual and was shortened");
                }
                boolean lowConfidence = result.confidence() < lowConfidenceThreshold;
                if (lowConfidence) {
                    warnings.add(String.format(Locale.ROOT,
                            "Low confidence (%.2f): please check the values", result.confidence()));
                    LOG.warn("Low-confidence extraction applied (task={}, confidence={})",
                            task.id(), result.confidence());
                }
                List<String> disputed = disputedMissingFields(result.missingFields(),
                        task.missingRequiredFields(context.speakerHint()));
                if (!disputed.isEmpty()) {
                    warnings.add("Model still considers missing: " + String.join(", ", disputed));
                    LOG.debug("Model and task disagree on missing fields (task={}, model-only={})",
                            task.id(), disputed);
                }
                context.addExchange(ChatExchange.user(prepared.text()));
                context.addExchange(ChatExchange.assistant(result.reply()));
                reply = result.reply();
                ResolvedData data = snapshot(task, settleReferences(task), reply, result.confidence(),
                        lowConfidence, warnings);
                states.add(new ExtractionState.Extracted(data));
                LOG.info("Round applied (task={}, updated={}, missing={})",
                        task.id(), outcome.appliedKeys(), data.missingFields());
            }
        } finally {
            publishAndUnlock(states);
        }
        speak(reply);
    }

    /**
     * Fields the model reports as missing although the task has a value for them, compared
     * case-insensitively. Fields the model leaves out are not disputes; the task's own list is authoritative.
     */
    static List<String> disputedMissingFields(List<String> modelMissing, List<String> taskMissing) {
        Set<String> known = new HashSet<>();
        for (String field : taskMissing) {
            known.add(field.toLowerCase(Locale.ROOT));
        }
        List<String> disputed = new ArrayList<>();
        for (String field : modelMissing) {
            if (field != null && !field.isBlank() && !known.contains(field.trim().toLowerCase(Locale.ROOT))) {
                disputed.add(field.trim());
            }
        }
        return disputed;
    }

    private void cancelFromRound(long round) {
        List<ExtractionState> states = new ArrayList<>();
        boolean cancelled = false;
        lock.lock();
        try {
            if (round == generation.get()) {
                // the current round is one of the pending futures; never interrupt our own thread
                abandonLocked(false, states);
                cancelled = true;
            }
        } finally {
            publishAndUnlock(states);
        }
        if (cancelled) {
            captureController.cancelCapture();
            speak(CANCELLED_REPLY);
        }
    }

    private void abandonLocked(boolean interrupt, List<ExtractionState> states) {
        generation.incrementAndGet();
        cancelPending(interrupt);
        context.activeTask().ifPresent(task -> {
            task.markAbandoned();
            LOG.info("Task abandoned (task={}, kind={})", task.id(), task.kind());
        });
        context.reset();
        states.add(new ExtractionState.Idle());
    }

    private Map<String, Resolution<NamedEntity>> settleReferences(ActiveTask task) {
        Map<String, Resolution<NamedEntity>> resolutions = new LinkedHashMap<>();
        for (TaskField field : task.pendingReferences()) {
            String spoken = task.text(field.key());
            Resolution<NamedEntity> resolution =
                    resolver.resolve(spoken, directory.listActive(field.reference()), NamedEntity::name);
            metrics.recordResolution(field.reference(), resolution);
            if (resolution instanceof Resolution.Found<NamedEntity> found) {
                task.pinReference(field.key(), found.record().id());
                LOG.debug("Reference resolved (field={}, record={})", field.key(), found.record().id());
            } else {
                resolutions.put(field.key(), resolution);
            }
        }
        return resolutions;
    }

    private ResolvedData snapshot(ActiveTask task, Map<String, Resolution<NamedEntity>> resolutions,
                                  String reply, double confidence, boolean lowConfidence, List<String> warnings) {
        return new ResolvedData(task.id(), task.kind(), task.fieldValues(), resolutions, task.pinnedReferences(),
                task.missingRequiredFields(context.speakerHint()), task.unresolvedReferences(),
                confidence, lowConfidence, warnings, reply);
    }

    private String proceedReply(ActiveTask task) {
        List<String> missing = task.missingRequiredFields(context.speakerHint());
        List<String> unresolved = task.unresolvedReferences();
        if (missing.isEmpty() && unresolved.isEmpty()) {
            return READY_REPLY;
        }
        StringBuilder reply = new StringBuilder();
        if (!missing.isEmpty()) {
            reply.append("Still missing: ").append(labels(task, missing)).append('.');
        }
        if (!unresolved.isEmpty()) {
            if (reply.length() > 0) {
                reply.append(' ');
            }
            reply.append("Please confirm: ").append(labels(task, unresolved)).append('.');
        }
        return reply.toString();
    }

    private static String labels(ActiveTask task, List<String> keys) {
        List<String> labels = new ArrayList<>();
        for (String key : keys) {
            labels.add(task.field(key).map(TaskField::label).orElse(key));
        }
        return String.join(", ", labels);
    }

    private ActiveTask requireActiveTask() {
        return context.activeTask().orElseThrow(() -> new IllegalStateException("No active task"));
    }

    private static TaskField requireReferenceField(ActiveTask task, String fieldKey) {
        return task.field(fieldKey)
                .filter(TaskField::isReference)
                .orElseThrow(() -> new IllegalArgumentException("Not a reference field: " + fieldKey));
    }

    private ActiveTask currentTask(long round) {
        return round == generation.get() ? context.activeTask().orElse(null) : null;
    }

    private void cancelPending(boolean interrupt) {
        for (Future<?> future : pending) {
            future.cancel(interrupt);
        }
        pending.clear();
    }

    private boolean publishIfCurrent(long round, ExtractionState state) {
        List<ExtractionState> states = new ArrayList<>();
        lock.lock();
        boolean current;
        try {
            current = round == generation.get();
            if (current) {
                states.add(state);
            }
        } finally {
            publishAndUnlock(states);
        }
        return current;
    }

    private void speak(String reply) {
        if (reply == null || reply.isBlank()) {
            return;
        }
        try {
            spokenOutput.speak(SpokenTextFormatter.format(reply));
        } catch (RuntimeException e) {
            LOG.warn("Spoken output failed: {}", e.toString());
        }
    }

    private void publishAndUnlock(List<ExtractionState> states) {
        if (states.isEmpty()) {
            lock.unlock();
            return;
        }
        publishLock.lock();
        try {
            lock.unlock();
            for (ExtractionState state : states) {
                currentState = state;
                publisher.publishEvent(new ExtractionStateChangedEvent(state, Instant.now()));
            }
        } finally {
            publishLock.unlock();
        }
    }

    private record PreparedRound(UUID taskId, String text, ExtractionRequest request) {
    }
}
