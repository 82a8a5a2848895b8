package com.phillippitts.voiceinventory.service.context;

import com.phillippitts.voiceinventory.service.task.ActiveTask;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * Session-scoped state of the voice conversation: the active task, a bounded window of recent
 * exchanges, and the current speaker hint.
 *
 * <p>Owned by the extraction pipeline, which serializes all access. {@link #reset()} is the single
 * exit point used on save, cancel and navigation away.
 */
public final class ConversationContext {

    private final int maxExchanges;
    private final Deque<ChatExchange> exchanges = new ArrayDeque<>();
    private ActiveTask activeTask;
    private SpeakerHint speakerHint = SpeakerHint.UNKNOWN;

    public ConversationContext(int maxExchanges) {
        if (maxExchanges < 1) {
            throw new IllegalArgumentException("maxExchanges must be positive");
        }
        this.maxExchanges = maxExchanges;
    }

    public Optional<ActiveTask> activeTask() {
        return Optional.ofNullable(activeTask);
    }

    /**
     * @throws IllegalStateException if a task is already active
     */
    public void startTask(ActiveTask task) {
        if (activeTask != null) {
            throw new IllegalStateException("A " + activeTask.kind() + " task is already active");
        }
        activeTask = task;
    }

    /**
     * Appends an exchange, evicting the oldest beyond the window.
     */
    public void addExchange(ChatExchange exchange) {
        exchanges.addLast(exchange);
        while (exchanges.size() > maxExchanges) {
            exchanges.removeFirst();
        }
    }

    /**
     * Oldest first.
     */
    public List<ChatExchange> recentExchanges() {
        return List.copyOf(exchanges);
    }

    public SpeakerHint speakerHint() {
        return speakerHint;
    }

    public SpeakerHint updateSpeakerHint(SpeakerHint inferred) {
        speakerHint = speakerHint.merge(inferred);
        return speakerHint;
    }

    public void reset() {
        activeTask = null;
        exchanges.clear();
        speakerHint = SpeakerHint.UNKNOWN;
    }

    public boolean isEmpty() {
        return activeTask == null && exchanges.isEmpty() && speakerHint == SpeakerHint.UNKNOWN;
    }
}
