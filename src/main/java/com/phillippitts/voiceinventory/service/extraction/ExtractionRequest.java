package com.phillippitts.voiceinventory.service.extraction;

import com.phillippitts.voiceinventory.service.context.ChatExchange;
import com.phillippitts.voiceinventory.service.context.SpeakerHint;
import com.phillippitts.voiceinventory.service.task.ActiveTask;
import com.phillippitts.voiceinventory.service.task.TaskField;
import com.phillippitts.voiceinventory.service.task.TaskKind;

import java.time.LocalDate;
import java.util.List;

/**
 * Immutable copy of everything one extraction round sends to the model, taken while the pipeline
 * holds its lock so the model call can run without it.
 *
 * @param transcript sanitized operator utterance
 */
public record ExtractionRequest(TaskKind taskKind,
                                List<TaskField> fields,
                                List<String> missingFields,
                                String collectedSummary,
                                List<ChatExchange> history,
                                SpeakerHint speakerHint,
                                String transcript,
                                LocalDate today) {

    public ExtractionRequest {
        fields = List.copyOf(fields);
        missingFields = List.copyOf(missingFields);
        history = List.copyOf(history);
    }

    public static ExtractionRequest of(ActiveTask task, List<ChatExchange> history, SpeakerHint hint,
                                       String transcript, LocalDate today) {
        return new ExtractionRequest(task.kind(), task.fields(), task.missingRequiredFields(hint),
                task.collectedSummary(), history, hint, transcript, today);
    }
}
