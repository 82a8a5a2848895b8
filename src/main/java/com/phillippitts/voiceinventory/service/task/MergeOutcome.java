package com.phillippitts.voiceinventory.service.task;

import java.util.List;

/**
 * Result of merging an update map into a task.
 *
 * @param appliedKeys keys whose value changed
 * @param warnings rejected values and unknown keys, in encounter order
 */
public record MergeOutcome(List<String> appliedKeys, List<String> warnings) {

    public MergeOutcome {
        appliedKeys = List.copyOf(appliedKeys);
        warnings = List.copyOf(warnings);
    }

    public boolean changed() {
        return !appliedKeys.isEmpty();
    }
}
