package com.phillippitts.voiceinventory.service.context;

/**
 * Who appears to be dictating: the technician who performed the work, or an operator reporting it.
 */
public enum SpeakerHint {
    UNKNOWN,
    LIKELY_PERFORMER,
    LIKELY_OPERATOR;

    /**
     * Combines this hint with a freshly inferred one. A definite new hint wins; UNKNOWN never
     * overrides a definite hint.
     */
    public SpeakerHint merge(SpeakerHint inferred) {
        if (inferred == null || inferred == UNKNOWN) {
            return this;
        }
        return inferred;
    }
}
