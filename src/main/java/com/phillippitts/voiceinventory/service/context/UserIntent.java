package com.phillippitts.voiceinventory.service.context;

/**
 * Locally detected operator intent. Only {@link #CONTINUE} goes to the generative model.
 */
public enum UserIntent {
    /** Abandon the active task. */
    CANCEL,
    /** "That's all": go straight to the completeness check. */
    PROCEED,
    CONTINUE
}
