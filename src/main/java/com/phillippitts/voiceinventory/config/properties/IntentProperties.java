package com.phillippitts.voiceinventory.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

import java.util.List;

/**
 * Phrase lists for local intent detection. Matching is case-insensitive on the trimmed transcript.
 */
@Validated
@ConfigurationProperties(prefix = "intent")
public class IntentProperties {

    private static final List<String> DEFAULT_PROCEED = List.of(
            "proceed", "go ahead", "that's all", "that is all", "done", "save it", "confirm", "ok save");
    private static final List<String> DEFAULT_CANCEL = List.of(
            "cancel", "never mind", "nevermind", "forget it", "stop everything", "abort");

    private final List<String> proceedPhrases;
    private final List<String> cancelPhrases;

    @ConstructorBinding
    public IntentProperties(List<String> proceedPhrases, List<String> cancelPhrases) {
        this.proceedPhrases = proceedPhrases == null || proceedPhrases.isEmpty()
                ? DEFAULT_PROCEED : List.copyOf(proceedPhrases);
        this.cancelPhrases = cancelPhrases == null || cancelPhrases.isEmpty()
                ? DEFAULT_CANCEL : List.copyOf(cancelPhrases);
    }

    public static IntentProperties defaults() {
        return new IntentProperties(null, null);
    }

    public List<String> getProceedPhrases() {
        return proceedPhrases;
    }

    public List<String> getCancelPhrases() {
        return cancelPhrases;
    }
}
