package com.phillippitts.voiceinventory.service.context;

import com.phillippitts.voiceinventory.config.properties.IntentProperties;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Phrase-based intent detection run before any model round-trip.
 *
 * <p>Cancel phrases are checked first and match anywhere on word boundaries. Proceed phrases must
 * be the whole utterance, or open or close it, so that "done" inside a description does not end the task.
 */
public class IntentDetector {

    private static final Pattern TRAILING_PUNCTUATION = Pattern.compile("[\\p{Punct}\\s]+$");

    private final List<Pattern> cancelPatterns;
    private final List<String> proceedPhrases;

    public IntentDetector(IntentProperties properties) {
        Objects.requireNonNull(properties, "properties must not be null");
        this.cancelPatterns = properties.getCancelPhrases().stream()
                .map(IntentDetector::normalize)
                .filter(p -> !p.isEmpty())
                .map(p -> Pattern.compile("\\b" + Pattern.quote(p) + "\\b"))
                .toList();
        this.proceedPhrases = properties.getProceedPhrases().stream()
                .map(IntentDetector::normalize)
                .filter(p -> !p.isEmpty())
                .toList();
    }

    public UserIntent detect(String transcript) {
        String normalized = normalize(transcript);
        if (normalized.isEmpty()) {
            return UserIntent.CONTINUE;
        }
        for (Pattern cancel : cancelPatterns) {
            if (cancel.matcher(normalized).find()) {
                return UserIntent.CANCEL;
            }
        }
        for (String phrase : proceedPhrases) {
            if (normalized.equals(phrase)
                    || normalized.startsWith(phrase + " ")
                    || normalized.endsWith(" " + phrase)) {
                return UserIntent.PROCEED;
            }
        }
        return UserIntent.CONTINUE;
    }

    private static String normalize(String s) {
        if (s == null) {
            return "";
        }
        String lower = s.trim().toLowerCase(Locale.ROOT).replaceAll("\\s+", " ");
        return TRAILING_PUNCTUATION.matcher(lower).replaceAll("");
    }
}
