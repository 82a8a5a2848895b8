package com.phillippitts.voiceinventory.service.context;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Scores first-person against third-person narration in a transcript.
 * "I replaced the filter" suggests the performer is speaking; "the technician replaced it" an operator.
 */
public final class SpeakerInference {

    private static final List<Pattern> FIRST_PERSON = List.of(
            Pattern.compile("(?i)\\b(i|we)\\s+(have\\s+|just\\s+|already\\s+)?"
                    + "(repaired|fixed|checked|installed|replaced|serviced|inspected|tested|did)\\b"),
            Pattern.compile("(?i)\\b(i'm|i am|we're|we are)\\s+(from|with)\\s+\\w+"),
            Pattern.compile("(?i)\\b(i|we)\\s+(finished|completed)\\s+(the\\s+)?(job|work|repair|maintenance)"),
            Pattern.compile("(?i)\\b(i|we)\\s+came\\s+(in|by|over)\\b")
    );

    private static final List<Pattern> THIRD_PERSON = List.of(
            Pattern.compile("(?i)\\b(he|she|they)\\s+(has\\s+|have\\s+|just\\s+)?"
                    + "(repaired|fixed|checked|installed|replaced|serviced|inspected|tested|came)\\b"),
            Pattern.compile("(?i)\\bthe\\s+(technician|technicians|engineer|vendor|company|contractor)\\s+"
                    + "(has\\s+|have\\s+)?(repaired|fixed|checked|installed|replaced|serviced|came|did)\\b"),
            Pattern.compile("(?i)\\b(they|he|she)\\s+(said|told)\\b"),
            Pattern.compile("(?i)\\bsomeone\\s+from\\s+\\w+")
    );

    private SpeakerInference() {
    }

    public static SpeakerHint infer(String transcript) {
        if (transcript == null || transcript.isBlank()) {
            return SpeakerHint.UNKNOWN;
        }
        long first = FIRST_PERSON.stream().filter(p -> p.matcher(transcript).find()).count();
        long third = THIRD_PERSON.stream().filter(p -> p.matcher(transcript).find()).count();
        if (first > third) {
            return SpeakerHint.LIKELY_PERFORMER;
        }
        if (third > first) {
            return SpeakerHint.LIKELY_OPERATOR;
        }
        return SpeakerHint.UNKNOWN;
    }
}
