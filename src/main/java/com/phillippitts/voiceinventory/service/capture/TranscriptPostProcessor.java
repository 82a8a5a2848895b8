package com.phillippitts.voiceinventory.service.capture;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Cleans finalized transcripts: collapses whitespace and rewrites known misrecognized terms
 * (whole words, case-insensitive) to their canonical spelling.
 */
public class TranscriptPostProcessor {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final List<Correction> corrections;

    public TranscriptPostProcessor(Map<String, String> corrections) {
        List<Correction> compiled = new ArrayList<>();
        if (corrections != null) {
            corrections.forEach((heard, canonical) -> {
                if (heard != null && !heard.isBlank() && canonical != null) {
                    Pattern p = Pattern.compile("\\b" + Pattern.quote(heard.trim()) + "\\b",
                            Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
                    compiled.add(new Correction(p, Matcher.quoteReplacement(canonical)));
                }
            });
        }
        this.corrections = List.copyOf(compiled);
    }

    public String process(String transcript) {
        if (transcript == null) {
            return "";
        }
        String text = WHITESPACE.matcher(transcript).replaceAll(" ").trim();
        for (Correction c : corrections) {
            text = c.pattern.matcher(text).replaceAll(c.replacement);
        }
        return text;
    }

    private record Correction(Pattern pattern, String replacement) {
    }
}
