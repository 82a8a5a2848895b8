package com.phillippitts.voiceinventory.service.context;

import com.phillippitts.voiceinventory.exception.ExtractionException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Cleans transcripts before they are embedded in a model prompt.
 *
 * <p>Removes control and zero-width characters and collapses whitespace. Empty or over-long input is
 * rejected. Input that looks like an attempt to override the prompt is still processed, truncated,
 * and flagged.
 */
public class InputSanitizer {

    private static final Logger LOG = LogManager.getLogger(InputSanitizer.class);

    static final int SUSPICIOUS_MAX_LENGTH = 100;

    private static final Pattern INVISIBLE = Pattern.compile("[\\p{Cntrl}&&[^\\s]]|[\\u200B\\u200C\\u200D\\uFEFF]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final List<Pattern> SUSPICIOUS = List.of(
            Pattern.compile("(?i)(ignore|disregard|forget).*(system|previous instructions|instructions above)"),
            Pattern.compile("\\$\\{.*}"),
            Pattern.compile("\\.\\./\\.\\./")
    );

    private final int maxLength;

    public InputSanitizer(int maxLength) {
        if (maxLength < 1) {
            throw new IllegalArgumentException("maxLength must be positive");
        }
        this.maxLength = maxLength;
    }

    /**
     * @throws ExtractionException with kind {@code INVALID_INPUT} if the cleaned input is empty or too long
     */
    public SanitizedInput sanitize(String input) {
        if (input == null) {
            throw new ExtractionException(ExtractionException.Kind.INVALID_INPUT, "Input is empty");
        }
        String cleaned = INVISIBLE.matcher(input).replaceAll("");
        cleaned = WHITESPACE.matcher(cleaned).replaceAll(" ").trim();
        if (cleaned.isEmpty()) {
            throw new ExtractionException(ExtractionException.Kind.INVALID_INPUT, "Input is empty", input);
        }
        if (cleaned.length() > maxLength) {
            LOG.warn("Rejected transcript of {} characters (max {})", cleaned.length(), maxLength);
            throw new ExtractionException(ExtractionException.Kind.INVALID_INPUT,
                    "Input too long (max " + maxLength + " characters)", input);
        }
        for (Pattern pattern : SUSPICIOUS) {
            if (pattern.matcher(cleaned).find()) {
                LOG.warn("Suspicious pattern in transcript: {}", pattern.pattern());
                String limited = cleaned.length() > SUSPICIOUS_MAX_LENGTH
                        ? cleaned.substring(0, SUSPICIOUS_MAX_LENGTH) : cleaned;
                return new SanitizedInput(limited, true);
            }
        }
        return new SanitizedInput(cleaned, false);
    }

    /**
     * @param text cleaned text to send
     * @param suspicious whether a prompt-override pattern was found
     */
    public record SanitizedInput(String text, boolean suspicious) {
    }
}
