package com.phillippitts.voiceinventory.service.speech;

import java.util.regex.Pattern;

/**
 * Strips Markdown markup so a reply reads naturally when spoken.
 */
public final class SpokenTextFormatter {

    private static final Pattern FENCE = Pattern.compile("```[a-zA-Z]*");
    private static final Pattern HEADING = Pattern.compile("(?m)^\\s{0,3}#{1,6}\\s*");
    private static final Pattern BULLET = Pattern.compile("(?m)^\\s*(?:[-*+]|\\d+\\.)\\s+");
    private static final Pattern BOLD = Pattern.compile("(\\*\\*|__)(.+?)\\1");
    private static final Pattern EMPHASIS = Pattern.compile("(?<![\\w*])([*_])(?!\\s)(.+?)(?<!\\s)\\1(?![\\w*])");
    private static final Pattern CODE = Pattern.compile("`([^`]*)`");
    private static final Pattern LINK = Pattern.compile("\\[([^\\]]+)]\\([^)]*\\)");
    private static final Pattern WHITESPACE = Pattern.compile("[ \\t]*\\n[ \\t\\n]*|[ \\t]{2,}");

    private SpokenTextFormatter() {
    }

    public static String format(String text) {
        if (text == null || text.isBlank()) {
            return "";
        }
        String out = FENCE.matcher(text).replaceAll("");
        out = HEADING.matcher(out).replaceAll("");
        out = BULLET.matcher(out).replaceAll("");
        out = BOLD.matcher(out).replaceAll("$2");
        out = EMPHASIS.matcher(out).replaceAll("$2");
        out = CODE.matcher(out).replaceAll("$1");
        out = LINK.matcher(out).replaceAll("$1");
        out = WHITESPACE.matcher(out).replaceAll(" ");
        return out.trim();
    }
}
