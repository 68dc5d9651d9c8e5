package com.questrail.tikz.parse.impl;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * LabelCleaner
 * -----------------------------------------------------------------------------
 * Turns a raw label into display text.
 *
 * <p>Rules, applied in order:</p>
 * <ol>
 *   <li>{@code \textbf{x}} becomes {@code x} (repeated until none is left)</li>
 *   <li>{@code \small}, with any number of leading backslashes, becomes a line break</li>
 *   <li>{@code \\} (exactly two backslashes) becomes a line break</li>
 *   <li>any other {@code \cmd{x}} becomes {@code x}</li>
 *   <li>any other bare {@code \cmd} is removed</li>
 *   <li>remaining backslashes are removed and the result is trimmed</li>
 * </ol>
 *
 * <p>Cleaning never throws. If a rule fails the label falls back to the raw
 * text with its backslashes stripped.</p>
 */
final class LabelCleaner
{
    private static final Pattern TEXTBF_GROUP = Pattern.compile("\\\\textbf\\{([^}]*)\\}");
    private static final Pattern TEXTBF_BARE = Pattern.compile("\\\\textbf(?!\\{)");
    private static final Pattern SMALL = Pattern.compile("\\\\+small\\s*");
    private static final Pattern LINE_BREAK = Pattern.compile("\\\\\\\\(?!\\\\)");
    private static final Pattern COMMAND_GROUP = Pattern.compile("\\\\[a-zA-Z]+\\{([^}]*)\\}");
    private static final Pattern COMMAND_BARE = Pattern.compile("\\\\[a-zA-Z]+\\s*");

    // Bounds the unwrap loop for pathological nesting such as \textbf{\textbf{...}}.
    private static final int MAX_UNWRAP_ROUNDS = 16;

    private LabelCleaner() {}

    static String clean(String raw) {
        if (raw == null) {
            return "";
        }
        try {
            String text = raw;
            for (int i = 0; i < MAX_UNWRAP_ROUNDS && text.contains("\\textbf"); i++) {
                String next = replaceWithGroup(TEXTBF_GROUP, text);
                next = TEXTBF_BARE.matcher(next).replaceAll("");
                if (next.equals(text)) {
                    break;
                }
                text = next;
            }
            text = SMALL.matcher(text).replaceAll("\n");
            text = LINE_BREAK.matcher(text).replaceAll("\n");
            text = replaceWithGroup(COMMAND_GROUP, text);
            text = COMMAND_BARE.matcher(text).replaceAll("");
            text = text.replace("\\", "");
            return text.strip();
        } catch (RuntimeException e) {
            return raw.replace("\\", "").strip();
        }
    }

    private static String replaceWithGroup(Pattern p, String text) {
        Matcher m = p.matcher(text);
        return m.replaceAll(r -> Matcher.quoteReplacement(r.group(1)));
    }
}
