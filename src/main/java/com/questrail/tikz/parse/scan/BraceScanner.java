package com.questrail.tikz.parse.scan;

/**
 * BraceScanner
 * -----------------------------------------------------------------------------
 * Depth-counting delimiter matching over character offsets.
 *
 * <p>Labels may contain nested groups produced by formatting commands, e.g.
 * {@code {\textbf{AWS}\\small EC2}}. The closing delimiter of such a label is
 * the one that brings the nesting depth back to zero, not the first closing
 * delimiter after the opening one.</p>
 *
 * <p>This class is purely mechanical: it knows nothing about nodes, styles or
 * positions. A delimiter preceded by a backslash ({@code \{}, {@code \}}) is a
 * literal character and does not change the depth.</p>
 */
public final class BraceScanner
{
    private BraceScanner() {}

    /**
     * Finds the delimiter closing the one at {@code openIndex}.
     *
     * @param text      text to scan
     * @param openIndex index of the opening delimiter
     * @param open      opening delimiter character
     * @param close     closing delimiter character
     * @return index of the matching closing delimiter
     * @throws ScanException if {@code openIndex} does not hold {@code open} or
     *         the text ends before the depth returns to zero
     */
    public static int findMatchingClose(CharSequence text, int openIndex, char open, char close)
            throws ScanException
    {
        if (openIndex < 0 || openIndex >= text.length() || text.charAt(openIndex) != open) {
            throw new ScanException("Expected '" + open + "'", Math.max(openIndex, 0), Math.max(openIndex, 0) + 1);
        }

        int depth = 0;
        for (int i = openIndex; i < text.length(); i++) {
            char c = text.charAt(i);
            if (isEscaped(text, i)) {
                continue;
            }
            if (c == open) {
                depth++;
            } else if (c == close) {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        throw new ScanException("Unbalanced '" + open + "' (depth " + depth + " at end of text)",
                openIndex, openIndex + 1);
    }

    /**
     * Returns the index of the first {@code c} at or after {@code from} that is
     * not escaped, or {@code -1}.
     */
    public static int indexOf(CharSequence text, char c, int from) {
        for (int i = Math.max(from, 0); i < text.length(); i++) {
            if (text.charAt(i) == c && !isEscaped(text, i)) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Returns the index of the first non-whitespace character at or after
     * {@code from}, or {@code text.length()}.
     */
    public static int skipWhitespace(CharSequence text, int from) {
        int i = Math.max(from, 0);
        while (i < text.length() && Character.isWhitespace(text.charAt(i))) {
            i++;
        }
        return i;
    }

    // A character is escaped when preceded by an odd number of backslashes.
    private static boolean isEscaped(CharSequence text, int index) {
        int backslashes = 0;
        for (int i = index - 1; i >= 0 && text.charAt(i) == '\\'; i--) {
            backslashes++;
        }
        return (backslashes & 1) == 1;
    }
}
