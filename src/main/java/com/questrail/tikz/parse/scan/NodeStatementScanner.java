package com.questrail.tikz.parse.scan;

import java.util.Optional;

/**
 * NodeStatementScanner
 * -----------------------------------------------------------------------------
 * Locates {@code \node[...]} statements in raw text.
 *
 * <p>Grammar recognized, with whitespace allowed between parts:</p>
 * <pre>
 *   \node[ style ] [at (x,y)] ( name ) position-clause { label } [;]
 *   \node[ style ] [at (x,y)] ( name ) position-clause ;
 * </pre>
 *
 * <p>The style clause and the label are matched with
 * {@link BraceScanner#findMatchingClose}, so nested brackets and braces are
 * handled. A label must open before the statement terminator; a statement
 * without a label ends at its {@code ;}.</p>
 *
 * <p>Malformed statements raise {@link ScanException} carrying a resume offset
 * just past the point of failure; the scanner never consumes more text than
 * it could explain.</p>
 */
public final class NodeStatementScanner
{
    public static final String MARKER = "\\node[";

    private NodeStatementScanner() {}

    /**
     * Returns the offset of the next statement marker at or after {@code from},
     * or {@code -1}.
     */
    public static int findMarker(String text, int from) {
        return text.indexOf(MARKER, Math.max(from, 0));
    }

    /**
     * Scans the statement beginning at the marker found at {@code markerIndex}.
     *
     * @throws ScanException if the statement is malformed
     */
    public static NodeStatement scanAt(String text, int markerIndex) throws ScanException {
        if (!text.startsWith(MARKER, markerIndex)) {
            throw new ScanException("No node marker", markerIndex, markerIndex + 1);
        }

        final int styleOpen = markerIndex + MARKER.length() - 1;
        final int styleClose = closeOrFail(text, styleOpen, '[', ']', "style clause");
        final String style = text.substring(styleOpen + 1, styleClose);

        final int nameOpen = BraceScanner.indexOf(text, '(', styleClose + 1);
        final int terminator = BraceScanner.indexOf(text, ';', styleClose + 1);
        if (nameOpen < 0 || (terminator >= 0 && terminator < nameOpen)) {
            throw new ScanException("Missing node name", markerIndex, styleClose + 1);
        }

        // An "at (x,y)" may precede the name; the name is then the next group.
        int namePos = nameOpen;
        String leading = text.substring(styleClose + 1, nameOpen);
        if (leading.strip().equals("at")) {
            final int coordClose = closeOrFail(text, nameOpen, '(', ')', "coordinate");
            namePos = BraceScanner.indexOf(text, '(', coordClose + 1);
            int term = BraceScanner.indexOf(text, ';', coordClose + 1);
            if (namePos < 0 || (term >= 0 && term < namePos)) {
                throw new ScanException("Missing node name", markerIndex, coordClose + 1);
            }
            leading = text.substring(styleClose + 1, namePos);
        }

        final int nameClose = text.indexOf(')', namePos);
        if (nameClose < 0) {
            throw new ScanException("Unterminated node name", markerIndex, namePos + 1);
        }
        final String name = text.substring(namePos + 1, nameClose).strip();
        if (name.isEmpty()) {
            throw new ScanException("Empty node name", markerIndex, nameClose + 1);
        }

        final int labelOpen = BraceScanner.indexOf(text, '{', nameClose + 1);
        final int stmtEnd = BraceScanner.indexOf(text, ';', nameClose + 1);

        if (labelOpen < 0 || (stmtEnd >= 0 && stmtEnd < labelOpen)) {
            if (stmtEnd < 0) {
                throw new ScanException("Node statement has neither label nor terminator",
                        markerIndex, nameClose + 1);
            }
            return new NodeStatement(markerIndex, stmtEnd + 1, style, name, namePos, nameClose,
                    leading, text.substring(nameClose + 1, stmtEnd), "", false);
        }

        final int labelClose = closeOrFail(text, labelOpen, '{', '}', "label");
        int end = labelClose + 1;
        int afterLabel = BraceScanner.skipWhitespace(text, end);
        if (afterLabel < text.length() && text.charAt(afterLabel) == ';') {
            end = afterLabel + 1;
        }

        return new NodeStatement(markerIndex, end, style, name, namePos, nameClose,
                leading,
                text.substring(nameClose + 1, labelOpen),
                text.substring(labelOpen + 1, labelClose),
                true);
    }

    /**
     * Reads only the head of a statement {@link #scanAt} rejected: style clause
     * and name, both on the marker's line. The returned statement has no label
     * and ends at the end of that line (or at the next marker on it), with
     * everything after the name in its trailing clause.
     *
     * @return empty when even the style clause or the name cannot be read
     */
    public static Optional<NodeStatement> scanHeadAt(String text, int markerIndex) {
        if (!text.startsWith(MARKER, markerIndex)) {
            return Optional.empty();
        }
        int lineEnd = text.indexOf('\n', markerIndex);
        if (lineEnd < 0) {
            lineEnd = text.length();
        }
        int next = findMarker(text, markerIndex + 1);
        if (next >= 0 && next < lineEnd) {
            lineEnd = next;
        }
        final String line = text.substring(0, lineEnd);

        final int styleOpen = markerIndex + MARKER.length() - 1;
        final int styleClose;
        try {
            styleClose = BraceScanner.findMatchingClose(line, styleOpen, '[', ']');
        } catch (ScanException e) {
            return Optional.empty();
        }

        int namePos = BraceScanner.indexOf(line, '(', styleClose + 1);
        if (namePos < 0) {
            return Optional.empty();
        }
        String leading = line.substring(styleClose + 1, namePos);
        if (leading.strip().equals("at")) {
            int coordClose = line.indexOf(')', namePos);
            namePos = coordClose < 0 ? -1 : BraceScanner.indexOf(line, '(', coordClose + 1);
            if (namePos < 0) {
                return Optional.empty();
            }
            leading = line.substring(styleClose + 1, namePos);
        } else if (!leading.isBlank()) {
            return Optional.empty();
        }

        final int nameClose = line.indexOf(')', namePos);
        if (nameClose < 0) {
            return Optional.empty();
        }
        final String name = line.substring(namePos + 1, nameClose).strip();
        if (name.isEmpty()) {
            return Optional.empty();
        }

        return Optional.of(new NodeStatement(markerIndex, lineEnd,
                line.substring(styleOpen + 1, styleClose), name, namePos, nameClose,
                leading, line.substring(nameClose + 1), "", false));
    }

    private static int closeOrFail(String text, int openIndex, char open, char close, String what)
            throws ScanException
    {
        try {
            return BraceScanner.findMatchingClose(text, openIndex, open, close);
        } catch (ScanException e) {
            throw new ScanException("Unbalanced " + what + ": " + e.getMessage(),
                    openIndex, openIndex + 1);
        }
    }
}
