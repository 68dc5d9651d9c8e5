package com.questrail.tikz.parse.scan;

import java.util.ArrayList;
import java.util.List;

/**
 * VerbatimRegions
 * -----------------------------------------------------------------------------
 * Offsets of a document that are neither read as statements nor rewritten:
 * comment lines, style declaration lines ({@code /.style=},
 * {@code node distance=}) and the option block of {@code \begin{tikzpicture}}.
 *
 * <p>The parser and the regenerator both consult the same regions, so a
 * statement is either in the model and rewritten, or in neither.</p>
 */
public final class VerbatimRegions
{
    private static final String BEGIN_PICTURE = "\\begin{tikzpicture}";

    private final List<int[]> ranges;

    private VerbatimRegions(List<int[]> ranges) {
        this.ranges = ranges;
    }

    public static VerbatimRegions of(String source) {
        List<int[]> ranges = new ArrayList<>();

        int lineStart = 0;
        while (lineStart <= source.length()) {
            int lineEnd = source.indexOf('\n', lineStart);
            if (lineEnd < 0) {
                lineEnd = source.length();
            }
            String stripped = source.substring(lineStart, lineEnd).strip();
            if (stripped.startsWith("%")
                    || stripped.contains("/.style=")
                    || stripped.contains("node distance=")) {
                ranges.add(new int[] { lineStart, lineEnd });
            }
            lineStart = lineEnd + 1;
        }

        int begin = source.indexOf(BEGIN_PICTURE);
        while (begin >= 0) {
            int open = BraceScanner.skipWhitespace(source, begin + BEGIN_PICTURE.length());
            if (open < source.length() && source.charAt(open) == '[') {
                try {
                    ranges.add(new int[] { begin, BraceScanner.findMatchingClose(source, open, '[', ']') + 1 });
                } catch (ScanException e) {
                    // Unclosed option block: the rest of that line at least is options.
                    int eol = source.indexOf('\n', open);
                    ranges.add(new int[] { begin, eol < 0 ? source.length() : eol });
                }
            }
            begin = source.indexOf(BEGIN_PICTURE, begin + 1);
        }
        return new VerbatimRegions(ranges);
    }

    public boolean contains(int offset) {
        for (int[] r : ranges) {
            if (offset >= r[0] && offset < r[1]) {
                return true;
            }
        }
        return false;
    }

    /**
     * The first statement marker at or after {@code from} that lies outside
     * every region, or -1.
     */
    public int nextMarker(String source, int from) {
        int marker = NodeStatementScanner.findMarker(source, from);
        while (marker >= 0 && contains(marker)) {
            marker = NodeStatementScanner.findMarker(source, marker + 1);
        }
        return marker;
    }
}
