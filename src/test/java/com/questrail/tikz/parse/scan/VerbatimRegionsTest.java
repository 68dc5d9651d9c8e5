package com.questrail.tikz.parse.scan;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class VerbatimRegionsTest
{
    private static final String SOURCE = String.join("\n",
            "\\begin{tikzpicture}[node distance=2cm,",
            "  box/.style={draw}]",
            "  % \\node[s] (old) {Old};",
            "\\node[s] (a) {A};",
            "\\end{tikzpicture}");

    @Test
    void coversCommentLinesAndPictureOptions() {
        VerbatimRegions regions = VerbatimRegions.of(SOURCE);

        assertTrue(regions.contains(SOURCE.indexOf("node distance")));
        assertTrue(regions.contains(SOURCE.indexOf("box/.style")));
        assertTrue(regions.contains(SOURCE.indexOf("\\node[s] (old)")));
        assertFalse(regions.contains(SOURCE.indexOf("\\node[s] (a)")));
        assertFalse(regions.contains(SOURCE.indexOf("\\end{tikzpicture}")));
    }

    @Test
    void nextMarkerSkipsCoveredStatements() {
        VerbatimRegions regions = VerbatimRegions.of(SOURCE);

        assertEquals(SOURCE.indexOf("\\node[s] (a)"), regions.nextMarker(SOURCE, 0));
        assertEquals(-1, regions.nextMarker(SOURCE, SOURCE.indexOf("\\node[s] (a)") + 1));
    }

    @Test
    void unclosedPictureOptionsCoverTheirLine() {
        String source = "\\begin{tikzpicture}[scale=2 \\node[s] (x) {X};\n\\node[s] (y) {Y};";
        VerbatimRegions regions = VerbatimRegions.of(source);

        assertEquals(source.indexOf("\\node[s] (y)"), regions.nextMarker(source, 0));
    }
}
