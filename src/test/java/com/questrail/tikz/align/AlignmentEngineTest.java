package com.questrail.tikz.align;

import com.questrail.tikz.config.LayoutPolicy;
import com.questrail.tikz.model.NodeRecord;
import com.questrail.tikz.model.Point;
import com.questrail.tikz.model.PositionSpec;
import com.questrail.tikz.model.ResolutionTier;
import com.questrail.tikz.model.ShapeCategory;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class AlignmentEngineTest
{
    private final AlignmentEngine engine = new AlignmentEngine(LayoutPolicy.defaults());

    // Unit grid: rounding never hides which projection was chosen.
    private static NodeRecord placed(String name, double x, double y) {
        NodeRecord n = new NodeRecord(name, "service", ShapeCategory.DEFAULT_RECTANGLE,
                PositionSpec.none(""), name, name);
        n.place(new Point(x, y), ResolutionTier.ABSOLUTE);
        return n;
    }

    // ---------------------------------------------------------------------
    // Classification
    // ---------------------------------------------------------------------

    @Test
    void classifiesRowAndColumn() {
        NodeRecord n = placed("n", 100, 200);

        AlignmentCandidates row = engine.candidates(new Point(157, 204), List.of(n), null);
        assertEquals(1, row.of(AlignmentKind.ROW).size());
        assertTrue(row.of(AlignmentKind.COLUMN).isEmpty());
        assertEquals(new Point(157, 200), row.of(AlignmentKind.ROW).get(0).projection());

        AlignmentCandidates column = engine.candidates(new Point(106, 326), List.of(n), null);
        assertEquals(1, column.of(AlignmentKind.COLUMN).size());
        assertTrue(column.of(AlignmentKind.ROW).isEmpty());
    }

    /**
     * Verifies both diagonal families and the exact projection of the point
     * onto the node's diagonal.
     */
    @Test
    void classifiesDiagonals() {
        NodeRecord n = placed("n", 100, 100);

        AlignmentCandidates a = engine.candidates(new Point(151, 148), List.of(n), null);
        assertEquals(1, a.of(AlignmentKind.DIAGONAL_A).size());
        assertEquals(new Point(149.5, 149.5), a.of(AlignmentKind.DIAGONAL_A).get(0).projection());
        assertTrue(a.of(AlignmentKind.DIAGONAL_B).isEmpty());

        AlignmentCandidates b = engine.candidates(new Point(49, 148), List.of(n), null);
        assertEquals(1, b.of(AlignmentKind.DIAGONAL_B).size());
        assertEquals(new Point(50.5, 149.5), b.of(AlignmentKind.DIAGONAL_B).get(0).projection());
    }

    @Test
    void ignoresExcludedAndUnplacedNodes() {
        NodeRecord moving = placed("moving", 100, 100);
        NodeRecord unplaced = new NodeRecord("u", "", ShapeCategory.DEFAULT_RECTANGLE,
                PositionSpec.none(""), "", "");

        assertTrue(engine.candidates(new Point(100, 100), List.of(moving, unplaced), "moving").isEmpty());
    }

    // ---------------------------------------------------------------------
    // Snapping
    // ---------------------------------------------------------------------

    @Test
    void snapsOntoRowThenGrid() {
        assertEquals(new Point(160, 200), engine.snap(new Point(157, 204), List.of(placed("n", 100, 200)), null));
    }

    @Test
    void withoutCandidateOnlyRoundsToGrid() {
        assertEquals(new Point(40, 40), engine.snap(new Point(33, 47), List.of(), null));
        assertEquals(new Point(40, 40), engine.snap(new Point(33, 47), List.of(placed("n", 500, 500)), null));
    }

    /**
     * Verifies the tie-break: a row and a column candidate at the same
     * distance resolve to the row.
     */
    @Test
    void rowWinsTieAgainstColumn() {
        List<NodeRecord> nodes = List.of(placed("col", 100, 0), placed("row", 0, 200));

        AlignmentCandidate best = engine.candidates(new Point(105, 205), nodes, null).closest().orElseThrow();

        assertEquals(AlignmentKind.ROW, best.kind());
        assertEquals(new Point(105, 200), best.projection());
    }

    @Test
    void closerCandidateWinsOverPriority() {
        List<NodeRecord> nodes = List.of(placed("row", 0, 200), placed("col", 102, 0));

        // Row is 6 away, column 3 away.
        AlignmentCandidate best = engine.candidates(new Point(105, 206), nodes, null).closest().orElseThrow();

        assertEquals(AlignmentKind.COLUMN, best.kind());
        assertEquals(new Point(102, 206), best.projection());
    }

    /**
     * Verifies that snapping an already snapped point returns it unchanged,
     * for nodes on and off the grid.
     */
    @Test
    void snapIsIdempotent() {
        List<NodeRecord> nodes = List.of(
                placed("a", 400, 300),
                placed("b", 517, 303),
                placed("c", 283, 181),
                placed("d", 612, 455));

        for (int x = 200; x <= 700; x += 7) {
            for (int y = 100; y <= 550; y += 11) {
                Point once = engine.snap(new Point(x, y), nodes, null);
                assertEquals(once, engine.snap(once, nodes, null), "snap of (" + x + ", " + y + ")");
            }
        }
    }
}
