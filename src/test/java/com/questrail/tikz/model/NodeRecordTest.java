package com.questrail.tikz.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class NodeRecordTest
{
    private static NodeRecord node(ShapeCategory shape, String label) {
        return new NodeRecord("n", "", shape, PositionSpec.none(""), label, label);
    }

    // ---------------------------------------------------------------------
    // Size
    // ---------------------------------------------------------------------

    @Test
    void shortLabelGetsMinimumSize() {
        NodeRecord n = node(ShapeCategory.DEFAULT_RECTANGLE, "A");

        assertEquals(120, n.width());
        assertEquals(50, n.height());
    }

    @Test
    void widthFollowsLongestLineUpToCap() {
        assertEquals(160, node(ShapeCategory.DEFAULT_RECTANGLE, "twenty characters!!!").width());
        assertEquals(250, node(ShapeCategory.DEFAULT_RECTANGLE, "x".repeat(60)).width());
    }

    @Test
    void heightCountsNonBlankLines() {
        assertEquals(60, node(ShapeCategory.DEFAULT_RECTANGLE, "one\ntwo").height());
        assertEquals(60, node(ShapeCategory.DEFAULT_RECTANGLE, "one\n\n  \ntwo").height());
        assertEquals(80, node(ShapeCategory.DEFAULT_RECTANGLE, "1\n2\n3").height());
    }

    @Test
    void ellipseIsWider() {
        assertEquals(168, node(ShapeCategory.ELLIPSE, "").width());
        assertEquals(350, node(ShapeCategory.ELLIPSE, "x".repeat(40)).width());
    }

    // ---------------------------------------------------------------------
    // Placement
    // ---------------------------------------------------------------------

    @Test
    void unplacedNodeHasNoCenter() {
        NodeRecord n = node(ShapeCategory.DEFAULT_RECTANGLE, "A");

        assertFalse(n.isResolved());
        assertTrue(n.tier().isEmpty());
        assertThrows(IllegalStateException.class, n::requireCenter);
        assertThrows(IllegalStateException.class, () -> n.moveTo(new Point(1, 1)));
    }

    @Test
    void moveKeepsResolutionTier() {
        NodeRecord n = node(ShapeCategory.DEFAULT_RECTANGLE, "A");
        n.place(new Point(10, 20), ResolutionTier.GRID);

        n.moveTo(new Point(30, 40));

        assertEquals(new Point(30, 40), n.requireCenter());
        assertEquals(ResolutionTier.GRID, n.tier().orElseThrow());
        assertEquals(new Box(new Point(30, 40), 120, 50), n.box());
    }
}
