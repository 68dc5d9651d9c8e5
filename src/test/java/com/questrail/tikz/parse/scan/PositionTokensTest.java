package com.questrail.tikz.parse.scan;

import com.questrail.tikz.model.Direction;
import com.questrail.tikz.model.DocumentPoint;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public class PositionTokensTest
{
    // ---------------------------------------------------------------------
    // Absolute coordinates
    // ---------------------------------------------------------------------

    @Test
    void readsCoordinateWithAndWithoutUnits() {
        assertEquals(Optional.of(new DocumentPoint(1.5, -2.0)), PositionTokens.findAbsolute("at (1.5cm, -2)"));
        assertEquals(Optional.of(new DocumentPoint(0, 0)), PositionTokens.findAbsolute("service] (a) at(0,0)"));
    }

    /**
     * Verifies that a symbolic coordinate is recognized as a token but not
     * read as a position.
     */
    @Test
    void symbolicCoordinateIsNotNumeric() {
        assertTrue(PositionTokens.findAbsolute("at (a.north)").isEmpty());
        assertTrue(PositionTokens.hasAbsoluteToken("at (a.north)"));
        assertFalse(PositionTokens.hasAbsoluteToken("right=of a"));
    }

    @Test
    void rejectsCoordinateWithWrongArity() {
        assertTrue(PositionTokens.parseCoordinate("1,2,3").isEmpty());
        assertTrue(PositionTokens.parseCoordinate("1").isEmpty());
    }

    // ---------------------------------------------------------------------
    // Relative references
    // ---------------------------------------------------------------------

    /**
     * Verifies that strict matching tries directions in a fixed order rather
     * than by position in the text.
     */
    @Test
    void strictMatchUsesDirectionOrder() {
        Optional<PositionTokens.RelativeMatch> m = PositionTokens.findRelativeStrict("right=of a, below=of b");

        assertTrue(m.isPresent());
        assertEquals(Direction.BELOW, m.get().direction());
        assertEquals("b", m.get().referenceName());
    }

    @Test
    void strictMatchRejectsLooseSpellings() {
        assertTrue(PositionTokens.findRelativeStrict("Above = of Foo").isEmpty());
        assertTrue(PositionTokens.findRelativeStrict("service").isEmpty());
    }

    @Test
    void strictMatchReadsWholeDottedOrHyphenatedName() {
        Optional<PositionTokens.RelativeMatch> m = PositionTokens.findRelativeStrict("s, below=of code-gen.v2-, xshift=1cm");

        assertTrue(m.isPresent());
        assertEquals("code-gen.v2", m.get().referenceName());
    }

    @Test
    void looseMatchToleratesCaseSpacingAndPunctuation() {
        Optional<PositionTokens.RelativeMatch> m = PositionTokens.findRelativeLoose("Above = of Foo-1.");

        assertTrue(m.isPresent());
        assertEquals(Direction.ABOVE, m.get().direction());
        assertEquals("Foo-1", m.get().referenceName());
    }

    // ---------------------------------------------------------------------
    // Shifts and options
    // ---------------------------------------------------------------------

    @Test
    void readsShifts() {
        String text = "below=of a, xshift=1.5cm, yshift=-0.5cm";
        assertEquals(1.5, PositionTokens.findXShift(text).getAsDouble(), 1e-9);
        assertEquals(-0.5, PositionTokens.findYShift(text).getAsDouble(), 1e-9);
        assertTrue(PositionTokens.findXShift("below=of a").isEmpty());
    }

    @Test
    void classifiesPositionOptions() {
        assertTrue(PositionTokens.isPositionOption(" right=of a"));
        assertTrue(PositionTokens.isPositionOption("xshift=1cm"));
        assertFalse(PositionTokens.isPositionOption("service"));
        assertFalse(PositionTokens.isPositionOption("fill=blue!10"));
    }

    @Test
    void splitOptionsIgnoresNestedCommas() {
        List<String> parts = PositionTokens.splitOptions("service, label={a, b}, fit=(x) (y)");

        assertEquals(List.of("service", " label={a, b}", " fit=(x) (y)"), parts);
    }
}
