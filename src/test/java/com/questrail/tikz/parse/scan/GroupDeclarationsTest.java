package com.questrail.tikz.parse.scan;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class GroupDeclarationsTest
{
    @Test
    void readsParenthesizedMembers() {
        String style = "fill=blue!10, fit=(a) (b) (c), inner sep=0.4cm";
        GroupDeclarations.FitClause fit = GroupDeclarations.findFit(style).orElseThrow();

        assertEquals(List.of("a", "b", "c"), fit.members());
        assertEquals("fit=(a) (b) (c)", style.substring(fit.start(), fit.end()));
    }

    /**
     * Verifies that several names inside one parenthesized group are split
     * and that duplicates collapse.
     */
    @Test
    void readsSeveralNamesPerGroupWithoutDuplicates() {
        GroupDeclarations.FitClause fit = GroupDeclarations.findFit("fit=(a, b) (b)").orElseThrow();
        assertEquals(List.of("a", "b"), fit.members());
    }

    @Test
    void readsBareMembers() {
        String style = "draw, fit=web api, rounded corners";
        GroupDeclarations.FitClause fit = GroupDeclarations.findFit(style).orElseThrow();

        assertEquals(List.of("web", "api"), fit.members());
        assertEquals("fit=web api", style.substring(fit.start(), fit.end()));
    }

    @Test
    void absentFitClause() {
        assertTrue(GroupDeclarations.findFit("fill=red").isEmpty());
        assertFalse(GroupDeclarations.declaresFit("fill=red"));
        assertTrue(GroupDeclarations.declaresFit("x, fit = ???"));
    }

    @Test
    void readsInnerSep() {
        assertEquals(0.5, GroupDeclarations.findInnerSep("inner sep=0.5cm").getAsDouble(), 1e-9);
        assertTrue(GroupDeclarations.findInnerSep("fill=red").isEmpty());
    }

    @Test
    void formatsMembers() {
        assertEquals("fit=(a) (b)", GroupDeclarations.formatFit(List.of("a", "b")));
    }
}
