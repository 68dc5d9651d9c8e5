package com.questrail.tikz.regen.impl;

import com.questrail.tikz.parse.scan.NodeStatement;
import com.questrail.tikz.parse.scan.NodeStatementScanner;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class StatementRewriterTest
{
    private static final String AT = "at (2.00cm,0.00cm)";

    private static String rewrite(String text) throws Exception {
        NodeStatement stmt = NodeStatementScanner.scanAt(text, 0);
        return StatementRewriter.rewriteNode(text, stmt, AT);
    }

    // ---------------------------------------------------------------------
    // Node statements
    // ---------------------------------------------------------------------

    @Test
    void relativeOptionIsReplacedByCoordinate() throws Exception {
        assertEquals("\\node[service] (b) at (2.00cm,0.00cm) {B};",
                rewrite("\\node[service, right=of a] (b) {B};"));
    }

    @Test
    void coordinateBeforeNameMovesAfterName() throws Exception {
        assertEquals("\\node[service] (a) at (2.00cm,0.00cm) {A};",
                rewrite("\\node[service] at (1,2) (a) {A};"));
    }

    @Test
    void trailingOptionListIsDroppedOnceEmpty() throws Exception {
        assertEquals("\\node[service] (c) at (2.00cm,0.00cm) {C};",
                rewrite("\\node[service] (c) [below=of a, xshift=1cm] {C};"));
        assertEquals("\\node[service] (c) at (2.00cm,0.00cm) {C};",
                rewrite("\\node[service] (c) [Right = of a] {C};"));
    }

    /**
     * Verifies that a style clause without position options is kept byte for
     * byte, including its irregular spacing.
     */
    @Test
    void styleWithoutPositionKeepsSpacing() throws Exception {
        assertEquals("\\node[ service ,draw] (a) at (2.00cm,0.00cm) {A};",
                rewrite("\\node[ service ,draw] (a) at (0,0) {A};"));
    }

    @Test
    void labelAndTerminatorAreVerbatim() throws Exception {
        assertEquals("\\node[service] (a) at (2.00cm,0.00cm) {\\textbf{A}\\\\ B} ;",
                rewrite("\\node[service] (a) at (0,0) {\\textbf{A}\\\\ B} ;"));
    }

    @Test
    void statementWithoutLabel() throws Exception {
        assertEquals("\\node[service] (a) at (2.00cm,0.00cm);",
                rewrite("\\node[service] (a) at (0,0);"));
    }

    @Test
    void statementSpanningLines() throws Exception {
        assertEquals("\\node[service]\n  (b) at (2.00cm,0.00cm) {B};",
                rewrite("\\node[service,\n  right=of a]\n  (b) {B};"));
    }

    // ---------------------------------------------------------------------
    // Group statements
    // ---------------------------------------------------------------------

    @Test
    void fitClauseIsReplacedByMembers() throws Exception {
        String text = "\\node[group, fit=(a) (b), inner sep=0.3cm] (g) {G};";
        NodeStatement stmt = NodeStatementScanner.scanAt(text, 0);

        assertEquals("\\node[group, fit=(a), inner sep=0.3cm] (g) {G};",
                StatementRewriter.rewriteGroup(text, stmt, List.of("a")).orElseThrow());
    }

    @Test
    void fitClauseAfterNameIsReplaced() throws Exception {
        String text = "\\node[group] (g) [fit=a b] {G};";
        NodeStatement stmt = NodeStatementScanner.scanAt(text, 0);

        assertEquals("\\node[group] (g) [fit=(b) (c)] {G};",
                StatementRewriter.rewriteGroup(text, stmt, List.of("b", "c")).orElseThrow());
    }

    @Test
    void statementWithoutFitIsNotAGroup() throws Exception {
        String text = "\\node[service] (a) {A};";
        NodeStatement stmt = NodeStatementScanner.scanAt(text, 0);

        assertTrue(StatementRewriter.rewriteGroup(text, stmt, List.of("a")).isEmpty());
    }

    // ---------------------------------------------------------------------
    // Clause cleaning
    // ---------------------------------------------------------------------

    @Test
    void cleanStyleKeepsNonPositionOptions() {
        assertEquals("cloud, fill=blue!10", StatementRewriter.cleanStyle("cloud, above=of a, yshift=-1cm, fill=blue!10"));
        assertEquals("service ", StatementRewriter.cleanStyle("service "));
    }

    @Test
    void cleanTrailingRemovesEveryPositionToken() {
        assertEquals("", StatementRewriter.cleanTrailing(" at (1cm, 2cm) "));
        assertEquals("[draw]", StatementRewriter.cleanTrailing(" [left=of x, draw]"));
    }
}
