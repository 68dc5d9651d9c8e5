package com.questrail.tikz.parse.scan;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class NodeStatementScannerTest
{
    // ---------------------------------------------------------------------
    // Happy Path
    // ---------------------------------------------------------------------

    /**
     * Verifies that every part of a complete statement is located and that
     * the statement end includes the terminator.
     */
    @Test
    void scansCompleteStatement() throws ScanException {
        String text = "  \\node[service] (a) at (0,0) {A}; rest";
        NodeStatement stmt = NodeStatementScanner.scanAt(text, 2);

        assertEquals("service", stmt.styleClause());
        assertEquals("a", stmt.name());
        assertEquals(" at (0,0) ", stmt.trailingClause());
        assertEquals("A", stmt.label());
        assertTrue(stmt.hasLabel());
        assertEquals(text.indexOf(" rest"), stmt.end());
        assertEquals('(', text.charAt(stmt.nameOpen()));
        assertEquals(')', text.charAt(stmt.nameClose()));
    }

    /**
     * Verifies that a label containing nested formatting groups is kept
     * whole.
     */
    @Test
    void keepsNestedLabel() throws ScanException {
        String text = "\\node[cloud] (aws) {\\textbf{AWS}\\\\small{EC2}};";
        NodeStatement stmt = NodeStatementScanner.scanAt(text, 0);

        assertEquals("\\textbf{AWS}\\\\small{EC2}", stmt.label());
        assertEquals(text.length(), stmt.end());
    }

    @Test
    void acceptsCoordinateBeforeName() throws ScanException {
        String text = "\\node[db] at (1,2) (store) {Store};";
        NodeStatement stmt = NodeStatementScanner.scanAt(text, 0);

        assertEquals("store", stmt.name());
        assertTrue(stmt.positionText().contains("at (1,2)"));
    }

    @Test
    void statementWithoutLabelEndsAtTerminator() throws ScanException {
        String text = "\\node[service] (a) at (1,1); \\node[service] (b) {B};";
        NodeStatement stmt = NodeStatementScanner.scanAt(text, 0);

        assertFalse(stmt.hasLabel());
        assertEquals("", stmt.label());
        assertEquals(text.indexOf(';') + 1, stmt.end());
    }

    @Test
    void positionTextJoinsStyleAndTrailingClauses() throws ScanException {
        NodeStatement stmt = NodeStatementScanner.scanAt("\\node[service, right=of a] (b) [yshift=1cm] {B};", 0);
        String position = stmt.positionText();

        assertTrue(position.contains("right=of a"));
        assertTrue(position.contains("yshift=1cm"));
    }

    // ---------------------------------------------------------------------
    // Malformed Input
    // ---------------------------------------------------------------------

    @Test
    void rejectsUnterminatedLabel() {
        assertThrows(ScanException.class,
                () -> NodeStatementScanner.scanAt("\\node[service] (a) {never closed", 0));
    }

    @Test
    void rejectsMissingName() {
        ScanException e = assertThrows(ScanException.class,
                () -> NodeStatementScanner.scanAt("\\node[service]; \\node[x] (y) {Y};", 0));
        assertTrue(e.resumeAt() > 0);
    }

    @Test
    void rejectsEmptyName() {
        assertThrows(ScanException.class, () -> NodeStatementScanner.scanAt("\\node[x] ( ) {X};", 0));
    }

    /**
     * Verifies that the head of a statement with an unbalanced label is still
     * readable, and that it stops at the end of its line.
     */
    @Test
    void scanHeadReadsStyleAndNameOfUnbalancedStatement() {
        String text = "\\node[s, below=of a] (b2) {B {x};\n\\node[s] (c) {C};";
        assertThrows(ScanException.class, () -> NodeStatementScanner.scanAt(text, 0));

        NodeStatement head = NodeStatementScanner.scanHeadAt(text, 0).orElseThrow();

        assertEquals("b2", head.name());
        assertEquals("s, below=of a", head.styleClause());
        assertEquals(" {B {x};", head.trailingClause());
        assertFalse(head.hasLabel());
        assertEquals(text.indexOf('\n'), head.end());
    }

    @Test
    void scanHeadNeedsClosedStyleAndName() {
        assertTrue(NodeStatementScanner.scanHeadAt("\\node[s (b) {B};", 0).isEmpty());
        assertTrue(NodeStatementScanner.scanHeadAt("\\node[s] {B};", 0).isEmpty());
        assertTrue(NodeStatementScanner.scanHeadAt("\\node[s] ( ) {B};", 0).isEmpty());
    }
}
