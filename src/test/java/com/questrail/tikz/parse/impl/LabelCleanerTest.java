package com.questrail.tikz.parse.impl;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class LabelCleanerTest
{
    // ---------------------------------------------------------------------
    // Line breaks
    // ---------------------------------------------------------------------

    @Test
    void boldTitleWithSmallSubtitleBecomesTwoLines() {
        assertEquals("AWS\nEC2", LabelCleaner.clean("\\textbf{AWS}\\\\small EC2"));
    }

    @Test
    void doubleBackslashBecomesLineBreak() {
        assertEquals("Line1\nLine2", LabelCleaner.clean("Line1\\\\Line2"));
    }

    // ---------------------------------------------------------------------
    // Commands
    // ---------------------------------------------------------------------

    @Test
    void unwrapsNestedBold() {
        assertEquals("A", LabelCleaner.clean("\\textbf{\\textbf{A}}"));
        assertEquals("", LabelCleaner.clean("\\textbf{}"));
        assertEquals("", LabelCleaner.clean("\\textbf"));
    }

    @Test
    void keepsArgumentOfOtherCommands() {
        assertEquals("x y", LabelCleaner.clean("\\emph{x} y"));
    }

    @Test
    void removesBareCommandsAndStrayBackslashes() {
        assertEquals("Text", LabelCleaner.clean("\\centering Text"));
        assertEquals("a_b", LabelCleaner.clean("a\\_b"));
    }

    @Test
    void nullAndPlainText() {
        assertEquals("", LabelCleaner.clean(null));
        assertEquals("Plain", LabelCleaner.clean("  Plain  "));
    }
}
