package com.questrail.tikz.align;

/**
 * Line families a point can align with.
 *
 * <p>Declaration order is the tie-break priority used by snapping: when two
 * candidates are equally close, the one whose kind comes first wins.</p>
 */
public enum AlignmentKind {
    /** Same row: the candidate's y is within threshold. */
    ROW,
    /** Same column: the candidate's x is within threshold. */
    COLUMN,
    /** Diagonal {@code y = x + c} through the candidate (canvas orientation). */
    DIAGONAL_A,
    /** Diagonal {@code y = -x + c} through the candidate (canvas orientation). */
    DIAGONAL_B
}
