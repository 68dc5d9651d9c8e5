package com.questrail.tikz.resolve;

/**
 * Summary of one resolution run.
 *
 * @param fixedPointPasses passes taken by the fixed-point phase (zero if nothing was relative)
 * @param fallbackPasses   passes taken by the interleaved loose / connector tiers
 * @param gridPlaced       nodes that reached the last-resort grid
 */
public record ResolutionStats(int fixedPointPasses, int fallbackPasses, int gridPlaced) {
}
