package com.questrail.tikz.model;

/**
 * Strategy that produced a node's coordinate.
 *
 * <p>The first two are regular resolution; the last three are the ordered
 * fallback tiers.</p>
 */
public enum ResolutionTier {
    /** Absolute coordinate converted directly. */
    ABSOLUTE,
    /** Reference position plus shift, found by the fixed-point passes. */
    RELATIVE,
    /** Tier A: reference re-extracted with loose matching. */
    LOOSE_MATCH,
    /** Tier B: offset from the source of an incoming connector. */
    CONNECTOR_INFERENCE,
    /** Tier C: deterministic grid cell. */
    GRID
}
