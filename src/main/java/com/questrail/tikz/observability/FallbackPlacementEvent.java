package com.questrail.tikz.observability;

import com.questrail.tikz.model.Point;
import com.questrail.tikz.model.ResolutionTier;

/**
 * A node placed by a fallback tier rather than by its declared position.
 */
public record FallbackPlacementEvent(String nodeName, ResolutionTier tier, Point placedAt) {
}
