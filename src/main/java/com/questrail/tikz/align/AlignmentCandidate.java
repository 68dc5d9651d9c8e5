package com.questrail.tikz.align;

import com.questrail.tikz.model.Point;

/**
 * One node a point could align with.
 *
 * @param kind       line family
 * @param nodeName   the aligned node
 * @param projection the point projected exactly onto the node's line
 * @param distance   distance from the point to {@code projection}
 */
public record AlignmentCandidate(AlignmentKind kind, String nodeName, Point projection, double distance) {
}
