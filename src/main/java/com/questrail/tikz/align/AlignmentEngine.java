package com.questrail.tikz.align;

import com.questrail.tikz.config.LayoutPolicy;
import com.questrail.tikz.model.NodeRecord;
import com.questrail.tikz.model.Point;

import java.util.Collection;
import java.util.Objects;

/**
 * AlignmentEngine
 * -----------------------------------------------------------------------------
 * Geometric alignment shared by interactive editing and automatic layout.
 *
 * <h2>Classification</h2>
 * <p>Given a point P and the placed nodes, every node N (other than an
 * optionally excluded one) is tested against one threshold {@code t}:</p>
 * <ul>
 *   <li>{@link AlignmentKind#ROW}: {@code |N.y - P.y| < t}</li>
 *   <li>{@link AlignmentKind#COLUMN}: {@code |N.x - P.x| < t}</li>
 *   <li>{@link AlignmentKind#DIAGONAL_A}: N lies within {@code t} (vertically)
 *       of the line {@code y - P.y = x - P.x}</li>
 *   <li>{@link AlignmentKind#DIAGONAL_B}: N lies within {@code t} (vertically)
 *       of the line {@code y - P.y = -(x - P.x)}</li>
 * </ul>
 *
 * <h2>Snapping</h2>
 * <p>The closest candidate over all kinds is selected (ties: row, column,
 * diagonal A, diagonal B), P is projected exactly onto that node's
 * row/column/diagonal, and both axes are then rounded to the grid. Without a
 * candidate within threshold, P is just rounded to the grid.</p>
 *
 * <p>Snapping is idempotent as long as the threshold does not exceed half the
 * grid size: a projection moves a grid point by less than half a cell, so
 * rounding brings it back.</p>
 *
 * <p>Stateless; one instance may be shared.</p>
 */
public final class AlignmentEngine
{
    private final double threshold;
    private final double gridSize;

    public AlignmentEngine(LayoutPolicy layout) {
        Objects.requireNonNull(layout, "layout");
        this.threshold = layout.alignmentThreshold();
        this.gridSize = layout.gridSize();
    }

    /**
     * Classifies every placed node relative to {@code p}.
     *
     * @param p            the candidate point
     * @param nodes        nodes to test; unresolved nodes are ignored
     * @param excludedName node to leave out (e.g. the one being moved); may be {@code null}
     */
    public AlignmentCandidates candidates(Point p, Collection<NodeRecord> nodes, String excludedName) {
        Objects.requireNonNull(p, "p");
        Objects.requireNonNull(nodes, "nodes");

        AlignmentCandidates out = new AlignmentCandidates();
        for (NodeRecord node : nodes) {
            if (!node.isResolved() || node.name().equals(excludedName)) {
                continue;
            }
            Point n = node.requireCenter();

            if (Math.abs(n.y() - p.y()) < threshold) {
                out.add(new AlignmentCandidate(AlignmentKind.ROW, node.name(),
                        new Point(p.x(), n.y()), Math.abs(p.y() - n.y())));
            }

            if (Math.abs(n.x() - p.x()) < threshold) {
                out.add(new AlignmentCandidate(AlignmentKind.COLUMN, node.name(),
                        new Point(n.x(), p.y()), Math.abs(p.x() - n.x())));
            }

            double expectedA = p.y() + (n.x() - p.x());
            if (Math.abs(n.y() - expectedA) < threshold) {
                // Line y = x + c through N.
                double c = n.y() - n.x();
                double px = (p.x() + p.y() - c) / 2;
                Point proj = new Point(px, px + c);
                out.add(new AlignmentCandidate(AlignmentKind.DIAGONAL_A, node.name(), proj, p.distanceTo(proj)));
            }

            double expectedB = p.y() - (n.x() - p.x());
            if (Math.abs(n.y() - expectedB) < threshold) {
                // Line y = -x + c through N.
                double c = n.y() + n.x();
                double px = (p.x() - p.y() + c) / 2;
                Point proj = new Point(px, -px + c);
                out.add(new AlignmentCandidate(AlignmentKind.DIAGONAL_B, node.name(), proj, p.distanceTo(proj)));
            }
        }
        return out;
    }

    /**
     * Snaps {@code p} onto the closest alignment line, then onto the grid.
     *
     * @see #candidates(Point, Collection, String)
     */
    public Point snap(Point p, Collection<NodeRecord> nodes, String excludedName) {
        return candidates(p, nodes, excludedName).closest()
                .filter(c -> c.distance() < threshold)
                .map(c -> roundToGrid(c.projection()))
                .orElseGet(() -> roundToGrid(p));
    }

    public Point roundToGrid(Point p) {
        return new Point(roundToGrid(p.x()), roundToGrid(p.y()));
    }

    public double roundToGrid(double v) {
        return Math.round(v / gridSize) * gridSize;
    }
}
