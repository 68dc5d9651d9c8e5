package com.questrail.tikz.resolve;

import com.questrail.tikz.config.LayoutPolicy;
import com.questrail.tikz.model.NodeRecord;
import com.questrail.tikz.model.Point;
import com.questrail.tikz.model.RelativeReference;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * One fixed-point pass over the relative references.
 *
 * <p>A pass is a pure function: every node is evaluated against the same
 * resolved map, and nodes placed during the pass are only visible to the next
 * one. The outcome therefore does not depend on the order of
 * {@code unresolved}.</p>
 */
final class ResolutionPass
{
    private final LayoutPolicy layout;

    ResolutionPass(LayoutPolicy layout) {
        this.layout = layout;
    }

    /**
     * @param unresolved nodes without a coordinate
     * @param resolved   snapshot of placed centers by name; not modified
     * @return centers placed by this pass, keyed by node name
     */
    Map<String, Point> apply(Collection<NodeRecord> unresolved, Map<String, Point> resolved) {
        Map<String, Point> placed = new LinkedHashMap<>();
        for (NodeRecord node : unresolved) {
            place(node, resolved).ifPresent(p -> placed.put(node.name(), p));
        }
        return placed;
    }

    private Optional<Point> place(NodeRecord node, Map<String, Point> resolved) {
        Optional<RelativeReference> relative = node.position().relativeReference();
        if (relative.isPresent()) {
            // A declared reference takes precedence over a declared coordinate.
            Point anchor = resolved.get(relative.get().referenceName());
            if (anchor == null) {
                return Optional.empty();
            }
            Point offset = RelativeOffsets.offsetOf(relative.get(), layout);
            return Optional.of(anchor.translate(offset.x(), offset.y()));
        }
        return node.position().absoluteCoordinate().map(layout::toCanvas);
    }
}
