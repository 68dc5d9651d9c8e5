package com.questrail.tikz.resolve;

import com.questrail.tikz.align.AlignmentEngine;
import com.questrail.tikz.config.LayoutPolicy;
import com.questrail.tikz.model.ConnectorRecord;
import com.questrail.tikz.model.DiagramModel;
import com.questrail.tikz.model.NodeRecord;
import com.questrail.tikz.model.Point;
import com.questrail.tikz.model.RelativeReference;
import com.questrail.tikz.model.ResolutionTier;
import com.questrail.tikz.observability.DiagramObservabilitySink;
import com.questrail.tikz.observability.FallbackPlacementEvent;
import com.questrail.tikz.parse.scan.PositionTokens;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * PositionResolver
 * -----------------------------------------------------------------------------
 * Assigns a canvas coordinate to every node of a model.
 *
 * <h2>Phases</h2>
 * <ol>
 *   <li><b>Seed</b>: nodes with an absolute coordinate and no relative
 *       reference are placed at the converted coordinate.</li>
 *   <li><b>Fixed point</b>: {@link ResolutionPass} is applied until a pass
 *       places nothing or the pass limit is reached. Cyclic references simply
 *       stop making progress.</li>
 *   <li><b>Fallback</b>, up to the fallback pass limit; for each remaining
 *       node in declaration order:
 *       <ul>
 *         <li>{@link ResolutionTier#LOOSE_MATCH}: the reference is re-read
 *             from the raw position text with loose matching and looked up
 *             exactly, then ignoring case;</li>
 *         <li>{@link ResolutionTier#CONNECTOR_INFERENCE}: otherwise the node
 *             is offset from the source of the first incoming connector whose
 *             source is placed.</li>
 *       </ul></li>
 *   <li><b>Grid</b> ({@link ResolutionTier#GRID}): whatever is left goes into
 *       the fallback grid, in declaration order.</li>
 * </ol>
 *
 * <p>Fallback placements are snapped through the {@link AlignmentEngine} and
 * reported to the {@link DiagramObservabilitySink}. After {@link #resolve}
 * returns, every node of the model is placed.</p>
 */
public final class PositionResolver
{
    private final LayoutPolicy layout;
    private final AlignmentEngine alignment;
    private final DiagramObservabilitySink sink;
    private final ResolutionPass pass;

    public PositionResolver(LayoutPolicy layout, AlignmentEngine alignment, DiagramObservabilitySink sink) {
        this.layout = Objects.requireNonNull(layout, "layout");
        this.alignment = Objects.requireNonNull(alignment, "alignment");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.pass = new ResolutionPass(layout);
    }

    /**
     * Places every unplaced node of {@code model}. Already placed nodes are
     * kept and serve as anchors.
     */
    public ResolutionStats resolve(DiagramModel model) {
        Objects.requireNonNull(model, "model");

        for (NodeRecord node : model.nodes()) {
            if (!node.isResolved() && node.position().isAbsoluteOnly()) {
                node.place(layout.toCanvas(node.position().absolute()), ResolutionTier.ABSOLUTE);
            }
        }

        int fixedPointPasses = runFixedPoint(model);
        int fallbackPasses = runFallbackTiers(model);
        int gridPlaced = runGrid(model);

        return new ResolutionStats(fixedPointPasses, fallbackPasses, gridPlaced);
    }

    // ========================================================================
    // Fixed point
    // ========================================================================

    private int runFixedPoint(DiagramModel model) {
        int passes = 0;
        while (passes < layout.maxResolutionPasses()) {
            List<NodeRecord> unresolved = unresolved(model);
            if (unresolved.isEmpty()) {
                break;
            }
            passes++;

            Map<String, Point> placed = pass.apply(unresolved, centers(model));
            if (placed.isEmpty()) {
                break;
            }
            for (NodeRecord node : unresolved) {
                Point p = placed.get(node.name());
                if (p != null) {
                    node.place(p, node.position().relative() != null ? ResolutionTier.RELATIVE : ResolutionTier.ABSOLUTE);
                }
            }
        }
        return passes;
    }

    // ========================================================================
    // Tiers A and B
    // ========================================================================

    private int runFallbackTiers(DiagramModel model) {
        int passes = 0;
        while (passes < layout.maxFallbackPasses()) {
            List<NodeRecord> unresolved = unresolved(model);
            if (unresolved.isEmpty()) {
                break;
            }
            passes++;

            boolean progress = false;
            for (NodeRecord node : unresolved) {
                if (tryLooseMatch(model, node) || tryConnectorInference(model, node)) {
                    progress = true;
                }
            }
            if (!progress) {
                break;
            }
        }
        return passes;
    }

    private boolean tryLooseMatch(DiagramModel model, NodeRecord node) {
        String raw = node.position().rawText();
        Optional<PositionTokens.RelativeMatch> match = PositionTokens.findRelativeLoose(raw);
        if (match.isEmpty()) {
            return false;
        }

        Optional<NodeRecord> anchor = findResolved(model, match.get().referenceName());
        if (anchor.isEmpty()) {
            return false;
        }

        RelativeReference ref = new RelativeReference(
                anchor.get().name(),
                match.get().direction(),
                boxed(PositionTokens.findXShift(raw)),
                boxed(PositionTokens.findYShift(raw)));
        Point offset = RelativeOffsets.offsetOf(ref, layout);
        Point target = anchor.get().requireCenter().translate(offset.x(), offset.y());

        placeFallback(model, node, target, ResolutionTier.LOOSE_MATCH);
        return true;
    }

    private boolean tryConnectorInference(DiagramModel model, NodeRecord node) {
        for (ConnectorRecord c : model.connectors()) {
            if (!c.targetName().equals(node.name())) {
                continue;
            }
            Optional<Point> source = model.node(c.sourceName()).flatMap(NodeRecord::center);
            if (source.isPresent()) {
                Point target = source.get().translate(layout.connectorOffset().x(), layout.connectorOffset().y());
                placeFallback(model, node, target, ResolutionTier.CONNECTOR_INFERENCE);
                return true;
            }
        }
        return false;
    }

    private static Optional<NodeRecord> findResolved(DiagramModel model, String name) {
        Optional<NodeRecord> exact = model.node(name).filter(NodeRecord::isResolved);
        if (exact.isPresent()) {
            return exact;
        }
        for (NodeRecord candidate : model.resolvedNodes()) {
            if (candidate.name().equalsIgnoreCase(name)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    // ========================================================================
    // Tier C
    // ========================================================================

    private int runGrid(DiagramModel model) {
        List<NodeRecord> remaining = unresolved(model);
        int columns = layout.gridColumns();
        for (int i = 0; i < remaining.size(); i++) {
            int col = i % columns;
            int row = i / columns;
            Point cell = new Point(
                    layout.gridOrigin().x() + (col - columns / 2.0) * layout.gridCellWidth(),
                    layout.gridOrigin().y() + row * layout.gridCellHeight());
            placeFallback(model, remaining.get(i), cell, ResolutionTier.GRID);
        }
        return remaining.size();
    }

    // ------------------------------------------------------------------------

    private void placeFallback(DiagramModel model, NodeRecord node, Point target, ResolutionTier tier) {
        Point snapped = alignment.snap(target, model.resolvedNodes(), node.name());
        node.place(snapped, tier);
        sink.onFallbackPlacement(new FallbackPlacementEvent(node.name(), tier, snapped));
    }

    private static List<NodeRecord> unresolved(DiagramModel model) {
        List<NodeRecord> out = new ArrayList<>();
        for (NodeRecord node : model.nodes()) {
            if (!node.isResolved()) {
                out.add(node);
            }
        }
        return out;
    }

    private static Map<String, Point> centers(DiagramModel model) {
        Map<String, Point> out = new LinkedHashMap<>();
        for (NodeRecord node : model.resolvedNodes()) {
            out.put(node.name(), node.requireCenter());
        }
        return out;
    }

    private static Double boxed(OptionalDouble value) {
        return value.isPresent() ? value.getAsDouble() : null;
    }
}
