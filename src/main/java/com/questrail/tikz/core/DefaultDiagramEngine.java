package com.questrail.tikz.core;

import com.questrail.tikz.align.AlignmentEngine;
import com.questrail.tikz.api.DiagramEngine;
import com.questrail.tikz.config.DiagramEngineConfig;
import com.questrail.tikz.group.BoundingBoxCalculator;
import com.questrail.tikz.model.Box;
import com.questrail.tikz.model.ConnectorRecord;
import com.questrail.tikz.model.DiagramModel;
import com.questrail.tikz.model.GroupRecord;
import com.questrail.tikz.model.NodeRecord;
import com.questrail.tikz.model.Point;
import com.questrail.tikz.observability.DiagramObservabilitySink;
import com.questrail.tikz.observability.ModelAnomalyEvent;
import com.questrail.tikz.parse.DiagramSourceParser;
import com.questrail.tikz.parse.ParsedDocument;
import com.questrail.tikz.parse.impl.DefaultDiagramSourceParser;
import com.questrail.tikz.regen.Regenerator;
import com.questrail.tikz.regen.impl.RoundTripRegenerator;
import com.questrail.tikz.resolve.PositionResolver;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * DefaultDiagramEngine
 * -----------------------------------------------------------------------------
 * Wires parser, resolver, alignment, bounding-box calculator and regenerator
 * into a {@link DiagramEngine}.
 *
 * <p>All collaborators are built from one {@link DiagramEngineConfig} so that
 * they share the same layout constants, membership policy and sink.</p>
 */
public final class DefaultDiagramEngine implements DiagramEngine
{
    private final DiagramObservabilitySink sink;
    private final DiagramSourceParser parser;
    private final AlignmentEngine alignment;
    private final PositionResolver resolver;
    private final BoundingBoxCalculator groups;
    private final Regenerator regenerator;

    public DefaultDiagramEngine() {
        this(DiagramEngineConfig.defaults());
    }

    public DefaultDiagramEngine(DiagramEngineConfig config) {
        Objects.requireNonNull(config, "config");
        this.sink = config.observabilitySink();
        this.parser = new DefaultDiagramSourceParser(config.layout(), sink);
        this.alignment = new AlignmentEngine(config.layout());
        this.resolver = new PositionResolver(config.layout(), alignment, sink);
        this.groups = new BoundingBoxCalculator(config.layout(), config.membershipPolicy(), sink);
        this.regenerator = new RoundTripRegenerator(config.layout(), sink);
    }

    @Override
    public DiagramModel parse(String source) {
        ParsedDocument doc = parser.parse(source);

        DiagramModel model = new DiagramModel(doc.source());
        doc.nodes().forEach(model::addNode);
        doc.groups().forEach(model::addGroup);
        doc.connectors().forEach(model::addConnector);

        resolver.resolve(model);
        dropDanglingConnectors(model);
        groups.initialize(model);
        return model;
    }

    @Override
    public DiagramModel moveNode(DiagramModel model, String nodeName, double x, double y) {
        Objects.requireNonNull(model, "model");
        Objects.requireNonNull(nodeName, "nodeName");

        Optional<NodeRecord> node = model.node(nodeName).filter(NodeRecord::isResolved);
        if (node.isEmpty()) {
            reportUnknown(nodeName, "moveNode");
            return model;
        }

        Point target = new Point(x, y);
        if (model.isGridSnap()) {
            target = alignment.snap(target, model.resolvedNodes(), nodeName);
        }
        node.get().moveTo(target);
        groups.onNodeMoved(model, nodeName);
        return model;
    }

    @Override
    public DiagramModel resizeGroup(DiagramModel model, String groupName, Box box) {
        Objects.requireNonNull(model, "model");
        Objects.requireNonNull(groupName, "groupName");
        Objects.requireNonNull(box, "box");

        Optional<GroupRecord> group = model.group(groupName);
        if (group.isEmpty()) {
            reportUnknown(groupName, "resizeGroup");
            return model;
        }
        groups.resize(model, group.get(), box);
        return model;
    }

    @Override
    public DiagramModel moveGroup(DiagramModel model, String groupName, double x, double y) {
        Objects.requireNonNull(model, "model");
        Objects.requireNonNull(groupName, "groupName");

        Optional<GroupRecord> group = model.group(groupName).filter(g -> g.box().isPresent());
        if (group.isEmpty()) {
            reportUnknown(groupName, "moveGroup");
            return model;
        }
        groups.move(model, group.get(), new Point(x, y));
        return model;
    }

    @Override
    public DiagramModel setGridSnap(DiagramModel model, boolean gridSnap) {
        Objects.requireNonNull(model, "model");
        model.setGridSnap(gridSnap);
        return model;
    }

    @Override
    public DiagramModel reparse(DiagramModel model) {
        Objects.requireNonNull(model, "model");
        DiagramModel fresh = parse(regenerate(model));
        fresh.setGridSnap(model.isGridSnap());
        return fresh;
    }

    @Override
    public String regenerate(DiagramModel model) {
        Objects.requireNonNull(model, "model");
        return regenerator.regenerate(model);
    }

    // ------------------------------------------------------------------------

    private void dropDanglingConnectors(DiagramModel model) {
        List<ConnectorRecord> dangling = new ArrayList<>();
        for (ConnectorRecord c : model.connectors()) {
            if (model.node(c.sourceName()).isEmpty() || model.node(c.targetName()).isEmpty()) {
                dangling.add(c);
                sink.onModelAnomaly(new ModelAnomalyEvent(
                        ModelAnomalyEvent.Kind.DANGLING_CONNECTOR,
                        c.sourceName() + " -> " + c.targetName(),
                        "endpoint is not a declared node"));
            }
        }
        model.removeConnectors(dangling);
    }

    private void reportUnknown(String name, String command) {
        sink.onModelAnomaly(new ModelAnomalyEvent(
                ModelAnomalyEvent.Kind.UNKNOWN_TARGET, name, command + " ignored"));
    }
}
