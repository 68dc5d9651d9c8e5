package com.questrail.tikz.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * DiagramModel
 * -----------------------------------------------------------------------------
 * The in-memory geometry of one open document.
 *
 * <p>Nodes and groups live in an arena indexed by name that preserves
 * declaration order. The model also keeps the source text it was parsed from
 * (for round-trip regeneration) and the grid-snap flag that governs both
 * interactive moves and export precision.</p>
 *
 * <p>The model holds document geometry only; viewport state such as zoom or
 * pan belongs to the caller.</p>
 *
 * <p>Not thread-safe. All commands are expected to run on one thread.</p>
 */
public final class DiagramModel
{
    private final String sourceText;
    private final Map<String, NodeRecord> nodes = new LinkedHashMap<>();
    private final Map<String, GroupRecord> groups = new LinkedHashMap<>();
    private final List<ConnectorRecord> connectors = new ArrayList<>();
    private boolean gridSnap;

    public DiagramModel(String sourceText) {
        this.sourceText = sourceText == null ? "" : sourceText;
    }

    public String sourceText() {
        return sourceText;
    }

    /**
     * Adds a node unless one with the same name already exists.
     *
     * @return {@code true} if the node was added; {@code false} for a duplicate
     */
    public boolean addNode(NodeRecord node) {
        Objects.requireNonNull(node, "node");
        return nodes.putIfAbsent(node.name(), node) == null;
    }

    public boolean addGroup(GroupRecord group) {
        Objects.requireNonNull(group, "group");
        return groups.putIfAbsent(group.name(), group) == null;
    }

    public void addConnector(ConnectorRecord connector) {
        connectors.add(Objects.requireNonNull(connector, "connector"));
    }

    public void removeConnectors(Collection<ConnectorRecord> dropped) {
        connectors.removeAll(dropped);
    }

    public void removeGroup(String name) {
        groups.remove(name);
    }

    public Optional<NodeRecord> node(String name) {
        return Optional.ofNullable(nodes.get(name));
    }

    public Optional<GroupRecord> group(String name) {
        return Optional.ofNullable(groups.get(name));
    }

    /** Nodes in declaration order. */
    public Collection<NodeRecord> nodes() {
        return Collections.unmodifiableCollection(nodes.values());
    }

    public Collection<GroupRecord> groups() {
        return Collections.unmodifiableCollection(groups.values());
    }

    public List<ConnectorRecord> connectors() {
        return Collections.unmodifiableList(connectors);
    }

    public List<NodeRecord> resolvedNodes() {
        return nodes.values().stream().filter(NodeRecord::isResolved).toList();
    }

    public boolean isGridSnap() {
        return gridSnap;
    }

    public void setGridSnap(boolean gridSnap) {
        this.gridSnap = gridSnap;
    }
}
