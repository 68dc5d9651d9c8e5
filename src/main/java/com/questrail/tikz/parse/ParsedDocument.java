package com.questrail.tikz.parse;

import com.questrail.tikz.model.ConnectorRecord;
import com.questrail.tikz.model.GroupRecord;
import com.questrail.tikz.model.NodeRecord;

import java.util.List;
import java.util.Objects;

/**
 * Unresolved output of a parse: records in declaration order, node names
 * already de-duplicated (first declaration wins).
 */
public record ParsedDocument(
        String source,
        List<NodeRecord> nodes,
        List<ConnectorRecord> connectors,
        List<GroupRecord> groups
) {
    public ParsedDocument {
        source = source == null ? "" : source;
        nodes = List.copyOf(Objects.requireNonNull(nodes, "nodes"));
        connectors = List.copyOf(Objects.requireNonNull(connectors, "connectors"));
        groups = List.copyOf(Objects.requireNonNull(groups, "groups"));
    }
}
