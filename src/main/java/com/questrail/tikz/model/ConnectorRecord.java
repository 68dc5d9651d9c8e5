package com.questrail.tikz.model;

import java.util.Objects;

/**
 * Directed, styled link between two node names.
 *
 * <p>Endpoints are names, not node references: they are checked against the
 * resolved node set and dangling connectors are dropped, never reported as
 * errors.</p>
 */
public record ConnectorRecord(String sourceName, String targetName, ConnectorStyle style) {

    public ConnectorRecord {
        Objects.requireNonNull(sourceName, "sourceName");
        Objects.requireNonNull(targetName, "targetName");
        Objects.requireNonNull(style, "style");
    }
}
