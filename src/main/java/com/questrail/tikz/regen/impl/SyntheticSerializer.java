package com.questrail.tikz.regen.impl;

import com.questrail.tikz.model.ConnectorRecord;
import com.questrail.tikz.model.ConnectorStyle;
import com.questrail.tikz.model.DiagramModel;
import com.questrail.tikz.model.DocumentPoint;
import com.questrail.tikz.model.GroupRecord;
import com.questrail.tikz.model.NodeRecord;
import com.questrail.tikz.parse.scan.GroupDeclarations;
import com.questrail.tikz.parse.scan.PositionTokens;

import java.util.ArrayList;
import java.util.List;

/**
 * Minimal serialization built from the model alone.
 *
 * <p>Nodes are written with the style keyword of their shape category and
 * their original label; groups go into one background scope; connectors
 * follow. No formatting from the source is kept.</p>
 */
final class SyntheticSerializer
{
    private static final String INDENT = "    ";

    private SyntheticSerializer() {}

    static String serialize(DiagramModel model, ExportCoordinates export) {
        StringBuilder sb = new StringBuilder();
        sb.append("\\begin{tikzpicture}\n");

        for (NodeRecord node : model.resolvedNodes()) {
            DocumentPoint p = export.of(node.name()).orElseThrow();
            sb.append(INDENT)
              .append("\\node[").append(node.shape().styleKeyword()).append("] (")
              .append(node.name()).append(") ")
              .append(export.atClause(p))
              .append(" {").append(node.rawLabel()).append("};\n");
        }

        List<GroupRecord> groups = new ArrayList<>();
        for (GroupRecord g : model.groups()) {
            if (!g.members().isEmpty()) {
                groups.add(g);
            }
        }
        if (!groups.isEmpty()) {
            sb.append(INDENT).append(GroupDeclarations.SCOPE_BEGIN)
              .append('[').append(GroupDeclarations.BACKGROUND_MARKER).append("]\n");
            for (GroupRecord g : groups) {
                String style = styleWithoutFit(g.styleClause());
                sb.append(INDENT).append(INDENT)
                  .append("\\node[")
                  .append(style.isEmpty() ? "" : style + ", ")
                  .append(GroupDeclarations.formatFit(g.members()))
                  .append("] (").append(g.name()).append(") {")
                  .append(g.label()).append("};\n");
            }
            sb.append(INDENT).append(GroupDeclarations.SCOPE_END).append('\n');
        }

        for (ConnectorRecord c : model.connectors()) {
            sb.append(INDENT)
              .append("\\draw[").append(c.style() == ConnectorStyle.DASHED ? "dashed" : "").append("] (")
              .append(c.sourceName()).append(") -- (")
              .append(c.targetName()).append(");\n");
        }

        sb.append("\\end{tikzpicture}\n");
        return sb.toString();
    }

    private static String styleWithoutFit(String style) {
        List<String> kept = new ArrayList<>();
        for (String option : PositionTokens.splitOptions(style)) {
            if (!option.isBlank() && !GroupDeclarations.declaresFit(option)) {
                kept.add(option.strip());
            }
        }
        return String.join(", ", kept);
    }
}
