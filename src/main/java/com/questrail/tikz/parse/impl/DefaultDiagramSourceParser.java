package com.questrail.tikz.parse.impl;

import com.questrail.tikz.config.LayoutPolicy;
import com.questrail.tikz.model.ConnectorRecord;
import com.questrail.tikz.model.ConnectorStyle;
import com.questrail.tikz.model.DocumentPoint;
import com.questrail.tikz.model.GroupRecord;
import com.questrail.tikz.model.NodeRecord;
import com.questrail.tikz.model.PositionSpec;
import com.questrail.tikz.model.RelativeReference;
import com.questrail.tikz.observability.DiagramObservabilitySink;
import com.questrail.tikz.observability.ModelAnomalyEvent;
import com.questrail.tikz.observability.ParseAnomalyEvent;
import com.questrail.tikz.parse.DiagramSourceParser;
import com.questrail.tikz.parse.ParsedDocument;
import com.questrail.tikz.parse.scan.GroupDeclarations;
import com.questrail.tikz.parse.scan.NodeStatement;
import com.questrail.tikz.parse.scan.NodeStatementScanner;
import com.questrail.tikz.parse.scan.PositionTokens;
import com.questrail.tikz.parse.scan.ScanException;
import com.questrail.tikz.parse.scan.VerbatimRegions;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * DefaultDiagramSourceParser
 * -----------------------------------------------------------------------------
 * Concrete implementation of {@link DiagramSourceParser}.
 *
 * <p>The parser performs three independent scans over the whole document:</p>
 * <ol>
 *   <li>Node statements ({@code \node[...]}), excluding group declarations</li>
 *   <li>Connectors ({@code \draw[...] (a) -- (b)})</li>
 *   <li>Group declarations inside {@code on background layer} scopes</li>
 * </ol>
 *
 * <p>Comment lines, style declaration lines and the picture's option block
 * are never read as statements (see {@link VerbatimRegions}).</p>
 *
 * <p>Each scan skips what it cannot read and keeps going. Skips are reported
 * to the {@link DiagramObservabilitySink}; nothing is thrown.</p>
 */
public final class DefaultDiagramSourceParser implements DiagramSourceParser
{
    private static final Pattern CONNECTOR = Pattern.compile(
            "\\\\draw(?:\\[([^\\]]*)\\])?\\s*\\(([^)]+)\\)\\s*--\\s*\\(([^)]+)\\)");

    private static final int EXCERPT_LENGTH = 60;

    private final LayoutPolicy layout;
    private final DiagramObservabilitySink sink;

    public DefaultDiagramSourceParser(LayoutPolicy layout, DiagramObservabilitySink sink) {
        this.layout = Objects.requireNonNull(layout, "layout");
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    @Override
    public ParsedDocument parse(String source) {
        final String text = source == null ? "" : source;
        final VerbatimRegions verbatim = VerbatimRegions.of(text);
        return new ParsedDocument(
                text,
                parseNodes(text, verbatim),
                parseConnectors(text),
                parseGroups(text, verbatim));
    }

    // ========================================================================
    // Nodes
    // ========================================================================

    private List<NodeRecord> parseNodes(String text, VerbatimRegions verbatim) {
        List<NodeRecord> nodes = new ArrayList<>();
        Set<String> seen = new HashSet<>();

        int marker = verbatim.nextMarker(text, 0);
        while (marker >= 0) {
            final NodeStatement stmt;
            try {
                stmt = NodeStatementScanner.scanAt(text, marker);
            } catch (ScanException e) {
                reportSkipped(text, e.offset(), e.getMessage());
                marker = verbatim.nextMarker(text, e.resumeAt());
                continue;
            }
            marker = verbatim.nextMarker(text, stmt.end());

            // Group declarations are not shapes; they are read by parseGroups.
            if (GroupDeclarations.declaresFit(stmt.styleClause())
                    || GroupDeclarations.declaresFit(stmt.trailingClause())) {
                continue;
            }

            if (!seen.add(stmt.name())) {
                sink.onModelAnomaly(new ModelAnomalyEvent(
                        ModelAnomalyEvent.Kind.DUPLICATE_NODE, stmt.name(),
                        "later declaration at offset " + stmt.start() + " ignored"));
                continue;
            }
            nodes.add(toNode(text, stmt));
        }
        return nodes;
    }

    private NodeRecord toNode(String text, NodeStatement stmt) {
        final String positionText = stmt.positionText();

        DocumentPoint absolute = PositionTokens.findAbsolute(positionText).orElse(null);
        if (absolute == null && PositionTokens.hasAbsoluteToken(positionText)) {
            reportSkipped(text, stmt.start(), "non-numeric coordinate for node '" + stmt.name() + "'");
        }

        RelativeReference relative = PositionTokens.findRelativeStrict(positionText)
                .map(m -> new RelativeReference(
                        m.referenceName(),
                        m.direction(),
                        boxed(PositionTokens.findXShift(positionText)),
                        boxed(PositionTokens.findYShift(positionText))))
                .orElse(null);

        return new NodeRecord(
                stmt.name(),
                stmt.styleClause(),
                StyleClassifier.classify(stmt.styleClause()),
                new PositionSpec(absolute, relative, positionText),
                LabelCleaner.clean(stmt.label()),
                stmt.label());
    }

    // ========================================================================
    // Connectors
    // ========================================================================

    private List<ConnectorRecord> parseConnectors(String text) {
        List<ConnectorRecord> connectors = new ArrayList<>();
        Matcher m = CONNECTOR.matcher(text);
        while (m.find()) {
            String options = m.group(1) == null ? "" : m.group(1);
            String from = m.group(2).strip();
            String to = m.group(3).strip();
            if (from.isEmpty() || to.isEmpty()) {
                reportSkipped(text, m.start(), "connector with empty endpoint");
                continue;
            }
            ConnectorStyle style = options.contains("dashed") ? ConnectorStyle.DASHED : ConnectorStyle.PLAIN;
            connectors.add(new ConnectorRecord(from, to, style));
        }
        return connectors;
    }

    // ========================================================================
    // Groups
    // ========================================================================

    private List<GroupRecord> parseGroups(String text, VerbatimRegions verbatim) {
        List<GroupRecord> groups = new ArrayList<>();
        Set<String> seen = new HashSet<>();

        int scopeStart = text.indexOf(GroupDeclarations.SCOPE_BEGIN);
        while (scopeStart >= 0) {
            int scopeEnd = text.indexOf(GroupDeclarations.SCOPE_END, scopeStart);
            if (scopeEnd < 0) {
                reportSkipped(text, scopeStart, "scope without \\end{scope}");
                break;
            }

            String scope = text.substring(scopeStart, scopeEnd);
            if (scope.contains(GroupDeclarations.BACKGROUND_MARKER)) {
                for (GroupRecord g : parseGroupsInScope(text, verbatim, scopeStart, scopeEnd)) {
                    if (seen.add(g.name())) {
                        groups.add(g);
                    } else {
                        sink.onModelAnomaly(new ModelAnomalyEvent(
                                ModelAnomalyEvent.Kind.DUPLICATE_NODE, g.name(),
                                "later group declaration ignored"));
                    }
                }
            }
            scopeStart = text.indexOf(GroupDeclarations.SCOPE_BEGIN, scopeEnd);
        }
        return groups;
    }

    private List<GroupRecord> parseGroupsInScope(String text, VerbatimRegions verbatim, int scopeStart, int scopeEnd) {
        List<GroupRecord> out = new ArrayList<>();
        // Scan against the scope only, so a statement can never run past \end{scope}.
        String scope = text.substring(0, scopeEnd);

        int marker = verbatim.nextMarker(scope, scopeStart);
        while (marker >= 0) {
            final NodeStatement stmt;
            try {
                stmt = NodeStatementScanner.scanAt(scope, marker);
            } catch (ScanException e) {
                marker = verbatim.nextMarker(scope, e.resumeAt());
                continue;
            }
            marker = verbatim.nextMarker(scope, stmt.end());
            toGroup(text, stmt).ifPresent(out::add);
        }
        return out;
    }

    private Optional<GroupRecord> toGroup(String text, NodeStatement stmt) {
        Optional<GroupDeclarations.FitClause> fit = GroupDeclarations.findFit(stmt.styleClause())
                .or(() -> GroupDeclarations.findFit(stmt.trailingClause()));
        if (fit.isEmpty()) {
            if (GroupDeclarations.declaresFit(stmt.positionText())) {
                reportSkipped(text, stmt.start(), "unreadable fit clause for '" + stmt.name() + "'");
            }
            return Optional.empty();
        }

        double padding = GroupDeclarations.findInnerSep(stmt.styleClause() + " " + stmt.trailingClause())
                .orElse(layout.defaultPaddingCm());

        return Optional.of(new GroupRecord(
                stmt.name(),
                stmt.styleClause(),
                stmt.label(),
                fit.get().members(),
                padding));
    }

    // ------------------------------------------------------------------------

    private void reportSkipped(String text, int offset, String reason) {
        int end = Math.min(text.length(), offset + EXCERPT_LENGTH);
        int lineEnd = text.indexOf('\n', offset);
        if (lineEnd >= 0 && lineEnd < end) {
            end = lineEnd;
        }
        sink.onParseAnomaly(new ParseAnomalyEvent(offset, text.substring(offset, end), reason));
    }

    private static Double boxed(OptionalDouble value) {
        return value.isPresent() ? value.getAsDouble() : null;
    }
}
