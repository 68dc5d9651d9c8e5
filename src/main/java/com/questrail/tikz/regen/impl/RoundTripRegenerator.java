package com.questrail.tikz.regen.impl;

import com.questrail.tikz.config.LayoutPolicy;
import com.questrail.tikz.model.DiagramModel;
import com.questrail.tikz.model.DocumentPoint;
import com.questrail.tikz.model.GroupRecord;
import com.questrail.tikz.model.NodeRecord;
import com.questrail.tikz.observability.DiagramObservabilitySink;
import com.questrail.tikz.observability.RegenerationEvent;
import com.questrail.tikz.parse.scan.GroupDeclarations;
import com.questrail.tikz.parse.scan.NodeStatement;
import com.questrail.tikz.parse.scan.NodeStatementScanner;
import com.questrail.tikz.parse.scan.ScanException;
import com.questrail.tikz.parse.scan.VerbatimRegions;
import com.questrail.tikz.regen.Regenerator;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * RoundTripRegenerator
 * -----------------------------------------------------------------------------
 * {@link Regenerator} that rewrites the statements of the model's source text
 * in place and copies everything else.
 *
 * <h2>Copied unchanged</h2>
 * <ul>
 *   <li>the option block of {@code \begin{tikzpicture}}, up to the bracket
 *       that closes it</li>
 *   <li>comment lines and style declaration lines ({@code /.style=},
 *       {@code node distance=}), even when they mention {@code \node[}</li>
 *   <li>all text outside {@code \node[} statements: scope markers,
 *       {@code \draw} connectors, blank lines, unrecognized text</li>
 *   <li>statements whose style clause or name cannot be read</li>
 * </ul>
 * <p>An {@code \end{tikzpicture}} missing its closing brace is repaired.</p>
 *
 * <h2>Statements rewritten</h2>
 * <ul>
 *   <li>node statements get their position replaced by the exported
 *       coordinate (see {@link ExportClustering}); a statement naming no
 *       placed node borrows the coordinate of a node whose name matches
 *       loosely, or gets the configured unmatched coordinate. A statement
 *       whose label cannot be read is rewritten up to the end of its line
 *       and placed the same way;</li>
 *   <li>group statements get their fit clause replaced by the current
 *       members, unless the group has none or is not in the model.</li>
 * </ul>
 * <p>Statements may span lines; only their own text is replaced.</p>
 *
 * <h2>Safety check</h2>
 * <p>If the source is blank, or does not mention every placed node by name,
 * the source is not trusted and {@link SyntheticSerializer} is used instead.
 * Either way one {@link RegenerationEvent} is reported.</p>
 */
public final class RoundTripRegenerator implements Regenerator
{
    private static final Pattern UNCLOSED_END_PICTURE = Pattern.compile("\\\\end\\{tikzpicture(?!\\})");

    private final LayoutPolicy layout;
    private final DiagramObservabilitySink sink;
    private final ExportClustering clustering;

    public RoundTripRegenerator(LayoutPolicy layout, DiagramObservabilitySink sink) {
        this.layout = Objects.requireNonNull(layout, "layout");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.clustering = new ExportClustering(layout);
    }

    @Override
    public String regenerate(DiagramModel model) {
        Objects.requireNonNull(model, "model");

        ExportCoordinates export = clustering.compute(model.resolvedNodes(), model.isGridSnap());

        Optional<String> distrust = distrustReason(model);
        if (distrust.isPresent()) {
            sink.onRegeneration(new RegenerationEvent(RegenerationEvent.Mode.SYNTHESIZED, distrust.get()));
            return SyntheticSerializer.serialize(model, export);
        }

        String out = rewrite(model, export);
        sink.onRegeneration(new RegenerationEvent(RegenerationEvent.Mode.ROUND_TRIP, ""));
        return out;
    }

    private static Optional<String> distrustReason(DiagramModel model) {
        String source = model.sourceText();
        if (source.isBlank()) {
            return Optional.of("no source text");
        }
        for (NodeRecord node : model.resolvedNodes()) {
            if (!source.contains(node.name())) {
                return Optional.of("source does not mention node '" + node.name() + "'");
            }
        }
        return Optional.empty();
    }

    // ========================================================================
    // Rewrite pass
    // ========================================================================

    private String rewrite(DiagramModel model, ExportCoordinates export) {
        String source = model.sourceText();
        VerbatimRegions verbatim = VerbatimRegions.of(source);

        StringBuilder sb = new StringBuilder(source.length());
        int pos = 0;
        int marker = verbatim.nextMarker(source, 0);
        while (marker >= 0) {
            NodeStatement stmt;
            try {
                stmt = NodeStatementScanner.scanAt(source, marker);
            } catch (ScanException e) {
                // Unreadable body: place the node by its head alone if that much parses.
                Optional<NodeStatement> head = NodeStatementScanner.scanHeadAt(source, marker)
                        .filter(h -> !isGroup(h));
                if (head.isEmpty()) {
                    marker = verbatim.nextMarker(source, e.resumeAt());
                    continue;
                }
                stmt = head.get();
            }
            sb.append(source, pos, stmt.start());
            sb.append(replacement(source, stmt, model, export));
            pos = stmt.end();
            marker = verbatim.nextMarker(source, pos);
        }
        sb.append(source, pos, source.length());

        return UNCLOSED_END_PICTURE.matcher(sb).replaceAll(Matcher.quoteReplacement("\\end{tikzpicture}"));
    }

    private static boolean isGroup(NodeStatement stmt) {
        return GroupDeclarations.declaresFit(stmt.styleClause())
                || GroupDeclarations.declaresFit(stmt.trailingClause());
    }

    private String replacement(String source, NodeStatement stmt, DiagramModel model, ExportCoordinates export) {
        String verbatim = source.substring(stmt.start(), stmt.end());

        if (isGroup(stmt)) {
            List<String> members = model.group(stmt.name()).map(GroupRecord::members).orElse(List.of());
            if (members.isEmpty()) {
                return verbatim;
            }
            return StatementRewriter.rewriteGroup(source, stmt, members).orElse(verbatim);
        }

        DocumentPoint target = export.of(stmt.name())
                .or(() -> fuzzyMatch(model, stmt.name()).flatMap(n -> export.of(n.name())))
                .orElse(layout.unmatchedCoordinate());
        return StatementRewriter.rewriteNode(source, stmt, export.atClause(target));
    }

    /**
     * A placed node whose name equals {@code name} ignoring case, or contains
     * it, or is contained in it.
     */
    static Optional<NodeRecord> fuzzyMatch(DiagramModel model, String name) {
        String wanted = name.toLowerCase(Locale.ROOT);
        for (NodeRecord node : model.resolvedNodes()) {
            String candidate = node.name().toLowerCase(Locale.ROOT);
            if (candidate.equals(wanted) || candidate.contains(wanted) || wanted.contains(candidate)) {
                return Optional.of(node);
            }
        }
        return Optional.empty();
    }
}
