package com.questrail.tikz.regen.impl;

import com.questrail.tikz.parse.scan.GroupDeclarations;
import com.questrail.tikz.parse.scan.NodeStatement;
import com.questrail.tikz.parse.scan.NodeStatementScanner;
import com.questrail.tikz.parse.scan.PositionTokens;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Rewrites the position-bearing parts of one scanned statement.
 *
 * <p>Replacements cover exactly {@code [stmt.start(), stmt.end())} of the text
 * the statement was scanned from. Anything not named below is copied
 * unchanged.</p>
 */
final class StatementRewriter
{
    private static final Pattern TRAILING_ABSOLUTE =
            Pattern.compile(",?\\s*" + PositionTokens.ABSOLUTE.pattern());
    private static final Pattern TRAILING_RELATIVE =
            Pattern.compile("(?i),?\\s*\\b(?:above|below|left|right)\\s*=\\s*of\\s+[\\w.\\-]+");
    private static final Pattern TRAILING_SHIFT =
            Pattern.compile(",?\\s*\\b[xy]shift\\s*=\\s*[-+]?\\d*\\.?\\d+\\s*(?:cm)?");
    private static final Pattern EMPTY_OPTION_LIST = Pattern.compile("\\[[\\s,]*\\]");
    private static final Pattern OPTION_LIST_LEADING_COMMA = Pattern.compile("\\[\\s*,\\s*");
    private static final Pattern LEADING_SEPARATORS = Pattern.compile("^[\\s,]+");

    private StatementRewriter() {}

    /**
     * Node statement with every absolute, relative and shift token removed
     * and {@code atClause} inserted right after the name.
     */
    static String rewriteNode(String text, NodeStatement stmt, String atClause) {
        final int styleOpen = styleOpen(stmt);
        final int styleClose = styleOpen + 1 + stmt.styleClause().length();
        final int trailingEnd = stmt.nameClose() + 1 + stmt.trailingClause().length();

        StringBuilder sb = new StringBuilder();
        sb.append(text, stmt.start(), styleOpen + 1);
        sb.append(cleanStyle(stmt.styleClause()));
        sb.append(']');

        String leading = PositionTokens.ABSOLUTE.matcher(stmt.leadingClause()).replaceAll("");
        sb.append(leading.equals(stmt.leadingClause()) ? leading : " ");

        sb.append(text, stmt.nameOpen(), stmt.nameClose() + 1);
        sb.append(' ').append(atClause);

        String trailing = cleanTrailing(stmt.trailingClause());
        if (!trailing.isEmpty()) {
            sb.append(' ').append(trailing);
        }
        if (stmt.hasLabel()) {
            sb.append(' ');
        }

        // Label, closing brace and terminator, verbatim.
        sb.append(text, trailingEnd, stmt.end());
        return sb.toString();
    }

    /**
     * Group statement with its fit clause replaced by {@code members}.
     *
     * @return empty when the statement carries no readable fit clause
     */
    static Optional<String> rewriteGroup(String text, NodeStatement stmt, List<String> members) {
        final int styleOpen = styleOpen(stmt);
        final String replacement = GroupDeclarations.formatFit(members);

        Optional<GroupDeclarations.FitClause> fit = GroupDeclarations.findFit(stmt.styleClause());
        int base = styleOpen + 1;
        if (fit.isEmpty()) {
            fit = GroupDeclarations.findFit(stmt.trailingClause());
            base = stmt.nameClose() + 1;
        }
        if (fit.isEmpty()) {
            return Optional.empty();
        }

        return Optional.of(text.substring(stmt.start(), base + fit.get().start())
                + replacement
                + text.substring(base + fit.get().end(), stmt.end()));
    }

    /**
     * Style clause without relative and shift options. Returned unchanged
     * when it has none, so its exact spacing survives.
     */
    static String cleanStyle(String style) {
        List<String> kept = new ArrayList<>();
        boolean removed = false;
        for (String option : PositionTokens.splitOptions(style)) {
            if (PositionTokens.isPositionOption(option)) {
                removed = true;
            } else if (!option.isBlank()) {
                kept.add(option.strip());
            }
        }
        return removed ? String.join(", ", kept) : style;
    }

    static String cleanTrailing(String trailing) {
        String s = TRAILING_ABSOLUTE.matcher(trailing).replaceAll("");
        s = TRAILING_RELATIVE.matcher(s).replaceAll("");
        s = TRAILING_SHIFT.matcher(s).replaceAll("");
        s = EMPTY_OPTION_LIST.matcher(s).replaceAll("");
        s = OPTION_LIST_LEADING_COMMA.matcher(s).replaceAll("[");
        s = LEADING_SEPARATORS.matcher(s).replaceAll("");
        return s.strip();
    }

    private static int styleOpen(NodeStatement stmt) {
        return stmt.start() + NodeStatementScanner.MARKER.length() - 1;
    }
}
