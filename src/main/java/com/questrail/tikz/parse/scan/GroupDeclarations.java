package com.questrail.tikz.parse.scan;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lexical helpers for group ({@code fit=}) declarations and the background
 * scopes that contain them.
 *
 * <p>Two membership spellings are recognized, in the style clause or after the
 * name:</p>
 * <ul>
 *   <li>{@code fit=(a) (b) (c)}: one name per group, or several separated by
 *       commas/whitespace inside a group</li>
 *   <li>{@code fit=a b c}: names separated by whitespace, ending at the next
 *       comma, bracket or brace</li>
 * </ul>
 */
public final class GroupDeclarations
{
    public static final String SCOPE_BEGIN = "\\begin{scope}";
    public static final String SCOPE_END = "\\end{scope}";
    public static final String BACKGROUND_MARKER = "on background layer";

    static final Pattern FIT_PARENTHESIZED = Pattern.compile("\\bfit\\s*=\\s*((?:\\s*\\([^)]*\\))+)");
    static final Pattern FIT_BARE = Pattern.compile("\\bfit\\s*=\\s*([\\w.\\-]+(?:[ \\t]+[\\w.\\-]+)*)");
    static final Pattern FIT_ANY = Pattern.compile("\\bfit\\s*=");
    static final Pattern INNER_SEP = Pattern.compile("\\binner\\s+sep\\s*=\\s*(\\d*\\.?\\d+)\\s*(?:cm)?");

    private static final Pattern PAREN_GROUP = Pattern.compile("\\(([^)]*)\\)");
    private static final Pattern NAME_SEPARATOR = Pattern.compile("[,\\s]+");

    /**
     * A membership clause located in some text.
     *
     * @param start   offset of {@code fit} in that text
     * @param end     offset just past the member list
     * @param members member names in declared order, de-duplicated
     */
    public record FitClause(int start, int end, List<String> members) {}

    private GroupDeclarations() {}

    /** Whether text carries any {@code fit=} clause. */
    public static boolean declaresFit(String text) {
        return FIT_ANY.matcher(text).find();
    }

    public static Optional<FitClause> findFit(String text) {
        Matcher m = FIT_PARENTHESIZED.matcher(text);
        if (m.find()) {
            Set<String> names = new LinkedHashSet<>();
            Matcher g = PAREN_GROUP.matcher(m.group(1));
            while (g.find()) {
                names.addAll(splitNames(g.group(1)));
            }
            return Optional.of(new FitClause(m.start(), m.end(), List.copyOf(names)));
        }
        m = FIT_BARE.matcher(text);
        if (m.find()) {
            return Optional.of(new FitClause(m.start(), m.end(),
                    List.copyOf(new LinkedHashSet<>(splitNames(m.group(1))))));
        }
        return Optional.empty();
    }

    public static OptionalDouble findInnerSep(String text) {
        Matcher m = INNER_SEP.matcher(text);
        if (!m.find()) {
            return OptionalDouble.empty();
        }
        try {
            return OptionalDouble.of(Double.parseDouble(m.group(1)));
        } catch (NumberFormatException e) {
            return OptionalDouble.empty();
        }
    }

    /**
     * Formats a member list in the parenthesized spelling: {@code fit=(a) (b)}.
     */
    public static String formatFit(List<String> members) {
        StringBuilder sb = new StringBuilder("fit=");
        for (int i = 0; i < members.size(); i++) {
            if (i > 0) {
                sb.append(' ');
            }
            sb.append('(').append(members.get(i)).append(')');
        }
        return sb.toString();
    }

    private static List<String> splitNames(String list) {
        List<String> out = new ArrayList<>();
        for (String n : NAME_SEPARATOR.split(list)) {
            if (!n.isBlank()) {
                out.add(n.strip());
            }
        }
        return out;
    }
}
