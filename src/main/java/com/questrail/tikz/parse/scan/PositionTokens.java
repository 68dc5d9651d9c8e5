package com.questrail.tikz.parse.scan;

import com.questrail.tikz.model.Direction;
import com.questrail.tikz.model.DocumentPoint;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * PositionTokens
 * -----------------------------------------------------------------------------
 * Lexical patterns for the position-bearing tokens of a node statement, shared
 * by the parser (which reads them) and the regenerator (which removes them).
 *
 * <ul>
 *   <li>{@code at (x,y)}: absolute coordinate, optional {@code cm} units</li>
 *   <li>{@code above=of ref} / {@code below=of} / {@code left=of} /
 *       {@code right=of}: relative reference</li>
 *   <li>{@code xshift=Ncm}, {@code yshift=Ncm}: explicit shift overrides</li>
 * </ul>
 *
 * <p>Relative references have a strict form (exact keyword, no spaces
 * around {@code =}), used for regular resolution, and a loose form (any case,
 * spaces around {@code =}), used by the loose fallback
 * tier and by token removal. Both read names with dots and hyphens, minus
 * any trailing dot or hyphen.</p>
 */
public final class PositionTokens
{
    public static final Pattern ABSOLUTE = Pattern.compile("\\bat\\s*\\(([^)]*)\\)");

    public static final Pattern XSHIFT = Pattern.compile("\\bxshift\\s*=\\s*([-+]?\\d*\\.?\\d+)\\s*(?:cm)?");
    public static final Pattern YSHIFT = Pattern.compile("\\byshift\\s*=\\s*([-+]?\\d*\\.?\\d+)\\s*(?:cm)?");

    public static final Pattern RELATIVE_LOOSE =
            Pattern.compile("(?i)\\b(above|below|left|right)\\s*=\\s*of\\s+([\\w.\\-]+)");

    private static final Map<Direction, Pattern> RELATIVE_STRICT = new EnumMap<>(Direction.class);

    static {
        for (Direction d : Direction.values()) {
            RELATIVE_STRICT.put(d, Pattern.compile("\\b" + d.keyword() + "=of\\s+([\\w.\\-]+)"));
        }
    }

    /** A relative reference as read from text, before shifts are applied. */
    public record RelativeMatch(Direction direction, String referenceName) {}

    private PositionTokens() {}

    /**
     * Reads the first {@code at (x,y)} coordinate.
     *
     * @return the coordinate, or empty if absent or not numeric
     */
    public static Optional<DocumentPoint> findAbsolute(String text) {
        Matcher m = ABSOLUTE.matcher(text);
        if (!m.find()) {
            return Optional.empty();
        }
        return parseCoordinate(m.group(1));
    }

    /** Whether the text carries an {@code at (...)} token at all, numeric or not. */
    public static boolean hasAbsoluteToken(String text) {
        return ABSOLUTE.matcher(text).find();
    }

    /**
     * Parses {@code "x,y"}, each part optionally suffixed with {@code cm}.
     */
    public static Optional<DocumentPoint> parseCoordinate(String inner) {
        String[] parts = inner.replace("cm", "").split(",");
        if (parts.length != 2) {
            return Optional.empty();
        }
        try {
            return Optional.of(new DocumentPoint(
                    Double.parseDouble(parts[0].strip()),
                    Double.parseDouble(parts[1].strip())));
        } catch (NumberFormatException e) {
            // Symbolic coordinates such as (a.north) are outside the recognized subset.
            return Optional.empty();
        }
    }

    /**
     * Strict relative match. Directions are tried in the order above, below,
     * left, right; the first one present wins.
     */
    public static Optional<RelativeMatch> findRelativeStrict(String text) {
        for (Direction d : Direction.values()) {
            Matcher m = RELATIVE_STRICT.get(d).matcher(text);
            if (m.find()) {
                return Optional.of(new RelativeMatch(d, stripTrailingPunctuation(m.group(1))));
            }
        }
        return Optional.empty();
    }

    /**
     * Loose relative match: the first relative token in text order, in any
     * case, tolerant of whitespace and of dots or hyphens in the name.
     */
    public static Optional<RelativeMatch> findRelativeLoose(String text) {
        Matcher m = RELATIVE_LOOSE.matcher(text);
        if (!m.find()) {
            return Optional.empty();
        }
        return Direction.fromKeyword(m.group(1))
                .map(d -> new RelativeMatch(d, stripTrailingPunctuation(m.group(2))));
    }

    public static OptionalDouble findXShift(String text) {
        return findShift(XSHIFT, text);
    }

    public static OptionalDouble findYShift(String text) {
        return findShift(YSHIFT, text);
    }

    /**
     * Whether a single comma-separated option is a position option
     * (relative reference or shift).
     */
    public static boolean isPositionOption(String option) {
        String o = option.strip();
        return RELATIVE_LOOSE.matcher(o).lookingAt()
                || XSHIFT.matcher(o).lookingAt()
                || YSHIFT.matcher(o).lookingAt();
    }

    /**
     * Splits an option list on commas that are not nested inside brackets,
     * braces or parentheses.
     */
    public static List<String> splitOptions(String optionList) {
        List<String> out = new ArrayList<>();
        int depth = 0;
        int start = 0;
        for (int i = 0; i < optionList.length(); i++) {
            char c = optionList.charAt(i);
            if (c == '(' || c == '[' || c == '{') {
                depth++;
            } else if (c == ')' || c == ']' || c == '}') {
                depth = Math.max(0, depth - 1);
            } else if (c == ',' && depth == 0) {
                out.add(optionList.substring(start, i));
                start = i + 1;
            }
        }
        out.add(optionList.substring(start));
        return out;
    }

    private static OptionalDouble findShift(Pattern p, String text) {
        Matcher m = p.matcher(text);
        if (!m.find()) {
            return OptionalDouble.empty();
        }
        try {
            return OptionalDouble.of(Double.parseDouble(m.group(1)));
        } catch (NumberFormatException e) {
            return OptionalDouble.empty();
        }
    }

    private static String stripTrailingPunctuation(String name) {
        int end = name.length();
        while (end > 0 && (name.charAt(end - 1) == '.' || name.charAt(end - 1) == '-')) {
            end--;
        }
        return name.substring(0, end);
    }
}
