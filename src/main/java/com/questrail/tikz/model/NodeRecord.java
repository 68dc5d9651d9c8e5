package com.questrail.tikz.model;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * NodeRecord
 * -----------------------------------------------------------------------------
 * A labeled shape declaration extracted from the source.
 *
 * <p>Everything except the center coordinate is fixed at parse time. The
 * center is assigned by the position resolver and then mutated in place by
 * interactive commands; until resolution it is absent.</p>
 *
 * <h2>Size</h2>
 * <p>The size is derived deterministically from the cleaned label:</p>
 * <ul>
 *   <li>width = {@code max(120, min(250, longestLine * 8))}, multiplied by 1.4
 *       (truncated) for ellipses</li>
 *   <li>height = {@code max(50, lineCount * 20 + 20)}</li>
 * </ul>
 * <p>Blank lines are not counted; an empty label behaves as a single
 * ten-character line for the width.</p>
 */
public final class NodeRecord
{
    static final int MIN_WIDTH = 120;
    static final int MAX_WIDTH = 250;
    static final int CHAR_WIDTH = 8;
    static final int EMPTY_LINE_LENGTH = 10;
    static final int MIN_HEIGHT = 50;
    static final int LINE_HEIGHT = 20;
    static final int VERTICAL_MARGIN = 20;
    static final double ELLIPSE_WIDTH_FACTOR = 1.4;

    private final String name;
    private final String styleClause;
    private final ShapeCategory shape;
    private final PositionSpec position;
    private final String label;
    private final String rawLabel;
    private final double width;
    private final double height;

    private Point center;
    private ResolutionTier tier;

    public NodeRecord(String name,
                      String styleClause,
                      ShapeCategory shape,
                      PositionSpec position,
                      String label,
                      String rawLabel) {
        this.name = Objects.requireNonNull(name, "name");
        this.styleClause = styleClause == null ? "" : styleClause;
        this.shape = Objects.requireNonNull(shape, "shape");
        this.position = Objects.requireNonNull(position, "position");
        this.label = label == null ? "" : label;
        this.rawLabel = rawLabel == null ? "" : rawLabel;

        List<String> lines = Arrays.stream(this.label.split("\n"))
                .map(String::strip)
                .filter(l -> !l.isEmpty())
                .toList();
        int longest = lines.stream().mapToInt(String::length).max().orElse(EMPTY_LINE_LENGTH);

        int baseWidth = Math.max(MIN_WIDTH, Math.min(MAX_WIDTH, longest * CHAR_WIDTH));
        this.width = shape == ShapeCategory.ELLIPSE
                ? (int) (baseWidth * ELLIPSE_WIDTH_FACTOR)
                : baseWidth;
        this.height = Math.max(MIN_HEIGHT, lines.size() * LINE_HEIGHT + VERTICAL_MARGIN);
    }

    public String name() {
        return name;
    }

    public String styleClause() {
        return styleClause;
    }

    public ShapeCategory shape() {
        return shape;
    }

    public PositionSpec position() {
        return position;
    }

    public String label() {
        return label;
    }

    public String rawLabel() {
        return rawLabel;
    }

    public double width() {
        return width;
    }

    public double height() {
        return height;
    }

    public boolean isResolved() {
        return center != null;
    }

    public Optional<Point> center() {
        return Optional.ofNullable(center);
    }

    /**
     * Returns the resolved center.
     *
     * @throws IllegalStateException if the node has not been resolved
     */
    public Point requireCenter() {
        if (center == null) {
            throw new IllegalStateException("Node '" + name + "' has not been resolved");
        }
        return center;
    }

    public Optional<ResolutionTier> tier() {
        return Optional.ofNullable(tier);
    }

    /**
     * Places the node. Called by the resolver; {@code tier} records which
     * strategy produced the coordinate.
     */
    public void place(Point newCenter, ResolutionTier resolvedBy) {
        this.center = Objects.requireNonNull(newCenter, "newCenter");
        this.tier = Objects.requireNonNull(resolvedBy, "resolvedBy");
    }

    /**
     * Moves an already placed node. The resolution tier is kept.
     */
    public void moveTo(Point newCenter) {
        requireCenter();
        this.center = Objects.requireNonNull(newCenter, "newCenter");
    }

    /**
     * Box occupied by the node; requires a resolved center.
     */
    public Box box() {
        return new Box(requireCenter(), width, height);
    }

    @Override
    public String toString() {
        return "NodeRecord[" + name + ", " + shape + ", center=" + center + "]";
    }
}
