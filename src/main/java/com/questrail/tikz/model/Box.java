package com.questrail.tikz.model;

/**
 * Axis-aligned box described by its center and its extent, in canvas units.
 *
 * <p>Edges are inclusive: a point lying exactly on an edge is contained.</p>
 */
public record Box(Point center, double width, double height) {

    public Box {
        if (center == null) {
            throw new NullPointerException("center");
        }
        if (width < 0 || height < 0) {
            throw new IllegalArgumentException(
                    "Box extent must be non-negative (was " + width + " x " + height + ")");
        }
    }

    public static Box fromEdges(double left, double top, double right, double bottom) {
        return new Box(new Point((left + right) / 2, (top + bottom) / 2),
                right - left, bottom - top);
    }

    public double left() {
        return center.x() - width / 2;
    }

    public double right() {
        return center.x() + width / 2;
    }

    public double top() {
        return center.y() - height / 2;
    }

    public double bottom() {
        return center.y() + height / 2;
    }

    public boolean contains(Point p) {
        return p.x() >= left() && p.x() <= right()
                && p.y() >= top() && p.y() <= bottom();
    }

    public boolean contains(Box other) {
        return other.left() >= left() && other.right() <= right()
                && other.top() >= top() && other.bottom() <= bottom();
    }

    public boolean intersects(Box other) {
        return other.left() <= right() && other.right() >= left()
                && other.top() <= bottom() && other.bottom() >= top();
    }

    public Box union(Box other) {
        return fromEdges(
                Math.min(left(), other.left()),
                Math.min(top(), other.top()),
                Math.max(right(), other.right()),
                Math.max(bottom(), other.bottom()));
    }

    public Box expand(double padding) {
        return new Box(center, width + 2 * padding, height + 2 * padding);
    }

    public Box moveTo(Point newCenter) {
        return new Box(newCenter, width, height);
    }
}
