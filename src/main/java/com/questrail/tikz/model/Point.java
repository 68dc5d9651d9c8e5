package com.questrail.tikz.model;

/**
 * A coordinate in canvas units (x grows to the right, y grows downward).
 */
public record Point(double x, double y) {

    public Point translate(double dx, double dy) {
        return new Point(x + dx, y + dy);
    }

    public double distanceTo(Point other) {
        return Math.hypot(x - other.x, y - other.y);
    }
}
