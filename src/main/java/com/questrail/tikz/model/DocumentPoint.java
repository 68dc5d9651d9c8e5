package com.questrail.tikz.model;

/**
 * A coordinate expressed in document length units (centimetres, y grows upward).
 *
 * <p>Kept distinct from {@link Point} so that document and canvas units can
 * never be mixed by accident; conversion lives in
 * {@link com.questrail.tikz.config.LayoutPolicy}.</p>
 */
public record DocumentPoint(double x, double y) {

    public static final DocumentPoint ORIGIN = new DocumentPoint(0, 0);
}
