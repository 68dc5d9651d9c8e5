package com.questrail.tikz.resolve;

import com.questrail.tikz.config.LayoutPolicy;
import com.questrail.tikz.model.Point;
import com.questrail.tikz.model.RelativeReference;

/**
 * Canvas offset of a relative reference.
 *
 * <p>The axis of the direction takes the explicit shift if declared, else the
 * direction's default; the other axis takes the explicit shift or zero.
 * Document y is up, canvas y is down, hence the sign flip.</p>
 */
final class RelativeOffsets
{
    private RelativeOffsets() {}

    static Point offsetOf(RelativeReference ref, LayoutPolicy layout) {
        double defaultCm = layout.defaultShiftCm(ref.direction());

        double xCm = ref.explicitXShift().orElse(ref.direction().isVertical() ? 0.0 : defaultCm);
        double yCm = ref.explicitYShift().orElse(ref.direction().isVertical() ? defaultCm : 0.0);

        return new Point(layout.toCanvasLength(xCm), -layout.toCanvasLength(yCm));
    }
}
