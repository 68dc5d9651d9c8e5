package com.questrail.tikz.model;

import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Relative part of a position clause: {@code <direction>=of <reference>} with
 * optional explicit shifts.
 *
 * <p>Shifts are in centimetres in document orientation (positive y is up).
 * A {@code null} shift means "not declared"; the resolver then applies the
 * default magnitude for the direction.</p>
 */
public record RelativeReference(
        String referenceName,
        Direction direction,
        Double xShiftCm,
        Double yShiftCm
) {
    public RelativeReference {
        Objects.requireNonNull(referenceName, "referenceName");
        Objects.requireNonNull(direction, "direction");
    }

    public OptionalDouble explicitXShift() {
        return xShiftCm == null ? OptionalDouble.empty() : OptionalDouble.of(xShiftCm);
    }

    public OptionalDouble explicitYShift() {
        return yShiftCm == null ? OptionalDouble.empty() : OptionalDouble.of(yShiftCm);
    }
}
