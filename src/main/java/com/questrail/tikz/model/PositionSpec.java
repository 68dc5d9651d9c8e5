package com.questrail.tikz.model;

import java.util.Optional;

/**
 * Position of a node as declared in the source.
 *
 * <p>A node may declare an absolute coordinate, a relative reference, both, or
 * neither. The raw text the two parts were extracted from is retained because
 * the loose fallback tier re-reads it.</p>
 *
 * @param absolute absolute coordinate in document units, or {@code null}
 * @param relative relative reference, or {@code null}
 * @param rawText  the position-bearing text of the declaration (never {@code null})
 */
public record PositionSpec(
        DocumentPoint absolute,
        RelativeReference relative,
        String rawText
) {
    public PositionSpec {
        rawText = rawText == null ? "" : rawText;
    }

    public static PositionSpec none(String rawText) {
        return new PositionSpec(null, null, rawText);
    }

    public Optional<DocumentPoint> absoluteCoordinate() {
        return Optional.ofNullable(absolute);
    }

    public Optional<RelativeReference> relativeReference() {
        return Optional.ofNullable(relative);
    }

    public boolean isAbsoluteOnly() {
        return absolute != null && relative == null;
    }
}
