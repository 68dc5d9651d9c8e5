package com.questrail.tikz.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Directional keyword of a relative position ({@code above=of ref} etc.).
 */
public enum Direction {
    ABOVE("above"),
    BELOW("below"),
    LEFT("left"),
    RIGHT("right");

    private final String keyword;

    Direction(String keyword) {
        this.keyword = keyword;
    }

    public String keyword() {
        return keyword;
    }

    public boolean isVertical() {
        return this == ABOVE || this == BELOW;
    }

    public static Optional<Direction> fromKeyword(String keyword) {
        if (keyword == null) {
            return Optional.empty();
        }
        String k = keyword.trim().toLowerCase(Locale.ROOT);
        for (Direction d : values()) {
            if (d.keyword.equals(k)) {
                return Optional.of(d);
            }
        }
        return Optional.empty();
    }
}
