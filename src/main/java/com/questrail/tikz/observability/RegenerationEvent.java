package com.questrail.tikz.observability;

/**
 * Outcome of one regeneration.
 *
 * @param mode   round-trip rewrite or from-scratch synthesis
 * @param reason why synthesis was chosen; empty for round-trip
 */
public record RegenerationEvent(Mode mode, String reason) {

    public enum Mode {
        ROUND_TRIP,
        SYNTHESIZED
    }

    public boolean isDegraded() {
        return mode == Mode.SYNTHESIZED;
    }
}
