package com.questrail.tikz.observability;

/**
 * Something the model dropped or ignored.
 */
public record ModelAnomalyEvent(Kind kind, String subject, String detail) {

    public enum Kind {
        DUPLICATE_NODE,
        DANGLING_CONNECTOR,
        EMPTY_GROUP,
        UNKNOWN_TARGET
    }
}
