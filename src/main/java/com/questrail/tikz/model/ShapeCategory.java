package com.questrail.tikz.model;

/**
 * Closed set of shape categories a node style can map to.
 *
 * <p>Each category carries the style keyword used when a node has to be
 * serialized without its original style clause.</p>
 */
public enum ShapeCategory {
    ELLIPSE("cloud"),
    CYLINDER("db"),
    DASHED_RECTANGLE("k8s"),
    HIGHLIGHTED_RECTANGLE("api"),
    DEFAULT_RECTANGLE("service");

    private final String styleKeyword;

    ShapeCategory(String styleKeyword) {
        this.styleKeyword = styleKeyword;
    }

    public String styleKeyword() {
        return styleKeyword;
    }
}
