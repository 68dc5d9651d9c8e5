package com.questrail.tikz.parse.impl;

import com.questrail.tikz.model.ShapeCategory;

import java.util.List;

/**
 * Maps a raw style clause to a {@link ShapeCategory} by substring match.
 *
 * <p>Rules are checked in order and the first rule with a matching keyword
 * wins; a clause matching nothing is a default rectangle.</p>
 */
final class StyleClassifier
{
    private record Rule(ShapeCategory category, List<String> keywords) {}

    private static final List<Rule> RULES = List.of(
            new Rule(ShapeCategory.ELLIPSE, List.of("cloud", "ellipse")),
            new Rule(ShapeCategory.CYLINDER, List.of("cylinder", "db")),
            new Rule(ShapeCategory.DASHED_RECTANGLE, List.of("k8s")),
            new Rule(ShapeCategory.HIGHLIGHTED_RECTANGLE, List.of("api"))
    );

    private StyleClassifier() {}

    static ShapeCategory classify(String styleClause) {
        if (styleClause == null || styleClause.isEmpty()) {
            return ShapeCategory.DEFAULT_RECTANGLE;
        }
        for (Rule rule : RULES) {
            for (String keyword : rule.keywords()) {
                if (styleClause.contains(keyword)) {
                    return rule.category();
                }
            }
        }
        return ShapeCategory.DEFAULT_RECTANGLE;
    }
}
