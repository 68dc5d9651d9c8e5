package com.questrail.tikz.regen;

import com.questrail.tikz.model.DiagramModel;

/**
 * Serializes a model back into diagram source.
 *
 * <p>Implementations reuse the model's source text wherever they can and
 * rewrite only position-bearing fragments. When the source cannot be trusted
 * they fall back to a from-scratch serialization instead of failing.</p>
 */
public interface Regenerator {
    /**
     * @param model a resolved model
     * @return complete diagram source; never {@code null}
     */
    String regenerate(DiagramModel model);
}
