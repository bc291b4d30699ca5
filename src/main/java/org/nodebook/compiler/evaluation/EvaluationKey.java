package org.nodebook.compiler.evaluation;

import org.nodebook.graph.MorphId;

/**
 * Identifies one derived value: a function evaluated on a node within one morph.
 *
 * @param nodeId        The node.
 * @param morphId       The morph the value is computed in.
 * @param attributeName The derived attribute (function) name.
 */
public record EvaluationKey(String nodeId, MorphId morphId, String attributeName) {

    @Override
    public String toString() {
        return morphId.value() + "/" + attributeName;
    }
}
