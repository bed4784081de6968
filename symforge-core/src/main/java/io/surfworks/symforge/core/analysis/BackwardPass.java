package io.surfworks.symforge.core.analysis;

import io.surfworks.symforge.core.graph.StaticEntry;

import java.util.List;

/**
 * Result of backward synthesis over a static graph.
 *
 * @param headGradNodes Id of the node holding the incoming gradient, one per graph head
 * @param argGrads      Accumulated gradient entry, one per argument node in argument order
 */
public record BackwardPass(List<Integer> headGradNodes, List<StaticEntry> argGrads) {

    public BackwardPass {
        headGradNodes = List.copyOf(headGradNodes);
        argGrads = List.copyOf(argGrads);
    }
}
