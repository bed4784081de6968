package io.surfworks.symforge.core.graph;

import io.surfworks.symforge.core.symbol.OperatorProperty;

import java.util.List;

/**
 * A node of the flattened graph with integer-addressed inputs.
 *
 * @param op               Operator copy owned by the static graph, or null for variables
 *                         and backward nodes
 * @param name             Node name
 * @param backwardSourceId Id of the forward node a backward node derives from, or
 *                         {@link #NO_SOURCE} when there is none or it lies outside this graph
 * @param inputs           Operand edges
 * @param backward         Whether the node was synthesized for the backward pass. Set even
 *                         when the forward node is not part of this graph.
 */
public record StaticNode(
    OperatorProperty op,
    String name,
    int backwardSourceId,
    List<StaticEntry> inputs,
    boolean backward
) {
    /** Sentinel for a node without a backward source. */
    public static final int NO_SOURCE = -1;

    public StaticNode {
        name = name == null ? "" : name;
        inputs = List.copyOf(inputs);
        if (backwardSourceId < NO_SOURCE) {
            throw new IllegalArgumentException(
                "Backward source id of node '" + name + "' must be " + NO_SOURCE + " or a node id, got "
                    + backwardSourceId);
        }
        if (backwardSourceId != NO_SOURCE && !backward) {
            throw new IllegalArgumentException(
                "Node '" + name + "' has backward source " + backwardSourceId + " but is not a backward node");
        }
    }

    /**
     * Node whose backward classification follows from its source id.
     */
    public StaticNode(OperatorProperty op, String name, int backwardSourceId, List<StaticEntry> inputs) {
        this(op, name, backwardSourceId, inputs, backwardSourceId != NO_SOURCE);
    }

    /**
     * Check if this node is an unbound variable.
     */
    public boolean isVariable() {
        return op == null && !backward;
    }

    /**
     * Check if this node was synthesized for the backward pass.
     */
    public boolean isBackward() {
        return backward;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(op == null ? (isVariable() ? "Variable" : "Backward") : op.typeString());
        sb.append(" name=").append(name);
        if (backwardSourceId != NO_SOURCE) {
            sb.append(" source=").append(backwardSourceId);
        }
        sb.append(" inputs=").append(inputs);
        return sb.toString();
    }
}
