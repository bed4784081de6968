package io.surfworks.symforge.core.symbol;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A vertex of the symbolic graph.
 *
 * <p>There are four kinds of node:
 * <ul>
 *   <li>Variable: no operator and no backward source, a named placeholder</li>
 *   <li>Atomic template: operator present, no inputs bound yet</li>
 *   <li>Applied node: operator present with inputs</li>
 *   <li>Backward node: synthesized by {@link SymbolGraph#grad}, refers to its forward node</li>
 * </ul>
 *
 * <p>Nodes are compared by identity. The backward source is a lookup relation
 * only; traversal follows {@link #inputs()} exclusively.
 */
public final class Node {

    final OperatorProperty op;
    String name;
    final List<DataEntry> inputs = new ArrayList<>();
    Node backwardSource;

    Node(OperatorProperty op, String name, Node backwardSource) {
        this.op = op;
        this.name = name == null ? "" : name;
        this.backwardSource = backwardSource;
    }

    static Node variable(String name) {
        return new Node(null, name, null);
    }

    static Node operator(OperatorProperty op, String name) {
        return new Node(op, name, null);
    }

    /**
     * Operator descriptor, or null for variables and backward nodes.
     */
    public OperatorProperty op() {
        return op;
    }

    public String name() {
        return name;
    }

    /**
     * Operand edges in argument order.
     */
    public List<DataEntry> inputs() {
        return Collections.unmodifiableList(inputs);
    }

    /**
     * Forward node this node computes the gradient of, or null.
     */
    public Node backwardSource() {
        return backwardSource;
    }

    /**
     * Operator present and nothing bound to it yet.
     */
    public boolean isAtomic() {
        return inputs.isEmpty() && op != null;
    }

    public boolean isVariable() {
        return op == null && backwardSource == null;
    }

    public boolean isBackward() {
        return backwardSource != null;
    }

    /**
     * Type name for display. Backward nodes report the type of their forward node.
     */
    public String typeString() {
        if (backwardSource != null && backwardSource.op != null) {
            return backwardSource.op.typeString();
        }
        return op == null ? "" : op.typeString();
    }

    @Override
    public String toString() {
        if (isVariable()) {
            return "Variable:" + name;
        }
        return "Node[name=" + name + ", type=" + typeString() + ", inputs=" + inputs.size() + "]";
    }
}
