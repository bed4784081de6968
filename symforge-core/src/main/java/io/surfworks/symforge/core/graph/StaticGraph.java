package io.surfworks.symforge.core.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Index-addressed projection of a symbolic graph.
 *
 * <p>Node ids are dense and follow the discovery order of the graph walk that
 * produced them. Analysis passes may append nodes through {@link #appendNode};
 * existing nodes are never rewritten.
 */
public final class StaticGraph {

    private final List<StaticNode> nodes;
    private final List<Integer> argNodes;
    private final List<StaticEntry> heads;

    StaticGraph(List<StaticNode> nodes, List<Integer> argNodes, List<StaticEntry> heads) {
        this.nodes = new ArrayList<>(nodes);
        this.argNodes = List.copyOf(argNodes);
        this.heads = List.copyOf(heads);
    }

    /**
     * Get all nodes in id order.
     */
    public List<StaticNode> nodes() {
        return Collections.unmodifiableList(nodes);
    }

    /**
     * Get the node with the given id.
     */
    public StaticNode node(int id) {
        return nodes.get(id);
    }

    /**
     * Get the number of nodes, including appended ones.
     */
    public int numNodes() {
        return nodes.size();
    }

    /**
     * Get the ids of variable nodes in discovery order.
     */
    public List<Integer> argNodes() {
        return argNodes;
    }

    /**
     * Get the graph outputs.
     */
    public List<StaticEntry> heads() {
        return heads;
    }

    /**
     * Names of the argument nodes, in argument order.
     */
    public List<String> argumentNames() {
        List<String> names = new ArrayList<>(argNodes.size());
        for (int id : argNodes) {
            names.add(nodes.get(id).name());
        }
        return names;
    }

    /**
     * Append a node. Inputs may only reference nodes that already exist.
     *
     * @return the id of the appended node
     * @throws IllegalArgumentException if an input references an unknown node
     */
    public int appendNode(StaticNode node) {
        int id = nodes.size();
        for (StaticEntry e : node.inputs()) {
            if (e.sourceId() < 0 || e.sourceId() >= id) {
                throw new IllegalArgumentException(
                    "Input " + e + " of node '" + node.name() + "' does not reference an existing node");
            }
        }
        if (node.backwardSourceId() < StaticNode.NO_SOURCE || node.backwardSourceId() >= id) {
            throw new IllegalArgumentException(
                "Backward source " + node.backwardSourceId() + " of node '" + node.name() + "' does not exist");
        }
        nodes.add(node);
        return id;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("StaticGraph[nodes=").append(nodes.size())
          .append(", args=").append(argNodes)
          .append(", heads=").append(heads).append("]\n");
        for (int i = 0; i < nodes.size(); i++) {
            sb.append("  ").append(i).append(": ").append(nodes.get(i)).append("\n");
        }
        return sb.toString();
    }
}
