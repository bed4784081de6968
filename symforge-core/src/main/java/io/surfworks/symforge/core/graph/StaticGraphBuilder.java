package io.surfworks.symforge.core.graph;

import io.surfworks.symforge.core.symbol.DataEntry;
import io.surfworks.symforge.core.symbol.Node;
import io.surfworks.symforge.core.symbol.OperatorProperty;
import io.surfworks.symforge.core.symbol.SymbolGraph;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Lowers a {@link SymbolGraph} into a {@link StaticGraph}.
 * Assigns dense ids in graph-walk discovery order and copies operator descriptors.
 */
public final class StaticGraphBuilder {

    private static final Logger LOG = Logger.getLogger(StaticGraphBuilder.class.getName());

    private StaticGraphBuilder() {} // Utility class

    /**
     * Lower a symbolic graph.
     *
     * <p>The result is stable: lowering an unmodified graph twice yields the same ids.
     *
     * @param symbol The graph to lower
     * @return Flattened graph
     */
    public static StaticGraph build(SymbolGraph symbol) {
        LoweringContext ctx = new LoweringContext();
        symbol.dfsVisit(ctx::register);

        List<StaticNode> nodes = new ArrayList<>(ctx.order.size());
        for (Node node : ctx.order) {
            OperatorProperty op = node.op() == null ? null : node.op().copy();
            int backwardSourceId = node.backwardSource() == null
                ? StaticNode.NO_SOURCE
                : ctx.indexOf(node.backwardSource());
            nodes.add(new StaticNode(op, node.name(), backwardSourceId,
                resolveEntries(node.inputs(), ctx), node.isBackward()));
        }

        StaticGraph graph = new StaticGraph(nodes, ctx.argNodes, resolveEntries(symbol.heads(), ctx));
        LOG.fine("Lowered symbol to static graph with " + nodes.size() + " nodes, "
            + ctx.argNodes.size() + " arguments");
        return graph;
    }

    // ==================== Internal Helpers ====================

    private static List<StaticEntry> resolveEntries(List<DataEntry> entries, LoweringContext ctx) {
        List<StaticEntry> resolved = new ArrayList<>(entries.size());
        for (DataEntry e : entries) {
            resolved.add(new StaticEntry(ctx.requireIndex(e.source()), e.index()));
        }
        return resolved;
    }

    /**
     * Lowering context for tracking node ids by identity.
     */
    private static class LoweringContext {
        private final Map<Node, Integer> nodeIndex = new IdentityHashMap<>();
        private final List<Node> order = new ArrayList<>();
        private final List<Integer> argNodes = new ArrayList<>();

        void register(Node node) {
            int id = order.size();
            nodeIndex.put(node, id);
            order.add(node);
            if (node.isVariable()) {
                argNodes.add(id);
            }
        }

        // A backward source outside the walked graph lowers to the sentinel; the node keeps its backward flag
        int indexOf(Node node) {
            Integer index = nodeIndex.get(node);
            return index == null ? StaticNode.NO_SOURCE : index;
        }

        int requireIndex(Node node) {
            Integer index = nodeIndex.get(node);
            if (index == null) {
                throw new IllegalStateException("Node not reachable from graph heads: " + node);
            }
            return index;
        }
    }
}
