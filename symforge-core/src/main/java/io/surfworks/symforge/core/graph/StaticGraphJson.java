package io.surfworks.symforge.core.graph;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;

import java.util.List;

/**
 * Renders a {@link StaticGraph} as JSON for debugging.
 *
 * <p>Layout:
 * <pre>{@code
 * {
 *   "nodes": [
 *     {"op": "FullyConnected", "name": "fc1", "backward_source_id": -1, "backward": false, "inputs": [[0, 0], [2, 0]]}
 *   ],
 *   "arg_nodes": [1, 2],
 *   "heads": [[0, 0]]
 * }
 * }</pre>
 * Variables and backward nodes carry {@code "op": null}; {@code "backward"} tells them apart
 * when the forward node of a backward node is not part of the graph.
 */
public final class StaticGraphJson {

    private static final Gson GSON = new GsonBuilder()
            .setPrettyPrinting()
            .serializeNulls()
            .create();

    private StaticGraphJson() {}

    /**
     * Build the JSON tree for a static graph.
     */
    public static JsonObject toJsonTree(StaticGraph graph) {
        JsonArray nodes = new JsonArray();
        for (StaticNode node : graph.nodes()) {
            JsonObject obj = new JsonObject();
            if (node.op() == null) {
                obj.add("op", JsonNull.INSTANCE);
            } else {
                obj.addProperty("op", node.op().typeString());
            }
            obj.addProperty("name", node.name());
            obj.addProperty("backward_source_id", node.backwardSourceId());
            obj.addProperty("backward", node.isBackward());
            obj.add("inputs", entries(node.inputs()));
            nodes.add(obj);
        }

        JsonArray argNodes = new JsonArray();
        for (int id : graph.argNodes()) {
            argNodes.add(id);
        }

        JsonObject root = new JsonObject();
        root.add("nodes", nodes);
        root.add("arg_nodes", argNodes);
        root.add("heads", entries(graph.heads()));
        return root;
    }

    /**
     * Render a static graph as pretty-printed JSON.
     */
    public static String toJson(StaticGraph graph) {
        return GSON.toJson(toJsonTree(graph));
    }

    private static JsonArray entries(List<StaticEntry> entries) {
        JsonArray array = new JsonArray();
        for (StaticEntry e : entries) {
            JsonArray pair = new JsonArray();
            pair.add(e.sourceId());
            pair.add(e.index());
            array.add(pair);
        }
        return array;
    }
}
