package io.surfworks.symforge.core.analysis;

import io.surfworks.symforge.core.graph.StaticGraph;
import io.surfworks.symforge.core.shape.Shape;

import java.util.List;

/**
 * Analysis passes that operate on the flattened graph.
 *
 * <p>Implementations are discovered through {@link java.util.ServiceLoader} or
 * registered explicitly with {@link AnalyzerRegistry}.
 */
public interface StaticGraphAnalyzer {

    /**
     * Analyzer name used for registry lookup (e.g., "reference").
     */
    String name();

    /**
     * Infer argument and output shapes.
     *
     * @param graph     The graph to analyze
     * @param argShapes Known argument shapes in argument order; unresolved entries are
     *                  {@link Shape#unknown()} and may be filled in
     * @param outShapes Receives one shape per graph head
     * @return false if some shape could not be resolved
     */
    boolean inferShape(StaticGraph graph, List<Shape> argShapes, List<Shape> outShapes);

    /**
     * Append gradient nodes to {@code graph}.
     *
     * <p>Appended nodes may only reference nodes with smaller ids. A node derived
     * from a forward node records that node's id as its backward source.
     *
     * @param graph The graph to extend in place
     * @return head gradient node ids and per-argument gradient entries
     */
    BackwardPass makeBackwardPass(StaticGraph graph);
}
