package io.surfworks.symforge.core.symbol;

import io.surfworks.symforge.core.analysis.AnalyzerRegistry;
import io.surfworks.symforge.core.analysis.BackwardPass;
import io.surfworks.symforge.core.analysis.StaticGraphAnalyzer;
import io.surfworks.symforge.core.graph.StaticEntry;
import io.surfworks.symforge.core.graph.StaticGraph;
import io.surfworks.symforge.core.graph.StaticGraphBuilder;
import io.surfworks.symforge.core.graph.StaticNode;
import io.surfworks.symforge.core.shape.Shape;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Consumer;
import java.util.logging.Logger;

/**
 * A symbolic computation graph: an ordered list of output entries ("heads")
 * over a DAG of {@link Node}s.
 *
 * <p>Graphs are built from variables and operator templates and grow by
 * composition:
 * <pre>{@code
 * SymbolGraph data = SymbolGraph.createVariable("data");
 * SymbolGraph fc = SymbolGraph.create(new FullyConnected())
 *     .apply(Map.of("data", data), "fc1");
 *
 * fc.listArguments();   // [data, fc1_weight, fc1_bias]
 * StaticGraph g = fc.toStaticGraph();
 * SymbolGraph grads = fc.grad(List.of("fc1_weight"));
 * }</pre>
 *
 * <p>Only {@code compose} mutates nodes, and it mutates nodes reachable from
 * the receiver. Use {@link #apply} to compose a private copy instead. Nodes
 * shared between graphs must not be composed concurrently.
 */
public final class SymbolGraph {

    private static final Logger LOG = Logger.getLogger(SymbolGraph.class.getName());

    private final List<DataEntry> heads = new ArrayList<>();

    private SymbolGraph() {}

    // ==================== Construction ====================

    /**
     * Create a graph holding a single named variable.
     */
    public static SymbolGraph createVariable(String name) {
        SymbolGraph s = new SymbolGraph();
        s.heads.add(new DataEntry(Node.variable(Objects.requireNonNull(name, "name")), 0));
        return s;
    }

    /**
     * Wrap an operator descriptor as an atomic template with one head per visible output.
     */
    public static SymbolGraph create(OperatorProperty op) {
        Objects.requireNonNull(op, "op");
        Node node = Node.operator(op, "");
        SymbolGraph s = new SymbolGraph();
        for (int i = 0; i < op.numVisibleReturns(); i++) {
            s.heads.add(new DataEntry(node, i));
        }
        return s;
    }

    /**
     * Concatenate the heads of several graphs into one tuple-valued graph.
     */
    public static SymbolGraph createGroup(List<SymbolGraph> symbols) {
        SymbolGraph s = new SymbolGraph();
        for (SymbolGraph symbol : symbols) {
            s.heads.addAll(symbol.heads);
        }
        return s;
    }

    public static SymbolGraph createGroup(SymbolGraph... symbols) {
        return createGroup(List.of(symbols));
    }

    // ==================== Introspection ====================

    /**
     * Get the graph outputs.
     */
    public List<DataEntry> heads() {
        return Collections.unmodifiableList(heads);
    }

    public int numReturns() {
        return heads.size();
    }

    /**
     * Check if this graph is a single operator template with nothing bound.
     */
    public boolean isAtomic() {
        return heads.size() == 1 && heads.get(0).source().isAtomic();
    }

    /**
     * Visit every node reachable from the heads exactly once.
     *
     * <p>Pre-order walk over an explicit stack. Heads are pushed in head order
     * and inputs in reverse, so inputs are visited in argument order. A node is
     * pushed only the first time it is discovered.
     */
    public void dfsVisit(Consumer<Node> visitor) {
        Deque<Node> stack = new ArrayDeque<>();
        Set<Node> visited = Collections.newSetFromMap(new IdentityHashMap<>());
        for (DataEntry head : heads) {
            if (visited.add(head.source())) {
                stack.push(head.source());
            }
        }
        while (!stack.isEmpty()) {
            Node node = stack.pop();
            visitor.accept(node);
            for (int i = node.inputs.size() - 1; i >= 0; i--) {
                Node source = node.inputs.get(i).source();
                if (visited.add(source)) {
                    stack.push(source);
                }
            }
        }
    }

    /**
     * List the argument names.
     *
     * <p>For an atomic template these are the operator's declared arguments.
     * Otherwise they are the names of all variable nodes in discovery order,
     * duplicates included.
     */
    public List<String> listArguments() {
        if (isAtomic()) {
            return List.copyOf(heads.get(0).source().op.listArguments());
        }
        List<String> ret = new ArrayList<>();
        dfsVisit(node -> {
            if (node.isVariable()) {
                ret.add(node.name);
            }
        });
        return ret;
    }

    /**
     * List one output name per head.
     *
     * <p>Variables return their own name. Operator outputs use the declared
     * return name, prefixed with {@code <node name>_} when the node is named.
     */
    public List<String> listReturns() {
        List<String> ret = new ArrayList<>(heads.size());
        for (DataEntry head : heads) {
            Node source = head.source();
            if (source.isVariable()) {
                ret.add(source.name);
            } else {
                String rname = returnName(source, head.index());
                ret.add(source.name.isEmpty() ? rname : source.name + "_" + rname);
            }
        }
        return ret;
    }

    private static String returnName(Node node, int index) {
        if (node.op != null && index < node.op.listReturns().size()) {
            return node.op.listReturns().get(index);
        }
        return "output" + index;
    }

    /**
     * Count, per variable name, the distinct variable nodes carrying it.
     *
     * @param out receives name to node count, in discovery order
     * @return the largest count, at least 1
     */
    public int findDuplicateArgs(Map<String, Integer> out) {
        out.clear();
        dfsVisit(node -> {
            if (node.isVariable()) {
                out.merge(node.name, 1, Integer::sum);
            }
        });
        int maxDup = 1;
        for (int count : out.values()) {
            maxDup = Math.max(maxDup, count);
        }
        return maxDup;
    }

    /**
     * Select one output of a multi-head graph.
     *
     * @return this graph if it has a single head, otherwise a graph over head {@code index}
     * @throws IndexOutOfBoundsException if index is not a valid head position
     */
    public SymbolGraph get(int index) {
        int nreturn = numReturns();
        if (index < 0 || index >= nreturn) {
            throw new IndexOutOfBoundsException(
                "Output index " + index + " out of bounds for symbol with " + nreturn + " outputs");
        }
        if (nreturn == 1) {
            return this;
        }
        SymbolGraph s = new SymbolGraph();
        s.heads.add(heads.get(index));
        return s;
    }

    // ==================== Copy and composition ====================

    /**
     * Deep copy: every reachable node is duplicated and the sharing topology is preserved.
     *
     * <p>Backward source links are redirected to the copied forward node when it is part
     * of the copy; otherwise they keep pointing at the original forward node.
     */
    public SymbolGraph copy() {
        Map<Node, Node> oldNew = new IdentityHashMap<>();
        List<Node> order = new ArrayList<>();
        dfsVisit(node -> {
            OperatorProperty op = node.op == null ? null : node.op.copy();
            oldNew.put(node, new Node(op, node.name, null));
            order.add(node);
        });
        for (Node old : order) {
            Node fresh = oldNew.get(old);
            for (DataEntry e : old.inputs) {
                fresh.inputs.add(new DataEntry(oldNew.get(e.source()), e.index()));
            }
            if (old.backwardSource != null) {
                fresh.backwardSource = oldNew.getOrDefault(old.backwardSource, old.backwardSource);
            }
        }
        SymbolGraph s = new SymbolGraph();
        for (DataEntry head : heads) {
            s.heads.add(new DataEntry(oldNew.get(head.source()), head.index()));
        }
        return s;
    }

    public void compose(List<SymbolGraph> args) {
        compose(args, "");
    }

    /**
     * Bind free variables positionally, in place.
     *
     * <p>An atomic template needs exactly one argument per declared operator argument.
     * Otherwise each distinct variable node reached by an input edge consumes one
     * argument in discovery order; every edge to that node receives the same
     * replacement. Nothing is rewired unless the count matches. The head node is
     * renamed before validation and keeps the new name on failure.
     *
     * @param args single-head argument graphs
     * @param name name given to the head node
     * @throws SymbolException on an invalid receiver, a tuple argument or an arity mismatch
     */
    public void compose(List<SymbolGraph> args, String name) {
        Node head = composableHead();
        head.name = Objects.requireNonNull(name, "name");
        for (int i = 0; i < args.size(); i++) {
            if (args.get(i).numReturns() != 1) {
                throw SymbolException.tupleArgument("Argument " + i);
            }
        }
        if (isAtomic()) {
            List<String> reqArgs = head.op.listArguments();
            if (args.size() != reqArgs.size()) {
                throw SymbolException.arityMismatch(reqArgs.size(), args.size());
            }
            for (SymbolGraph arg : args) {
                head.inputs.add(arg.heads.get(0));
            }
        } else {
            Map<Node, DataEntry> replaceMap = new IdentityHashMap<>();
            List<Replacement> plan = new ArrayList<>();
            dfsVisit(node -> {
                for (int i = 0; i < node.inputs.size(); i++) {
                    Node source = node.inputs.get(i).source();
                    if (!source.isVariable()) {
                        continue;
                    }
                    if (!replaceMap.containsKey(source)) {
                        int slot = replaceMap.size();
                        replaceMap.put(source, slot < args.size() ? args.get(slot).heads.get(0) : null);
                    }
                    DataEntry target = replaceMap.get(source);
                    if (target != null) {
                        plan.add(new Replacement(node, i, target));
                    }
                }
            });
            if (args.size() != replaceMap.size()) {
                throw SymbolException.arityMismatch(replaceMap.size(), args.size());
            }
            commit(plan);
        }
        LOG.fine("Composed '" + name + "' with " + args.size() + " positional arguments");
    }

    public void compose(Map<String, SymbolGraph> kwargs) {
        compose(kwargs, "");
    }

    /**
     * Bind free variables by name, in place.
     *
     * <p>For an atomic template, declared arguments missing from {@code kwargs} get a
     * fresh variable named {@code <arg>} or {@code <name>_<arg>}. For a composed graph
     * every keyword must name exactly one variable node; replacements are committed
     * only if all keywords match.
     *
     * @param kwargs single-head argument graphs by argument name
     * @param name   name given to the head node
     * @throws SymbolException on an invalid receiver, a tuple argument, duplicated
     *                         variable names or unknown keywords
     */
    public void compose(Map<String, SymbolGraph> kwargs, String name) {
        Node head = composableHead();
        head.name = Objects.requireNonNull(name, "name");
        for (Map.Entry<String, SymbolGraph> kv : kwargs.entrySet()) {
            if (kv.getValue().numReturns() != 1) {
                throw SymbolException.tupleArgument("Keyword argument " + kv.getKey());
            }
        }
        int matched;
        if (isAtomic()) {
            matched = 0;
            for (String reqArg : head.op.listArguments()) {
                SymbolGraph bound = kwargs.get(reqArg);
                if (bound != null) {
                    head.inputs.add(bound.heads.get(0));
                    matched++;
                } else {
                    String varName = name.isEmpty() ? reqArg : name + "_" + reqArg;
                    head.inputs.add(new DataEntry(Node.variable(varName), 0));
                }
            }
            if (matched != kwargs.size()) {
                head.inputs.clear();
            }
        } else {
            Map<String, Integer> dupArgs = new LinkedHashMap<>();
            if (findDuplicateArgs(dupArgs) > 1) {
                List<String> duplicated = new ArrayList<>();
                for (Map.Entry<String, Integer> kv : dupArgs.entrySet()) {
                    if (kv.getValue() > 1) {
                        duplicated.add(kv.getKey());
                    }
                }
                throw SymbolException.ambiguousName(duplicated);
            }
            Set<Node> counted = Collections.newSetFromMap(new IdentityHashMap<>());
            List<Replacement> plan = new ArrayList<>();
            dfsVisit(node -> {
                for (int i = 0; i < node.inputs.size(); i++) {
                    Node source = node.inputs.get(i).source();
                    if (!source.isVariable()) {
                        continue;
                    }
                    SymbolGraph bound = kwargs.get(source.name);
                    if (bound != null) {
                        counted.add(source);
                        plan.add(new Replacement(node, i, bound.heads.get(0)));
                    }
                }
            });
            matched = counted.size();
            if (matched == kwargs.size()) {
                commit(plan);
            }
        }
        if (matched != kwargs.size()) {
            throw SymbolException.unknownKeyword("SymbolGraph.compose", kwargs.keySet(), listArguments());
        }
        LOG.fine("Composed '" + name + "' with keyword arguments " + kwargs.keySet());
    }

    /**
     * Compose a copy of this graph positionally. The receiver is left untouched.
     */
    public SymbolGraph apply(List<SymbolGraph> args, String name) {
        SymbolGraph s = copy();
        s.compose(args, name);
        return s;
    }

    /**
     * Compose a copy of this graph by keyword. The receiver is left untouched.
     */
    public SymbolGraph apply(Map<String, SymbolGraph> kwargs, String name) {
        SymbolGraph s = copy();
        s.compose(kwargs, name);
        return s;
    }

    private Node composableHead() {
        if (heads.size() != 1) {
            throw SymbolException.nonScalarReceiver(
                "Only composition of value function is supported currently, symbol has "
                    + heads.size() + " outputs");
        }
        Node head = heads.get(0).source();
        if (head.isVariable()) {
            throw SymbolException.nonScalarReceiver("Variable cannot be composed: " + head.name);
        }
        return head;
    }

    private static void commit(List<Replacement> plan) {
        for (Replacement r : plan) {
            r.owner().inputs.set(r.slot(), r.target());
        }
    }

    private record Replacement(Node owner, int slot, DataEntry target) {}

    // ==================== Lowering and analysis ====================

    /**
     * Flatten this graph into integer-addressed form.
     */
    public StaticGraph toStaticGraph() {
        return StaticGraphBuilder.build(this);
    }

    /**
     * Build the gradient graph using the default analyzer.
     *
     * @see #grad(StaticGraphAnalyzer, List)
     */
    public SymbolGraph grad(List<String> wrt) {
        return grad(AnalyzerRegistry.getDefault(), wrt);
    }

    /**
     * Build a graph computing the gradients of this graph's outputs with respect to
     * the named arguments.
     *
     * <p>The analyzer appends gradient nodes to the lowered graph. Nodes of the
     * forward graph are reused by reference; each appended node becomes a new node
     * whose backward source is the forward node it derives from.
     *
     * @param analyzer backward synthesis implementation
     * @param wrt      argument names, one output head per name
     * @throws SymbolException if a name is not an argument of this graph
     */
    public SymbolGraph grad(StaticGraphAnalyzer analyzer, List<String> wrt) {
        StaticGraph g = toStaticGraph();
        List<String> argList = g.argumentNames();
        Map<String, Integer> argIndex = new HashMap<>();
        for (int i = 0; i < argList.size(); i++) {
            argIndex.put(argList.get(i), i);
        }
        for (String name : wrt) {
            if (!argIndex.containsKey(name)) {
                throw SymbolException.unknownKeyword("SymbolGraph.grad", wrt, listArguments());
            }
        }

        int numNodes = g.numNodes();
        BackwardPass pass = analyzer.makeBackwardPass(g);
        if (pass.argGrads().size() != argList.size()) {
            throw new IllegalStateException("Analyzer '" + analyzer.name() + "' returned "
                + pass.argGrads().size() + " argument gradients for " + argList.size() + " arguments");
        }

        List<Node> sharedNodes = new ArrayList<>(g.numNodes());
        dfsVisit(sharedNodes::add);
        for (int nid = numNodes; nid < g.numNodes(); nid++) {
            StaticNode sn = g.node(nid);
            Node source = sn.backwardSourceId() == StaticNode.NO_SOURCE
                ? null
                : sharedNodes.get(sn.backwardSourceId());
            Node node = new Node(sn.op() == null ? null : sn.op().copy(), sn.name(), source);
            for (StaticEntry e : sn.inputs()) {
                node.inputs.add(new DataEntry(sharedNodes.get(e.sourceId()), e.index()));
            }
            sharedNodes.add(node);
        }

        SymbolGraph ret = new SymbolGraph();
        for (String name : wrt) {
            StaticEntry entry = pass.argGrads().get(argIndex.get(name));
            ret.heads.add(new DataEntry(sharedNodes.get(entry.sourceId()), entry.index()));
        }
        LOG.fine("Built gradient graph for " + wrt + " with " + (g.numNodes() - numNodes)
            + " backward nodes using analyzer '" + analyzer.name() + "'");
        return ret;
    }

    public boolean inferShape(List<Shape> argShapes, List<Shape> outShapes) {
        return inferShape(AnalyzerRegistry.getDefault(), argShapes, outShapes);
    }

    /**
     * Infer shapes from argument shapes given in argument order.
     *
     * @return false if the analyzer could not resolve every shape
     */
    public boolean inferShape(StaticGraphAnalyzer analyzer, List<Shape> argShapes, List<Shape> outShapes) {
        return analyzer.inferShape(toStaticGraph(), argShapes, outShapes);
    }

    public boolean inferShape(Map<String, Shape> knownArgShapes, List<Shape> argShapes, List<Shape> outShapes) {
        return inferShape(AnalyzerRegistry.getDefault(), knownArgShapes, argShapes, outShapes);
    }

    /**
     * Infer shapes from argument shapes given by name.
     *
     * <p>{@code argShapes} is reset to one entry per argument, unknown unless named in
     * {@code knownArgShapes}.
     *
     * @return false if the analyzer could not resolve every shape
     * @throws SymbolException if a known shape names no argument
     */
    public boolean inferShape(StaticGraphAnalyzer analyzer, Map<String, Shape> knownArgShapes,
                              List<Shape> argShapes, List<Shape> outShapes) {
        StaticGraph g = toStaticGraph();
        argShapes.clear();
        Set<String> matched = new HashSet<>();
        for (int nid : g.argNodes()) {
            String name = g.node(nid).name();
            Shape shape = knownArgShapes.get(name);
            if (shape != null) {
                argShapes.add(shape);
                matched.add(name);
            } else {
                argShapes.add(Shape.unknown());
            }
        }
        if (matched.size() != knownArgShapes.size()) {
            throw SymbolException.unknownKeyword("SymbolGraph.inferShape", knownArgShapes.keySet(), listArguments());
        }
        return analyzer.inferShape(g, argShapes, outShapes);
    }

    // ==================== Display ====================

    /**
     * Write a human-readable dump of the graph structure.
     */
    public void print(StringBuilder os) {
        if (isAtomic()) {
            os.append("AtomicFunction  Type:").append(heads.get(0).source().op.typeString()).append('\n')
              .append("Inputs:");
            List<String> args = listArguments();
            for (int i = 0; i < args.size(); i++) {
                os.append("\targ[").append(i).append("]=").append(args.get(i)).append('\n');
            }
            return;
        }
        os.append("Outputs:\n");
        for (int i = 0; i < heads.size(); i++) {
            os.append("\toutput[").append(i).append("]=").append(heads.get(i)).append('\n');
        }
        dfsVisit(node -> {
            if (node.isVariable()) {
                os.append("Variable:").append(node.name).append('\n');
            } else {
                os.append("Name: ").append(node.name).append(" Type:").append(node.typeString()).append('\n')
                  .append("Inputs:\n");
                for (int i = 0; i < node.inputs.size(); i++) {
                    os.append("\targ[").append(i).append("]=").append(node.inputs.get(i)).append('\n');
                }
            }
        });
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        print(sb);
        return sb.toString();
    }
}
