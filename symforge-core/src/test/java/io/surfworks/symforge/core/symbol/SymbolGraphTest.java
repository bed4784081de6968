package io.surfworks.symforge.core.symbol;

import io.surfworks.symforge.core.testing.FakeOperator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SymbolGraphTest {

    private static SymbolGraph var(String name) {
        return SymbolGraph.createVariable(name);
    }

    private static SymbolGraph add(SymbolGraph lhs, SymbolGraph rhs, String name) {
        return SymbolGraph.create(FakeOperator.binary("Add")).apply(List.of(lhs, rhs), name);
    }

    private static SymbolGraph relu(SymbolGraph data, String name) {
        return SymbolGraph.create(FakeOperator.unary("Relu")).apply(List.of(data), name);
    }

    private static List<String> visitedNames(SymbolGraph graph) {
        List<String> names = new ArrayList<>();
        graph.dfsVisit(node -> names.add(node.name()));
        return names;
    }

    private static List<String> visitedTypes(SymbolGraph graph) {
        List<String> types = new ArrayList<>();
        graph.dfsVisit(node -> types.add(node.typeString()));
        return types;
    }

    private static Set<Node> nodesOf(SymbolGraph graph) {
        Set<Node> nodes = Collections.newSetFromMap(new IdentityHashMap<>());
        graph.dfsVisit(nodes::add);
        return nodes;
    }

    @Nested
    @DisplayName("Construction")
    class ConstructionTests {

        @Test
        void variableHasSingleHead() {
            SymbolGraph x = var("x");

            assertEquals(1, x.numReturns());
            assertFalse(x.isAtomic());
            assertTrue(x.heads().get(0).source().isVariable());
            assertEquals(List.of("x"), x.listArguments());
            assertEquals(List.of("x"), x.listReturns());
        }

        @Test
        void operatorTemplateIsAtomic() {
            SymbolGraph fc = SymbolGraph.create(FakeOperator.fullyConnected());

            assertTrue(fc.isAtomic());
            assertEquals(List.of("data", "weight", "bias"), fc.listArguments());
            assertEquals(List.of("output"), fc.listReturns());
        }

        @Test
        void multiOutputOperatorExposesVisibleReturns() {
            SymbolGraph split = SymbolGraph.create(
                new FakeOperator("Split", List.of("data"), List.of("out0", "out1", "out2")));
            SymbolGraph partial = SymbolGraph.create(
                new FakeOperator("Split", List.of("data"), List.of("out0", "out1", "out2"), 2));

            assertEquals(3, split.numReturns());
            assertFalse(split.isAtomic());
            assertEquals(List.of("out0", "out1", "out2"), split.listReturns());
            assertEquals(2, partial.numReturns());
            assertSame(split.heads().get(0).source(), split.heads().get(2).source());
        }

        @Test
        void groupConcatenatesHeads() {
            SymbolGraph x = var("x");
            SymbolGraph y = relu(var("y"), "act");

            SymbolGraph group = SymbolGraph.createGroup(x, y);

            assertEquals(2, group.numReturns());
            assertEquals(List.of("x", "act_output"), group.listReturns());
            assertSame(x.heads().get(0), group.heads().get(0));
        }
    }

    @Nested
    @DisplayName("Introspection")
    class IntrospectionTests {

        @Test
        void unnamedOperatorReturnsBareName() {
            SymbolGraph r = relu(var("x"), "");

            assertEquals(List.of("output"), r.listReturns());
        }

        @Test
        void namedOperatorPrefixesReturnName() {
            SymbolGraph r = relu(var("x"), "relu1");

            assertEquals(List.of("relu1_output"), r.listReturns());
        }

        @Test
        void argumentsFollowDiscoveryOrder() {
            SymbolGraph g = add(var("a"), relu(var("b"), "relu"), "add");

            assertEquals(List.of("a", "b"), g.listArguments());
        }

        @Test
        void indexSelectsSingleOutput() {
            SymbolGraph split = SymbolGraph.create(
                new FakeOperator("Split", List.of("data"), List.of("out0", "out1")));

            SymbolGraph second = split.get(1);

            assertEquals(1, second.numReturns());
            assertEquals(List.of("out1"), second.listReturns());
            assertSame(split.heads().get(1), second.heads().get(0));
        }

        @Test
        void indexOnSingleOutputReturnsSameGraph() {
            SymbolGraph x = var("x");

            assertSame(x, x.get(0));
        }

        @Test
        void indexOutOfRangeThrows() {
            SymbolGraph x = var("x");

            assertThrows(IndexOutOfBoundsException.class, () -> x.get(1));
            assertThrows(IndexOutOfBoundsException.class, () -> x.get(-1));
        }
    }

    @Nested
    @DisplayName("Graph walk")
    class DfsVisitTests {

        @Test
        void visitsInputsInArgumentOrder() {
            SymbolGraph g = add(var("a"), relu(var("b"), "relu"), "add");

            assertEquals(List.of("add", "a", "relu", "b"), visitedNames(g));
        }

        @Test
        void visitsSharedNodeOnce() {
            SymbolGraph x = var("x");
            SymbolGraph g = add(x, x, "add");

            assertEquals(List.of("add", "x"), visitedNames(g));
        }

        @Test
        void visitsNodesSharedAcrossHeadsOnce() {
            SymbolGraph x = var("x");
            SymbolGraph group = SymbolGraph.createGroup(relu(x, "r1"), relu(x, "r2"));

            assertEquals(3, visitedNames(group).size());
        }
    }

    @Nested
    @DisplayName("Copy")
    class CopyTests {

        @Test
        void copyIsStructurallyEqual() {
            SymbolGraph g = add(var("a"), relu(var("b"), "relu"), "add");

            SymbolGraph c = g.copy();

            assertEquals(g.numReturns(), c.numReturns());
            assertEquals(visitedNames(g), visitedNames(c));
            assertEquals(visitedTypes(g), visitedTypes(c));
        }

        @Test
        void copySharesNoNodes() {
            SymbolGraph g = add(var("a"), relu(var("b"), "relu"), "add");

            SymbolGraph c = g.copy();

            Set<Node> original = nodesOf(g);
            for (Node node : nodesOf(c)) {
                assertFalse(original.contains(node), "copy shares node " + node);
            }
            assertNotSame(g.heads().get(0).source().op(), c.heads().get(0).source().op());
        }

        @Test
        void copyPreservesSharing() {
            SymbolGraph x = var("x");
            SymbolGraph g = add(x, x, "add");

            SymbolGraph c = g.copy();

            Node head = c.heads().get(0).source();
            assertSame(head.inputs().get(0).source(), head.inputs().get(1).source());
            assertNotSame(x.heads().get(0).source(), head.inputs().get(0).source());
        }

        @Test
        void composingCopyLeavesOriginalUntouched() {
            SymbolGraph g = add(var("x"), var("y"), "add");

            SymbolGraph c = g.copy();
            c.compose(List.of(var("p"), var("q")), "other");

            assertEquals(List.of("x", "y"), g.listArguments());
            assertEquals("add", g.heads().get(0).source().name());
            assertEquals(List.of("p", "q"), c.listArguments());
        }
    }

    @Nested
    @DisplayName("Duplicate arguments")
    class DuplicateArgsTests {

        @Test
        void sharedVariableCountsOnce() {
            SymbolGraph x = var("x");
            SymbolGraph g = add(x, x, "add");
            Map<String, Integer> dups = new HashMap<>();

            int max = g.findDuplicateArgs(dups);

            assertEquals(1, max);
            assertEquals(Map.of("x", 1), dups);
        }

        @Test
        void independentVariablesWithSameNameCountTwice() {
            SymbolGraph g = add(var("x"), var("x"), "add");
            Map<String, Integer> dups = new HashMap<>();

            int max = g.findDuplicateArgs(dups);

            assertEquals(2, max);
            assertEquals(Map.of("x", 2), dups);
        }

        @Test
        void graphWithoutVariablesReportsOne() {
            SymbolGraph template = SymbolGraph.create(FakeOperator.unary("Relu"));
            Map<String, Integer> dups = new HashMap<>();

            assertEquals(1, template.findDuplicateArgs(dups));
            assertTrue(dups.isEmpty());
        }
    }

    @Nested
    @DisplayName("Textual dump")
    class PrintTests {

        @Test
        void atomicDumpListsArguments() {
            String dump = SymbolGraph.create(FakeOperator.fullyConnected()).toString();

            assertTrue(dump.startsWith("AtomicFunction  Type:FullyConnected"), dump);
            assertTrue(dump.contains("arg[0]=data"), dump);
            assertTrue(dump.contains("arg[2]=bias"), dump);
        }

        @Test
        void compositeDumpListsOutputsNodesAndVariables() {
            SymbolGraph fc = SymbolGraph.create(FakeOperator.fullyConnected())
                .apply(Map.of("data", var("data")), "fc1");

            String dump = fc.toString();

            assertTrue(dump.startsWith("Outputs:\n\toutput[0]=fc1(0)"), dump);
            assertTrue(dump.contains("Name: fc1 Type:FullyConnected"), dump);
            assertTrue(dump.contains("arg[1]=fc1_weight(0)"), dump);
            assertTrue(dump.contains("Variable:data"), dump);
            assertTrue(dump.contains("Variable:fc1_bias"), dump);
        }
    }
}
