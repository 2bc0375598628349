package xyz.vvrf.reactor.processgraph.util;

import org.junit.jupiter.api.Test;
import xyz.vvrf.reactor.processgraph.core.ArgumentValue;
import xyz.vvrf.reactor.processgraph.core.ProcessGraph;
import xyz.vvrf.reactor.processgraph.core.ProcessNode;
import xyz.vvrf.reactor.processgraph.exception.ErrorKind;
import xyz.vvrf.reactor.processgraph.exception.GraphValidationException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static xyz.vvrf.reactor.processgraph.test.util.ProcessGraphTestSupport.PARSER;
import static xyz.vvrf.reactor.processgraph.test.util.ProcessGraphTestSupport.json;
import static xyz.vvrf.reactor.processgraph.test.util.ProcessGraphTestSupport.readGraph;

class GraphUtilsTest {

    private static ProcessGraph graph(String text) {
        return PARSER.parse(json(text)).getDocument().getGraph();
    }

    private static ProcessNode node(String id, String... dependencies) {
        Map<String, ArgumentValue> arguments = new LinkedHashMap<>();
        for (int i = 0; i < dependencies.length; i++) {
            arguments.put("arg" + i, ArgumentValue.fromNode(dependencies[i]));
        }
        return new ProcessNode(id, "noop", arguments, false, null);
    }

    @Test
    void dependenciesComeBeforeDependents() {
        ProcessGraph graph = PARSER.parse(readGraph("evi.json")).getDocument().getGraph();

        List<String> order = GraphUtils.topologicalSort(graph);

        assertEquals(Arrays.asList("sub", "p1", "p2", "sum", "div", "p3"), order);
    }

    @Test
    void orderIsDeterministicForSameInput() {
        ProcessGraph graph = graph("{"
                + "'d': {'process_id': 'x', 'arguments': {'a': {'from_node': 'b'}, 'b': {'from_node': 'c'}}, 'result': true},"
                + "'c': {'process_id': 'x', 'arguments': {'a': {'from_node': 'a'}}},"
                + "'b': {'process_id': 'x', 'arguments': {'a': {'from_node': 'a'}}},"
                + "'a': {'process_id': 'x', 'arguments': {}}}");

        List<String> first = GraphUtils.topologicalSort(graph);
        for (int i = 0; i < 10; i++) {
            assertEquals(first, GraphUtils.topologicalSort(graph));
        }
        assertEquals(Arrays.asList("a", "b", "c", "d"), first);
    }

    @Test
    void nestedReferencesAreDependencies() {
        ProcessNode node = graph("{'n': {'process_id': 'x', 'arguments': {"
                + "'data': [{'from_node': 'a'}, {'nested': {'from_node': 'b'}}], 'other': {'from_node': 'a'}, 'p': {'from_argument': 'q'}}}}")
                .getNode("n").get();

        assertEquals(Arrays.asList("a", "b"), new ArrayList<>(GraphUtils.dependenciesOf(node)));
        assertEquals(Collections.singletonList("q"), new ArrayList<>(GraphUtils.parameterReferencesOf(node)));
    }

    @Test
    void cycleMembersAreReported() {
        ProcessGraph graph = ProcessGraph.of(Arrays.asList(
                node("a", "c"), node("b", "a"), node("c", "b"), node("d", "a")));

        GraphUtils.DependencyResolution resolution = GraphUtils.resolve(graph);

        assertFalse(resolution.isAcyclic());
        assertEquals(1, resolution.getCycles().size());
        assertEquals(Arrays.asList("a", "c", "b"), resolution.getCycles().get(0));
        assertEquals(ErrorKind.CYCLIC_DEPENDENCY, resolution.toErrors().get(0).getKind());
        assertTrue(resolution.toErrors().get(0).getMessage().contains("a -> c -> b -> a"));
    }

    @Test
    void topologicalSortRejectsCyclesAndDanglingReferences() {
        GraphValidationException e = assertThrows(GraphValidationException.class,
                () -> GraphUtils.topologicalSort(ProcessGraph.of(Arrays.asList(node("a", "b"), node("b", "a"), node("c", "missing")))));

        assertTrue(e.hasErrorOfKind(ErrorKind.CYCLIC_DEPENDENCY));
        assertTrue(e.hasErrorOfKind(ErrorKind.DANGLING_REFERENCE));
    }

    @Test
    void deepChainDoesNotOverflowStack() {
        List<ProcessNode> nodes = new ArrayList<>();
        nodes.add(node("n0"));
        for (int i = 1; i < 20000; i++) {
            nodes.add(node("n" + i, "n" + (i - 1)));
        }
        Collections.reverse(nodes);

        List<String> order = GraphUtils.topologicalSort(ProcessGraph.of(nodes));

        assertEquals(20000, order.size());
        assertEquals("n0", order.get(0));
        assertEquals("n19999", order.get(order.size() - 1));
    }

    @Test
    void dotOutputContainsNodesAndEdges() {
        String dot = GraphUtils.toDot(graph("{"
                + "'a': {'process_id': 'add', 'arguments': {}},"
                + "'b': {'process_id': 'absolute', 'arguments': {'x': {'from_node': 'a'}}, 'result': true}}"), "demo");

        assertTrue(dot.startsWith("digraph \"demo\""));
        assertTrue(dot.contains("\"a\" -> \"b\""));
        assertTrue(dot.contains("penwidth=2"));
    }
}
