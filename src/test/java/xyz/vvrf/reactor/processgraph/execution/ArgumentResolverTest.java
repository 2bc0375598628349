package xyz.vvrf.reactor.processgraph.execution;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import xyz.vvrf.reactor.processgraph.builtin.ArithmeticProcesses;
import xyz.vvrf.reactor.processgraph.core.NodeResult;
import xyz.vvrf.reactor.processgraph.core.NodeStatus;
import xyz.vvrf.reactor.processgraph.core.ProcessDocument;
import xyz.vvrf.reactor.processgraph.core.ProcessNode;
import xyz.vvrf.reactor.processgraph.exception.ErrorKind;
import xyz.vvrf.reactor.processgraph.exception.NodeEvaluationException;
import xyz.vvrf.reactor.processgraph.registry.ProcessRegistrySnapshot;
import xyz.vvrf.reactor.processgraph.util.GraphUtils;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static xyz.vvrf.reactor.processgraph.test.util.ProcessGraphTestSupport.PARSER;
import static xyz.vvrf.reactor.processgraph.test.util.ProcessGraphTestSupport.json;

class ArgumentResolverTest {

    private final ArgumentResolver resolver = new ArgumentResolver();
    private ProcessDocument document;

    @BeforeEach
    void setUp() {
        document = PARSER.parse(json("{'parameters': ["
                + "{'name': 'bound', 'schema': {}},"
                + "{'name': 'defaulted', 'schema': {}, 'optional': true, 'default': 7},"
                + "{'name': 'nullDefault', 'schema': {}, 'optional': true, 'default': null},"
                + "{'name': 'missing', 'schema': {}}],"
                + "'process_graph': {"
                + "'up': {'process_id': 'add', 'arguments': {'x': 1, 'y': 2}},"
                + "'n': {'process_id': 'sum', 'arguments': {"
                + "'data': [{'from_node': 'up'}, {'from_argument': 'bound'}, 3],"
                + "'options': {'d': {'from_argument': 'defaulted'}, 'z': {'from_argument': 'nullDefault'}}},"
                + "'result': true},"
                + "'bad': {'process_id': 'add', 'arguments': {'x': {'from_argument': 'missing'}}}}}")).getDocumentOrThrow();
    }

    private EvaluationContext context(Map<String, Object> bindings) {
        return EvaluationContext.builder()
                .requestId("req-resolver")
                .graphName("resolver")
                .graph(document.getGraph())
                .executionOrder(GraphUtils.topologicalSort(document.getGraph()))
                .bindings(bindings)
                .declaredParameters(document.getParameters())
                .processes(ProcessRegistrySnapshot.of(ArithmeticProcesses.all()))
                .callStack(CallStack.root(4))
                .subgraphEvaluator((parent, node, process, arguments) -> Mono.empty())
                .build();
    }

    private ProcessNode node(String id) {
        return document.getGraph().getNode(id).get();
    }

    @Test
    void resolvesNestedReferencesBindingsAndDefaults() {
        EvaluationContext context = context(Collections.singletonMap("bound", "B"));
        context.transition("up", NodeStatus.READY);
        context.transition("up", NodeStatus.RUNNING);
        context.recordCompletedResult("up", NodeResult.done(3.0));

        Map<String, Object> resolved = resolver.resolve(node("n"), context);

        assertEquals(Arrays.asList("data", "options"), Arrays.asList(resolved.keySet().toArray(new String[0])));
        assertEquals(Arrays.asList(3.0, "B", 3), resolved.get("data"));
        @SuppressWarnings("unchecked")
        Map<String, Object> options = (Map<String, Object>) resolved.get("options");
        assertEquals(7, options.get("d"));
        assertTrue(options.containsKey("z"));
        assertNull(options.get("z"));
    }

    @Test
    void bindingWinsOverDefault() {
        Map<String, Object> bindings = new LinkedHashMap<>();
        bindings.put("bound", 1);
        bindings.put("defaulted", 99);
        EvaluationContext context = context(bindings);
        context.recordCompletedResult("up", NodeResult.done(0.0));

        @SuppressWarnings("unchecked")
        Map<String, Object> options = (Map<String, Object>) resolver.resolve(node("n"), context).get("options");

        assertEquals(99, options.get("d"));
    }

    @Test
    void unboundParameterWithoutDefaultFails() {
        NodeEvaluationException e = assertThrows(NodeEvaluationException.class,
                () -> resolver.resolve(node("bad"), context(Collections.emptyMap())));

        assertEquals(ErrorKind.UNBOUND_PARAMETER, e.getKind());
        assertEquals("bad", e.getNodeId());
        assertTrue(e.getMessage().contains("'missing'"));
    }

    @Test
    void referenceToNodeWithoutOutputFails() {
        EvaluationContext context = context(Collections.singletonMap("bound", 1));
        context.recordCompletedResult("up", NodeResult.skipped());

        NodeEvaluationException e = assertThrows(NodeEvaluationException.class, () -> resolver.resolve(node("n"), context));

        assertEquals(ErrorKind.PROCESS_EXECUTION_FAILURE, e.getKind());
        assertFalse(e.getMessage().isEmpty());
    }
}
