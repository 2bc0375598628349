package xyz.vvrf.reactor.processgraph.validation;

import org.junit.jupiter.api.Test;
import xyz.vvrf.reactor.processgraph.core.ProcessDocument;
import xyz.vvrf.reactor.processgraph.core.UserDefinedProcess;
import xyz.vvrf.reactor.processgraph.exception.ErrorKind;
import xyz.vvrf.reactor.processgraph.exception.GraphError;
import xyz.vvrf.reactor.processgraph.exception.GraphValidationException;
import xyz.vvrf.reactor.processgraph.registry.ProcessLookup;
import xyz.vvrf.reactor.processgraph.registry.ProcessRegistrySnapshot;
import xyz.vvrf.reactor.processgraph.builtin.ArithmeticProcesses;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static xyz.vvrf.reactor.processgraph.test.util.ProcessGraphTestSupport.PARSER;
import static xyz.vvrf.reactor.processgraph.test.util.ProcessGraphTestSupport.VALIDATOR;
import static xyz.vvrf.reactor.processgraph.test.util.ProcessGraphTestSupport.json;
import static xyz.vvrf.reactor.processgraph.test.util.ProcessGraphTestSupport.readGraph;

class ProcessGraphValidatorTest {

    private final ProcessLookup arithmetic = ProcessRegistrySnapshot.of(ArithmeticProcesses.all());

    @Test
    void validGraphHasNoErrors() {
        assertTrue(VALIDATOR.validate(readGraph("evi.json"), arithmetic).isEmpty());
    }

    @Test
    void multipleResultNodesAreReportedTogether() {
        List<GraphError> errors = VALIDATOR.validate(json("{"
                + "'a': {'process_id': 'add', 'arguments': {'x': 1, 'y': 1}, 'result': true},"
                + "'b': {'process_id': 'add', 'arguments': {'x': 1, 'y': 1}, 'result': true}}"), arithmetic);

        assertEquals(1, errors.size());
        assertEquals(ErrorKind.AMBIGUOUS_OR_MISSING_RESULT, errors.get(0).getKind());
        assertEquals(Arrays.asList("a", "b"), errors.get(0).getNodeIds());
    }

    @Test
    void missingResultNodeIsReported() {
        List<GraphError> errors = VALIDATOR.validate(json("{'a': {'process_id': 'add', 'arguments': {'x': 1, 'y': 1}}}"), arithmetic);

        assertEquals(1, errors.size());
        assertEquals(ErrorKind.AMBIGUOUS_OR_MISSING_RESULT, errors.get(0).getKind());
    }

    @Test
    void danglingNodeReferenceIsReported() {
        List<GraphError> errors = VALIDATOR.validate(json("{'a': {'process_id': 'add', 'arguments': {'x': {'from_node': 'nope'}, 'y': 1}, 'result': true}}"), arithmetic);

        assertEquals(1, errors.size());
        assertEquals(ErrorKind.DANGLING_REFERENCE, errors.get(0).getKind());
        assertEquals("a", errors.get(0).getNodeId());
        assertTrue(errors.get(0).getMessage().contains("'nope'"));
    }

    @Test
    void selfReferenceIsCycle() {
        List<GraphError> errors = VALIDATOR.validate(json("{'a': {'process_id': 'add', 'arguments': {'x': {'from_node': 'a'}, 'y': 1}, 'result': true}}"), arithmetic);

        assertEquals(1, errors.size());
        assertEquals(ErrorKind.CYCLIC_DEPENDENCY, errors.get(0).getKind());
        assertEquals(Arrays.asList("a"), errors.get(0).getNodeIds());
    }

    @Test
    void unknownProcessIsCheckedOnlyWithLookup() {
        String graph = "{'a': {'process_id': 'ndvi', 'arguments': {}, 'result': true}}";

        List<GraphError> errors = VALIDATOR.validate(json(graph), arithmetic);
        assertEquals(1, errors.size());
        assertEquals(ErrorKind.UNKNOWN_PROCESS, errors.get(0).getKind());

        assertTrue(VALIDATOR.validate(json(graph), null).isEmpty());
    }

    @Test
    void undeclaredParameterIsDanglingWhenParametersAreDeclared() {
        List<GraphError> errors = VALIDATOR.validate(json("{'parameters': [{'name': 'x', 'schema': {}}],"
                + "'process_graph': {'a': {'process_id': 'add', 'arguments': {'x': {'from_argument': 'x'}, 'y': {'from_argument': 'y'}}, 'result': true}}}"),
                arithmetic);

        assertEquals(1, errors.size());
        assertEquals(ErrorKind.DANGLING_REFERENCE, errors.get(0).getKind());
        assertTrue(errors.get(0).getMessage().contains("'y'"));
    }

    @Test
    void bareNodeMapDoesNotCheckParameterReferences() {
        assertTrue(VALIDATOR.validate(json("{'a': {'process_id': 'add', 'arguments': {'x': {'from_argument': 'anything'}, 'y': 1}, 'result': true}}"),
                arithmetic).isEmpty());
    }

    @Test
    void accumulatesAllErrorKinds() {
        List<GraphError> errors = VALIDATOR.validate(json("{"
                + "'broken': {'arguments': {}},"
                + "'a': {'process_id': 'add', 'arguments': {'x': {'from_node': 'b'}, 'y': 1}},"
                + "'b': {'process_id': 'add', 'arguments': {'x': {'from_node': 'a'}, 'y': {'from_node': 'ghost'}}},"
                + "'c': {'process_id': 'mystery', 'arguments': {}}}"), arithmetic);

        List<ErrorKind> kinds = Arrays.asList(errors.stream().map(GraphError::getKind).toArray(ErrorKind[]::new));
        assertTrue(kinds.contains(ErrorKind.MALFORMED_GRAPH));
        assertTrue(kinds.contains(ErrorKind.AMBIGUOUS_OR_MISSING_RESULT));
        assertTrue(kinds.contains(ErrorKind.DANGLING_REFERENCE));
        assertTrue(kinds.contains(ErrorKind.CYCLIC_DEPENDENCY));
        assertTrue(kinds.contains(ErrorKind.UNKNOWN_PROCESS));
    }

    @Test
    void requireValidThrowsWithAllErrors() {
        GraphValidationException e = assertThrows(GraphValidationException.class,
                () -> VALIDATOR.requireValid(json("{'a': {'process_id': 'mystery', 'arguments': {}}}"), arithmetic));

        assertTrue(e.hasErrorOfKind(ErrorKind.UNKNOWN_PROCESS));
        assertTrue(e.hasErrorOfKind(ErrorKind.AMBIGUOUS_OR_MISSING_RESULT));
    }

    @Test
    void userDefinedProcessMayReferenceUnknownProcesses() {
        ProcessDocument document = PARSER.parse(json("{'id': 'later', 'parameters': [],"
                + "'process_graph': {'a': {'process_id': 'not_registered_yet', 'arguments': {}, 'result': true}}}")).getDocumentOrThrow();

        assertTrue(VALIDATOR.validateUserDefined(UserDefinedProcess.fromDocument("alice", document)).isEmpty());
    }
}
