package xyz.vvrf.reactor.processgraph.parser;

import org.junit.jupiter.api.Test;
import xyz.vvrf.reactor.processgraph.core.ArgumentValue;
import xyz.vvrf.reactor.processgraph.core.ProcessDocument;
import xyz.vvrf.reactor.processgraph.core.ProcessNode;
import xyz.vvrf.reactor.processgraph.core.ProcessParameter;
import xyz.vvrf.reactor.processgraph.exception.ErrorKind;
import xyz.vvrf.reactor.processgraph.exception.GraphError;
import xyz.vvrf.reactor.processgraph.exception.GraphValidationException;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static xyz.vvrf.reactor.processgraph.test.util.ProcessGraphTestSupport.PARSER;
import static xyz.vvrf.reactor.processgraph.test.util.ProcessGraphTestSupport.json;
import static xyz.vvrf.reactor.processgraph.test.util.ProcessGraphTestSupport.readGraph;

class ProcessGraphParserTest {

    @Test
    void parsesBareNodeMapPreservingOrder() {
        ParseResult result = PARSER.parse(json("{"
                + "'z': {'process_id': 'add', 'arguments': {'x': 1, 'y': 2}},"
                + "'a': {'process_id': 'multiply', 'arguments': {'x': {'from_node': 'z'}, 'y': 3}, 'result': true}}"));

        assertFalse(result.hasErrors());
        ProcessDocument document = result.getDocument();
        assertFalse(document.isParametersDeclared());
        assertFalse(document.getId().isPresent());
        assertEquals(Arrays.asList("z", "a"), Arrays.asList(document.getGraph().getNodeIds().toArray(new String[0])));
        assertEquals("a", document.getGraph().getResultNode().getId());
        assertEquals(Arrays.asList("a"), result.getResultCandidates());
    }

    @Test
    void classifiesArgumentValuesRecursively() {
        ProcessNode node = PARSER.parse(json("{'n': {'process_id': 'p', 'arguments': {"
                + "'lit': 4.5,"
                + "'ref': {'from_node': 'm'},"
                + "'param': {'from_argument': 'x'},"
                + "'list': [1, {'from_node': 'm'}],"
                + "'obj': {'inner': {'from_argument': 'y'}, 'text': 'hello'},"
                + "'nil': null},"
                + "'result': true}}")).getDocument().getGraph().getResultNode();

        assertEquals(ArgumentValue.Kind.LITERAL, node.getArgument("lit").get().getKind());
        assertEquals(4.5, ((ArgumentValue.Literal) node.getArgument("lit").get()).getValue());
        assertEquals("m", ((ArgumentValue.NodeReference) node.getArgument("ref").get()).getNodeId());
        assertEquals("x", ((ArgumentValue.ParameterReference) node.getArgument("param").get()).getName());

        ArgumentValue.ArrayValue list = (ArgumentValue.ArrayValue) node.getArgument("list").get();
        assertEquals(ArgumentValue.Kind.LITERAL, list.getElements().get(0).getKind());
        assertEquals(ArgumentValue.Kind.NODE_REFERENCE, list.getElements().get(1).getKind());

        ArgumentValue.ObjectValue obj = (ArgumentValue.ObjectValue) node.getArgument("obj").get();
        assertEquals(ArgumentValue.Kind.PARAMETER_REFERENCE, obj.getEntries().get("inner").getKind());
        assertEquals("hello", ((ArgumentValue.Literal) obj.getEntries().get("text")).getValue());

        assertNull(((ArgumentValue.Literal) node.getArgument("nil").get()).getValue());
    }

    @Test
    void parsesProcessDocumentWithParametersAndReturns() {
        ProcessDocument document = PARSER.parse(readGraph("scale.json")).getDocumentOrThrow();

        assertEquals("scale", document.getId().get());
        assertEquals("Scales a value by a factor", document.getSummary());
        assertTrue(document.isParametersDeclared());
        List<ProcessParameter> parameters = document.getParameters();
        assertEquals(2, parameters.size());
        assertEquals("x", parameters.get(0).getName());
        assertFalse(parameters.get(0).isOptional());
        assertFalse(parameters.get(0).hasDefault());
        assertTrue(parameters.get(1).isOptional());
        assertTrue(parameters.get(1).hasDefault());
        assertEquals(2, parameters.get(1).getDefaultValue());
        assertEquals("number", document.getReturns().get("type").get(0).asText());
    }

    @Test
    void unwrapsProcessEnvelope() {
        ProcessDocument document = PARSER.parse(readGraph("load_and_reduce.json")).getDocumentOrThrow();

        assertEquals(3, document.getGraph().size());
        assertEquals("save", document.getGraph().getResultNode().getId());
    }

    @Test
    void nodeNamedProcessGraphIsTreatedAsNode() {
        ParseResult result = PARSER.parse(json("{'process_graph': {'process_id': 'add', 'arguments': {'x': 1, 'y': 1}, 'result': true}}"));

        assertFalse(result.hasErrors());
        assertTrue(result.getDocument().getGraph().containsNode("process_graph"));
    }

    @Test
    void accumulatesMalformedNodeErrors() {
        ParseResult result = PARSER.parse(json("{"
                + "'a': {'arguments': {}},"
                + "'b': {'process_id': 'add'},"
                + "'c': {'process_id': 'add', 'arguments': {'x': {'from_node': 5}}},"
                + "'d': 'not an object',"
                + "'e': {'process_id': 'add', 'arguments': {}, 'result': 'yes'},"
                + "'ok': {'process_id': 'add', 'arguments': {}, 'result': true}}"));

        List<GraphError> errors = result.getErrors();
        assertEquals(5, errors.size());
        assertTrue(errors.stream().allMatch(e -> e.getKind() == ErrorKind.MALFORMED_GRAPH));
        assertEquals(Arrays.asList("a", "b", "c", "d", "e"),
                Arrays.asList(errors.stream().map(GraphError::getNodeId).toArray(String[]::new)));
        assertEquals(1, result.getDocument().getGraph().size());
        assertThrows(GraphValidationException.class, result::getDocumentOrThrow);
    }

    @Test
    void rejectsInvalidJsonText() {
        ParseResult result = PARSER.parse("{not json");

        assertTrue(result.hasErrors());
        assertEquals(ErrorKind.MALFORMED_GRAPH, result.getErrors().get(0).getKind());
        assertTrue(result.getDocument().getGraph().isEmpty());
    }

    @Test
    void rejectsNonObjectDocument() {
        ParseResult result = PARSER.parse(json("[1, 2]"));

        assertEquals(1, result.getErrors().size());
        assertNull(result.getErrors().get(0).getNodeId());
    }
}
