package xyz.vvrf.reactor.processgraph.schema;

import org.junit.jupiter.api.Test;
import xyz.vvrf.reactor.processgraph.builtin.ArithmeticProcesses;
import xyz.vvrf.reactor.processgraph.core.ProcessParameter;
import xyz.vvrf.reactor.processgraph.exception.SchemaViolationException;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static xyz.vvrf.reactor.processgraph.test.util.ProcessGraphTestSupport.BINDER;
import static xyz.vvrf.reactor.processgraph.test.util.ProcessGraphTestSupport.json;

class ParameterBinderTest {

    private final List<ProcessParameter> declared = Arrays.asList(
            ProcessParameter.required("x", json("{'type': 'number'}")),
            ProcessParameter.withDefault("factor", json("{'type': 'number'}"), 2),
            ProcessParameter.builder().name("label").schema(json("{'type': 'string'}")).optional(true).build());

    @Test
    void fillsDefaultsAndSkipsAbsentOptionalParameters() {
        ParameterBinder.BindingResult result = BINDER.bind(declared, Collections.singletonMap("x", 1.5));

        assertTrue(result.isValid());
        assertEquals(1.5, result.getArguments().get("x"));
        assertEquals(2, result.getArguments().get("factor"));
        assertFalse(result.getArguments().containsKey("label"));
    }

    @Test
    void accumulatesAllViolations() {
        Map<String, Object> supplied = new HashMap<>();
        supplied.put("factor", "two");
        supplied.put("unexpected", 1);

        ParameterBinder.BindingResult result = BINDER.bind(declared, supplied);

        assertFalse(result.isValid());
        List<String> parameters = Arrays.asList(result.getViolations().stream()
                .map(SchemaViolation::getParameter).toArray(String[]::new));
        assertTrue(parameters.contains("unexpected"));
        assertTrue(parameters.contains("x"));
        assertTrue(parameters.contains("factor"));
    }

    @Test
    void bindOrThrowReportsArgumentSide() {
        SchemaViolationException e = assertThrows(SchemaViolationException.class,
                () -> BINDER.bindOrThrow("n1", ArithmeticProcesses.add(), Collections.singletonMap("x", 1)));

        assertEquals(SchemaViolationException.Side.ARGUMENT, e.getSide());
        assertEquals("n1", e.getNodeId());
        assertEquals("add", e.getProcessId());
        assertEquals(Collections.singletonList("y"), e.getParameterNames());
    }

    @Test
    void explicitNullIsCheckedAgainstSchema() {
        Map<String, Object> supplied = new HashMap<>();
        supplied.put("x", null);
        supplied.put("y", 1);

        assertTrue(BINDER.bind(ArithmeticProcesses.add().getParameters(), supplied).isValid());
        assertFalse(BINDER.bind(declared, Collections.singletonMap("x", null)).isValid());
    }

    @Test
    void checkReturnReportsReturnSide() {
        BINDER.checkReturn("n", ArithmeticProcesses.add(), 3.0);
        BINDER.checkReturn("n", ArithmeticProcesses.add(), null);

        SchemaViolationException e = assertThrows(SchemaViolationException.class,
                () -> BINDER.checkReturn("n", ArithmeticProcesses.add(), "three"));
        assertEquals(SchemaViolationException.Side.RETURN, e.getSide());
        assertEquals(Collections.singletonList(SchemaViolation.RETURN), e.getParameterNames());
    }
}
