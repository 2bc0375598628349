package xyz.vvrf.reactor.processgraph.execution;

import org.junit.jupiter.api.Test;
import xyz.vvrf.reactor.processgraph.exception.ErrorKind;
import xyz.vvrf.reactor.processgraph.exception.NodeEvaluationException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CallStackTest {

    @Test
    void pushReturnsNewStackAndLeavesOriginalUntouched() {
        CallStack root = CallStack.root(3);
        CallStack one = root.push(new EvaluationFrame("scale", "s1", "g"));
        CallStack two = one.push(new EvaluationFrame("inner", "m", "udp:scale"));

        assertEquals(0, root.getDepth());
        assertEquals(1, one.getDepth());
        assertEquals(2, two.getDepth());
        assertFalse(root.peek().isPresent());
        assertEquals("inner", two.peek().get().getProcessId());
        assertEquals("<root> -> scale -> inner", two.describe());
        assertEquals("<root>", root.describe());
    }

    @Test
    void pushBeyondMaxDepthFails() {
        CallStack stack = CallStack.root(2)
                .push(new EvaluationFrame("p", "a", "g"))
                .push(new EvaluationFrame("p", "b", "udp:p"));

        NodeEvaluationException e = assertThrows(NodeEvaluationException.class,
                () -> stack.push(new EvaluationFrame("p", "c", "udp:p")));

        assertEquals(ErrorKind.RECURSION_LIMIT_EXCEEDED, e.getKind());
        assertEquals("c", e.getNodeId());
        assertTrue(e.getMessage().contains("<root> -> p -> p"));
    }

    @Test
    void rootRequiresPositiveDepth() {
        assertThrows(IllegalArgumentException.class, () -> CallStack.root(0));
    }
}
