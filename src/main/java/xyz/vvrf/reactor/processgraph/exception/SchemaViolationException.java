package xyz.vvrf.reactor.processgraph.exception;

import lombok.Getter;
import xyz.vvrf.reactor.processgraph.schema.SchemaViolation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 参数或返回值未通过 JSON Schema 校验。包含本次检查发现的全部违规项。
 *
 * @author ruifeng.wen
 */
@Getter
public class SchemaViolationException extends NodeEvaluationException {

    /**
     * 违规发生在哪一侧。
     */
    public enum Side {
        ARGUMENT, RETURN
    }

    private final Side side;
    private final String processId;
    private final List<SchemaViolation> violations;

    public SchemaViolationException(Side side, String nodeId, String processId, List<SchemaViolation> violations) {
        super(ErrorKind.SCHEMA_VIOLATION, nodeId, buildMessage(side, nodeId, processId, violations));
        this.side = side;
        this.processId = processId;
        this.violations = Collections.unmodifiableList(new ArrayList<>(violations));
    }

    /**
     * 违规涉及的参数名 (返回值违规时为 "return")，按发现顺序去重。
     */
    public List<String> getParameterNames() {
        return violations.stream().map(SchemaViolation::getParameter).distinct().collect(Collectors.toList());
    }

    private static String buildMessage(Side side, String nodeId, String processId, List<SchemaViolation> violations) {
        String details = violations.stream().map(SchemaViolation::toString).collect(Collectors.joining("; "));
        if (side == Side.RETURN) {
            return String.format("Return value of process '%s' at node '%s' violates its schema: %s", processId, nodeId, details);
        }
        return String.format("Arguments of process '%s' at node '%s' violate parameter schemas: %s", processId, nodeId, details);
    }
}
