package xyz.vvrf.reactor.processgraph.exception;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 结构校验失败。一次性携带全部 {@link GraphError}，调用方无需逐个修复再重试。
 *
 * @author ruifeng.wen
 */
@Getter
public class GraphValidationException extends ProcessGraphException {

    private final List<GraphError> errors;

    public GraphValidationException(List<GraphError> errors) {
        super(firstKind(errors), firstNode(errors), buildMessage(errors));
        this.errors = Collections.unmodifiableList(new ArrayList<>(errors));
    }

    public boolean hasErrorOfKind(ErrorKind kind) {
        return errors.stream().anyMatch(e -> e.getKind() == kind);
    }

    public List<GraphError> getErrorsOfKind(ErrorKind kind) {
        return errors.stream().filter(e -> e.getKind() == kind).collect(Collectors.toList());
    }

    private static ErrorKind firstKind(List<GraphError> errors) {
        if (errors == null || errors.isEmpty()) {
            throw new IllegalArgumentException("GraphValidationException 至少需要一条错误");
        }
        return errors.get(0).getKind();
    }

    private static String firstNode(List<GraphError> errors) {
        return errors.get(0).getNodeId();
    }

    private static String buildMessage(List<GraphError> errors) {
        return String.format("Process graph is invalid (%d error(s)): %s",
                errors.size(),
                errors.stream().map(GraphError::toString).collect(Collectors.joining("; ")));
    }
}
