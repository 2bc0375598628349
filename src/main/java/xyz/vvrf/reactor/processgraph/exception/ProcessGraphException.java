package xyz.vvrf.reactor.processgraph.exception;

import lombok.Getter;

import java.util.Objects;
import java.util.Optional;

/**
 * 处理图框架的基础运行时异常。
 * 携带错误类别以及 (可选的) 出错节点 ID。
 *
 * @author ruifeng.wen
 */
@Getter
public class ProcessGraphException extends RuntimeException {

    private final ErrorKind kind;
    private final String nodeId;

    public ProcessGraphException(ErrorKind kind, String nodeId, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "错误类别不能为空");
        this.nodeId = nodeId;
    }

    public ProcessGraphException(ErrorKind kind, String nodeId, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "错误类别不能为空");
        this.nodeId = nodeId;
    }

    public Optional<String> getNodeIdOptional() {
        return Optional.ofNullable(nodeId);
    }
}
