package xyz.vvrf.reactor.processgraph.exception;

import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 一条结构性校验错误 (不可变)。
 * {@code nodeIds} 列出与错误相关的节点，例如环上的全部节点或全部结果节点。
 */
@Getter
@EqualsAndHashCode
public final class GraphError {

    private final ErrorKind kind;
    private final List<String> nodeIds;
    private final String message;

    private GraphError(ErrorKind kind, List<String> nodeIds, String message) {
        this.kind = Objects.requireNonNull(kind, "错误类别不能为空");
        this.nodeIds = nodeIds == null ? Collections.emptyList() : Collections.unmodifiableList(nodeIds);
        this.message = Objects.requireNonNull(message, "错误信息不能为空");
    }

    public static GraphError of(ErrorKind kind, String nodeId, String message) {
        return new GraphError(kind, nodeId == null ? null : Collections.singletonList(nodeId), message);
    }

    public static GraphError of(ErrorKind kind, List<String> nodeIds, String message) {
        return new GraphError(kind, nodeIds, message);
    }

    public static GraphError global(ErrorKind kind, String message) {
        return new GraphError(kind, null, message);
    }

    /**
     * 第一个相关节点，若错误与节点无关则为 null。
     */
    public String getNodeId() {
        return nodeIds.isEmpty() ? null : nodeIds.get(0);
    }

    @Override
    public String toString() {
        if (nodeIds.isEmpty()) {
            return kind + ": " + message;
        }
        return kind + " " + nodeIds + ": " + message;
    }
}
