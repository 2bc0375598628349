package xyz.vvrf.reactor.processgraph.execution;

import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.Objects;

/**
 * 调用栈中的一帧：哪个图中的哪个节点调用了哪个用户自定义处理。
 */
@Getter
@EqualsAndHashCode
public final class EvaluationFrame {

    private final String processId;
    private final String callerNodeId;
    private final String callerGraphName;

    public EvaluationFrame(String processId, String callerNodeId, String callerGraphName) {
        this.processId = Objects.requireNonNull(processId, "处理 ID 不能为空");
        this.callerNodeId = Objects.requireNonNull(callerNodeId, "调用节点 ID 不能为空");
        this.callerGraphName = callerGraphName;
    }

    @Override
    public String toString() {
        return callerGraphName + "#" + callerNodeId + " -> " + processId;
    }
}
