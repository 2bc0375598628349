package xyz.vvrf.reactor.processgraph.core;

import lombok.Getter;
import xyz.vvrf.reactor.processgraph.exception.ProcessGraphException;

import java.util.Objects;
import java.util.Optional;

/**
 * 单个节点求值结束后的结果（不可变数据类）。
 * 只表示终态: DONE (带输出，输出可以为 null)、FAILED (带错误) 或 SKIPPED。
 *
 * @author ruifeng.wen
 */
public final class NodeResult {

    @Getter
    private final NodeStatus status;
    private final Object output;
    private final ProcessGraphException error;

    private NodeResult(NodeStatus status, Object output, ProcessGraphException error) {
        this.status = Objects.requireNonNull(status, "节点状态不能为空");
        if (!status.isTerminal()) {
            throw new IllegalArgumentException("NodeResult 只能表示终态，实际为: " + status);
        }
        if (status == NodeStatus.FAILED && error == null) {
            throw new IllegalArgumentException("FAILED 状态的结果必须包含一个非空的错误信息。");
        }
        if (status != NodeStatus.FAILED && error != null) {
            throw new IllegalArgumentException("非 FAILED 状态的结果不能包含错误信息。");
        }
        this.output = output;
        this.error = error;
    }

    // --- 静态工厂方法 ---

    /**
     * 创建一个表示成功执行的结果。
     * @param output 节点输出 (可以为 null)
     */
    public static NodeResult done(Object output) {
        return new NodeResult(NodeStatus.DONE, output, null);
    }

    /**
     * 创建一个表示执行失败的结果。
     * @param error 导致失败的异常 (不能为空)
     */
    public static NodeResult failed(ProcessGraphException error) {
        Objects.requireNonNull(error, "错误对象不能为空");
        return new NodeResult(NodeStatus.FAILED, null, error);
    }

    public static NodeResult skipped() {
        return new NodeResult(NodeStatus.SKIPPED, null, null);
    }

    // --- 实例方法 ---

    /**
     * 节点输出，仅对 DONE 状态有意义 (可以为 null)。
     */
    public Object getOutput() {
        return output;
    }

    public Optional<ProcessGraphException> getError() {
        return Optional.ofNullable(error);
    }

    public boolean isDone() { return status == NodeStatus.DONE; }
    public boolean isFailed() { return status == NodeStatus.FAILED; }
    public boolean isSkipped() { return status == NodeStatus.SKIPPED; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        NodeResult that = (NodeResult) o;
        return status == that.status &&
                Objects.equals(output, that.output) &&
                Objects.equals(error, that.error);
    }

    @Override
    public int hashCode() {
        return Objects.hash(status, output, error);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("NodeResult{");
        sb.append("status=").append(status);
        if (status == NodeStatus.DONE) {
            sb.append(", output=").append(output == null ? "null" : output.getClass().getSimpleName());
        }
        getError().ifPresent(e -> sb.append(", error=").append(e.getKind()));
        sb.append('}');
        return sb.toString();
    }
}
