package xyz.vvrf.reactor.processgraph.core;

/**
 * 单次求值中节点的状态。
 * 状态只会向前迁移: {@code PENDING -> READY -> RUNNING -> DONE | FAILED}，
 * 上游失败而从未被分派的节点直接进入 {@code SKIPPED}。
 */
public enum NodeStatus {
    /** 尚有未完成的依赖。 */
    PENDING,
    /** 所有依赖已 DONE，等待分派。 */
    READY,
    /** 正在解析参数或执行处理。 */
    RUNNING,
    /** 执行成功，输出已记录。 */
    DONE,
    /** 执行失败，错误已记录。 */
    FAILED,
    /** 因上游失败 (或快速失败已触发) 而未执行。 */
    SKIPPED;

    public boolean isTerminal() {
        return this == DONE || this == FAILED || this == SKIPPED;
    }

    /**
     * 判断从当前状态迁移到 {@code next} 是否合法。
     */
    public boolean canTransitionTo(NodeStatus next) {
        switch (this) {
            case PENDING:
                return next == READY || next == SKIPPED;
            case READY:
                return next == RUNNING || next == SKIPPED;
            case RUNNING:
                return next == DONE || next == FAILED;
            default:
                return false;
        }
    }
}
