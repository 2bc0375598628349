package xyz.vvrf.reactor.processgraph.monitor;

import xyz.vvrf.reactor.processgraph.core.NodeResult;
import xyz.vvrf.reactor.processgraph.core.ProcessGraph;

import java.time.Duration;
import java.util.Map;

/**
 * 用于监控处理图求值事件的监听器接口。
 * 包括求值级别 (仅顶层文档) 和节点级别 (包括用户自定义处理的子图) 的事件。
 * 监听器抛出的异常会被记录并忽略，不影响求值。
 *
 * @author ruifeng.wen
 */
public interface ProcessGraphMonitorListener {

    /**
     * 顶层求值开始时调用。
     *
     * @param requestId 请求 ID
     * @param graphName 图名称
     * @param graph     已校验的处理图
     */
    void onEvaluationStart(String requestId, String graphName, ProcessGraph graph);

    /**
     * 顶层求值完成时调用 (无论成功或失败)。
     *
     * @param requestId     请求 ID
     * @param graphName     图名称
     * @param totalDuration 总耗时
     * @param success       是否成功
     * @param nodeResults   顶层图中各节点的终态结果
     * @param error         失败时的错误；成功时为 null
     */
    void onEvaluationComplete(String requestId, String graphName, Duration totalDuration, boolean success,
                              Map<String, NodeResult> nodeResults, Throwable error);

    /**
     * 节点开始执行 (RUNNING) 时调用。
     */
    void onNodeStart(String requestId, String graphName, String nodeId, String processId);

    /**
     * 节点成功完成时调用。
     *
     * @param duration 从 RUNNING 到 DONE 的耗时
     */
    void onNodeSuccess(String requestId, String graphName, String nodeId, String processId, Duration duration);

    /**
     * 节点失败时调用。
     *
     * @param duration 从 RUNNING 到 FAILED 的耗时
     * @param error    导致失败的错误
     */
    void onNodeFailure(String requestId, String graphName, String nodeId, String processId, Duration duration, Throwable error);

    /**
     * 节点因上游失败或快速失败而被跳过时调用。
     */
    void onNodeSkipped(String requestId, String graphName, String nodeId, String processId);

    /**
     * 节点执行超时时调用。超时随后也会以 onNodeFailure 报告。
     *
     * @param timeout 生效的超时时长
     */
    void onNodeTimeout(String requestId, String graphName, String nodeId, String processId, Duration timeout);
}
