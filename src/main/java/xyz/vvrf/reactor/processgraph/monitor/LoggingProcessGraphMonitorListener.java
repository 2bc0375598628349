package xyz.vvrf.reactor.processgraph.monitor;

/**
 * reactor-process-graph
 *
 * @author ruifeng.wen
 */

import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.reactor.processgraph.core.NodeResult;
import xyz.vvrf.reactor.processgraph.core.ProcessGraph;

import java.time.Duration;
import java.util.Map;

@Slf4j
public class LoggingProcessGraphMonitorListener implements ProcessGraphMonitorListener {

    @Override
    public void onEvaluationStart(String requestId, String graphName, ProcessGraph graph) {
        log.info("[MONITOR] 请求:[{}] 图:[{}] 求值开始。 节点数:[{}]", requestId, graphName, graph.size());
    }

    @Override
    public void onEvaluationComplete(String requestId, String graphName, Duration totalDuration, boolean success,
                                     Map<String, NodeResult> nodeResults, Throwable error) {
        if (success) {
            log.info("[MONITOR] 请求:[{}] 图:[{}] 求值成功。 耗时:[{}ms], 已完成节点:[{}]",
                    requestId, graphName, totalDuration.toMillis(), nodeResults.size());
        } else {
            log.warn("[MONITOR] 请求:[{}] 图:[{}] 求值失败。 耗时:[{}ms], 错误:[{}]",
                    requestId, graphName, totalDuration.toMillis(), error == null ? "未知" : error.getMessage());
        }
    }

    @Override
    public void onNodeStart(String requestId, String graphName, String nodeId, String processId) {
        log.info("[MONITOR] 请求:[{}] 图:[{}] 节点:[{}] 开始。 处理:[{}]", requestId, graphName, nodeId, processId);
    }

    @Override
    public void onNodeSuccess(String requestId, String graphName, String nodeId, String processId, Duration duration) {
        log.info("[MONITOR] 请求:[{}] 图:[{}] 节点:[{}] 成功。 耗时:[{}ms], 处理:[{}]",
                requestId, graphName, nodeId, duration.toMillis(), processId);
    }

    @Override
    public void onNodeFailure(String requestId, String graphName, String nodeId, String processId, Duration duration, Throwable error) {
        log.error("[MONITOR] 请求:[{}] 图:[{}] 节点:[{}] 失败。 耗时:[{}ms], 错误:[{}], 处理:[{}]",
                requestId, graphName, nodeId, duration.toMillis(), error.getMessage(), processId);
    }

    @Override
    public void onNodeSkipped(String requestId, String graphName, String nodeId, String processId) {
        log.info("[MONITOR] 请求:[{}] 图:[{}] 节点:[{}] 跳过。 处理:[{}]", requestId, graphName, nodeId, processId);
    }

    @Override
    public void onNodeTimeout(String requestId, String graphName, String nodeId, String processId, Duration timeout) {
        log.warn("[MONITOR] 请求:[{}] 图:[{}] 节点:[{}] 超时。 配置:[{}ms], 处理:[{}]",
                requestId, graphName, nodeId, timeout.toMillis(), processId);
    }
}
