package xyz.vvrf.reactor.processgraph.monitor;

/**
 * reactor-process-graph
 *
 * @author ruifeng.wen
 */

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.reactor.processgraph.core.NodeResult;
import xyz.vvrf.reactor.processgraph.core.ProcessGraph;
import xyz.vvrf.reactor.processgraph.exception.ProcessGraphException;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

@Slf4j
public class MicrometerProcessGraphMonitorListener implements ProcessGraphMonitorListener {

    // 指标名称
    public static final String METRIC_EVALUATION_TIME = "process.graph.evaluation.time";
    public static final String METRIC_NODE_EXECUTION_TIME = "process.graph.node.execution.time";
    public static final String METRIC_NODE_EXECUTION_TOTAL = "process.graph.node.execution.total";
    public static final String METRIC_NODE_TIMEOUT_TOTAL = "process.graph.node.timeout.total";

    // 标签键
    private static final String TAG_GRAPH_NAME = "graph.name";
    private static final String TAG_PROCESS_ID = "process.id";
    private static final String TAG_STATUS = "status";
    private static final String TAG_ERROR_KIND = "error.kind";

    // 状态标签值
    private static final String STATUS_SUCCESS = "SUCCESS";
    private static final String STATUS_FAILURE = "FAILURE";
    private static final String STATUS_SKIPPED = "SKIPPED";
    private static final String STATUS_TIMEOUT = "TIMEOUT";

    private final MeterRegistry meterRegistry;

    public MicrometerProcessGraphMonitorListener(MeterRegistry meterRegistry) {
        this.meterRegistry = Objects.requireNonNull(meterRegistry, "MeterRegistry 不能为空");
    }

    @Override
    public void onEvaluationStart(String requestId, String graphName, ProcessGraph graph) {
        // 计时在完成时记录
    }

    @Override
    public void onEvaluationComplete(String requestId, String graphName, Duration totalDuration, boolean success,
                                     Map<String, NodeResult> nodeResults, Throwable error) {
        try {
            Timer.builder(METRIC_EVALUATION_TIME)
                    .tags(Tags.of(Tag.of(TAG_STATUS, success ? STATUS_SUCCESS : STATUS_FAILURE)))
                    .description("处理图求值总耗时")
                    .register(meterRegistry)
                    .record(totalDuration.toNanos(), TimeUnit.NANOSECONDS);
        } catch (Exception e) {
            log.error("记录求值计时器指标失败: {}", e.getMessage(), e);
        }
    }

    @Override
    public void onNodeStart(String requestId, String graphName, String nodeId, String processId) {
        // 节点计数在结束时记录
    }

    @Override
    public void onNodeSuccess(String requestId, String graphName, String nodeId, String processId, Duration duration) {
        Tags tags = Tags.of(
                Tag.of(TAG_GRAPH_NAME, graphName),
                Tag.of(TAG_PROCESS_ID, processId),
                Tag.of(TAG_STATUS, STATUS_SUCCESS)
        );
        recordTimer(tags, duration);
        incrementCounter(tags);
    }

    @Override
    public void onNodeFailure(String requestId, String graphName, String nodeId, String processId, Duration duration, Throwable error) {
        String errorKind = (error instanceof ProcessGraphException)
                ? ((ProcessGraphException) error).getKind().name()
                : (error != null ? error.getClass().getSimpleName() : "Unknown");
        Tags tags = Tags.of(
                Tag.of(TAG_GRAPH_NAME, graphName),
                Tag.of(TAG_PROCESS_ID, processId),
                Tag.of(TAG_STATUS, STATUS_FAILURE),
                Tag.of(TAG_ERROR_KIND, errorKind)
        );
        recordTimer(tags, duration);
        incrementCounter(tags);
    }

    @Override
    public void onNodeSkipped(String requestId, String graphName, String nodeId, String processId) {
        Tags tags = Tags.of(
                Tag.of(TAG_GRAPH_NAME, graphName),
                Tag.of(TAG_PROCESS_ID, processId),
                Tag.of(TAG_STATUS, STATUS_SKIPPED)
        );
        incrementCounter(tags);
    }

    @Override
    public void onNodeTimeout(String requestId, String graphName, String nodeId, String processId, Duration timeout) {
        // 超时随后还会以失败计数，这里单独计数
        Tags tags = Tags.of(
                Tag.of(TAG_GRAPH_NAME, graphName),
                Tag.of(TAG_PROCESS_ID, processId),
                Tag.of(TAG_STATUS, STATUS_TIMEOUT)
        );
        Counter.builder(METRIC_NODE_TIMEOUT_TOTAL).tags(tags).register(meterRegistry).increment();
        log.debug("Micrometer 监听器捕获到节点 {} 的超时事件", nodeId);
    }

    private void recordTimer(Tags tags, Duration duration) {
        try {
            Timer timer = Timer.builder(METRIC_NODE_EXECUTION_TIME)
                    .tags(tags)
                    .description("处理图节点执行时间")
                    .register(meterRegistry);
            timer.record(duration.toNanos(), TimeUnit.NANOSECONDS);
        } catch (Exception e) {
            log.error("记录计时器指标失败: {}", e.getMessage(), e);
        }
    }

    private void incrementCounter(Tags tags) {
        try {
            Counter counter = Counter.builder(METRIC_NODE_EXECUTION_TOTAL)
                    .tags(tags)
                    .description("按状态统计的处理图节点执行总数")
                    .register(meterRegistry);
            counter.increment();
        } catch (Exception e) {
            log.error("增加计数器指标失败: {}", e.getMessage(), e);
        }
    }
}
