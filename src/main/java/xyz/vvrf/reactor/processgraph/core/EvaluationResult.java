package xyz.vvrf.reactor.processgraph.core;

import lombok.Getter;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 一次成功求值的结果：结果节点的输出，以及各节点的终态结果 (按拓扑顺序)。
 */
@Getter
public final class EvaluationResult {

    private final String requestId;
    private final String resultNodeId;
    private final Object value;
    private final Map<String, NodeResult> nodeResults;
    private final Duration duration;

    public EvaluationResult(String requestId, String resultNodeId, Object value,
                            Map<String, NodeResult> nodeResults, Duration duration) {
        this.requestId = requestId;
        this.resultNodeId = resultNodeId;
        this.value = value;
        this.nodeResults = Collections.unmodifiableMap(new LinkedHashMap<>(nodeResults));
        this.duration = duration;
    }

    @Override
    public String toString() {
        return "EvaluationResult{requestId='" + requestId + "', resultNode='" + resultNodeId + "', value=" + value + ", duration=" + duration + '}';
    }
}
