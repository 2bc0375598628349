package xyz.vvrf.reactor.processgraph.test.util;

import xyz.vvrf.reactor.processgraph.core.NodeResult;
import xyz.vvrf.reactor.processgraph.core.ProcessGraph;
import xyz.vvrf.reactor.processgraph.monitor.ProcessGraphMonitorListener;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 记录所有回调的监听器，事件格式为 {@code <类型>:<节点 ID>}。
 */
public class RecordingMonitorListener implements ProcessGraphMonitorListener {

    private final List<String> events = new CopyOnWriteArrayList<>();
    private final Map<String, NodeResult> lastNodeResults = new ConcurrentHashMap<>();
    private volatile Boolean lastSuccess;
    private volatile Throwable lastError;

    @Override
    public void onEvaluationStart(String requestId, String graphName, ProcessGraph graph) {
        events.add("evaluationStart:" + graphName);
    }

    @Override
    public void onEvaluationComplete(String requestId, String graphName, Duration totalDuration, boolean success,
                                     Map<String, NodeResult> nodeResults, Throwable error) {
        lastNodeResults.clear();
        lastNodeResults.putAll(nodeResults);
        lastSuccess = success;
        lastError = error;
        events.add("evaluationComplete:" + graphName);
    }

    @Override
    public void onNodeStart(String requestId, String graphName, String nodeId, String processId) {
        events.add("start:" + nodeId);
    }

    @Override
    public void onNodeSuccess(String requestId, String graphName, String nodeId, String processId, Duration duration) {
        events.add("success:" + nodeId);
    }

    @Override
    public void onNodeFailure(String requestId, String graphName, String nodeId, String processId, Duration duration, Throwable error) {
        events.add("failure:" + nodeId);
    }

    @Override
    public void onNodeSkipped(String requestId, String graphName, String nodeId, String processId) {
        events.add("skipped:" + nodeId);
    }

    @Override
    public void onNodeTimeout(String requestId, String graphName, String nodeId, String processId, Duration timeout) {
        events.add("timeout:" + nodeId);
    }

    public List<String> getEvents() {
        return events;
    }

    public Map<String, NodeResult> getLastNodeResults() {
        return lastNodeResults;
    }

    public Boolean getLastSuccess() {
        return lastSuccess;
    }

    public Throwable getLastError() {
        return lastError;
    }
}
