package xyz.vvrf.reactor.processgraph.execution;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import xyz.vvrf.reactor.processgraph.core.ErrorHandlingStrategy;
import xyz.vvrf.reactor.processgraph.core.NodeResult;
import xyz.vvrf.reactor.processgraph.core.NodeStatus;
import xyz.vvrf.reactor.processgraph.core.ProcessGraph;
import xyz.vvrf.reactor.processgraph.core.ProcessParameter;
import xyz.vvrf.reactor.processgraph.core.UserDefinedProcess;
import xyz.vvrf.reactor.processgraph.exception.ProcessGraphException;
import xyz.vvrf.reactor.processgraph.registry.ProcessLookup;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * 封装单次图求值的上下文和运行时状态。
 * 顶层文档与每次用户自定义处理的子求值各自拥有一个实例；
 * 子求值与父求值共享请求 ID、处理快照和错误策略。
 *
 * @author ruifeng.wen
 */
@Slf4j
@Getter
public class EvaluationContext {

    private final String requestId;
    private final String graphName;
    private final ProcessGraph graph;
    private final String resultNodeId;
    private final List<String> executionOrder;
    private final Map<String, Object> bindings;
    private final Map<String, ProcessParameter> declaredParameters;
    private final ProcessLookup processes;
    private final CallStack callStack;
    private final ErrorHandlingStrategy errorStrategy;
    private final SubgraphEvaluator subgraphEvaluator;
    private final Instant startTime;

    private final Map<String, Mono<NodeResult>> nodeExecutionMonos = new ConcurrentHashMap<>();
    private final Map<String, NodeResult> completedResults = new ConcurrentHashMap<>();
    private final Map<String, NodeStatus> nodeStates = new ConcurrentHashMap<>();
    private final AtomicBoolean failFastTriggered = new AtomicBoolean(false);
    private final AtomicReference<ProcessGraphException> firstFailure = new AtomicReference<>();
    private final AtomicInteger completedNodeCounter = new AtomicInteger(0);

    private EvaluationContext(Builder builder) {
        this.requestId = (builder.requestId != null && !builder.requestId.trim().isEmpty())
                ? builder.requestId
                : "pg-req-" + UUID.randomUUID().toString().substring(0, 8);
        this.graphName = Objects.requireNonNull(builder.graphName, "图名称不能为空");
        this.graph = Objects.requireNonNull(builder.graph, "处理图不能为空");
        this.resultNodeId = graph.getResultNode().getId();
        this.executionOrder = Collections.unmodifiableList(Objects.requireNonNull(builder.executionOrder, "执行顺序不能为空"));
        this.bindings = builder.bindings == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(builder.bindings));
        Map<String, ProcessParameter> declared = new LinkedHashMap<>();
        if (builder.declaredParameters != null) {
            for (ProcessParameter parameter : builder.declaredParameters) {
                declared.put(parameter.getName(), parameter);
            }
        }
        this.declaredParameters = Collections.unmodifiableMap(declared);
        this.processes = Objects.requireNonNull(builder.processes, "处理查找视图不能为空");
        this.callStack = Objects.requireNonNull(builder.callStack, "调用栈不能为空");
        this.errorStrategy = Objects.requireNonNull(builder.errorStrategy, "错误处理策略不能为空");
        this.subgraphEvaluator = Objects.requireNonNull(builder.subgraphEvaluator, "子图求值器不能为空");
        this.startTime = Instant.now();

        for (String nodeId : graph.getNodeIds()) {
            nodeStates.put(nodeId, NodeStatus.PENDING);
        }

        log.debug("[RequestId: {}][Graph: '{}'] 创建 EvaluationContext (Strategy: {}, Nodes: {}, Depth: {})",
                this.requestId, this.graphName, this.errorStrategy, graph.size(), callStack.getDepth());
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * 为用户自定义处理的子求值创建上下文，继承请求 ID、处理快照、错误策略和子图求值器。
     */
    public EvaluationContext createChild(UserDefinedProcess process, List<String> order,
                                         Map<String, Object> arguments, CallStack childStack) {
        return builder()
                .requestId(requestId)
                .graphName("udp:" + process.getId())
                .graph(process.getGraph())
                .executionOrder(order)
                .bindings(arguments)
                .declaredParameters(process.getParameters())
                .processes(processes)
                .callStack(childStack)
                .errorStrategy(errorStrategy)
                .subgraphEvaluator(subgraphEvaluator)
                .build();
    }

    public int getDepth() {
        return callStack.getDepth();
    }

    public int getTotalNodes() {
        return graph.size();
    }

    public Optional<ProcessParameter> getDeclaredParameter(String name) {
        return Optional.ofNullable(declaredParameters.get(name));
    }

    public NodeStatus getNodeStatus(String nodeId) {
        return nodeStates.get(nodeId);
    }

    /**
     * 将节点迁移到新状态。非法迁移只记录警告，不改变状态。
     *
     * @return 迁移是否生效
     */
    public boolean transition(String nodeId, NodeStatus next) {
        AtomicBoolean applied = new AtomicBoolean(false);
        nodeStates.computeIfPresent(nodeId, (id, current) -> {
            if (current.canTransitionTo(next)) {
                applied.set(true);
                return next;
            }
            return current;
        });
        if (!applied.get()) {
            log.warn("[RequestId: {}][Graph: '{}'] Ignored illegal state transition of node '{}': {} -> {}",
                    requestId, graphName, nodeId, nodeStates.get(nodeId), next);
        }
        return applied.get();
    }

    /**
     * 原子性地记录一个节点的终态结果 (每个节点只写一次)，同时推进节点状态。
     *
     * @return 如果结果是新记录的，则返回 true；如果该节点的结果已存在，则返回 false。
     */
    public boolean recordCompletedResult(String nodeId, NodeResult result) {
        if (completedResults.putIfAbsent(nodeId, result) == null) {
            if (nodeStates.get(nodeId) != result.getStatus()) {
                transition(nodeId, result.getStatus());
            }
            int count = completedNodeCounter.incrementAndGet();
            log.debug("[RequestId: {}][Graph: '{}'] Node '{}' completed with status: {}. Progress: {}/{}",
                    requestId, graphName, nodeId, result.getStatus(), count, graph.size());
            return true;
        }
        log.warn("[RequestId: {}][Graph: '{}'] Node '{}' result ALREADY recorded when trying to add status: {}.",
                requestId, graphName, nodeId, result.getStatus());
        return false;
    }

    /**
     * 记录失败；只保留第一个失败。
     */
    public void recordFailure(ProcessGraphException error) {
        if (firstFailure.compareAndSet(null, error)) {
            log.debug("[RequestId: {}][Graph: '{}'] First failure recorded: {} ({})",
                    requestId, graphName, error.getMessage(), error.getKind());
        }
    }

    public Optional<ProcessGraphException> getFirstFailure() {
        return Optional.ofNullable(firstFailure.get());
    }

    public boolean hasFailure() {
        return firstFailure.get() != null;
    }

    /**
     * 尝试触发 FAIL_FAST 模式。
     *
     * @return 如果 FAIL_FAST 是首次被触发，则返回 true。
     */
    public boolean triggerFailFast() {
        if (failFastTriggered.compareAndSet(false, true)) {
            log.warn("[RequestId: {}][Graph: '{}'] Activating FAIL_FAST strategy due to a failure.", requestId, graphName);
            return true;
        }
        return false;
    }

    public boolean isFailFastActive() {
        return failFastTriggered.get();
    }

    public int getCompletedNodeCount() {
        return completedNodeCounter.get();
    }

    /**
     * 按执行顺序排列的节点终态结果；尚未结束的节点不包含在内。
     */
    public Map<String, NodeResult> getOrderedResults() {
        Map<String, NodeResult> ordered = new LinkedHashMap<>();
        for (String nodeId : executionOrder) {
            NodeResult result = completedResults.get(nodeId);
            if (result != null) {
                ordered.put(nodeId, result);
            }
        }
        return ordered;
    }

    /**
     * 获取或创建指定节点的执行 Mono。
     * 使用 computeIfAbsent 确保为每个节点只创建一个 Mono。
     */
    public Mono<NodeResult> getOrCreateNodeMono(String nodeId, Supplier<Mono<NodeResult>> monoSupplier) {
        return nodeExecutionMonos.computeIfAbsent(nodeId, key -> {
            log.trace("[RequestId: {}][Graph: '{}'] Creating execution Mono for node '{}'.", requestId, graphName, nodeId);
            return monoSupplier.get();
        });
    }

    public void clearExecutionMonoCache() {
        log.debug("[RequestId: {}][Graph: '{}'] Clearing execution mono cache for this context.", requestId, graphName);
        this.nodeExecutionMonos.clear();
    }

    /**
     * {@link EvaluationContext} 的构建器。
     */
    public static final class Builder {
        private String requestId;
        private String graphName;
        private ProcessGraph graph;
        private List<String> executionOrder;
        private Map<String, Object> bindings;
        private List<ProcessParameter> declaredParameters;
        private ProcessLookup processes;
        private CallStack callStack;
        private ErrorHandlingStrategy errorStrategy = ErrorHandlingStrategy.FAIL_FAST;
        private SubgraphEvaluator subgraphEvaluator;

        private Builder() {}

        public Builder requestId(String requestId) { this.requestId = requestId; return this; }
        public Builder graphName(String graphName) { this.graphName = graphName; return this; }
        public Builder graph(ProcessGraph graph) { this.graph = graph; return this; }
        public Builder executionOrder(List<String> executionOrder) { this.executionOrder = executionOrder; return this; }
        public Builder bindings(Map<String, Object> bindings) { this.bindings = bindings; return this; }
        public Builder declaredParameters(List<ProcessParameter> declaredParameters) { this.declaredParameters = declaredParameters; return this; }
        public Builder processes(ProcessLookup processes) { this.processes = processes; return this; }
        public Builder callStack(CallStack callStack) { this.callStack = callStack; return this; }
        public Builder errorStrategy(ErrorHandlingStrategy errorStrategy) { this.errorStrategy = errorStrategy; return this; }
        public Builder subgraphEvaluator(SubgraphEvaluator subgraphEvaluator) { this.subgraphEvaluator = subgraphEvaluator; return this; }

        public EvaluationContext build() {
            return new EvaluationContext(this);
        }
    }
}
