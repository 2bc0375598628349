package xyz.vvrf.reactor.processgraph.execution;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import xyz.vvrf.reactor.processgraph.core.ErrorHandlingStrategy;
import xyz.vvrf.reactor.processgraph.core.EvaluationResult;
import xyz.vvrf.reactor.processgraph.core.NodeResult;
import xyz.vvrf.reactor.processgraph.core.NodeStatus;
import xyz.vvrf.reactor.processgraph.core.ProcessDocument;
import xyz.vvrf.reactor.processgraph.core.ProcessNode;
import xyz.vvrf.reactor.processgraph.core.UserDefinedProcess;
import xyz.vvrf.reactor.processgraph.exception.ErrorKind;
import xyz.vvrf.reactor.processgraph.exception.GraphError;
import xyz.vvrf.reactor.processgraph.exception.GraphValidationException;
import xyz.vvrf.reactor.processgraph.exception.NodeEvaluationException;
import xyz.vvrf.reactor.processgraph.exception.ProcessGraphException;
import xyz.vvrf.reactor.processgraph.exception.SchemaViolationException;
import xyz.vvrf.reactor.processgraph.monitor.ProcessGraphMonitorListener;
import xyz.vvrf.reactor.processgraph.parser.ParseResult;
import xyz.vvrf.reactor.processgraph.registry.ProcessRegistry;
import xyz.vvrf.reactor.processgraph.registry.ProcessRegistrySnapshot;
import xyz.vvrf.reactor.processgraph.schema.ParameterBinder;
import xyz.vvrf.reactor.processgraph.util.GraphUtils;
import xyz.vvrf.reactor.processgraph.validation.ProcessGraphValidator;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * ProcessGraphEngine 的标准实现。
 * 校验文档后，为每个节点建立一个缓存的 Mono，等待其依赖的 Mono 完成后交给 {@link NodeExecutor} 执行；
 * 使用 concurrencyLevel 控制引擎层面节点执行流的并发度。
 * 用户自定义处理通过 {@link SubgraphEvaluator} 回调在同一套机制上进行子求值。
 *
 * @author ruifeng.wen
 */
@Slf4j
public class StandardProcessGraphEngine implements ProcessGraphEngine {

    public static final String DEFAULT_GRAPH_NAME = "process-graph";

    private final ProcessRegistry processRegistry;
    private final ProcessGraphValidator validator;
    private final ParameterBinder parameterBinder;
    private final NodeExecutor nodeExecutor;
    private final int concurrencyLevel;
    private final ErrorHandlingStrategy errorStrategy;
    private final int maxRecursionDepth;
    private final List<ProcessGraphMonitorListener> monitorListeners;

    public StandardProcessGraphEngine(ProcessRegistry processRegistry,
                                      ProcessGraphValidator validator,
                                      ParameterBinder parameterBinder,
                                      NodeExecutor nodeExecutor,
                                      int concurrencyLevel,
                                      ErrorHandlingStrategy errorStrategy,
                                      int maxRecursionDepth,
                                      List<ProcessGraphMonitorListener> monitorListeners) {
        this.processRegistry = Objects.requireNonNull(processRegistry, "ProcessRegistry cannot be null");
        this.validator = Objects.requireNonNull(validator, "ProcessGraphValidator cannot be null");
        this.parameterBinder = Objects.requireNonNull(parameterBinder, "ParameterBinder cannot be null");
        this.nodeExecutor = Objects.requireNonNull(nodeExecutor, "NodeExecutor cannot be null");
        if (concurrencyLevel <= 0) {
            throw new IllegalArgumentException("Concurrency level must be positive.");
        }
        if (maxRecursionDepth <= 0) {
            throw new IllegalArgumentException("Max recursion depth must be positive.");
        }
        this.concurrencyLevel = concurrencyLevel;
        this.errorStrategy = Objects.requireNonNull(errorStrategy, "ErrorHandlingStrategy cannot be null");
        this.maxRecursionDepth = maxRecursionDepth;
        this.monitorListeners = (monitorListeners != null) ? Collections.unmodifiableList(new ArrayList<>(monitorListeners)) : Collections.emptyList();
        log.info("StandardProcessGraphEngine initialized. Executor: {}, Concurrency Level: {}, Strategy: {}, Max Recursion Depth: {}",
                nodeExecutor.getClass().getSimpleName(), concurrencyLevel, errorStrategy, maxRecursionDepth);
    }

    @Override
    public List<GraphError> validate(JsonNode document, String ownerKey) {
        return validator.validate(document, processRegistry.snapshot(ownerKey));
    }

    @Override
    public Mono<EvaluationResult> evaluate(JsonNode document, Map<String, Object> parameters, String ownerKey, String requestId) {
        Objects.requireNonNull(document, "处理文档不能为空");
        final Map<String, Object> supplied = parameters == null ? Collections.emptyMap() : parameters;

        return Mono.defer(() -> {
            // 1. 每次求值使用同一个注册表快照 (包括子求值)
            ProcessRegistrySnapshot snapshot = processRegistry.snapshot(ownerKey);

            // 2. 结构校验，有错误时不调用任何处理
            ParseResult parsed = validator.getParser().parse(document);
            List<GraphError> errors = validator.validate(parsed, snapshot);
            if (!errors.isEmpty()) {
                log.warn("[RequestId: {}] Process graph rejected with {} structural error(s): {}", requestId, errors.size(), errors);
                return Mono.error(new GraphValidationException(errors));
            }
            ProcessDocument processDocument = parsed.getDocument();
            String graphName = processDocument.getId().orElse(DEFAULT_GRAPH_NAME);

            // 3. 顶层参数绑定
            Map<String, Object> bindings = bindTopLevel(processDocument, graphName, supplied);

            EvaluationContext context = EvaluationContext.builder()
                    .requestId(requestId)
                    .graphName(graphName)
                    .graph(processDocument.getGraph())
                    .executionOrder(GraphUtils.topologicalSort(processDocument.getGraph()))
                    .bindings(bindings)
                    .declaredParameters(processDocument.getParameters())
                    .processes(snapshot)
                    .callStack(CallStack.root(maxRecursionDepth))
                    .errorStrategy(errorStrategy)
                    .subgraphEvaluator(this::evaluateUserDefined)
                    .build();

            final String actualRequestId = context.getRequestId();
            log.info("[RequestId: {}][Graph: '{}'] Starting evaluation of {} nodes (result node '{}') with concurrency level {}.",
                    actualRequestId, graphName, context.getTotalNodes(), context.getResultNodeId(), concurrencyLevel);
            if (log.isDebugEnabled()) {
                log.debug("[RequestId: {}][Graph: '{}'] Graph:\n{}", actualRequestId, graphName,
                        GraphUtils.toDot(context.getGraph(), graphName));
            }
            safeNotifyListeners(l -> l.onEvaluationStart(actualRequestId, graphName, context.getGraph()));

            return evaluateGraph(context)
                    .map(result -> new EvaluationResult(actualRequestId, context.getResultNodeId(), result.getOutput(),
                            context.getOrderedResults(), Duration.between(context.getStartTime(), Instant.now())))
                    .doOnSuccess(result -> {
                        logCompletion(context);
                        safeNotifyListeners(l -> l.onEvaluationComplete(actualRequestId, graphName, result.getDuration(),
                                true, result.getNodeResults(), null));
                    })
                    .doOnError(error -> {
                        log.error("[RequestId: {}][Graph: '{}'] Evaluation failed: {}", actualRequestId, graphName, error.getMessage());
                        logCompletion(context);
                        safeNotifyListeners(l -> l.onEvaluationComplete(actualRequestId, graphName,
                                Duration.between(context.getStartTime(), Instant.now()), false, context.getOrderedResults(), error));
                    });
        });
    }

    /**
     * 文档声明了参数时按声明绑定 (缺失、未声明和类型错误都会被拒绝)；
     * 裸节点映射的参数原样作为绑定，未绑定的引用在节点执行时报 UNBOUND_PARAMETER。
     */
    private Map<String, Object> bindTopLevel(ProcessDocument document, String graphName, Map<String, Object> supplied) {
        if (!document.isParametersDeclared()) {
            return new LinkedHashMap<>(supplied);
        }
        ParameterBinder.BindingResult binding = parameterBinder.bind(document.getParameters(), supplied);
        if (!binding.isValid()) {
            throw new SchemaViolationException(SchemaViolationException.Side.ARGUMENT, null, graphName, binding.getViolations());
        }
        return binding.getArguments();
    }

    /**
     * 用户自定义处理的子求值：压入调用栈帧，以已绑定的参数作为子图绑定。
     */
    private Mono<NodeResult> evaluateUserDefined(EvaluationContext parent, ProcessNode callerNode,
                                                 UserDefinedProcess process, Map<String, Object> arguments) {
        return Mono.defer(() -> {
            CallStack childStack = parent.getCallStack()
                    .push(new EvaluationFrame(process.getId(), callerNode.getId(), parent.getGraphName()));
            EvaluationContext child = parent.createChild(process, GraphUtils.topologicalSort(process.getGraph()),
                    arguments, childStack);
            log.debug("[RequestId: {}][Graph: '{}'] Node '{}' enters user-defined process '{}' at depth {}.",
                    parent.getRequestId(), parent.getGraphName(), callerNode.getId(), process.getId(), childStack.getDepth());
            return evaluateGraph(child)
                    .onErrorMap(ProcessGraphException.class, inner -> attributeToCaller(callerNode, child.getGraphName(), inner));
        });
    }

    /**
     * 子图中的失败记在调用节点上，保留错误类别，内层异常作为 cause。
     */
    private static ProcessGraphException attributeToCaller(ProcessNode callerNode, String childGraphName,
                                                           ProcessGraphException inner) {
        return new NodeEvaluationException(inner.getKind(), callerNode.getId(),
                String.format("User-defined process '%s' called at node '%s' failed in graph '%s' at node '%s': %s",
                        callerNode.getProcessId(), callerNode.getId(), childGraphName, inner.getNodeId(), inner.getMessage()),
                inner);
    }

    /**
     * 求值一个图，成功时发出结果节点的结果；有任何节点失败时以第一个失败终止。
     */
    private Mono<NodeResult> evaluateGraph(EvaluationContext context) {
        return Flux.fromIterable(context.getExecutionOrder())
                .flatMap(nodeId -> getNodeMono(nodeId, context).then(), concurrencyLevel)
                .then(Mono.defer(() -> {
                    if (context.hasFailure()) {
                        return Mono.<NodeResult>error(context.getFirstFailure().get());
                    }
                    NodeResult result = context.getCompletedResults().get(context.getResultNodeId());
                    if (result == null || !result.isDone()) {
                        return Mono.<NodeResult>error(new NodeEvaluationException(ErrorKind.PROCESS_EXECUTION_FAILURE,
                                context.getResultNodeId(),
                                String.format("Result node '%s' did not complete (status: %s).", context.getResultNodeId(),
                                        result == null ? "MISSING" : result.getStatus())));
                    }
                    return Mono.just(result);
                }))
                .doFinally(signal -> context.clearExecutionMonoCache());
    }

    /**
     * 获取或创建指定节点的执行 Mono。
     * Mono.cache() 确保依赖等待和节点执行只运行一次。
     */
    private Mono<NodeResult> getNodeMono(String nodeId, EvaluationContext context) {
        return context.getOrCreateNodeMono(nodeId, () ->
                Mono.defer(() -> {
                    // --- 1. 检查是否可以提前终止 (FAIL_FAST) ---
                    if (context.getErrorStrategy() == ErrorHandlingStrategy.FAIL_FAST && context.isFailFastActive()) {
                        return createSkippedResultMono(nodeId, context);
                    }

                    ProcessNode node = context.getGraph().getNode(nodeId)
                            .orElseThrow(() -> new IllegalStateException("Node disappeared from graph: " + nodeId));
                    Set<String> dependencies = GraphUtils.dependenciesOf(node);
                    List<Mono<NodeResult>> dependencyMonos = dependencies.stream()
                            .map(dependency -> getNodeMono(dependency, context))
                            .collect(Collectors.toList());

                    // --- 2. 等待依赖并执行 ---
                    return Mono.when(dependencyMonos)
                            .then(Mono.defer(() -> {
                                if (context.getErrorStrategy() == ErrorHandlingStrategy.FAIL_FAST && context.isFailFastActive()) {
                                    log.debug("[RequestId: {}][Graph: '{}'] FAIL_FAST active after dependencies resolved, skipping node '{}'.",
                                            context.getRequestId(), context.getGraphName(), nodeId);
                                    return createSkippedResultMono(nodeId, context);
                                }
                                for (String dependency : dependencies) {
                                    NodeResult upstream = context.getCompletedResults().get(dependency);
                                    if (upstream == null) {
                                        String message = String.format("Consistency error: result of node '%s' not found for dependent '%s'.", dependency, nodeId);
                                        log.error("[RequestId: {}][Graph: '{}'] {}", context.getRequestId(), context.getGraphName(), message);
                                        return Mono.just(recordFailure(nodeId,
                                                new NodeEvaluationException(ErrorKind.PROCESS_EXECUTION_FAILURE, nodeId, message), context));
                                    }
                                    if (!upstream.isDone()) {
                                        log.debug("[RequestId: {}][Graph: '{}'] Upstream node '{}' is {}. Node '{}' will be skipped.",
                                                context.getRequestId(), context.getGraphName(), dependency, upstream.getStatus(), nodeId);
                                        return createSkippedResultMono(nodeId, context);
                                    }
                                }

                                context.transition(nodeId, NodeStatus.READY);
                                return nodeExecutor.executeNode(node, context)
                                        .doOnNext(result -> {
                                            if (context.recordCompletedResult(nodeId, result) && result.isFailed()) {
                                                handleFailureInternal(nodeId, result.getError().get(), context);
                                            }
                                        })
                                        .onErrorResume(error -> {
                                            log.error("[RequestId: {}][Graph: '{}'] Unexpected error while executing node '{}'. Recording failure.",
                                                    context.getRequestId(), context.getGraphName(), nodeId, error);
                                            ProcessGraphException wrapped = error instanceof ProcessGraphException
                                                    ? (ProcessGraphException) error
                                                    : new NodeEvaluationException(ErrorKind.PROCESS_EXECUTION_FAILURE, nodeId, error.getMessage(), error);
                                            return Mono.just(recordFailure(nodeId, wrapped, context));
                                        });
                            }));
                }).cache());
    }

    private Mono<NodeResult> createSkippedResultMono(String nodeId, EvaluationContext context) {
        NodeResult skipped = NodeResult.skipped();
        if (context.recordCompletedResult(nodeId, skipped)) {
            String processId = context.getGraph().getNode(nodeId).map(ProcessNode::getProcessId).orElse(null);
            safeNotifyListeners(l -> l.onNodeSkipped(context.getRequestId(), context.getGraphName(), nodeId, processId));
        }
        return Mono.just(context.getCompletedResults().get(nodeId));
    }

    private NodeResult recordFailure(String nodeId, ProcessGraphException error, EvaluationContext context) {
        NodeResult failed = NodeResult.failed(error);
        if (context.recordCompletedResult(nodeId, failed)) {
            handleFailureInternal(nodeId, error, context);
        }
        return context.getCompletedResults().get(nodeId);
    }

    private void handleFailureInternal(String nodeId, ProcessGraphException error, EvaluationContext context) {
        context.recordFailure(error);
        if (context.getErrorStrategy() == ErrorHandlingStrategy.FAIL_FAST) {
            if (context.triggerFailFast()) {
                log.debug("[RequestId: {}][Graph: '{}'] Node '{}' failed. FAIL_FAST strategy activated. Error: {}",
                        context.getRequestId(), context.getGraphName(), nodeId, error.getMessage());
            }
        } else {
            log.debug("[RequestId: {}][Graph: '{}'] Node '{}' failed (CONTINUE_ON_FAILURE strategy). Independent branches continue. Error: {}",
                    context.getRequestId(), context.getGraphName(), nodeId, error.getMessage());
        }
    }

    private void logCompletion(EvaluationContext context) {
        String finalStatus = context.hasFailure()
                ? (context.isFailFastActive() ? "FAILED (FAIL_FAST)" : "FAILED")
                : "SUCCESS";
        boolean allAccountedFor = context.getCompletedNodeCount() == context.getTotalNodes();
        log.info("[RequestId: {}][Graph: '{}'] Evaluation finished. Final Status: {}. Completed nodes accounted for: {}/{}.",
                context.getRequestId(), context.getGraphName(), finalStatus, context.getCompletedNodeCount(), context.getTotalNodes());
        if (!allAccountedFor) {
            log.warn("[RequestId: {}][Graph: '{}'] Not all nodes ({}) were accounted for upon completion ({}).",
                    context.getRequestId(), context.getGraphName(), context.getTotalNodes(), context.getCompletedNodeCount());
        }
    }

    private void safeNotifyListeners(Consumer<ProcessGraphMonitorListener> notification) {
        if (monitorListeners.isEmpty()) {
            return;
        }
        for (ProcessGraphMonitorListener listener : monitorListeners) {
            try {
                notification.accept(listener);
            } catch (Exception e) {
                log.error("处理图监控监听器 {} 在通知期间抛出异常: {}", listener.getClass().getName(), e.getMessage(), e);
            }
        }
    }
}
