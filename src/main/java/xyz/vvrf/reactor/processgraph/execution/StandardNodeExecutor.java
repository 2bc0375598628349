package xyz.vvrf.reactor.processgraph.execution;

import lombok.extern.slf4j.Slf4j;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import xyz.vvrf.reactor.processgraph.core.NodeResult;
import xyz.vvrf.reactor.processgraph.core.NodeStatus;
import xyz.vvrf.reactor.processgraph.core.ProcessDefinition;
import xyz.vvrf.reactor.processgraph.core.ProcessNode;
import xyz.vvrf.reactor.processgraph.exception.ErrorKind;
import xyz.vvrf.reactor.processgraph.exception.NodeEvaluationException;
import xyz.vvrf.reactor.processgraph.exception.ProcessGraphException;
import xyz.vvrf.reactor.processgraph.monitor.ProcessGraphMonitorListener;
import xyz.vvrf.reactor.processgraph.schema.ParameterBinder;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;

/**
 * NodeExecutor 的标准实现。
 * 从上下文的处理快照中查找处理，解析参数并按参数声明绑定，
 * 在节点调度器上以超时执行处理，最后校验返回值。
 *
 * @author ruifeng.wen
 */
@Slf4j
public class StandardNodeExecutor implements NodeExecutor {

    private final ArgumentResolver argumentResolver;
    private final ParameterBinder parameterBinder;
    private final Duration defaultNodeTimeout;
    private final Scheduler nodeExecutionScheduler;
    private final List<ProcessGraphMonitorListener> monitorListeners;

    /**
     * 创建 StandardNodeExecutor 实例。
     *
     * @param argumentResolver       参数解析器
     * @param parameterBinder        参数绑定与 Schema 校验
     * @param defaultNodeTimeout     节点的全局默认超时时间
     * @param nodeExecutionScheduler 节点执行的 Reactor Scheduler
     * @param monitorListeners       监控监听器列表
     */
    public StandardNodeExecutor(ArgumentResolver argumentResolver,
                                ParameterBinder parameterBinder,
                                Duration defaultNodeTimeout,
                                Scheduler nodeExecutionScheduler,
                                List<ProcessGraphMonitorListener> monitorListeners) {
        this.argumentResolver = Objects.requireNonNull(argumentResolver, "ArgumentResolver 不能为空");
        this.parameterBinder = Objects.requireNonNull(parameterBinder, "ParameterBinder 不能为空");
        this.defaultNodeTimeout = Objects.requireNonNull(defaultNodeTimeout, "默认节点超时不能为空");
        if (defaultNodeTimeout.isZero() || defaultNodeTimeout.isNegative()) {
            throw new IllegalArgumentException("Default node timeout must be positive.");
        }
        this.nodeExecutionScheduler = Objects.requireNonNull(nodeExecutionScheduler, "节点执行调度器不能为空");
        this.monitorListeners = (monitorListeners != null) ? Collections.unmodifiableList(new ArrayList<>(monitorListeners)) : Collections.emptyList();
        log.info("初始化了 StandardNodeExecutor。默认超时: {}, 调度器: {}, 监听器数量: {}",
                defaultNodeTimeout, nodeExecutionScheduler.getClass().getSimpleName(), this.monitorListeners.size());
    }

    @Override
    public Mono<NodeResult> executeNode(ProcessNode node, EvaluationContext context) {
        final String requestId = context.getRequestId();
        final String graphName = context.getGraphName();
        final String nodeId = node.getId();
        final String processId = node.getProcessId();

        return Mono.defer(() -> {
            context.transition(nodeId, NodeStatus.RUNNING);
            Instant startTime = Instant.now();
            safeNotifyListeners(l -> l.onNodeStart(requestId, graphName, nodeId, processId));

            // 1. 从快照查找处理
            Optional<ProcessDefinition> found = context.getProcesses().lookup(processId);
            if (!found.isPresent()) {
                log.error("[RequestId: {}][Graph: '{}'] 节点 '{}' 引用的处理 '{}' 不在注册表快照中。",
                        requestId, graphName, nodeId, processId);
                return Mono.just(failure(new NodeEvaluationException(ErrorKind.UNKNOWN_PROCESS, nodeId,
                        String.format("Node '%s' references unknown process '%s'.", nodeId, processId)), context, node, startTime));
            }
            ProcessDefinition process = found.get();

            // 2. 解析并绑定参数；失败时不调用处理
            Map<String, Object> arguments;
            try {
                Map<String, Object> resolved = argumentResolver.resolve(node, context);
                arguments = parameterBinder.bindOrThrow(nodeId, process, resolved);
            } catch (ProcessGraphException e) {
                log.warn("[RequestId: {}][Graph: '{}'] 节点 '{}' 参数准备失败 ({}): {}",
                        requestId, graphName, nodeId, e.getKind(), e.getMessage());
                return Mono.just(failure(e, context, node, startTime));
            }

            // 3. 以有效超时执行
            Duration effectiveTimeout = determineEffectiveTimeout(process);
            log.debug("[RequestId: {}][Graph: '{}'] 执行节点 '{}' (处理: {}, 超时: {}, 深度: {})",
                    requestId, graphName, nodeId, processId, effectiveTimeout, context.getDepth());

            Mono<?> invocation;
            try {
                invocation = process.invoke(arguments, new NodeInvocationContext(context, node));
            } catch (RuntimeException e) {
                invocation = Mono.error(e);
            }
            if (invocation == null) {
                invocation = Mono.error(new IllegalStateException("Process '" + processId + "' returned a null Mono."));
            }

            return invocation
                    .subscribeOn(nodeExecutionScheduler)
                    .timeout(effectiveTimeout)
                    .map(value -> Optional.<Object>of(value))
                    .defaultIfEmpty(Optional.empty())
                    .map(output -> {
                        Object value = output.orElse(null);
                        // 4. 校验返回值
                        parameterBinder.checkReturn(nodeId, process, value);
                        Duration duration = Duration.between(startTime, Instant.now());
                        log.debug("[RequestId: {}][Graph: '{}'] 节点 '{}' 执行成功，耗时 {}", requestId, graphName, nodeId, duration);
                        safeNotifyListeners(l -> l.onNodeSuccess(requestId, graphName, nodeId, processId, duration));
                        return NodeResult.done(value);
                    })
                    .onErrorResume(error -> Mono.just(failure(
                            toProcessGraphException(error, node, effectiveTimeout, context), context, node, startTime)));
        });
    }

    /**
     * 处理级别超时优先，否则使用全局默认。
     */
    private Duration determineEffectiveTimeout(ProcessDefinition process) {
        return process.getTimeout()
                .filter(timeout -> !timeout.isZero() && !timeout.isNegative())
                .orElse(this.defaultNodeTimeout);
    }

    private ProcessGraphException toProcessGraphException(Throwable raw, ProcessNode node, Duration timeout,
                                                          EvaluationContext context) {
        Throwable error = Exceptions.unwrap(raw);
        if (error instanceof ProcessGraphException) {
            // 返回值校验失败，或子求值失败 (已记在当前节点上)
            return (ProcessGraphException) error;
        }
        if (error instanceof TimeoutException) {
            log.warn("[RequestId: {}][Graph: '{}'] 节点 '{}' 执行在 {} 后超时。",
                    context.getRequestId(), context.getGraphName(), node.getId(), timeout);
            safeNotifyListeners(l -> l.onNodeTimeout(context.getRequestId(), context.getGraphName(), node.getId(), node.getProcessId(), timeout));
            return new NodeEvaluationException(ErrorKind.PROCESS_EXECUTION_FAILURE, node.getId(),
                    String.format("Process '%s' at node '%s' timed out after %s.", node.getProcessId(), node.getId(), timeout), error);
        }
        return new NodeEvaluationException(ErrorKind.PROCESS_EXECUTION_FAILURE, node.getId(),
                String.format("Process '%s' failed at node '%s': %s", node.getProcessId(), node.getId(), error.getMessage()), error);
    }

    private NodeResult failure(ProcessGraphException error, EvaluationContext context, ProcessNode node, Instant startTime) {
        Duration duration = Duration.between(startTime, Instant.now());
        log.warn("[RequestId: {}][Graph: '{}'] 节点 '{}' 失败 ({}): {}",
                context.getRequestId(), context.getGraphName(), node.getId(), error.getKind(), error.getMessage());
        safeNotifyListeners(l -> l.onNodeFailure(context.getRequestId(), context.getGraphName(), node.getId(), node.getProcessId(), duration, error));
        return NodeResult.failed(error);
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
