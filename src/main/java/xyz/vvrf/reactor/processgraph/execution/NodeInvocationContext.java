package xyz.vvrf.reactor.processgraph.execution;

import reactor.core.publisher.Mono;
import xyz.vvrf.reactor.processgraph.core.InvocationContext;
import xyz.vvrf.reactor.processgraph.core.ProcessNode;
import xyz.vvrf.reactor.processgraph.core.UserDefinedProcess;

import java.util.Map;

/**
 * 绑定到某个正在执行节点的 {@link InvocationContext}。
 */
final class NodeInvocationContext implements InvocationContext {

    private final EvaluationContext evaluationContext;
    private final ProcessNode node;

    NodeInvocationContext(EvaluationContext evaluationContext, ProcessNode node) {
        this.evaluationContext = evaluationContext;
        this.node = node;
    }

    @Override
    public String getRequestId() {
        return evaluationContext.getRequestId();
    }

    @Override
    public String getGraphName() {
        return evaluationContext.getGraphName();
    }

    @Override
    public String getNodeId() {
        return node.getId();
    }

    @Override
    public String getProcessId() {
        return node.getProcessId();
    }

    @Override
    public int getDepth() {
        return evaluationContext.getDepth();
    }

    @Override
    public Mono<?> evaluateUserDefined(UserDefinedProcess process, Map<String, Object> arguments) {
        return evaluationContext.getSubgraphEvaluator()
                .evaluate(evaluationContext, node, process, arguments)
                .flatMap(result -> Mono.justOrEmpty(result.getOutput()));
    }
}
