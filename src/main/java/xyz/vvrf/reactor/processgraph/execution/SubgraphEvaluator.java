package xyz.vvrf.reactor.processgraph.execution;

import reactor.core.publisher.Mono;
import xyz.vvrf.reactor.processgraph.core.NodeResult;
import xyz.vvrf.reactor.processgraph.core.ProcessNode;
import xyz.vvrf.reactor.processgraph.core.UserDefinedProcess;

import java.util.Map;

/**
 * 对用户自定义处理的图进行子求值，由引擎提供给执行上下文。
 */
@FunctionalInterface
public interface SubgraphEvaluator {

    /**
     * @param parent     调用方所在的执行上下文
     * @param callerNode 调用该处理的节点
     * @param process    被调用的用户自定义处理
     * @param arguments  已绑定的参数，作为子图的参数绑定
     * @return 子图结果节点的结果；失败时以错误信号结束
     */
    Mono<NodeResult> evaluate(EvaluationContext parent, ProcessNode callerNode, UserDefinedProcess process,
                              Map<String, Object> arguments);
}
