package xyz.vvrf.reactor.processgraph.execution;

import reactor.core.publisher.Mono;
import xyz.vvrf.reactor.processgraph.core.NodeResult;
import xyz.vvrf.reactor.processgraph.core.ProcessNode;

/**
 * 节点执行器接口。
 * 负责执行单个节点：查找处理、解析并绑定参数、应用超时、调用处理并校验返回值。
 *
 * @author ruifeng.wen
 */
public interface NodeExecutor {

    /**
     * 执行指定的节点。调用时节点的所有依赖均已 DONE。
     *
     * @param node    要执行的节点 (不能为空)
     * @param context 当前求值上下文 (不能为空)
     * @return 包含节点终态结果 (DONE 或 FAILED) 的 Mono。
     * 节点失败通过 {@link NodeResult#failed} 返回，而不是让 Mono 失败。
     */
    Mono<NodeResult> executeNode(ProcessNode node, EvaluationContext context);
}
