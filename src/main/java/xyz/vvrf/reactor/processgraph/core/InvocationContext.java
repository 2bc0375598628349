package xyz.vvrf.reactor.processgraph.core;

import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * 处理被调用时可见的上下文信息。
 */
public interface InvocationContext {

    String getRequestId();

    /**
     * 当前所在图的名称 (顶层文档或用户自定义处理)。
     */
    String getGraphName();

    String getNodeId();

    String getProcessId();

    /**
     * 当前调用栈深度，顶层图为 0。
     */
    int getDepth();

    /**
     * 以给定参数作为绑定，对用户自定义处理的图进行子求值。
     *
     * @return 子图结果节点的输出；空的 Mono 表示 null
     */
    Mono<?> evaluateUserDefined(UserDefinedProcess process, Map<String, Object> arguments);
}
