package xyz.vvrf.reactor.processgraph.core;

import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * 内置处理的原生实现。
 * 实现应当是纯函数: 相同参数产生相同输出，不依赖其他节点的执行顺序。
 */
@FunctionalInterface
public interface ProcessInvoker {

    /**
     * @param arguments 已绑定的参数 (缺省的可选参数已填入默认值)
     * @param context   调用上下文
     * @return 处理输出；空的 Mono 表示 null
     */
    Mono<?> invoke(Map<String, Object> arguments, InvocationContext context);

    /**
     * 将同步 (可能阻塞) 的函数包装为 ProcessInvoker。
     * 引擎会在节点执行调度器上订阅，因此阻塞调用不会占用调用线程。
     */
    static ProcessInvoker blocking(BlockingFunction function) {
        return (arguments, context) -> Mono.fromCallable(() -> function.apply(arguments));
    }

    @FunctionalInterface
    interface BlockingFunction {
        Object apply(Map<String, Object> arguments) throws Exception;
    }
}
