package xyz.vvrf.reactor.processgraph.core;

import com.fasterxml.jackson.databind.JsonNode;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 处理定义：已声明参数与返回值 Schema 的命名处理。
 * 内置处理 ({@link BuiltinProcess}) 与用户自定义处理 ({@link UserDefinedProcess})
 * 共享同一个 {@link #invoke} 能力，引擎无需区分二者。
 *
 * @author ruifeng.wen
 */
public interface ProcessDefinition {

    String getId();

    /**
     * 有序的参数声明列表 (不可变)。
     */
    List<ProcessParameter> getParameters();

    /**
     * 返回值 Schema，为 null 表示不校验返回值。
     */
    JsonNode getReturns();

    String getSummary();

    String getDescription();

    boolean isDeprecated();

    boolean isExperimental();

    /**
     * 处理级别的执行超时，覆盖引擎的默认节点超时。
     */
    default Optional<Duration> getTimeout() {
        return Optional.empty();
    }

    default Optional<ProcessParameter> getParameter(String name) {
        return getParameters().stream().filter(p -> p.getName().equals(name)).findFirst();
    }

    /**
     * 使用已绑定 (并通过 Schema 校验) 的参数执行处理。
     * 空的 Mono 表示输出为 null。
     *
     * @param arguments 参数名到值的映射
     * @param context   调用上下文
     * @return 处理输出
     */
    Mono<?> invoke(Map<String, Object> arguments, InvocationContext context);
}
