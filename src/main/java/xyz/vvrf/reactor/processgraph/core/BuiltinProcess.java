package xyz.vvrf.reactor.processgraph.core;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * 由原生 {@link ProcessInvoker} 实现的内置处理。
 *
 * @author ruifeng.wen
 */
@Getter
public final class BuiltinProcess implements ProcessDefinition {

    private final String id;
    private final List<ProcessParameter> parameters;
    private final JsonNode returns;
    private final String summary;
    private final String description;
    private final boolean deprecated;
    private final boolean experimental;
    private final Duration executionTimeout;
    private final ProcessInvoker invoker;

    @Builder
    private BuiltinProcess(String id, @Singular List<ProcessParameter> parameters, JsonNode returns,
                           String summary, String description, boolean deprecated, boolean experimental,
                           Duration executionTimeout, ProcessInvoker invoker) {
        this.id = Objects.requireNonNull(id, "处理 ID 不能为空");
        this.parameters = Collections.unmodifiableList(new ArrayList<>(parameters));
        this.returns = returns;
        this.summary = summary;
        this.description = description;
        this.deprecated = deprecated;
        this.experimental = experimental;
        this.executionTimeout = executionTimeout;
        this.invoker = Objects.requireNonNull(invoker, "处理 '" + id + "' 的 ProcessInvoker 不能为空");
    }

    @Override
    public Optional<Duration> getTimeout() {
        return Optional.ofNullable(executionTimeout);
    }

    @Override
    public Mono<?> invoke(Map<String, Object> arguments, InvocationContext context) {
        return invoker.invoke(arguments, context);
    }

    @Override
    public String toString() {
        return "BuiltinProcess{id='" + id + "', parameters=" + parameters.size() + '}';
    }
}
