package xyz.vvrf.reactor.processgraph.core;

import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * 处理图中的一个节点 (不可变)。
 * 参数按文档中的出现顺序保存。
 *
 * @author ruifeng.wen
 */
@Getter
@EqualsAndHashCode
public final class ProcessNode {

    private final String id;
    private final String processId;
    private final Map<String, ArgumentValue> arguments;
    private final boolean result;
    private final String description;

    public ProcessNode(String id, String processId, Map<String, ArgumentValue> arguments, boolean result, String description) {
        this.id = Objects.requireNonNull(id, "节点 ID 不能为空");
        this.processId = Objects.requireNonNull(processId, "process_id 不能为空");
        this.arguments = Collections.unmodifiableMap(new LinkedHashMap<>(
                Objects.requireNonNull(arguments, "参数 Map 不能为空")));
        this.result = result;
        this.description = description;
    }

    public Optional<ArgumentValue> getArgument(String name) {
        return Optional.ofNullable(arguments.get(name));
    }

    public Optional<String> getDescriptionOptional() {
        return Optional.ofNullable(description);
    }

    @Override
    public String toString() {
        return "ProcessNode{id='" + id + "', processId='" + processId + "', result=" + result + ", arguments=" + arguments + '}';
    }
}
