package xyz.vvrf.reactor.processgraph.registry;

import xyz.vvrf.reactor.processgraph.core.ProcessDefinition;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * 注册表在某一时刻的不可变视图。
 * 一次求值 (包括其所有子求值) 只使用同一个快照，之后注册表的修改对它不可见。
 */
public final class ProcessRegistrySnapshot implements ProcessLookup {

    private final String ownerKey;
    private final Map<String, ProcessDefinition> definitions;

    ProcessRegistrySnapshot(String ownerKey, Map<String, ? extends ProcessDefinition> definitions) {
        this.ownerKey = ownerKey;
        this.definitions = Collections.unmodifiableMap(new TreeMap<>(definitions));
    }

    /**
     * 由任意定义集合构建快照，主要用于测试和嵌入式场景。
     */
    public static ProcessRegistrySnapshot of(List<? extends ProcessDefinition> definitions) {
        Map<String, ProcessDefinition> map = new TreeMap<>();
        for (ProcessDefinition definition : definitions) {
            if (map.putIfAbsent(definition.getId(), definition) != null) {
                throw new IllegalArgumentException("重复的处理 ID: " + definition.getId());
            }
        }
        return new ProcessRegistrySnapshot(null, map);
    }

    /**
     * 快照所属的 owner key，仅包含内置处理时为 null。
     */
    public Optional<String> getOwnerKey() {
        return Optional.ofNullable(ownerKey);
    }

    @Override
    public Optional<ProcessDefinition> lookup(String processId) {
        return Optional.ofNullable(definitions.get(processId));
    }

    @Override
    public List<ProcessDefinition> list() {
        return Collections.unmodifiableList(new ArrayList<>(definitions.values()));
    }

    public int size() {
        return definitions.size();
    }
}
