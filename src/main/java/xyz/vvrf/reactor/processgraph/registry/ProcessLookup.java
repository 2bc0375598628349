package xyz.vvrf.reactor.processgraph.registry;

import xyz.vvrf.reactor.processgraph.core.ProcessDefinition;

import java.util.List;
import java.util.Optional;

/**
 * 按 ID 查找处理定义的只读视图。
 */
public interface ProcessLookup {

    Optional<ProcessDefinition> lookup(String processId);

    /**
     * 全部可见的处理定义 (按 ID 排序)。
     */
    List<ProcessDefinition> list();

    default boolean contains(String processId) {
        return lookup(processId).isPresent();
    }
}
