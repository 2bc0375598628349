package xyz.vvrf.reactor.processgraph.registry;

import xyz.vvrf.reactor.processgraph.core.BuiltinProcess;
import xyz.vvrf.reactor.processgraph.core.ProcessDefinition;
import xyz.vvrf.reactor.processgraph.core.UserDefinedProcess;

import java.util.List;
import java.util.Optional;

/**
 * 处理注册表接口。
 * 内置处理在启动阶段注册，{@link #freezeBuiltins()} 之后不可再修改；
 * 用户自定义处理可随时增删改，并按不透明的 owner key 隔离。
 * 内置处理的 ID 不能被用户自定义处理占用。
 *
 * @author ruifeng.wen
 */
public interface ProcessRegistry {

    /**
     * 注册内置处理。
     *
     * @throws IllegalStateException    如果内置处理已冻结
     * @throws IllegalArgumentException 如果 ID 已存在
     */
    void registerBuiltin(BuiltinProcess process);

    /**
     * 冻结内置处理集合。重复调用无副作用。
     */
    void freezeBuiltins();

    boolean isBuiltinsFrozen();

    /**
     * 注册用户自定义处理。注册前会对其处理图做结构校验。
     *
     * @throws xyz.vvrf.reactor.processgraph.exception.GraphValidationException 如果处理图结构无效
     * @throws IllegalArgumentException 如果 ID 与内置处理冲突，或该 owner 下已存在同名处理
     */
    UserDefinedProcess register(String ownerKey, UserDefinedProcess process);

    /**
     * 替换已存在的用户自定义处理。
     *
     * @throws IllegalArgumentException 如果该 owner 下不存在此处理
     */
    UserDefinedProcess update(String ownerKey, UserDefinedProcess process);

    boolean remove(String ownerKey, String processId);

    /**
     * 查找处理：先查内置处理，再查该 owner 的用户自定义处理。ownerKey 为 null 时只查内置处理。
     */
    Optional<ProcessDefinition> lookup(String ownerKey, String processId);

    default Optional<ProcessDefinition> lookup(String processId) {
        return lookup(null, processId);
    }

    /**
     * 内置处理与该 owner 的用户自定义处理 (按 ID 排序)。
     */
    List<ProcessDefinition> list(String ownerKey);

    default List<ProcessDefinition> list() {
        return list(null);
    }

    List<BuiltinProcess> listBuiltins();

    List<UserDefinedProcess> listUserDefined(String ownerKey);

    /**
     * 当前内置处理加上该 owner 的用户自定义处理的不可变快照。
     */
    ProcessRegistrySnapshot snapshot(String ownerKey);

    default ProcessRegistrySnapshot snapshot() {
        return snapshot(null);
    }
}
