package xyz.vvrf.reactor.processgraph.registry;

import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.reactor.processgraph.core.BuiltinProcess;
import xyz.vvrf.reactor.processgraph.core.ProcessDefinition;
import xyz.vvrf.reactor.processgraph.core.UserDefinedProcess;
import xyz.vvrf.reactor.processgraph.exception.GraphError;
import xyz.vvrf.reactor.processgraph.exception.GraphValidationException;
import xyz.vvrf.reactor.processgraph.validation.ProcessGraphValidator;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * ProcessRegistry 的简单内存实现。
 * 内置处理保存在本地 Map 中；用户自定义处理委托给 {@link ProcessDefinitionStore}。
 * 线程安全。
 *
 * @author ruifeng.wen
 */
@Slf4j
public class SimpleProcessRegistry implements ProcessRegistry {

    private final Map<String, BuiltinProcess> builtins = new ConcurrentHashMap<>();
    private final AtomicBoolean builtinsFrozen = new AtomicBoolean(false);
    private final ProcessGraphValidator validator;
    private final ProcessDefinitionStore store;
    // 用户自定义处理的注册/更新需要 "检查再写入" 的原子性
    private final Object userDefinedLock = new Object();

    public SimpleProcessRegistry(ProcessGraphValidator validator, ProcessDefinitionStore store) {
        this.validator = Objects.requireNonNull(validator, "ProcessGraphValidator 不能为空");
        this.store = Objects.requireNonNull(store, "ProcessDefinitionStore 不能为空");
        log.info("SimpleProcessRegistry 已创建，存储实现: {}", store.getClass().getSimpleName());
    }

    @Override
    public void registerBuiltin(BuiltinProcess process) {
        Objects.requireNonNull(process, "内置处理不能为空");
        if (builtinsFrozen.get()) {
            throw new IllegalStateException(String.format("内置处理已冻结，无法注册 '%s'。", process.getId()));
        }
        if (builtins.putIfAbsent(process.getId(), process) != null) {
            throw new IllegalArgumentException(String.format("内置处理 ID '%s' 已存在。", process.getId()));
        }
        log.info("已注册内置处理 '{}' (参数数量: {})", process.getId(), process.getParameters().size());
    }

    @Override
    public void freezeBuiltins() {
        if (builtinsFrozen.compareAndSet(false, true)) {
            log.info("内置处理集合已冻结，共 {} 个。", builtins.size());
        }
    }

    @Override
    public boolean isBuiltinsFrozen() {
        return builtinsFrozen.get();
    }

    @Override
    public UserDefinedProcess register(String ownerKey, UserDefinedProcess process) {
        UserDefinedProcess owned = prepare(ownerKey, process);
        synchronized (userDefinedLock) {
            if (store.load(ownerKey, owned.getId()).isPresent()) {
                throw new IllegalArgumentException(String.format("owner '%s' 下已存在处理 '%s'。", ownerKey, owned.getId()));
            }
            store.store(owned);
        }
        log.info("已注册用户自定义处理 '{}' (owner: {}, 节点数量: {})", owned.getId(), ownerKey, owned.getGraph().size());
        return owned;
    }

    @Override
    public UserDefinedProcess update(String ownerKey, UserDefinedProcess process) {
        UserDefinedProcess owned = prepare(ownerKey, process);
        synchronized (userDefinedLock) {
            if (!store.load(ownerKey, owned.getId()).isPresent()) {
                throw new IllegalArgumentException(String.format("owner '%s' 下不存在处理 '%s'，无法更新。", ownerKey, owned.getId()));
            }
            store.store(owned);
        }
        log.info("已更新用户自定义处理 '{}' (owner: {})", owned.getId(), ownerKey);
        return owned;
    }

    @Override
    public boolean remove(String ownerKey, String processId) {
        Objects.requireNonNull(ownerKey, "owner key 不能为空");
        Objects.requireNonNull(processId, "处理 ID 不能为空");
        boolean removed;
        synchronized (userDefinedLock) {
            removed = store.delete(ownerKey, processId);
        }
        if (removed) {
            log.info("已删除用户自定义处理 '{}' (owner: {})", processId, ownerKey);
        }
        return removed;
    }

    private UserDefinedProcess prepare(String ownerKey, UserDefinedProcess process) {
        Objects.requireNonNull(ownerKey, "owner key 不能为空");
        Objects.requireNonNull(process, "用户自定义处理不能为空");
        if (builtins.containsKey(process.getId())) {
            throw new IllegalArgumentException(String.format("处理 ID '%s' 与内置处理冲突。", process.getId()));
        }
        List<GraphError> errors = validator.validateUserDefined(process);
        if (!errors.isEmpty()) {
            log.warn("用户自定义处理 '{}' (owner: {}) 的处理图无效: {}", process.getId(), ownerKey, errors);
            throw new GraphValidationException(errors);
        }
        return ownerKey.equals(process.getOwnerKey()) ? process : process.withOwner(ownerKey);
    }

    @Override
    public Optional<ProcessDefinition> lookup(String ownerKey, String processId) {
        Objects.requireNonNull(processId, "处理 ID 不能为空");
        BuiltinProcess builtin = builtins.get(processId);
        if (builtin != null) {
            return Optional.of(builtin);
        }
        if (ownerKey == null) {
            return Optional.empty();
        }
        return store.load(ownerKey, processId).map(p -> (ProcessDefinition) p);
    }

    @Override
    public List<ProcessDefinition> list(String ownerKey) {
        return snapshot(ownerKey).list();
    }

    @Override
    public List<BuiltinProcess> listBuiltins() {
        List<BuiltinProcess> result = new ArrayList<>(new TreeMap<>(builtins).values());
        return Collections.unmodifiableList(result);
    }

    @Override
    public List<UserDefinedProcess> listUserDefined(String ownerKey) {
        Objects.requireNonNull(ownerKey, "owner key 不能为空");
        return Collections.unmodifiableList(new ArrayList<>(store.list(ownerKey)));
    }

    @Override
    public ProcessRegistrySnapshot snapshot(String ownerKey) {
        Map<String, ProcessDefinition> definitions = new TreeMap<>();
        if (ownerKey != null) {
            for (UserDefinedProcess process : store.list(ownerKey)) {
                definitions.put(process.getId(), process);
            }
        }
        // 内置处理优先
        definitions.putAll(builtins);
        return new ProcessRegistrySnapshot(ownerKey, definitions);
    }
}
