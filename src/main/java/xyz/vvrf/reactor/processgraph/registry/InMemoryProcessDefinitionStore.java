package xyz.vvrf.reactor.processgraph.registry;

import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.reactor.processgraph.core.UserDefinedProcess;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link ProcessDefinitionStore} 的内存实现。线程安全。
 */
@Slf4j
public class InMemoryProcessDefinitionStore implements ProcessDefinitionStore {

    private final Map<String, Map<String, UserDefinedProcess>> processesByOwner = new ConcurrentHashMap<>();

    @Override
    public Optional<UserDefinedProcess> load(String ownerKey, String processId) {
        Map<String, UserDefinedProcess> processes = processesByOwner.get(ownerKey);
        return processes == null ? Optional.empty() : Optional.ofNullable(processes.get(processId));
    }

    @Override
    public List<UserDefinedProcess> list(String ownerKey) {
        Map<String, UserDefinedProcess> processes = processesByOwner.get(ownerKey);
        if (processes == null) {
            return Collections.emptyList();
        }
        List<UserDefinedProcess> result = new ArrayList<>(processes.values());
        result.sort(Comparator.comparing(UserDefinedProcess::getId));
        return result;
    }

    @Override
    public void store(UserDefinedProcess process) {
        Objects.requireNonNull(process, "处理不能为空");
        processesByOwner.computeIfAbsent(process.getOwnerKey(), k -> new ConcurrentHashMap<>())
                .put(process.getId(), process);
        log.debug("已保存用户自定义处理 '{}' (owner: {})", process.getId(), process.getOwnerKey());
    }

    @Override
    public boolean delete(String ownerKey, String processId) {
        Map<String, UserDefinedProcess> processes = processesByOwner.get(ownerKey);
        return processes != null && processes.remove(processId) != null;
    }
}
