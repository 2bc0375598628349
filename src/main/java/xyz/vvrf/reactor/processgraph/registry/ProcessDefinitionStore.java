package xyz.vvrf.reactor.processgraph.registry;

import xyz.vvrf.reactor.processgraph.core.UserDefinedProcess;

import java.util.List;
import java.util.Optional;

/**
 * 用户自定义处理的持久化边界。
 * 实现按 (owner key, 处理 ID) 存取；框架只提供内存实现 {@link InMemoryProcessDefinitionStore}。
 */
public interface ProcessDefinitionStore {

    Optional<UserDefinedProcess> load(String ownerKey, String processId);

    /**
     * 某个 owner 的全部处理 (按 ID 排序)。
     */
    List<UserDefinedProcess> list(String ownerKey);

    /**
     * 保存 (新增或覆盖)。
     */
    void store(UserDefinedProcess process);

    /**
     * @return 是否确实删除了一条记录
     */
    boolean delete(String ownerKey, String processId);
}
