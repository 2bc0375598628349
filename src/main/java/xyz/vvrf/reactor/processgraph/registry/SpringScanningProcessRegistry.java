// 文件名: registry/SpringScanningProcessRegistry.java
package xyz.vvrf.reactor.processgraph.registry;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.BeansException;
import org.springframework.beans.factory.BeanCreationException;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.context.ApplicationContext;
import org.springframework.context.ApplicationContextAware;
import org.springframework.lang.NonNull;
import xyz.vvrf.reactor.processgraph.annotation.ProcessType;
import xyz.vvrf.reactor.processgraph.core.BuiltinProcess;
import xyz.vvrf.reactor.processgraph.core.ProcessDefinition;
import xyz.vvrf.reactor.processgraph.core.ProcessImplementation;
import xyz.vvrf.reactor.processgraph.core.UserDefinedProcess;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * 一个 {@link ProcessRegistry} 实现，它会自动发现并注册使用 {@link ProcessType} 注解的 Spring Bean。
 * <p>
 * 初始化时依次: 注册构造时传入的内置处理 (例如算术处理)，扫描 ApplicationContext 中的
 * {@link ProcessType} Bean，最后冻结内置处理集合。
 *
 * @author ruifeng.wen
 */
@Slf4j
public class SpringScanningProcessRegistry implements ProcessRegistry, ApplicationContextAware, InitializingBean {

    private ApplicationContext applicationContext;
    // 内部使用 SimpleProcessRegistry 来存储注册信息
    private final SimpleProcessRegistry delegateRegistry;
    private final List<BuiltinProcess> initialBuiltins;

    public SpringScanningProcessRegistry(SimpleProcessRegistry delegateRegistry, List<BuiltinProcess> initialBuiltins) {
        this.delegateRegistry = Objects.requireNonNull(delegateRegistry, "委托注册表不能为空");
        this.initialBuiltins = initialBuiltins == null
                ? Collections.emptyList()
                : Collections.unmodifiableList(new ArrayList<>(initialBuiltins));
    }

    @Override
    public void setApplicationContext(@NonNull ApplicationContext applicationContext) throws BeansException {
        this.applicationContext = applicationContext;
    }

    @Override
    public void afterPropertiesSet() {
        if (applicationContext == null) {
            throw new BeanCreationException("SpringScanningProcessRegistry 中 ApplicationContext 未设置");
        }
        for (BuiltinProcess builtin : initialBuiltins) {
            delegateRegistry.registerBuiltin(builtin);
        }
        log.info("开始扫描 @ProcessType Bean...");
        scanAndRegisterProcesses();
        delegateRegistry.freezeBuiltins();
    }

    private void scanAndRegisterProcesses() {
        Map<String, Object> beansWithAnnotation = applicationContext.getBeansWithAnnotation(ProcessType.class);
        int registeredCount = 0;

        for (Map.Entry<String, Object> entry : beansWithAnnotation.entrySet()) {
            String beanName = entry.getKey();
            Object beanInstance = entry.getValue();
            ProcessType annotation = applicationContext.findAnnotationOnBean(beanName, ProcessType.class);

            if (annotation == null) {
                log.warn("在 Bean '{}' 上找不到 @ProcessType 注解，尽管 getBeansWithAnnotation 返回了它。", beanName);
                continue;
            }
            if (!(beanInstance instanceof ProcessImplementation)) {
                log.error("Bean '{}' 使用了 @ProcessType 注解，但未实现 ProcessImplementation 接口。跳过注册。", beanName);
                continue;
            }

            String processId = determineProcessId(annotation, beanName);
            ProcessImplementation implementation = (ProcessImplementation) beanInstance;
            try {
                delegateRegistry.registerBuiltin(BuiltinProcess.builder()
                        .id(processId)
                        .parameters(implementation.getParameters())
                        .returns(implementation.getReturns())
                        .summary(emptyToNull(annotation.summary()))
                        .description(emptyToNull(annotation.description()))
                        .deprecated(annotation.deprecated())
                        .experimental(annotation.experimental())
                        .executionTimeout(annotation.timeoutMillis() > 0 ? Duration.ofMillis(annotation.timeoutMillis()) : null)
                        .invoker(implementation)
                        .build());
                registeredCount++;
            } catch (IllegalArgumentException e) {
                // 记录注册错误（例如重复ID），但继续扫描
                log.error("注册处理 Bean '{}' (ID: '{}') 失败: {}", beanName, processId, e.getMessage());
            }
        }
        log.info("@ProcessType 扫描完成。共注册了 {} 个处理。", registeredCount);
    }

    private String determineProcessId(ProcessType annotation, String beanName) {
        String id = annotation.id();
        if (id.isEmpty()) {
            id = annotation.value();
        }
        if (id.isEmpty()) {
            log.warn("在 Bean '{}' 的 @ProcessType 注解中未提供 'id' 或 'value'。将使用 Bean 名称作为处理 ID。", beanName);
            return beanName;
        }
        return id;
    }

    private static String emptyToNull(String text) {
        return text == null || text.isEmpty() ? null : text;
    }

    @Override
    public void registerBuiltin(BuiltinProcess process) {
        delegateRegistry.registerBuiltin(process);
    }

    @Override
    public void freezeBuiltins() {
        delegateRegistry.freezeBuiltins();
    }

    @Override
    public boolean isBuiltinsFrozen() {
        return delegateRegistry.isBuiltinsFrozen();
    }

    @Override
    public UserDefinedProcess register(String ownerKey, UserDefinedProcess process) {
        return delegateRegistry.register(ownerKey, process);
    }

    @Override
    public UserDefinedProcess update(String ownerKey, UserDefinedProcess process) {
        return delegateRegistry.update(ownerKey, process);
    }

    @Override
    public boolean remove(String ownerKey, String processId) {
        return delegateRegistry.remove(ownerKey, processId);
    }

    @Override
    public Optional<ProcessDefinition> lookup(String ownerKey, String processId) {
        return delegateRegistry.lookup(ownerKey, processId);
    }

    @Override
    public List<ProcessDefinition> list(String ownerKey) {
        return delegateRegistry.list(ownerKey);
    }

    @Override
    public List<BuiltinProcess> listBuiltins() {
        return delegateRegistry.listBuiltins();
    }

    @Override
    public List<UserDefinedProcess> listUserDefined(String ownerKey) {
        return delegateRegistry.listUserDefined(ownerKey);
    }

    @Override
    public ProcessRegistrySnapshot snapshot(String ownerKey) {
        return delegateRegistry.snapshot(ownerKey);
    }
}
