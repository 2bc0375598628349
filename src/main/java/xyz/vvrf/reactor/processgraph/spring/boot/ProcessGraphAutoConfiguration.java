package xyz.vvrf.reactor.processgraph.spring.boot;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfigureAfter;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ApplicationContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;
import xyz.vvrf.reactor.processgraph.builtin.ArithmeticProcesses;
import xyz.vvrf.reactor.processgraph.core.BuiltinProcess;
import xyz.vvrf.reactor.processgraph.execution.ArgumentResolver;
import xyz.vvrf.reactor.processgraph.execution.NodeExecutor;
import xyz.vvrf.reactor.processgraph.execution.ProcessGraphEngine;
import xyz.vvrf.reactor.processgraph.execution.StandardNodeExecutor;
import xyz.vvrf.reactor.processgraph.execution.StandardProcessGraphEngine;
import xyz.vvrf.reactor.processgraph.monitor.LoggingProcessGraphMonitorListener;
import xyz.vvrf.reactor.processgraph.monitor.MicrometerProcessGraphMonitorListener;
import xyz.vvrf.reactor.processgraph.monitor.ProcessGraphMonitorListener;
import xyz.vvrf.reactor.processgraph.parser.ProcessGraphParser;
import xyz.vvrf.reactor.processgraph.registry.InMemoryProcessDefinitionStore;
import xyz.vvrf.reactor.processgraph.registry.ProcessDefinitionStore;
import xyz.vvrf.reactor.processgraph.registry.ProcessRegistry;
import xyz.vvrf.reactor.processgraph.registry.SimpleProcessRegistry;
import xyz.vvrf.reactor.processgraph.registry.SpringScanningProcessRegistry;
import xyz.vvrf.reactor.processgraph.schema.ParameterBinder;
import xyz.vvrf.reactor.processgraph.schema.SchemaChecker;
import xyz.vvrf.reactor.processgraph.validation.ProcessGraphValidator;

import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 处理图框架的 Spring Boot 自动配置类。
 * 职责:
 * 1. 启用并绑定 {@link ProcessGraphProperties}。
 * 2. 提供解析、校验、Schema 绑定、注册表、节点执行器和引擎等核心 Bean，均可被用户 Bean 替换。
 * 3. 提供可由属性配置的节点执行 {@link Scheduler} Bean ("processGraphNodeScheduler")。
 * 4. 收集所有 {@link ProcessGraphMonitorListener} Bean 交给执行器和引擎。
 * <p>
 * **用户职责:** 实现 {@link xyz.vvrf.reactor.processgraph.core.ProcessImplementation}，
 * 使用 {@link xyz.vvrf.reactor.processgraph.annotation.ProcessType} 注解，
 * 然后注入 {@link ProcessGraphEngine} 求值处理文档。
 *
 * @author ruifeng.wen
 */
@Configuration
@EnableConfigurationProperties(ProcessGraphProperties.class)
@AutoConfigureAfter(name = {
        "org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration",
        "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration"})
@Slf4j
public class ProcessGraphAutoConfiguration {

    public static final String NODE_SCHEDULER_BEAN_NAME = "processGraphNodeScheduler";

    private final ApplicationContext applicationContext;
    private final ObjectMapper objectMapper;

    public ProcessGraphAutoConfiguration(ApplicationContext applicationContext, ObjectProvider<ObjectMapper> objectMapperProvider) {
        this.applicationContext = applicationContext;
        this.objectMapper = objectMapperProvider.getIfAvailable(ObjectMapper::new);
        log.info("处理图框架自动配置 (ProcessGraphAutoConfiguration) 已加载。");
    }

    @Bean
    @ConditionalOnMissingBean
    public SchemaChecker schemaChecker(ProcessGraphProperties properties) {
        return new SchemaChecker(objectMapper, properties.getSchema().getCacheSize());
    }

    @Bean
    @ConditionalOnMissingBean
    public ParameterBinder parameterBinder(SchemaChecker schemaChecker) {
        return new ParameterBinder(schemaChecker);
    }

    @Bean
    @ConditionalOnMissingBean
    public ProcessGraphParser processGraphParser() {
        return new ProcessGraphParser(objectMapper);
    }

    @Bean
    @ConditionalOnMissingBean
    public ProcessGraphValidator processGraphValidator(ProcessGraphParser parser) {
        return new ProcessGraphValidator(parser);
    }

    @Bean
    @ConditionalOnMissingBean
    public ProcessDefinitionStore processDefinitionStore() {
        return new InMemoryProcessDefinitionStore();
    }

    /**
     * 扫描 {@code @ProcessType} Bean 的注册表；算术内置处理按配置一并注册。
     */
    @Bean
    @ConditionalOnMissingBean(ProcessRegistry.class)
    public SpringScanningProcessRegistry processRegistry(ProcessGraphValidator validator,
                                                         ProcessDefinitionStore store,
                                                         ProcessGraphProperties properties) {
        List<BuiltinProcess> builtins = properties.getBuiltins().isArithmeticEnabled()
                ? ArithmeticProcesses.all()
                : Collections.emptyList();
        log.info("正在创建 SpringScanningProcessRegistry，预置内置处理 {} 个。", builtins.size());
        return new SpringScanningProcessRegistry(new SimpleProcessRegistry(validator, store), builtins);
    }

    @Bean
    @ConditionalOnMissingBean
    public ArgumentResolver argumentResolver() {
        return new ArgumentResolver();
    }

    /**
     * 提供节点执行使用的 Reactor Scheduler。
     * 调度器类型和参数可由 {@link ProcessGraphProperties.SchedulerProps} 配置。
     */
    @Bean(name = NODE_SCHEDULER_BEAN_NAME, destroyMethod = "dispose")
    @ConditionalOnMissingBean(name = NODE_SCHEDULER_BEAN_NAME)
    public Scheduler processGraphNodeScheduler(ProcessGraphProperties properties) {
        ProcessGraphProperties.SchedulerProps schedulerProps = properties.getScheduler();
        String namePrefix = schedulerProps.getNamePrefix();

        switch (schedulerProps.getType()) {
            case PARALLEL:
                log.info("正在创建 '{}' (Parallel): prefix={}, parallelism={}",
                        NODE_SCHEDULER_BEAN_NAME, namePrefix, schedulerProps.getParallel().getParallelism());
                return Schedulers.newParallel(namePrefix, schedulerProps.getParallel().getParallelism(), true);
            case SINGLE:
                log.info("正在创建 '{}' (Single): prefix={}", NODE_SCHEDULER_BEAN_NAME, namePrefix);
                return Schedulers.newSingle(namePrefix, true);
            case CUSTOM:
                String customBeanName = schedulerProps.getCustomBeanName();
                if (customBeanName == null || customBeanName.trim().isEmpty()) {
                    log.error("'process-graph.scheduler.type=CUSTOM' 但 'process-graph.scheduler.custom-bean-name' 未配置。回退到默认 BoundedElastic。");
                    return boundedElastic(schedulerProps, namePrefix + "-fallback");
                }
                log.info("正在从 Spring 上下文获取自定义节点调度器 Bean，名称: {}", customBeanName);
                return applicationContext.getBean(customBeanName, Scheduler.class);
            case BOUNDED_ELASTIC:
            default:
                ProcessGraphProperties.BoundedElasticProps beProps = schedulerProps.getBoundedElastic();
                log.info("正在创建 '{}' (BoundedElastic): prefix={}, cap={}, queue={}, ttl={}s",
                        NODE_SCHEDULER_BEAN_NAME, namePrefix, beProps.getThreadCap(), beProps.getQueuedTaskCap(), beProps.getTtlSeconds());
                return boundedElastic(schedulerProps, namePrefix);
        }
    }

    private static Scheduler boundedElastic(ProcessGraphProperties.SchedulerProps schedulerProps, String name) {
        ProcessGraphProperties.BoundedElasticProps beProps = schedulerProps.getBoundedElastic();
        return Schedulers.newBoundedElastic(beProps.getThreadCap(), beProps.getQueuedTaskCap(), name, beProps.getTtlSeconds(), true);
    }

    @Bean
    @ConditionalOnMissingBean
    public NodeExecutor nodeExecutor(ArgumentResolver argumentResolver,
                                     ParameterBinder parameterBinder,
                                     @Qualifier(NODE_SCHEDULER_BEAN_NAME) Scheduler scheduler,
                                     ProcessGraphProperties properties,
                                     ObjectProvider<ProcessGraphMonitorListener> listenersProvider) {
        return new StandardNodeExecutor(argumentResolver, parameterBinder,
                properties.getNode().getDefaultTimeout(), scheduler, collectListeners(listenersProvider));
    }

    @Bean
    @ConditionalOnMissingBean
    public ProcessGraphEngine processGraphEngine(ProcessRegistry processRegistry,
                                                 ProcessGraphValidator validator,
                                                 ParameterBinder parameterBinder,
                                                 NodeExecutor nodeExecutor,
                                                 ProcessGraphProperties properties,
                                                 ObjectProvider<ProcessGraphMonitorListener> listenersProvider) {
        log.info("正在创建 ProcessGraphEngine，配置: {}", properties);
        ProcessGraphProperties.Engine engine = properties.getEngine();
        return new StandardProcessGraphEngine(processRegistry, validator, parameterBinder, nodeExecutor,
                engine.getConcurrencyLevel(), engine.getErrorStrategy(), engine.getMaxRecursionDepth(),
                collectListeners(listenersProvider));
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "process-graph.monitor", name = "logging-enabled", havingValue = "true", matchIfMissing = true)
    public LoggingProcessGraphMonitorListener loggingProcessGraphMonitorListener() {
        return new LoggingProcessGraphMonitorListener();
    }

    private static List<ProcessGraphMonitorListener> collectListeners(ObjectProvider<ProcessGraphMonitorListener> listenersProvider) {
        List<ProcessGraphMonitorListener> listeners = listenersProvider.orderedStream().collect(Collectors.toList());
        if (listeners.isEmpty()) {
            log.info("在 Spring 上下文中未找到 ProcessGraphMonitorListener Bean。");
        } else {
            log.info("收集到 {} 个 ProcessGraphMonitorListener Bean: {}", listeners.size(),
                    listeners.stream().map(l -> l.getClass().getSimpleName()).collect(Collectors.joining(", ")));
        }
        return Collections.unmodifiableList(listeners);
    }

    /**
     * 存在 MeterRegistry Bean 时注册 Micrometer 指标监听器。
     */
    @Configuration
    @ConditionalOnClass(MeterRegistry.class)
    static class MicrometerMonitorConfiguration {

        @Bean
        @ConditionalOnBean(MeterRegistry.class)
        @ConditionalOnMissingBean
        public MicrometerProcessGraphMonitorListener micrometerProcessGraphMonitorListener(MeterRegistry meterRegistry) {
            return new MicrometerProcessGraphMonitorListener(meterRegistry);
        }
    }
}
