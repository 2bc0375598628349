package xyz.vvrf.reactor.processgraph.spring.boot;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;
import reactor.core.scheduler.Schedulers;
import xyz.vvrf.reactor.processgraph.core.ErrorHandlingStrategy;
import xyz.vvrf.reactor.processgraph.schema.SchemaChecker;

import javax.validation.Valid;
import javax.validation.constraints.Min;
import javax.validation.constraints.NotNull;
import java.time.Duration;

/**
 * 处理图框架的配置属性类
 * 绑定 'process-graph' 前缀下的属性。
 *
 * @author ruifeng.wen
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "process-graph")
@Validated
public class ProcessGraphProperties {

    @Valid
    private final Node node = new Node();
    @Valid
    private final Engine engine = new Engine();
    @Valid
    private final SchedulerProps scheduler = new SchedulerProps();
    @Valid
    private final Schema schema = new Schema();
    @Valid
    private final Builtins builtins = new Builtins();
    @Valid
    private final Monitor monitor = new Monitor();

    @Getter
    @Setter
    public static class Node {
        /**
         * 节点的默认执行超时时间，可被处理级别的超时覆盖。
         */
        @NotNull
        private Duration defaultTimeout = Duration.ofSeconds(30);
    }

    @Getter
    @Setter
    public static class Engine {
        /**
         * 求值期间同时执行节点的并发级别。默认为可用处理器的数量。
         */
        @Min(1)
        private int concurrencyLevel = Math.max(1, Runtime.getRuntime().availableProcessors());

        /**
         * 节点失败后的处理策略。
         */
        @NotNull
        private ErrorHandlingStrategy errorStrategy = ErrorHandlingStrategy.FAIL_FAST;

        /**
         * 用户自定义处理的最大嵌套调用深度。
         */
        @Min(1)
        private int maxRecursionDepth = 16;
    }

    @Getter
    @Setter
    public static class SchedulerProps {
        /**
         * 调度器类型。
         */
        private SchedulerType type = SchedulerType.BOUNDED_ELASTIC;

        /**
         * 调度器名称前缀。
         */
        private String namePrefix = "process-graph-exec";

        @Valid
        private final BoundedElasticProps boundedElastic = new BoundedElasticProps();

        @Valid
        private final ParallelProps parallel = new ParallelProps();

        /**
         * 当 type 为 CUSTOM 时，自定义 Scheduler Bean 的名称。
         */
        private String customBeanName;
    }

    public enum SchedulerType {
        BOUNDED_ELASTIC, PARALLEL, SINGLE, CUSTOM
    }

    @Getter
    @Setter
    public static class BoundedElasticProps {
        @Min(1)
        private int threadCap = Schedulers.DEFAULT_BOUNDED_ELASTIC_SIZE;
        @Min(1)
        private int queuedTaskCap = Schedulers.DEFAULT_BOUNDED_ELASTIC_QUEUESIZE;
        @Min(0)
        private int ttlSeconds = 60;
    }

    @Getter
    @Setter
    public static class ParallelProps {
        @Min(1)
        private int parallelism = Runtime.getRuntime().availableProcessors();
    }

    @Getter
    @Setter
    public static class Schema {
        /**
         * 已编译 JSON Schema 的缓存条目上限。
         */
        @Min(1)
        private long cacheSize = SchemaChecker.DEFAULT_CACHE_SIZE;
    }

    @Getter
    @Setter
    public static class Builtins {
        /**
         * 是否注册 add / subtract / multiply / divide / sum / product / absolute。
         */
        private boolean arithmeticEnabled = true;
    }

    @Getter
    @Setter
    public static class Monitor {
        /**
         * 是否注册 LoggingProcessGraphMonitorListener。
         */
        private boolean loggingEnabled = true;
    }

    @Override
    public String toString() {
        return "ProcessGraphProperties{" +
                "node={defaultTimeout=" + node.defaultTimeout +
                "}, engine={concurrencyLevel=" + engine.concurrencyLevel +
                ", errorStrategy=" + engine.errorStrategy +
                ", maxRecursionDepth=" + engine.maxRecursionDepth +
                "}, scheduler={type=" + scheduler.type +
                ", namePrefix='" + scheduler.namePrefix + '\'' +
                ", customBeanName='" + scheduler.customBeanName + '\'' +
                "}, schema={cacheSize=" + schema.cacheSize +
                "}, builtins={arithmeticEnabled=" + builtins.arithmeticEnabled +
                "}, monitor={loggingEnabled=" + monitor.loggingEnabled +
                "}}";
    }
}
