package xyz.vvrf.reactor.processgraph.spring.boot;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import xyz.vvrf.reactor.processgraph.annotation.ProcessType;
import xyz.vvrf.reactor.processgraph.core.InvocationContext;
import xyz.vvrf.reactor.processgraph.core.ProcessDefinition;
import xyz.vvrf.reactor.processgraph.core.ProcessImplementation;
import xyz.vvrf.reactor.processgraph.core.ProcessParameter;
import xyz.vvrf.reactor.processgraph.execution.ProcessGraphEngine;
import xyz.vvrf.reactor.processgraph.monitor.LoggingProcessGraphMonitorListener;
import xyz.vvrf.reactor.processgraph.monitor.MicrometerProcessGraphMonitorListener;
import xyz.vvrf.reactor.processgraph.registry.ProcessRegistry;

import java.time.Duration;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ProcessGraphAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(ProcessGraphAutoConfiguration.class));

    @ProcessType(id = "double_it", summary = "Doubles a number", timeoutMillis = 500)
    static class DoubleIt implements ProcessImplementation {

        @Override
        public List<ProcessParameter> getParameters() {
            return Collections.singletonList(ProcessParameter.required("x", new ObjectMapper().createObjectNode().put("type", "number")));
        }

        @Override
        public Mono<?> invoke(Map<String, Object> arguments, InvocationContext context) {
            return Mono.just(((Number) arguments.get("x")).doubleValue() * 2);
        }
    }

    @Configuration
    static class ProcessConfiguration {
        @Bean
        DoubleIt doubleIt() {
            return new DoubleIt();
        }
    }

    @Configuration
    static class MetricsConfiguration {
        @Bean
        MeterRegistry meterRegistry() {
            return new SimpleMeterRegistry();
        }
    }

    @Test
    void providesDefaultBeans() {
        contextRunner.run(context -> {
            assertThat(context).hasSingleBean(ProcessGraphEngine.class);
            assertThat(context).hasSingleBean(ProcessRegistry.class);
            assertThat(context).hasSingleBean(LoggingProcessGraphMonitorListener.class);
            assertThat(context).doesNotHaveBean(MicrometerProcessGraphMonitorListener.class);
            assertThat(context).hasBean(ProcessGraphAutoConfiguration.NODE_SCHEDULER_BEAN_NAME);
            assertThat(context.getBean(ProcessGraphAutoConfiguration.NODE_SCHEDULER_BEAN_NAME)).isInstanceOf(Scheduler.class);

            ProcessRegistry registry = context.getBean(ProcessRegistry.class);
            assertThat(registry.isBuiltinsFrozen()).isTrue();
            assertThat(registry.lookup("sum")).isPresent();
        });
    }

    @Test
    void registersAnnotatedProcessBeans() {
        contextRunner.withUserConfiguration(ProcessConfiguration.class).run(context -> {
            ProcessDefinition process = context.getBean(ProcessRegistry.class).lookup("double_it").get();
            assertThat(process.getTimeout()).contains(Duration.ofMillis(500));

            ProcessGraphEngine engine = context.getBean(ProcessGraphEngine.class);
            ObjectMapper mapper = new ObjectMapper();
            Object value = engine.evaluateBlocking(mapper.readTree(
                    "{\"d\": {\"process_id\": \"double_it\", \"arguments\": {\"x\": 21}, \"result\": true}}"),
                    Collections.emptyMap());
            assertThat(value).isEqualTo(42.0);
        });
    }

    @Test
    void arithmeticBuiltinsAndLoggingCanBeDisabled() {
        contextRunner
                .withPropertyValues("process-graph.builtins.arithmetic-enabled=false",
                        "process-graph.monitor.logging-enabled=false")
                .run(context -> {
                    assertThat(context.getBean(ProcessRegistry.class).lookup("add")).isEmpty();
                    assertThat(context).doesNotHaveBean(LoggingProcessGraphMonitorListener.class);
                });
    }

    @Test
    void bindsEngineProperties() {
        contextRunner
                .withPropertyValues("process-graph.engine.concurrency-level=2",
                        "process-graph.engine.max-recursion-depth=3",
                        "process-graph.engine.error-strategy=CONTINUE_ON_FAILURE",
                        "process-graph.node.default-timeout=5s",
                        "process-graph.scheduler.type=PARALLEL")
                .run(context -> {
                    ProcessGraphProperties properties = context.getBean(ProcessGraphProperties.class);
                    assertThat(properties.getEngine().getConcurrencyLevel()).isEqualTo(2);
                    assertThat(properties.getEngine().getMaxRecursionDepth()).isEqualTo(3);
                    assertThat(properties.getNode().getDefaultTimeout()).isEqualTo(Duration.ofSeconds(5));
                    assertThat(context).hasSingleBean(ProcessGraphEngine.class);
                });
    }

    @Test
    void invalidPropertiesFailStartup() {
        contextRunner
                .withPropertyValues("process-graph.engine.concurrency-level=0")
                .run(context -> assertThat(context).hasFailed());
    }

    @Test
    void registersMicrometerListenerWhenMeterRegistryPresent() {
        contextRunner.withUserConfiguration(MetricsConfiguration.class).run(context ->
                assertThat(context).hasSingleBean(MicrometerProcessGraphMonitorListener.class));
    }
}
