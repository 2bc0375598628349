// 文件名: annotation/ProcessType.java
package xyz.vvrf.reactor.processgraph.annotation;

import org.springframework.core.annotation.AliasFor;
import org.springframework.stereotype.Component;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Inherited;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * 标记一个类为可被发现的内置处理实现。
 * 使用此注解的类必须实现 {@link xyz.vvrf.reactor.processgraph.core.ProcessImplementation}，
 * 将会被 {@link xyz.vvrf.reactor.processgraph.registry.SpringScanningProcessRegistry} 自动注册为内置处理。
 * <p>
 * 包含 {@link Component} 以便 Spring 在组件扫描期间自动检测这些类。
 *
 * @author ruifeng.wen
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Inherited
@Documented
@Component
public @interface ProcessType {

    /**
     * 处理 ID，{@link #id()} 的别名。
     */
    @AliasFor("id")
    String value() default "";

    /**
     * 处理 ID，{@link #value()} 的别名。为空时使用 Bean 名称。
     */
    @AliasFor("value")
    String id() default "";

    String summary() default "";

    String description() default "";

    boolean deprecated() default false;

    boolean experimental() default false;

    /**
     * 处理级别的执行超时 (毫秒)，小于等于 0 表示使用引擎默认值。
     */
    long timeoutMillis() default 0;
}
