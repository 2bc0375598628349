package xyz.vvrf.reactor.processgraph.core;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.Objects;

/**
 * 处理的一个参数声明。
 * {@code schema} 为 openEO 风格的 JSON Schema (可为对象或 schema 数组)，为空表示不做类型约束。
 * {@code hasDefault} 区分 "没有默认值" 与 "默认值为 null"。
 */
@Getter
@ToString
@EqualsAndHashCode
public final class ProcessParameter {

    private final String name;
    private final String description;
    private final JsonNode schema;
    private final boolean optional;
    @Getter(AccessLevel.NONE)
    private final boolean hasDefault;
    private final Object defaultValue;

    @Builder
    private ProcessParameter(String name, String description, JsonNode schema, boolean optional,
                             boolean hasDefault, Object defaultValue) {
        this.name = Objects.requireNonNull(name, "参数名不能为空");
        this.description = description;
        this.schema = schema;
        // 带默认值的参数总是可选的
        this.optional = optional || hasDefault;
        this.hasDefault = hasDefault;
        this.defaultValue = defaultValue;
    }

    public boolean hasDefault() {
        return hasDefault;
    }

    public static ProcessParameter required(String name, JsonNode schema) {
        return builder().name(name).schema(schema).build();
    }

    public static ProcessParameter withDefault(String name, JsonNode schema, Object defaultValue) {
        return builder().name(name).schema(schema).hasDefault(true).defaultValue(defaultValue).build();
    }
}
