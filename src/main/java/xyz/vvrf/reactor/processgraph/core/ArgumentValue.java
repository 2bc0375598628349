package xyz.vvrf.reactor.processgraph.core;

import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 节点参数值 (带标签的变体)。
 * <ul>
 *     <li>{@link Literal}: 标量、字符串、布尔值或 null，没有图语义；</li>
 *     <li>{@link NodeReference}: {@code {"from_node": "<id>"}}；</li>
 *     <li>{@link ParameterReference}: {@code {"from_argument": "<name>"}}；</li>
 *     <li>{@link ArrayValue} / {@link ObjectValue}: 元素被递归分类的数组与对象。</li>
 * </ul>
 * 所有变体均不可变。
 *
 * @author ruifeng.wen
 */
public abstract class ArgumentValue {

    public enum Kind {
        LITERAL, NODE_REFERENCE, PARAMETER_REFERENCE, ARRAY, OBJECT
    }

    private ArgumentValue() {
    }

    public abstract Kind getKind();

    public static Literal literal(Object value) {
        return new Literal(value);
    }

    public static NodeReference fromNode(String nodeId) {
        return new NodeReference(nodeId);
    }

    public static ParameterReference fromArgument(String name) {
        return new ParameterReference(name);
    }

    public static ArrayValue array(List<ArgumentValue> elements) {
        return new ArrayValue(elements);
    }

    public static ObjectValue object(Map<String, ArgumentValue> entries) {
        return new ObjectValue(entries);
    }

    @Getter
    @EqualsAndHashCode(callSuper = false)
    public static final class Literal extends ArgumentValue {
        private final Object value;

        private Literal(Object value) {
            this.value = value;
        }

        @Override
        public Kind getKind() {
            return Kind.LITERAL;
        }

        @Override
        public String toString() {
            return String.valueOf(value);
        }
    }

    @Getter
    @EqualsAndHashCode(callSuper = false)
    public static final class NodeReference extends ArgumentValue {
        private final String nodeId;

        private NodeReference(String nodeId) {
            this.nodeId = Objects.requireNonNull(nodeId, "被引用的节点 ID 不能为空");
        }

        @Override
        public Kind getKind() {
            return Kind.NODE_REFERENCE;
        }

        @Override
        public String toString() {
            return "{from_node=" + nodeId + "}";
        }
    }

    @Getter
    @EqualsAndHashCode(callSuper = false)
    public static final class ParameterReference extends ArgumentValue {
        private final String name;

        private ParameterReference(String name) {
            this.name = Objects.requireNonNull(name, "被引用的参数名不能为空");
        }

        @Override
        public Kind getKind() {
            return Kind.PARAMETER_REFERENCE;
        }

        @Override
        public String toString() {
            return "{from_argument=" + name + "}";
        }
    }

    @Getter
    @EqualsAndHashCode(callSuper = false)
    public static final class ArrayValue extends ArgumentValue {
        private final List<ArgumentValue> elements;

        private ArrayValue(List<ArgumentValue> elements) {
            this.elements = Collections.unmodifiableList(new ArrayList<>(elements));
        }

        @Override
        public Kind getKind() {
            return Kind.ARRAY;
        }

        @Override
        public String toString() {
            return elements.toString();
        }
    }

    @Getter
    @EqualsAndHashCode(callSuper = false)
    public static final class ObjectValue extends ArgumentValue {
        private final Map<String, ArgumentValue> entries;

        private ObjectValue(Map<String, ArgumentValue> entries) {
            this.entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
        }

        @Override
        public Kind getKind() {
            return Kind.OBJECT;
        }

        @Override
        public String toString() {
            return entries.toString();
        }
    }
}
