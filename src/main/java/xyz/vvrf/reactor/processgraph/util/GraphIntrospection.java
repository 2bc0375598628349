package xyz.vvrf.reactor.processgraph.util;

import lombok.Getter;
import lombok.ToString;
import xyz.vvrf.reactor.processgraph.core.ArgumentValue;
import xyz.vvrf.reactor.processgraph.core.ProcessGraph;
import xyz.vvrf.reactor.processgraph.core.ProcessNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 在不求值的前提下检查处理图，例如作业服务在执行前找出需要加载的数据集合。
 */
public final class GraphIntrospection {

    public static final String LOAD_COLLECTION = "load_collection";

    private GraphIntrospection() {}

    /**
     * 调用指定处理的所有节点 (按插入顺序)。
     */
    public static List<ProcessNode> findNodesByProcess(ProcessGraph graph, String processId) {
        List<ProcessNode> matches = new ArrayList<>();
        for (ProcessNode node : graph.getNodes().values()) {
            if (node.getProcessId().equals(processId)) {
                matches.add(node);
            }
        }
        return matches;
    }

    /**
     * 列出所有 {@code load_collection} 节点的数据源参数。
     * 只提取完全由字面量构成的参数值；含有引用的参数值视为未知 (null)。
     */
    public static List<DataSource> collectDataSources(ProcessGraph graph) {
        List<DataSource> sources = new ArrayList<>();
        for (ProcessNode node : findNodesByProcess(graph, LOAD_COLLECTION)) {
            Object collectionId = literalArgument(node, "id").orElse(null);
            sources.add(new DataSource(
                    node.getId(),
                    collectionId == null ? null : String.valueOf(collectionId),
                    literalArgument(node, "spatial_extent").orElse(null),
                    literalArgument(node, "temporal_extent").orElse(null),
                    literalArgument(node, "bands").orElse(null)));
        }
        return sources;
    }

    private static Optional<Object> literalArgument(ProcessNode node, String name) {
        return node.getArgument(name).flatMap(GraphIntrospection::toLiteral);
    }

    /**
     * 若值不含任何引用，则转换为普通 Java 值 (List / Map / 标量)。
     */
    public static Optional<Object> toLiteral(ArgumentValue value) {
        switch (value.getKind()) {
            case LITERAL:
                return Optional.ofNullable(((ArgumentValue.Literal) value).getValue());
            case ARRAY: {
                List<Object> elements = new ArrayList<>();
                for (ArgumentValue element : ((ArgumentValue.ArrayValue) value).getElements()) {
                    if (containsReference(element)) {
                        return Optional.empty();
                    }
                    elements.add(toLiteral(element).orElse(null));
                }
                return Optional.of(Collections.unmodifiableList(elements));
            }
            case OBJECT: {
                Map<String, Object> entries = new LinkedHashMap<>();
                for (Map.Entry<String, ArgumentValue> entry : ((ArgumentValue.ObjectValue) value).getEntries().entrySet()) {
                    if (containsReference(entry.getValue())) {
                        return Optional.empty();
                    }
                    entries.put(entry.getKey(), toLiteral(entry.getValue()).orElse(null));
                }
                return Optional.of(Collections.unmodifiableMap(entries));
            }
            default:
                return Optional.empty();
        }
    }

    private static boolean containsReference(ArgumentValue value) {
        List<String> references = new ArrayList<>();
        GraphUtils.collectNodeReferences(value, references);
        GraphUtils.collectParameterReferences(value, references);
        return !references.isEmpty();
    }

    /**
     * 一个 load_collection 调用的数据源描述。
     */
    @Getter
    @ToString
    public static final class DataSource {
        private final String nodeId;
        private final String collectionId;
        private final Object spatialExtent;
        private final Object temporalExtent;
        private final Object bands;

        DataSource(String nodeId, String collectionId, Object spatialExtent, Object temporalExtent, Object bands) {
            this.nodeId = nodeId;
            this.collectionId = collectionId;
            this.spatialExtent = spatialExtent;
            this.temporalExtent = temporalExtent;
            this.bands = bands;
        }
    }
}
