package xyz.vvrf.reactor.processgraph.core;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.Getter;

import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * 解析后的处理文档。
 * 既可以来自完整的 openEO 处理 ({@code {id, parameters, returns, process_graph}})，
 * 也可以来自裸节点映射；后者 {@link #isParametersDeclared()} 为 false。
 */
@Getter
@Builder
public final class ProcessDocument {

    private final String id;
    private final String summary;
    private final String description;
    private final boolean deprecated;
    private final boolean experimental;
    private final boolean parametersDeclared;
    private final List<ProcessParameter> parameters;
    private final JsonNode returns;
    private final ProcessGraph graph;

    public Optional<String> getId() {
        return Optional.ofNullable(id);
    }

    public List<ProcessParameter> getParameters() {
        return parameters == null ? Collections.emptyList() : parameters;
    }

    public ProcessGraph getGraph() {
        return Objects.requireNonNull(graph, "文档尚未包含处理图");
    }

    public static ProcessDocument ofGraph(ProcessGraph graph) {
        return ProcessDocument.builder().graph(graph).build();
    }
}
