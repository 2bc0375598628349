package xyz.vvrf.reactor.processgraph.parser;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.reactor.processgraph.core.ArgumentValue;
import xyz.vvrf.reactor.processgraph.core.ProcessDocument;
import xyz.vvrf.reactor.processgraph.core.ProcessGraph;
import xyz.vvrf.reactor.processgraph.core.ProcessNode;
import xyz.vvrf.reactor.processgraph.core.ProcessParameter;
import xyz.vvrf.reactor.processgraph.exception.ErrorKind;
import xyz.vvrf.reactor.processgraph.exception.GraphError;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * 将无类型的 JSON 文档解析为 {@link ProcessDocument}。
 * <p>
 * 接受的形状:
 * <ul>
 *     <li>裸节点映射: {@code {"<nodeId>": {"process_id", "arguments", "result"?, "description"?}, ...}}；</li>
 *     <li>处理文档: {@code {"id"?, "summary"?, "description"?, "parameters"?, "returns"?, "process_graph": {...}}}；</li>
 *     <li>作业包装: {@code {"process": <处理文档>}}。</li>
 * </ul>
 * 解析是累积式的：所有格式错误都会被收集，而不是在第一个错误处停止。
 * 结构不变量 (结果节点、引用、环) 由 {@link xyz.vvrf.reactor.processgraph.validation.ProcessGraphValidator} 检查。
 *
 * @author ruifeng.wen
 */
@Slf4j
public class ProcessGraphParser {

    public static final String FIELD_PROCESS = "process";
    public static final String FIELD_PROCESS_GRAPH = "process_graph";
    public static final String FIELD_PROCESS_ID = "process_id";
    public static final String FIELD_ARGUMENTS = "arguments";
    public static final String FIELD_RESULT = "result";
    public static final String FIELD_DESCRIPTION = "description";
    public static final String FIELD_FROM_NODE = "from_node";
    public static final String FIELD_FROM_ARGUMENT = "from_argument";

    private final ObjectMapper objectMapper;

    public ProcessGraphParser(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "ObjectMapper 不能为空");
    }

    /**
     * 解析 JSON 文本。无法解析的 JSON 作为 MALFORMED_GRAPH 报告。
     */
    public ParseResult parse(String json) {
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            log.debug("处理图 JSON 无法解析: {}", e.getOriginalMessage());
            return malformedDocument("Process graph is not valid JSON: " + e.getOriginalMessage());
        }
        return parse(root);
    }

    public ParseResult parse(JsonNode root) {
        if (root == null || root.isNull() || root.isMissingNode()) {
            return malformedDocument("Process graph document is empty.");
        }
        if (!root.isObject()) {
            return malformedDocument("Process graph document must be a JSON object, got " + root.getNodeType() + ".");
        }

        JsonNode wrapped = root.get(FIELD_PROCESS);
        if (wrapped != null && wrapped.isObject() && wrapped.has(FIELD_PROCESS_GRAPH) && !root.has(FIELD_PROCESS_GRAPH)) {
            root = wrapped;
        }

        if (isProcessDocument(root)) {
            return parseProcessDocument(root);
        }
        List<GraphError> errors = new ArrayList<>();
        List<String> resultCandidates = new ArrayList<>();
        ProcessGraph graph = parseNodeMap(root, errors, resultCandidates);
        return new ParseResult(ProcessDocument.ofGraph(graph), errors, resultCandidates);
    }

    private boolean isProcessDocument(JsonNode root) {
        JsonNode processGraph = root.get(FIELD_PROCESS_GRAPH);
        // 名为 "process_graph" 的节点本身带有 process_id
        return processGraph != null && !(processGraph.isObject() && processGraph.has(FIELD_PROCESS_ID));
    }

    private ParseResult parseProcessDocument(JsonNode root) {
        List<GraphError> errors = new ArrayList<>();
        List<String> resultCandidates = new ArrayList<>();

        JsonNode processGraphNode = root.get(FIELD_PROCESS_GRAPH);
        ProcessGraph graph;
        if (!processGraphNode.isObject()) {
            errors.add(GraphError.global(ErrorKind.MALFORMED_GRAPH, "'process_graph' must be a JSON object."));
            graph = new ProcessGraph(new LinkedHashMap<>());
        } else {
            graph = parseNodeMap(processGraphNode, errors, resultCandidates);
        }

        JsonNode parametersNode = root.get("parameters");
        boolean parametersDeclared = parametersNode != null && !parametersNode.isNull();
        List<ProcessParameter> parameters = parametersDeclared
                ? parseParameters(parametersNode, errors)
                : new ArrayList<>();

        JsonNode returnsNode = root.get("returns");
        JsonNode returnsSchema = null;
        if (returnsNode != null && returnsNode.isObject()) {
            returnsSchema = returnsNode.get("schema");
        } else if (returnsNode != null && !returnsNode.isNull()) {
            errors.add(GraphError.global(ErrorKind.MALFORMED_GRAPH, "'returns' must be a JSON object."));
        }

        ProcessDocument document = ProcessDocument.builder()
                .id(optionalText(root, "id", errors))
                .summary(optionalText(root, "summary", errors))
                .description(optionalText(root, FIELD_DESCRIPTION, errors))
                .deprecated(root.path("deprecated").asBoolean(false))
                .experimental(root.path("experimental").asBoolean(false))
                .parametersDeclared(parametersDeclared)
                .parameters(parameters)
                .returns(returnsSchema)
                .graph(graph)
                .build();
        return new ParseResult(document, errors, resultCandidates);
    }

    private ProcessGraph parseNodeMap(JsonNode nodeMap, List<GraphError> errors, List<String> resultCandidates) {
        Map<String, ProcessNode> nodes = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = nodeMap.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            ProcessNode node = parseNode(field.getKey(), field.getValue(), errors, resultCandidates);
            if (node != null) {
                nodes.put(node.getId(), node);
            }
        }
        return new ProcessGraph(nodes);
    }

    /**
     * 解析单个节点体；有任何格式错误时返回 null，错误写入 {@code errors}。
     */
    private ProcessNode parseNode(String nodeId, JsonNode body, List<GraphError> errors, List<String> resultCandidates) {
        if (!body.isObject()) {
            errors.add(GraphError.of(ErrorKind.MALFORMED_GRAPH, nodeId,
                    String.format("Node '%s' must be a JSON object, got %s.", nodeId, body.getNodeType())));
            return null;
        }
        int errorsBefore = errors.size();

        JsonNode resultNode = body.get(FIELD_RESULT);
        boolean result = false;
        if (resultNode != null && !resultNode.isNull()) {
            if (resultNode.isBoolean()) {
                result = resultNode.booleanValue();
            } else {
                errors.add(GraphError.of(ErrorKind.MALFORMED_GRAPH, nodeId,
                        String.format("Node '%s': 'result' must be a boolean.", nodeId)));
            }
        }
        if (result) {
            resultCandidates.add(nodeId);
        }

        JsonNode processIdNode = body.get(FIELD_PROCESS_ID);
        if (processIdNode == null || processIdNode.isNull()) {
            errors.add(GraphError.of(ErrorKind.MALFORMED_GRAPH, nodeId,
                    String.format("Node '%s' is missing 'process_id'.", nodeId)));
        } else if (!processIdNode.isTextual() || processIdNode.textValue().isEmpty()) {
            errors.add(GraphError.of(ErrorKind.MALFORMED_GRAPH, nodeId,
                    String.format("Node '%s': 'process_id' must be a non-empty string.", nodeId)));
        }

        JsonNode argumentsNode = body.get(FIELD_ARGUMENTS);
        Map<String, ArgumentValue> arguments = new LinkedHashMap<>();
        if (argumentsNode == null || argumentsNode.isNull()) {
            errors.add(GraphError.of(ErrorKind.MALFORMED_GRAPH, nodeId,
                    String.format("Node '%s' is missing 'arguments'.", nodeId)));
        } else if (!argumentsNode.isObject()) {
            errors.add(GraphError.of(ErrorKind.MALFORMED_GRAPH, nodeId,
                    String.format("Node '%s': 'arguments' must be a JSON object.", nodeId)));
        } else {
            Iterator<Map.Entry<String, JsonNode>> it = argumentsNode.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> argument = it.next();
                arguments.put(argument.getKey(), classify(argument.getValue(), nodeId, argument.getKey(), errors));
            }
        }

        JsonNode descriptionNode = body.get(FIELD_DESCRIPTION);
        String description = null;
        if (descriptionNode != null && !descriptionNode.isNull()) {
            if (descriptionNode.isTextual()) {
                description = descriptionNode.textValue();
            } else {
                errors.add(GraphError.of(ErrorKind.MALFORMED_GRAPH, nodeId,
                        String.format("Node '%s': 'description' must be a string.", nodeId)));
            }
        }

        if (errors.size() > errorsBefore) {
            return null;
        }
        return new ProcessNode(nodeId, processIdNode.textValue(), arguments, result, description);
    }

    /**
     * 参数值分类。引用格式错误时记录错误并以字面量占位。
     */
    ArgumentValue classify(JsonNode value, String nodeId, String path, List<GraphError> errors) {
        if (value.isObject()) {
            if (value.has(FIELD_FROM_NODE)) {
                JsonNode target = value.get(FIELD_FROM_NODE);
                if (!target.isTextual()) {
                    errors.add(GraphError.of(ErrorKind.MALFORMED_GRAPH, nodeId,
                            String.format("Node '%s': 'from_node' in argument '%s' must be a string.", nodeId, path)));
                    return ArgumentValue.literal(null);
                }
                return ArgumentValue.fromNode(target.textValue());
            }
            if (value.has(FIELD_FROM_ARGUMENT)) {
                JsonNode name = value.get(FIELD_FROM_ARGUMENT);
                if (!name.isTextual()) {
                    errors.add(GraphError.of(ErrorKind.MALFORMED_GRAPH, nodeId,
                            String.format("Node '%s': 'from_argument' in argument '%s' must be a string.", nodeId, path)));
                    return ArgumentValue.literal(null);
                }
                return ArgumentValue.fromArgument(name.textValue());
            }
            Map<String, ArgumentValue> entries = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> it = value.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> entry = it.next();
                entries.put(entry.getKey(), classify(entry.getValue(), nodeId, path + "." + entry.getKey(), errors));
            }
            return ArgumentValue.object(entries);
        }
        if (value.isArray()) {
            List<ArgumentValue> elements = new ArrayList<>(value.size());
            int index = 0;
            for (JsonNode element : value) {
                elements.add(classify(element, nodeId, path + "[" + index + "]", errors));
                index++;
            }
            return ArgumentValue.array(elements);
        }
        return ArgumentValue.literal(toJava(value));
    }

    private List<ProcessParameter> parseParameters(JsonNode parametersNode, List<GraphError> errors) {
        List<ProcessParameter> parameters = new ArrayList<>();
        if (!parametersNode.isArray()) {
            errors.add(GraphError.global(ErrorKind.MALFORMED_GRAPH, "'parameters' must be a JSON array."));
            return parameters;
        }
        Set<String> names = new HashSet<>();
        int index = 0;
        for (JsonNode parameterNode : parametersNode) {
            index++;
            if (!parameterNode.isObject()) {
                errors.add(GraphError.global(ErrorKind.MALFORMED_GRAPH,
                        String.format("Parameter #%d must be a JSON object.", index)));
                continue;
            }
            JsonNode nameNode = parameterNode.get("name");
            if (nameNode == null || !nameNode.isTextual() || nameNode.textValue().isEmpty()) {
                errors.add(GraphError.global(ErrorKind.MALFORMED_GRAPH,
                        String.format("Parameter #%d is missing a non-empty string 'name'.", index)));
                continue;
            }
            String name = nameNode.textValue();
            if (!names.add(name)) {
                errors.add(GraphError.global(ErrorKind.MALFORMED_GRAPH,
                        String.format("Parameter '%s' is declared more than once.", name)));
                continue;
            }
            JsonNode optionalNode = parameterNode.get("optional");
            if (optionalNode != null && !optionalNode.isNull() && !optionalNode.isBoolean()) {
                errors.add(GraphError.global(ErrorKind.MALFORMED_GRAPH,
                        String.format("Parameter '%s': 'optional' must be a boolean.", name)));
                continue;
            }
            boolean hasDefault = parameterNode.has("default");
            parameters.add(ProcessParameter.builder()
                    .name(name)
                    .description(parameterNode.path(FIELD_DESCRIPTION).asText(null))
                    .schema(parameterNode.get("schema"))
                    .optional(optionalNode != null && optionalNode.asBoolean(false))
                    .hasDefault(hasDefault)
                    .defaultValue(hasDefault ? toJava(parameterNode.get("default")) : null)
                    .build());
        }
        return parameters;
    }

    private String optionalText(JsonNode root, String field, List<GraphError> errors) {
        JsonNode node = root.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        if (!node.isTextual()) {
            errors.add(GraphError.global(ErrorKind.MALFORMED_GRAPH, String.format("'%s' must be a string.", field)));
            return null;
        }
        return node.textValue();
    }

    /**
     * JSON 值转换为普通 Java 值 (Map / List / Number / String / Boolean / null)。
     */
    public Object toJava(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        return objectMapper.convertValue(node, Object.class);
    }

    private ParseResult malformedDocument(String message) {
        List<GraphError> errors = new ArrayList<>();
        errors.add(GraphError.global(ErrorKind.MALFORMED_GRAPH, message));
        return new ParseResult(ProcessDocument.ofGraph(new ProcessGraph(new LinkedHashMap<>())), errors, new ArrayList<>());
    }
}
