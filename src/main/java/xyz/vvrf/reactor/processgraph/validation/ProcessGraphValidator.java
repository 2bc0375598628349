package xyz.vvrf.reactor.processgraph.validation;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.reactor.processgraph.core.ProcessDocument;
import xyz.vvrf.reactor.processgraph.core.ProcessGraph;
import xyz.vvrf.reactor.processgraph.core.ProcessNode;
import xyz.vvrf.reactor.processgraph.core.ProcessParameter;
import xyz.vvrf.reactor.processgraph.core.UserDefinedProcess;
import xyz.vvrf.reactor.processgraph.exception.ErrorKind;
import xyz.vvrf.reactor.processgraph.exception.GraphError;
import xyz.vvrf.reactor.processgraph.exception.GraphValidationException;
import xyz.vvrf.reactor.processgraph.parser.ParseResult;
import xyz.vvrf.reactor.processgraph.parser.ProcessGraphParser;
import xyz.vvrf.reactor.processgraph.registry.ProcessLookup;
import xyz.vvrf.reactor.processgraph.util.GraphUtils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * 处理图结构校验器。
 * 检查项 (全部累积，不在第一个错误处停止):
 * <ol>
 *     <li>解析错误 (MALFORMED_GRAPH)；</li>
 *     <li>结果节点恰好一个 (AMBIGUOUS_OR_MISSING_RESULT)；</li>
 *     <li>from_node 目标存在 (DANGLING_REFERENCE)；</li>
 *     <li>引用关系无环 (CYCLIC_DEPENDENCY)；</li>
 *     <li>提供注册表视图时，process_id 均可解析 (UNKNOWN_PROCESS)；</li>
 *     <li>声明了参数时，from_argument 只引用已声明的参数 (DANGLING_REFERENCE)。</li>
 * </ol>
 *
 * @author ruifeng.wen
 */
@Slf4j
public class ProcessGraphValidator {

    private final ProcessGraphParser parser;

    public ProcessGraphValidator(ProcessGraphParser parser) {
        this.parser = Objects.requireNonNull(parser, "ProcessGraphParser 不能为空");
    }

    public ProcessGraphParser getParser() {
        return parser;
    }

    /**
     * 解析并校验原始文档。
     *
     * @param document 原始 JSON 文档
     * @param lookup   处理查找视图，为 null 时跳过 UNKNOWN_PROCESS 检查
     * @return 全部结构错误，为空表示有效
     */
    public List<GraphError> validate(JsonNode document, ProcessLookup lookup) {
        return validate(parser.parse(document), lookup);
    }

    public List<GraphError> validate(ParseResult parsed, ProcessLookup lookup) {
        ProcessDocument document = parsed.getDocument();
        List<GraphError> errors = new ArrayList<>(parsed.getErrors());
        errors.addAll(validateGraph(document.getGraph(), parsed.getResultCandidates(),
                document.isParametersDeclared() ? parameterNames(document.getParameters()) : null,
                lookup));
        return errors;
    }

    /**
     * 解析并校验，返回有效的文档。
     *
     * @throws GraphValidationException 携带全部结构错误
     */
    public ProcessDocument requireValid(JsonNode document, ProcessLookup lookup) {
        ParseResult parsed = parser.parse(document);
        List<GraphError> errors = validate(parsed, lookup);
        if (!errors.isEmpty()) {
            log.debug("处理图校验失败，共 {} 个错误: {}", errors.size(), errors);
            throw new GraphValidationException(errors);
        }
        return parsed.getDocument();
    }

    /**
     * 校验用户自定义处理的图。不检查 process_id 是否存在 (允许先注册、后补齐依赖以及递归调用)。
     */
    public List<GraphError> validateUserDefined(UserDefinedProcess process) {
        ProcessGraph graph = process.getGraph();
        return validateGraph(graph, graph.getResultNodeIds(), parameterNames(process.getParameters()), null);
    }

    /**
     * 对已构建的图进行结构校验。
     *
     * @param graph              处理图
     * @param resultCandidates   声明为结果节点的节点 ID
     * @param declaredParameters 已声明的参数名；为 null 表示未声明，此时不检查 from_argument
     * @param lookup             处理查找视图；为 null 时跳过 UNKNOWN_PROCESS 检查
     */
    public List<GraphError> validateGraph(ProcessGraph graph, List<String> resultCandidates,
                                          Set<String> declaredParameters, ProcessLookup lookup) {
        List<GraphError> errors = new ArrayList<>();

        if (resultCandidates.isEmpty()) {
            errors.add(GraphError.global(ErrorKind.AMBIGUOUS_OR_MISSING_RESULT,
                    "Process graph has no result node (no node declares \"result\": true)."));
        } else if (resultCandidates.size() > 1) {
            errors.add(GraphError.of(ErrorKind.AMBIGUOUS_OR_MISSING_RESULT, resultCandidates,
                    "Process graph has multiple result nodes: " + resultCandidates + "."));
        }

        errors.addAll(GraphUtils.findDanglingReferences(graph));
        errors.addAll(GraphUtils.resolve(graph).toErrors());

        if (lookup != null) {
            for (ProcessNode node : graph.getNodes().values()) {
                if (!lookup.contains(node.getProcessId())) {
                    errors.add(GraphError.of(ErrorKind.UNKNOWN_PROCESS, node.getId(),
                            String.format("Node '%s' references unknown process '%s'.", node.getId(), node.getProcessId())));
                }
            }
        }

        if (declaredParameters != null) {
            for (ProcessNode node : graph.getNodes().values()) {
                for (String name : GraphUtils.parameterReferencesOf(node)) {
                    if (!declaredParameters.contains(name)) {
                        errors.add(GraphError.of(ErrorKind.DANGLING_REFERENCE, node.getId(),
                                String.format("Node '%s' references undeclared parameter '%s' via from_argument.", node.getId(), name)));
                    }
                }
            }
        }
        return errors;
    }

    private static Set<String> parameterNames(List<ProcessParameter> parameters) {
        Set<String> names = new HashSet<>();
        for (ProcessParameter parameter : parameters) {
            names.add(parameter.getName());
        }
        return Collections.unmodifiableSet(names);
    }
}
