package xyz.vvrf.reactor.processgraph.execution;

import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.reactor.processgraph.core.ArgumentValue;
import xyz.vvrf.reactor.processgraph.core.NodeResult;
import xyz.vvrf.reactor.processgraph.core.ProcessNode;
import xyz.vvrf.reactor.processgraph.core.ProcessParameter;
import xyz.vvrf.reactor.processgraph.exception.ErrorKind;
import xyz.vvrf.reactor.processgraph.exception.NodeEvaluationException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 将节点的参数表达式解析为具体值。
 * <ul>
 *     <li>字面量原样返回；</li>
 *     <li>{@code from_node} 取被引用节点已记录的输出；</li>
 *     <li>{@code from_argument} 依次取当前图的参数绑定、参数声明的默认值，都没有时报 UNBOUND_PARAMETER；</li>
 *     <li>数组和对象逐元素递归解析，保留顺序。</li>
 * </ul>
 *
 * @author ruifeng.wen
 */
@Slf4j
public class ArgumentResolver {

    /**
     * 解析节点的全部参数 (保持声明顺序)。
     *
     * @throws NodeEvaluationException UNBOUND_PARAMETER，或被引用节点没有可用输出
     */
    public Map<String, Object> resolve(ProcessNode node, EvaluationContext context) {
        Map<String, Object> resolved = new LinkedHashMap<>();
        for (Map.Entry<String, ArgumentValue> entry : node.getArguments().entrySet()) {
            resolved.put(entry.getKey(), resolveValue(entry.getValue(), node.getId(), context));
        }
        log.trace("[RequestId: {}][Graph: '{}'] 节点 '{}' 参数解析完成: {}",
                context.getRequestId(), context.getGraphName(), node.getId(), resolved.keySet());
        return resolved;
    }

    public Object resolveValue(ArgumentValue value, String nodeId, EvaluationContext context) {
        switch (value.getKind()) {
            case LITERAL:
                return ((ArgumentValue.Literal) value).getValue();
            case NODE_REFERENCE:
                return resolveNodeReference(((ArgumentValue.NodeReference) value).getNodeId(), nodeId, context);
            case PARAMETER_REFERENCE:
                return resolveParameter(((ArgumentValue.ParameterReference) value).getName(), nodeId, context);
            case ARRAY: {
                List<Object> elements = new ArrayList<>();
                for (ArgumentValue element : ((ArgumentValue.ArrayValue) value).getElements()) {
                    elements.add(resolveValue(element, nodeId, context));
                }
                return elements;
            }
            case OBJECT: {
                Map<String, Object> entries = new LinkedHashMap<>();
                for (Map.Entry<String, ArgumentValue> entry : ((ArgumentValue.ObjectValue) value).getEntries().entrySet()) {
                    entries.put(entry.getKey(), resolveValue(entry.getValue(), nodeId, context));
                }
                return entries;
            }
            default:
                throw new IllegalStateException("Unsupported argument kind: " + value.getKind());
        }
    }

    private Object resolveNodeReference(String target, String nodeId, EvaluationContext context) {
        NodeResult result = context.getCompletedResults().get(target);
        if (result == null || !result.isDone()) {
            // 调度保证依赖先完成，走到这里说明依赖失败或被跳过
            throw new NodeEvaluationException(ErrorKind.PROCESS_EXECUTION_FAILURE, nodeId,
                    String.format("Node '%s' depends on node '%s' which has no output (status: %s).",
                            nodeId, target, result == null ? "MISSING" : result.getStatus()));
        }
        return result.getOutput();
    }

    private Object resolveParameter(String name, String nodeId, EvaluationContext context) {
        Map<String, Object> bindings = context.getBindings();
        if (bindings.containsKey(name)) {
            return bindings.get(name);
        }
        Optional<ProcessParameter> declared = context.getDeclaredParameter(name);
        if (declared.isPresent() && declared.get().hasDefault()) {
            return declared.get().getDefaultValue();
        }
        throw new NodeEvaluationException(ErrorKind.UNBOUND_PARAMETER, nodeId,
                String.format("Node '%s' references parameter '%s' which is not bound and has no default.", nodeId, name));
    }
}
