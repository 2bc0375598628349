package xyz.vvrf.reactor.processgraph.schema;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.reactor.processgraph.core.ProcessDefinition;
import xyz.vvrf.reactor.processgraph.core.ProcessParameter;
import xyz.vvrf.reactor.processgraph.exception.SchemaViolationException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * 将实际参数绑定到处理的参数声明上。
 * <ol>
 *     <li>拒绝未声明的参数名；</li>
 *     <li>非可选参数缺失即违规；</li>
 *     <li>缺失的可选参数若有默认值则填入；</li>
 *     <li>每个值按其 schema 校验。</li>
 * </ol>
 * 所有违规一次性累积返回。
 *
 * @author ruifeng.wen
 */
@Slf4j
public class ParameterBinder {

    private final SchemaChecker schemaChecker;

    public ParameterBinder(SchemaChecker schemaChecker) {
        this.schemaChecker = Objects.requireNonNull(schemaChecker, "SchemaChecker 不能为空");
    }

    public SchemaChecker getSchemaChecker() {
        return schemaChecker;
    }

    /**
     * 绑定参数，不抛出异常。
     *
     * @param declared 参数声明 (有序)
     * @param supplied 实际参数
     * @return 绑定结果 (包含绑定后的参数和全部违规)
     */
    public BindingResult bind(List<ProcessParameter> declared, Map<String, Object> supplied) {
        Map<String, Object> bound = new LinkedHashMap<>();
        List<SchemaViolation> violations = new ArrayList<>();

        Set<String> declaredNames = new LinkedHashSet<>();
        for (ProcessParameter parameter : declared) {
            declaredNames.add(parameter.getName());
        }
        for (String name : supplied.keySet()) {
            if (!declaredNames.contains(name)) {
                violations.add(new SchemaViolation(name, "parameter is not declared by the process"));
            }
        }

        for (ProcessParameter parameter : declared) {
            String name = parameter.getName();
            if (supplied.containsKey(name)) {
                Object value = supplied.get(name);
                for (String message : schemaChecker.check(value, parameter.getSchema())) {
                    violations.add(new SchemaViolation(name, message));
                }
                bound.put(name, value);
            } else if (parameter.hasDefault()) {
                bound.put(name, parameter.getDefaultValue());
            } else if (!parameter.isOptional()) {
                violations.add(new SchemaViolation(name, "missing required parameter"));
            }
        }
        return new BindingResult(bound, violations);
    }

    /**
     * 将节点的实际参数绑定到处理声明上，存在违规时抛出参数侧的 {@link SchemaViolationException}。
     */
    public Map<String, Object> bindOrThrow(String nodeId, ProcessDefinition process, Map<String, Object> supplied) {
        BindingResult result = bind(process.getParameters(), supplied);
        if (!result.isValid()) {
            log.debug("节点 '{}' 的参数未通过处理 '{}' 的声明校验: {}", nodeId, process.getId(), result.getViolations());
            throw new SchemaViolationException(SchemaViolationException.Side.ARGUMENT, nodeId, process.getId(), result.getViolations());
        }
        return result.getArguments();
    }

    /**
     * 校验处理的返回值，违规时抛出返回侧的 {@link SchemaViolationException}。
     */
    public void checkReturn(String nodeId, ProcessDefinition process, Object value) {
        List<String> messages = schemaChecker.check(value, process.getReturns());
        if (messages.isEmpty()) {
            return;
        }
        List<SchemaViolation> violations = new ArrayList<>(messages.size());
        for (String message : messages) {
            violations.add(new SchemaViolation(SchemaViolation.RETURN, message));
        }
        throw new SchemaViolationException(SchemaViolationException.Side.RETURN, nodeId, process.getId(), violations);
    }

    /**
     * 参数绑定结果。
     */
    @Getter
    public static final class BindingResult {
        private final Map<String, Object> arguments;
        private final List<SchemaViolation> violations;

        BindingResult(Map<String, Object> arguments, List<SchemaViolation> violations) {
            this.arguments = Collections.unmodifiableMap(arguments);
            this.violations = Collections.unmodifiableList(violations);
        }

        public boolean isValid() {
            return violations.isEmpty();
        }
    }
}
