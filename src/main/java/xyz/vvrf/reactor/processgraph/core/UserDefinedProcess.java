package xyz.vvrf.reactor.processgraph.core;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Getter;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 用户自定义处理：一个存储下来的处理图加上参数声明，归属于某个不透明的 owner key。
 * 调用即以调用方解析后的参数作为绑定，对 {@link #getGraph()} 进行子求值。
 *
 * @author ruifeng.wen
 */
@Getter
public final class UserDefinedProcess implements ProcessDefinition {

    private final String id;
    private final String ownerKey;
    private final List<ProcessParameter> parameters;
    private final JsonNode returns;
    private final String summary;
    private final String description;
    private final boolean deprecated;
    private final boolean experimental;
    private final ProcessGraph graph;

    public UserDefinedProcess(String id, String ownerKey, List<ProcessParameter> parameters, JsonNode returns,
                              String summary, String description, boolean deprecated, boolean experimental,
                              ProcessGraph graph) {
        this.id = Objects.requireNonNull(id, "处理 ID 不能为空");
        this.ownerKey = Objects.requireNonNull(ownerKey, "owner key 不能为空");
        this.parameters = parameters == null ? Collections.emptyList() : Collections.unmodifiableList(new ArrayList<>(parameters));
        this.returns = returns;
        this.summary = summary;
        this.description = description;
        this.deprecated = deprecated;
        this.experimental = experimental;
        this.graph = Objects.requireNonNull(graph, "处理图不能为空");
    }

    /**
     * 从已解析的处理文档创建；文档必须带有 id。
     */
    public static UserDefinedProcess fromDocument(String ownerKey, ProcessDocument document) {
        String id = document.getId()
                .orElseThrow(() -> new IllegalArgumentException("用户自定义处理文档缺少 'id'"));
        return new UserDefinedProcess(id, ownerKey, document.getParameters(), document.getReturns(),
                document.getSummary(), document.getDescription(), document.isDeprecated(), document.isExperimental(),
                document.getGraph());
    }

    /**
     * 以新的 owner 复制一份。
     */
    public UserDefinedProcess withOwner(String newOwnerKey) {
        return new UserDefinedProcess(id, newOwnerKey, parameters, returns, summary, description,
                deprecated, experimental, graph);
    }

    @Override
    public Mono<?> invoke(Map<String, Object> arguments, InvocationContext context) {
        return context.evaluateUserDefined(this, arguments);
    }

    @Override
    public String toString() {
        return "UserDefinedProcess{id='" + id + "', owner='" + ownerKey + "', nodes=" + graph.size() + '}';
    }
}
