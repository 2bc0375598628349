package xyz.vvrf.reactor.processgraph.execution;

import com.fasterxml.jackson.databind.JsonNode;
import reactor.core.publisher.Mono;
import xyz.vvrf.reactor.processgraph.core.EvaluationResult;
import xyz.vvrf.reactor.processgraph.exception.GraphError;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * 处理图求值引擎接口。
 * 接收 openEO 处理文档 (或裸节点映射) 与参数绑定，校验后求值其结果节点。
 *
 * @author ruifeng.wen
 */
public interface ProcessGraphEngine {

    /**
     * 校验并求值处理文档。
     *
     * @param document   处理文档 (不能为空)
     * @param parameters 顶层参数绑定 (可以为空映射)
     * @param ownerKey   用于解析用户自定义处理的 owner key；为 null 时只使用内置处理
     * @param requestId  可选的请求 ID，用于日志和监控。如果为 null 或空，将自动生成。
     * @return 成功时发出 {@link EvaluationResult}；
     * 结构错误以 {@link xyz.vvrf.reactor.processgraph.exception.GraphValidationException} 终止 (不调用任何处理)，
     * 执行错误以第一个记录的 {@link xyz.vvrf.reactor.processgraph.exception.ProcessGraphException} 终止。
     */
    Mono<EvaluationResult> evaluate(JsonNode document, Map<String, Object> parameters, String ownerKey, String requestId);

    default Mono<EvaluationResult> evaluate(JsonNode document, Map<String, Object> parameters) {
        return evaluate(document, parameters, null, null);
    }

    default Mono<EvaluationResult> evaluate(JsonNode document) {
        return evaluate(document, Collections.emptyMap());
    }

    /**
     * 阻塞地求值，直接返回结果节点的输出 (可以为 null)。
     *
     * @throws xyz.vvrf.reactor.processgraph.exception.ProcessGraphException 求值失败时
     */
    default Object evaluateBlocking(JsonNode document, Map<String, Object> parameters) {
        EvaluationResult result = evaluate(document, parameters).block();
        return result == null ? null : result.getValue();
    }

    /**
     * 只做结构校验，返回全部错误 (为空表示有效)。
     */
    List<GraphError> validate(JsonNode document, String ownerKey);

    default List<GraphError> validate(JsonNode document) {
        return validate(document, null);
    }
}
