package xyz.vvrf.reactor.processgraph.core;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Collections;
import java.util.List;

/**
 * 可被 Spring 扫描注册的内置处理实现。
 * ID 与描述性元数据来自 {@link xyz.vvrf.reactor.processgraph.annotation.ProcessType} 注解，
 * 参数和返回值 Schema 由实现自己声明。
 */
public interface ProcessImplementation extends ProcessInvoker {

    default List<ProcessParameter> getParameters() {
        return Collections.emptyList();
    }

    /**
     * 返回值 Schema，默认不校验。
     */
    default JsonNode getReturns() {
        return null;
    }
}
