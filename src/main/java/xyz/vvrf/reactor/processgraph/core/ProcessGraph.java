package xyz.vvrf.reactor.processgraph.core;

import lombok.EqualsAndHashCode;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 节点 ID 到 {@link ProcessNode} 的映射 (不可变，保留插入顺序以保证迭代确定性)。
 * <p>
 * 本类本身不强制结构不变量；结构校验由
 * {@link xyz.vvrf.reactor.processgraph.validation.ProcessGraphValidator} 负责，
 * 解析器也可能为了累积错误而构造出部分图。
 *
 * @author ruifeng.wen
 */
@EqualsAndHashCode
public final class ProcessGraph {

    private final Map<String, ProcessNode> nodes;

    public ProcessGraph(Map<String, ProcessNode> nodes) {
        this.nodes = Collections.unmodifiableMap(new LinkedHashMap<>(nodes));
    }

    public static ProcessGraph of(Collection<ProcessNode> nodes) {
        Map<String, ProcessNode> map = new LinkedHashMap<>();
        for (ProcessNode node : nodes) {
            if (map.putIfAbsent(node.getId(), node) != null) {
                throw new IllegalArgumentException("重复的节点 ID: " + node.getId());
            }
        }
        return new ProcessGraph(map);
    }

    public Map<String, ProcessNode> getNodes() {
        return nodes;
    }

    public Set<String> getNodeIds() {
        return nodes.keySet();
    }

    public Optional<ProcessNode> getNode(String nodeId) {
        return Optional.ofNullable(nodes.get(nodeId));
    }

    public boolean containsNode(String nodeId) {
        return nodes.containsKey(nodeId);
    }

    public int size() {
        return nodes.size();
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    /**
     * 所有 {@code result = true} 的节点 ID (按插入顺序)。校验通过的图恰好有一个。
     */
    public List<String> getResultNodeIds() {
        return nodes.values().stream()
                .filter(ProcessNode::isResult)
                .map(ProcessNode::getId)
                .collect(Collectors.toList());
    }

    /**
     * 校验通过的图的唯一结果节点。
     *
     * @throws IllegalStateException 如果结果节点不是恰好一个
     */
    public ProcessNode getResultNode() {
        List<String> resultIds = getResultNodeIds();
        if (resultIds.size() != 1) {
            throw new IllegalStateException("处理图应恰好有一个结果节点，实际为: " + resultIds);
        }
        return nodes.get(resultIds.get(0));
    }

    @Override
    public String toString() {
        return "ProcessGraph{nodes=" + nodes.keySet() + '}';
    }
}
