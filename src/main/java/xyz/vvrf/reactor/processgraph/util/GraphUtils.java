// file: util/GraphUtils.java
package xyz.vvrf.reactor.processgraph.util;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.reactor.processgraph.core.ArgumentValue;
import xyz.vvrf.reactor.processgraph.core.ProcessGraph;
import xyz.vvrf.reactor.processgraph.core.ProcessNode;
import xyz.vvrf.reactor.processgraph.exception.ErrorKind;
import xyz.vvrf.reactor.processgraph.exception.GraphError;
import xyz.vvrf.reactor.processgraph.exception.GraphValidationException;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 提供处理图的引用提取、悬空引用检测、循环检测和拓扑排序的工具方法。
 * <p>
 * 依赖边是派生的: 当 A 的某个参数 (任意嵌套深度) 包含 {@code NodeReference(B)} 时，A 依赖 B。
 *
 * @author ruifeng.wen
 */
@Slf4j
public final class GraphUtils {

    private GraphUtils() {}

    private enum VisitState {
        UNVISITED, IN_PROGRESS, DONE
    }

    // --- 引用提取 ---

    /**
     * 按参数顺序 (深度优先) 收集值中所有 from_node 引用。
     */
    public static void collectNodeReferences(ArgumentValue value, Collection<String> target) {
        switch (value.getKind()) {
            case NODE_REFERENCE:
                target.add(((ArgumentValue.NodeReference) value).getNodeId());
                break;
            case ARRAY:
                for (ArgumentValue element : ((ArgumentValue.ArrayValue) value).getElements()) {
                    collectNodeReferences(element, target);
                }
                break;
            case OBJECT:
                for (ArgumentValue entry : ((ArgumentValue.ObjectValue) value).getEntries().values()) {
                    collectNodeReferences(entry, target);
                }
                break;
            default:
                break;
        }
    }

    /**
     * 按参数顺序收集值中所有 from_argument 引用。
     */
    public static void collectParameterReferences(ArgumentValue value, Collection<String> target) {
        switch (value.getKind()) {
            case PARAMETER_REFERENCE:
                target.add(((ArgumentValue.ParameterReference) value).getName());
                break;
            case ARRAY:
                for (ArgumentValue element : ((ArgumentValue.ArrayValue) value).getElements()) {
                    collectParameterReferences(element, target);
                }
                break;
            case OBJECT:
                for (ArgumentValue entry : ((ArgumentValue.ObjectValue) value).getEntries().values()) {
                    collectParameterReferences(entry, target);
                }
                break;
            default:
                break;
        }
    }

    /**
     * 节点的直接依赖 (去重，保持参数顺序)。
     */
    public static Set<String> dependenciesOf(ProcessNode node) {
        Set<String> dependencies = new LinkedHashSet<>();
        for (ArgumentValue value : node.getArguments().values()) {
            collectNodeReferences(value, dependencies);
        }
        return Collections.unmodifiableSet(dependencies);
    }

    /**
     * 节点引用的所有参数名 (去重，保持参数顺序)。
     */
    public static Set<String> parameterReferencesOf(ProcessNode node) {
        Set<String> names = new LinkedHashSet<>();
        for (ArgumentValue value : node.getArguments().values()) {
            collectParameterReferences(value, names);
        }
        return Collections.unmodifiableSet(names);
    }

    // --- 悬空引用 ---

    /**
     * 找出所有指向不存在节点的 from_node 引用，每个 (节点, 目标) 对报告一次。
     */
    public static List<GraphError> findDanglingReferences(ProcessGraph graph) {
        List<GraphError> errors = new ArrayList<>();
        for (ProcessNode node : graph.getNodes().values()) {
            for (String target : dependenciesOf(node)) {
                if (!graph.containsNode(target)) {
                    errors.add(GraphError.of(ErrorKind.DANGLING_REFERENCE, node.getId(),
                            String.format("Node '%s' references non-existent node '%s' via from_node.", node.getId(), target)));
                }
            }
        }
        return errors;
    }

    // --- 循环检测与拓扑排序 ---

    /**
     * 使用三色深度优先搜索同时完成循环检测与拓扑排序。
     * 根节点按插入顺序访问，依赖按参数顺序访问，因此结果是确定的。
     * 指向不存在节点的引用被忽略 (由 {@link #findDanglingReferences} 单独报告)。
     * 使用显式栈，深链不会导致栈溢出。
     *
     * @param graph 处理图
     * @return 排序结果；有环时 {@link DependencyResolution#getCycles()} 非空
     */
    public static DependencyResolution resolve(ProcessGraph graph) {
        Map<String, VisitState> states = new HashMap<>();
        for (String nodeId : graph.getNodeIds()) {
            states.put(nodeId, VisitState.UNVISITED);
        }

        List<String> order = new ArrayList<>(graph.size());
        List<List<String>> cycles = new ArrayList<>();
        Set<List<String>> reportedCycles = new LinkedHashSet<>();

        for (String root : graph.getNodeIds()) {
            if (states.get(root) != VisitState.UNVISITED) {
                continue;
            }
            // 路径栈: 当前递归路径上的节点及其依赖迭代器
            Deque<Frame> stack = new ArrayDeque<>();
            List<String> path = new ArrayList<>();
            states.put(root, VisitState.IN_PROGRESS);
            stack.push(new Frame(root, dependenciesOf(graph.getNodes().get(root)).iterator()));
            path.add(root);

            while (!stack.isEmpty()) {
                Frame frame = stack.peek();
                if (frame.dependencies.hasNext()) {
                    String dependency = frame.dependencies.next();
                    VisitState state = states.get(dependency);
                    if (state == null) {
                        // 悬空引用，单独报告
                        continue;
                    }
                    if (state == VisitState.IN_PROGRESS) {
                        List<String> cycle = new ArrayList<>(path.subList(path.indexOf(dependency), path.size()));
                        if (reportedCycles.add(canonical(cycle))) {
                            cycles.add(Collections.unmodifiableList(cycle));
                            log.debug("Cycle detected: {}", cycle);
                        }
                    } else if (state == VisitState.UNVISITED) {
                        states.put(dependency, VisitState.IN_PROGRESS);
                        stack.push(new Frame(dependency, dependenciesOf(graph.getNodes().get(dependency)).iterator()));
                        path.add(dependency);
                    }
                } else {
                    stack.pop();
                    path.remove(path.size() - 1);
                    states.put(frame.nodeId, VisitState.DONE);
                    order.add(frame.nodeId);
                }
            }
        }
        return new DependencyResolution(order, cycles);
    }

    /**
     * 计算拓扑顺序 (依赖在前)。
     *
     * @throws GraphValidationException 如果存在悬空引用或循环
     */
    public static List<String> topologicalSort(ProcessGraph graph) {
        List<GraphError> errors = new ArrayList<>(findDanglingReferences(graph));
        DependencyResolution resolution = resolve(graph);
        errors.addAll(resolution.toErrors());
        if (!errors.isEmpty()) {
            throw new GraphValidationException(errors);
        }
        return resolution.getOrder();
    }

    // 同一个环从不同节点进入时只报告一次
    private static List<String> canonical(List<String> cycle) {
        int minIndex = 0;
        for (int i = 1; i < cycle.size(); i++) {
            if (cycle.get(i).compareTo(cycle.get(minIndex)) < 0) {
                minIndex = i;
            }
        }
        List<String> rotated = new ArrayList<>(cycle.size());
        for (int i = 0; i < cycle.size(); i++) {
            rotated.add(cycle.get((minIndex + i) % cycle.size()));
        }
        return rotated;
    }

    // --- 可视化 ---

    /**
     * 生成 DOT 格式的图描述，边从依赖指向使用方，结果节点加粗。
     */
    public static String toDot(ProcessGraph graph, String graphName) {
        StringBuilder sb = new StringBuilder();
        sb.append("digraph \"").append(escape(graphName)).append("\" {\n");
        sb.append("  rankdir=LR;\n");
        for (ProcessNode node : graph.getNodes().values()) {
            sb.append("  \"").append(escape(node.getId())).append("\" [label=\"")
                    .append(escape(node.getId())).append("\\n(").append(escape(node.getProcessId())).append(")\"");
            if (node.isResult()) {
                sb.append(", penwidth=2");
            }
            sb.append("];\n");
        }
        for (ProcessNode node : graph.getNodes().values()) {
            for (String dependency : dependenciesOf(node)) {
                sb.append("  \"").append(escape(dependency)).append("\" -> \"").append(escape(node.getId())).append("\";\n");
            }
        }
        sb.append("}\n");
        return sb.toString();
    }

    private static String escape(String text) {
        return text == null ? "" : text.replace("\\", "\\\\").replace("\"", "\\\"");
    }

    private static final class Frame {
        private final String nodeId;
        private final Iterator<String> dependencies;

        private Frame(String nodeId, Iterator<String> dependencies) {
            this.nodeId = nodeId;
            this.dependencies = dependencies;
        }
    }

    /**
     * 依赖解析结果：拓扑顺序以及发现的全部环 (环成员按遇到顺序排列)。
     */
    @Getter
    public static final class DependencyResolution {
        private final List<String> order;
        private final List<List<String>> cycles;

        DependencyResolution(List<String> order, List<List<String>> cycles) {
            this.order = Collections.unmodifiableList(order);
            this.cycles = Collections.unmodifiableList(cycles);
        }

        public boolean isAcyclic() {
            return cycles.isEmpty();
        }

        public List<GraphError> toErrors() {
            List<GraphError> errors = new ArrayList<>(cycles.size());
            for (List<String> cycle : cycles) {
                List<String> closed = new ArrayList<>(cycle);
                closed.add(cycle.get(0));
                errors.add(GraphError.of(ErrorKind.CYCLIC_DEPENDENCY, cycle,
                        "Cyclic dependency: " + String.join(" -> ", closed)));
            }
            return errors;
        }
    }
}
