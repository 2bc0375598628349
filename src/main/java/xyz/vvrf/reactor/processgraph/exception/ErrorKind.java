package xyz.vvrf.reactor.processgraph.exception;

/**
 * 处理图校验与求值过程中可能出现的错误类别。
 *
 * @author ruifeng.wen
 */
public enum ErrorKind {
    /** 文档无法解析，或节点体缺少 process_id / arguments，或 JSON 类型不正确。 */
    MALFORMED_GRAPH,
    /** 结果节点数量不是恰好一个。 */
    AMBIGUOUS_OR_MISSING_RESULT,
    /** from_node 指向不存在的节点，或 from_argument 指向未声明的参数。 */
    DANGLING_REFERENCE,
    /** 节点引用关系中存在环。 */
    CYCLIC_DEPENDENCY,
    /** process_id 在注册表中不存在。 */
    UNKNOWN_PROCESS,
    /** 参数或返回值不符合声明的 JSON Schema。 */
    SCHEMA_VIOLATION,
    /** from_argument 引用的参数既未绑定也没有默认值。 */
    UNBOUND_PARAMETER,
    /** 用户自定义处理的嵌套调用超过最大深度。 */
    RECURSION_LIMIT_EXCEEDED,
    /** 处理实现本身抛出异常或超时。 */
    PROCESS_EXECUTION_FAILURE;

    /**
     * 结构性错误在求值开始前即可被发现。
     */
    public boolean isStructural() {
        switch (this) {
            case MALFORMED_GRAPH:
            case AMBIGUOUS_OR_MISSING_RESULT:
            case DANGLING_REFERENCE:
            case CYCLIC_DEPENDENCY:
            case UNKNOWN_PROCESS:
                return true;
            default:
                return false;
        }
    }
}
