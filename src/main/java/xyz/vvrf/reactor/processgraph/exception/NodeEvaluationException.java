package xyz.vvrf.reactor.processgraph.exception;

/**
 * 单个节点在求值期间失败 (未绑定参数、递归超限、处理实现异常或超时)。
 */
public class NodeEvaluationException extends ProcessGraphException {

    public NodeEvaluationException(ErrorKind kind, String nodeId, String message) {
        super(kind, nodeId, message);
    }

    public NodeEvaluationException(ErrorKind kind, String nodeId, String message, Throwable cause) {
        super(kind, nodeId, message, cause);
    }
}
