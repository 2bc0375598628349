package xyz.vvrf.reactor.processgraph.parser;

import lombok.Getter;
import xyz.vvrf.reactor.processgraph.core.ProcessDocument;
import xyz.vvrf.reactor.processgraph.exception.GraphError;
import xyz.vvrf.reactor.processgraph.exception.GraphValidationException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 解析结果。
 * 即使存在错误也会带有一个 (可能不完整的) 文档，便于后续校验继续累积错误；
 * 格式错误的节点不会出现在文档的图中。
 */
@Getter
public final class ParseResult {

    private final ProcessDocument document;
    private final List<GraphError> errors;
    /**
     * 原始文档中声明 {@code "result": true} 的全部节点 ID，包括格式错误的节点。
     */
    private final List<String> resultCandidates;

    ParseResult(ProcessDocument document, List<GraphError> errors, List<String> resultCandidates) {
        this.document = document;
        this.errors = Collections.unmodifiableList(new ArrayList<>(errors));
        this.resultCandidates = Collections.unmodifiableList(new ArrayList<>(resultCandidates));
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    /**
     * @throws GraphValidationException 如果解析阶段发现任何错误
     */
    public ProcessDocument getDocumentOrThrow() {
        if (hasErrors()) {
            throw new GraphValidationException(errors);
        }
        return document;
    }
}
