package xyz.vvrf.reactor.processgraph.execution;

import xyz.vvrf.reactor.processgraph.exception.ErrorKind;
import xyz.vvrf.reactor.processgraph.exception.NodeEvaluationException;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * 用户自定义处理的显式调用栈 (不可变)。
 * 帧按深度存放在数组中，顶层图深度为 0；每次 {@link #push} 返回新的实例，
 * 并发的执行路径各自持有自己的栈。
 *
 * @author ruifeng.wen
 */
public final class CallStack {

    private final EvaluationFrame[] frames;
    private final int maxDepth;

    private CallStack(EvaluationFrame[] frames, int maxDepth) {
        this.frames = frames;
        this.maxDepth = maxDepth;
    }

    /**
     * 顶层图使用的空栈。
     *
     * @param maxDepth 允许的最大嵌套深度 (至少为 1)
     */
    public static CallStack root(int maxDepth) {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("Max recursion depth must be at least 1.");
        }
        return new CallStack(new EvaluationFrame[0], maxDepth);
    }

    /**
     * 压入一帧。
     *
     * @throws NodeEvaluationException RECURSION_LIMIT_EXCEEDED，如果新深度超过上限
     */
    public CallStack push(EvaluationFrame frame) {
        if (frames.length >= maxDepth) {
            throw new NodeEvaluationException(ErrorKind.RECURSION_LIMIT_EXCEEDED, frame.getCallerNodeId(),
                    String.format("Maximum recursion depth %d exceeded when node '%s' calls process '%s'. Call stack: %s",
                            maxDepth, frame.getCallerNodeId(), frame.getProcessId(), describe()));
        }
        EvaluationFrame[] next = Arrays.copyOf(frames, frames.length + 1);
        next[frames.length] = frame;
        return new CallStack(next, maxDepth);
    }

    public int getDepth() {
        return frames.length;
    }

    public int getMaxDepth() {
        return maxDepth;
    }

    public Optional<EvaluationFrame> peek() {
        return frames.length == 0 ? Optional.empty() : Optional.of(frames[frames.length - 1]);
    }

    public List<EvaluationFrame> getFrames() {
        return Collections.unmodifiableList(Arrays.asList(frames));
    }

    /**
     * 形如 {@code <root> -> a -> b} 的调用链描述。
     */
    public String describe() {
        if (frames.length == 0) {
            return "<root>";
        }
        return "<root> -> " + Arrays.stream(frames).map(EvaluationFrame::getProcessId).collect(Collectors.joining(" -> "));
    }

    @Override
    public String toString() {
        return "CallStack{depth=" + frames.length + "/" + maxDepth + ", " + describe() + '}';
    }
}
