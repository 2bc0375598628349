package xyz.vvrf.reactor.processgraph.core;

/**
 * 定义处理图求值过程中的错误处理策略。
 * 无论哪种策略，失败节点的下游都不会被调用，求值最终都以第一个记录的失败结束。
 *
 * @author ruifeng.wen
 */
public enum ErrorHandlingStrategy {
    /**
     * 快速失败：任何节点失败后不再分派新的节点，尚未开始的节点被标记为 SKIPPED。
     * 这是默认策略。
     */
    FAIL_FAST,

    /**
     * 继续执行：节点失败后，与其无依赖关系的分支仍会执行完毕，
     * 只有失败节点的下游被跳过。最终结果仍然是失败。
     */
    CONTINUE_ON_FAILURE
}
