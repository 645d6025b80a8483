package xyz.vvrf.reactor.flow.monitor;

import xyz.vvrf.reactor.flow.core.Action;
import xyz.vvrf.reactor.flow.core.BaseNode;

import java.time.Duration;

/**
 * 用于监控流程执行事件的监听器接口。
 * 包括流程级别和节点级别的事件。监听器抛出的异常会被记录并忽略，不会影响流程执行。
 */
public interface FlowMonitorListener {

    /**
     * 顶层流程开始执行时调用。
     *
     * @param requestId 请求 ID
     * @param flowName  流程名称
     * @param flow      顶层流程 (或单独运行的节点)
     */
    void onFlowStart(String requestId, String flowName, BaseNode<?, ?> flow);

    /**
     * 顶层流程结束时调用 (无论成功或失败)。
     *
     * @param requestId      请求 ID
     * @param flowName       流程名称
     * @param totalDuration  总耗时
     * @param terminalAction 终止动作，失败时为 null
     * @param error          失败原因，成功时为 null
     */
    void onFlowComplete(String requestId, String flowName, Duration totalDuration, Action terminalAction, Throwable error);

    /**
     * 流程遍历到某个节点、即将执行其完整生命周期时调用。
     */
    void onNodeStart(String requestId, String flowName, String nodeName, BaseNode<?, ?> node);

    /**
     * 节点生命周期成功完成时调用。
     *
     * @param duration 节点耗时 (包括重试等待)
     * @param action   节点 post 返回的动作
     */
    void onNodeSuccess(String requestId, String flowName, String nodeName, Duration duration, Action action);

    /**
     * 节点失败 (prep/post 抛出异常，或 exec 用尽重试) 时调用。
     */
    void onNodeFailure(String requestId, String flowName, String nodeName, Duration duration, Throwable error);

    /**
     * exec 某次尝试失败、即将重试时调用。
     *
     * @param attempt 已失败的尝试序号 (从 1 开始)
     */
    default void onNodeRetry(String requestId, String flowName, String nodeName, int attempt, Throwable error) {
    }

    /**
     * 重试用尽后回退函数成功给出结果时调用。
     */
    default void onNodeFallback(String requestId, String flowName, String nodeName, Throwable error) {
    }
}
