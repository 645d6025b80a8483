package xyz.vvrf.reactor.flow.execution;

import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.reactor.flow.core.RetryPolicy;
import xyz.vvrf.reactor.flow.exception.NodeExecutionException;
import xyz.vvrf.reactor.flow.monitor.FlowMonitor;

import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * 在调用线程上执行带重试的 exec 阶段。
 * 两次尝试之间阻塞等待 {@link RetryPolicy#getWait()}；全部失败后调用回退函数。
 */
@Slf4j
public final class BlockingRetryExecutor {

    /**
     * 单次尝试。
     */
    @FunctionalInterface
    public interface Attempt<T> {
        /**
         * @param attempt 尝试序号，从 0 开始
         */
        T call(int attempt) throws Exception;
    }

    /**
     * 重试用尽后的回退。直接抛出 lastError 表示没有回退。
     */
    @FunctionalInterface
    public interface Recovery<T> {
        T recover(Exception lastError) throws Exception;
    }

    private BlockingRetryExecutor() {
    }

    /**
     * @return 某次成功尝试的结果，或回退结果
     * @throws NodeExecutionException 重试用尽且回退失败，或尝试及重试等待被中断 (此时恢复线程的中断标志)
     */
    public static <T> T execute(String nodeName,
                                RetryPolicy policy,
                                Attempt<T> attempt,
                                Recovery<T> recovery,
                                FlowMonitor monitor) {
        Objects.requireNonNull(policy, "RetryPolicy 不能为空");
        Objects.requireNonNull(attempt, "Attempt 不能为空");
        Objects.requireNonNull(recovery, "Recovery 不能为空");
        FlowMonitor m = monitor != null ? monitor : FlowMonitor.NOOP;
        int maxRetries = policy.getMaxRetries();

        Exception lastError = null;
        for (int i = 0; i < maxRetries; i++) {
            try {
                log.trace("[RequestId: {}][Flow: {}] 节点 '{}' 第 {}/{} 次尝试",
                        m.getRequestId(), m.getFlowName(), nodeName, i + 1, maxRetries);
                return attempt.call(i);
            } catch (InterruptedException ie) {
                // 中断不重试，也不回退
                Thread.currentThread().interrupt();
                log.warn("[RequestId: {}][Flow: {}] 节点 '{}' 第 {}/{} 次尝试被中断",
                        m.getRequestId(), m.getFlowName(), nodeName, i + 1, maxRetries);
                throw new NodeExecutionException(nodeName, i + 1, ie);
            } catch (Exception e) {
                lastError = e;
                if (i < maxRetries - 1) {
                    log.warn("[RequestId: {}][Flow: {}] 节点 '{}' 第 {}/{} 次尝试失败，{} 后重试: {}",
                            m.getRequestId(), m.getFlowName(), nodeName, i + 1, maxRetries, policy.getWait(), e.getMessage());
                    m.nodeRetry(nodeName, i + 1, e);
                    sleepBetweenAttempts(nodeName, policy, i + 1, e);
                }
            }
        }

        try {
            T fallback = recovery.recover(lastError);
            log.warn("[RequestId: {}][Flow: {}] 节点 '{}' 重试 {} 次后失败，使用回退结果",
                    m.getRequestId(), m.getFlowName(), nodeName, maxRetries);
            m.nodeFallback(nodeName, lastError);
            return fallback;
        } catch (Exception e) {
            log.error("[RequestId: {}][Flow: {}] 节点 '{}' 在 {} 次尝试后最终失败: {}",
                    m.getRequestId(), m.getFlowName(), nodeName, maxRetries, e.getMessage());
            throw new NodeExecutionException(nodeName, maxRetries, e);
        }
    }

    private static void sleepBetweenAttempts(String nodeName, RetryPolicy policy, int attemptsSoFar, Exception lastError) {
        if (!policy.hasWait()) {
            return;
        }
        try {
            TimeUnit.NANOSECONDS.sleep(policy.getWait().toNanos());
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            NodeExecutionException ex = new NodeExecutionException(nodeName, attemptsSoFar, lastError);
            ex.addSuppressed(ie);
            throw ex;
        }
    }
}
