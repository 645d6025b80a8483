package xyz.vvrf.reactor.flow.core;

import xyz.vvrf.reactor.flow.execution.BlockingRetryExecutor;

import java.time.Duration;
import java.util.Objects;

/**
 * 带重试和回退的节点。
 * exec 最多尝试 {@code maxRetries} 次，两次尝试之间阻塞等待 {@code wait}。
 * 全部失败后调用 {@link #execFallback(Object, Exception)}；默认实现重新抛出最后一次的异常，
 * 此时节点以 {@link xyz.vvrf.reactor.flow.exception.NodeExecutionException} 失败，post 不执行。
 */
public class Node<P, E> extends BaseNode<P, E> {

    private RetryPolicy retryPolicy;
    private volatile int currentRetry;

    public Node() {
        this(RetryPolicy.NONE);
    }

    public Node(int maxRetries, Duration wait) {
        this(RetryPolicy.of(maxRetries, wait));
    }

    public Node(RetryPolicy retryPolicy) {
        this.retryPolicy = Objects.requireNonNull(retryPolicy, "RetryPolicy 不能为空");
    }

    public RetryPolicy getRetryPolicy() {
        return retryPolicy;
    }

    public void setRetryPolicy(RetryPolicy retryPolicy) {
        this.retryPolicy = Objects.requireNonNull(retryPolicy, "RetryPolicy 不能为空");
    }

    /**
     * @return 当前 exec 尝试的序号 (从 0 开始)
     */
    public int getCurrentRetry() {
        return currentRetry;
    }

    protected void setCurrentRetry(int currentRetry) {
        this.currentRetry = currentRetry;
    }

    /**
     * 重试用尽后的回退。返回值被当作正常的 exec 结果。
     *
     * @param lastError 最后一次尝试的异常
     */
    public E execFallback(P prepRes, Exception lastError) throws Exception {
        throw lastError;
    }

    @Override
    protected E internalExec(P prepRes) {
        return BlockingRetryExecutor.execute(getName(), retryPolicy,
                attempt -> {
                    setCurrentRetry(attempt);
                    return exec(prepRes);
                },
                lastError -> execFallback(prepRes, lastError),
                getMonitor());
    }
}
