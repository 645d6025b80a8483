package xyz.vvrf.reactor.flow.core;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import xyz.vvrf.reactor.flow.exception.FlowConfigurationException;

import java.time.Duration;

/**
 * exec 阶段的重试策略 (不可变)。
 * 同一份策略同时被阻塞式执行器 ({@link xyz.vvrf.reactor.flow.execution.BlockingRetryExecutor})
 * 和 Reactor 执行器 ({@link xyz.vvrf.reactor.flow.execution.ReactiveRetryExecutor}) 消费。
 */
@Getter
@EqualsAndHashCode
public final class RetryPolicy {

    /** 只尝试一次，不等待 */
    public static final RetryPolicy NONE = new RetryPolicy(1, Duration.ZERO);

    /**
     * 总尝试次数 (>= 1)，1 表示不重试。
     */
    private final int maxRetries;

    /**
     * 两次尝试之间的固定等待时间 (>= 0)。
     */
    private final Duration wait;

    private RetryPolicy(int maxRetries, Duration wait) {
        this.maxRetries = maxRetries;
        this.wait = wait;
    }

    /**
     * @throws FlowConfigurationException 如果 maxRetries < 1 或 wait 为空/负数
     */
    public static RetryPolicy of(int maxRetries, Duration wait) {
        if (maxRetries < 1) {
            throw new FlowConfigurationException("maxRetries 必须 >= 1，实际为: " + maxRetries);
        }
        if (wait == null || wait.isNegative()) {
            throw new FlowConfigurationException("wait 不能为空或负数，实际为: " + wait);
        }
        return new RetryPolicy(maxRetries, wait);
    }

    public static RetryPolicy of(int maxRetries) {
        return of(maxRetries, Duration.ZERO);
    }

    /**
     * @param waitSeconds 等待秒数，允许小数
     */
    public static RetryPolicy ofSeconds(int maxRetries, double waitSeconds) {
        if (Double.isNaN(waitSeconds) || waitSeconds < 0) {
            throw new FlowConfigurationException("wait 不能为负数，实际为: " + waitSeconds);
        }
        return of(maxRetries, Duration.ofNanos(Math.round(waitSeconds * 1_000_000_000d)));
    }

    public boolean hasWait() {
        return !wait.isZero();
    }

    @Override
    public String toString() {
        return "RetryPolicy{maxRetries=" + maxRetries + ", wait=" + wait + '}';
    }
}
