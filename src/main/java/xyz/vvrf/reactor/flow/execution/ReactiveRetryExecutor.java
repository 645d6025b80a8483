package xyz.vvrf.reactor.flow.execution;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;
import xyz.vvrf.reactor.flow.core.RetryPolicy;
import xyz.vvrf.reactor.flow.exception.NodeExecutionException;
import xyz.vvrf.reactor.flow.monitor.FlowMonitor;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import java.util.function.IntFunction;

/**
 * {@link BlockingRetryExecutor} 的 Reactor 版本：重试等待通过 {@link Retry#fixedDelay} 挂起，不阻塞线程。
 * 只有 {@link Exception} 会触发重试和回退，{@link Error} 原样传播。
 * 最终失败总是包装为带当前节点名称的 {@link NodeExecutionException}，与阻塞版本一致。
 */
@Slf4j
public final class ReactiveRetryExecutor {

    private ReactiveRetryExecutor() {
    }

    /**
     * @param attempt  根据尝试序号 (从 0 开始) 创建一次尝试
     * @param recovery 重试用尽后的回退，返回 {@code Mono.error(lastError)} 表示没有回退
     * @return 成功结果或回退结果；失败时发出 {@link NodeExecutionException}
     */
    public static <T> Mono<T> execute(String nodeName,
                                      RetryPolicy policy,
                                      IntFunction<Mono<T>> attempt,
                                      Function<Exception, Mono<T>> recovery,
                                      FlowMonitor monitor) {
        Objects.requireNonNull(policy, "RetryPolicy 不能为空");
        Objects.requireNonNull(attempt, "Attempt 不能为空");
        Objects.requireNonNull(recovery, "Recovery 不能为空");
        FlowMonitor m = monitor != null ? monitor : FlowMonitor.NOOP;
        int maxRetries = policy.getMaxRetries();

        return Mono.defer(() -> {
            AtomicInteger counter = new AtomicInteger();
            Mono<T> singleAttempt = Mono.defer(() -> {
                int current = counter.getAndIncrement();
                log.trace("[RequestId: {}][Flow: {}] 节点 '{}' 第 {}/{} 次尝试 (异步)",
                        m.getRequestId(), m.getFlowName(), nodeName, current + 1, maxRetries);
                return attempt.apply(current);
            });

            return singleAttempt
                    .retryWhen(buildRetry(nodeName, policy, m))
                    .onErrorResume(Exception.class, lastError -> Mono.defer(() -> recovery.apply(lastError))
                            .doOnSuccess(v -> {
                                log.warn("[RequestId: {}][Flow: {}] 节点 '{}' 重试 {} 次后失败，使用回退结果",
                                        m.getRequestId(), m.getFlowName(), nodeName, maxRetries);
                                m.nodeFallback(nodeName, lastError);
                            }))
                    .onErrorMap(Exception.class::isInstance,
                            e -> {
                                log.error("[RequestId: {}][Flow: {}] 节点 '{}' 在 {} 次尝试后最终失败: {}",
                                        m.getRequestId(), m.getFlowName(), nodeName, maxRetries, e.getMessage());
                                return new NodeExecutionException(nodeName, maxRetries, e);
                            });
        });
    }

    private static Retry buildRetry(String nodeName, RetryPolicy policy, FlowMonitor m) {
        long retries = policy.getMaxRetries() - 1L;
        if (policy.hasWait()) {
            return Retry.fixedDelay(retries, policy.getWait())
                    .filter(Exception.class::isInstance)
                    .doBeforeRetry(signal -> onRetry(nodeName, policy, m, signal))
                    .onRetryExhaustedThrow((retry, signal) -> signal.failure());
        }
        return Retry.max(retries)
                .filter(Exception.class::isInstance)
                .doBeforeRetry(signal -> onRetry(nodeName, policy, m, signal))
                .onRetryExhaustedThrow((retry, signal) -> signal.failure());
    }

    private static void onRetry(String nodeName, RetryPolicy policy, FlowMonitor m, Retry.RetrySignal signal) {
        int failedAttempt = (int) signal.totalRetries() + 1;
        log.warn("[RequestId: {}][Flow: {}] 节点 '{}' 第 {}/{} 次尝试失败，{} 后重试: {}",
                m.getRequestId(), m.getFlowName(), nodeName, failedAttempt, policy.getMaxRetries(),
                policy.getWait(), signal.failure().getMessage());
        m.nodeRetry(nodeName, failedAttempt, signal.failure());
    }
}
