package xyz.vvrf.reactor.flow.core;

import reactor.core.publisher.Mono;
import xyz.vvrf.reactor.flow.execution.ReactiveRetryExecutor;

import java.time.Duration;
import java.util.Optional;

/**
 * 阶段返回 {@link Mono} 的节点。重试等待是非阻塞的挂起。
 * <p>
 * 默认的 {@code prepAsync}/{@code execAsync}/{@code execFallbackAsync}/{@code postAsync}
 * 委托给对应的同步方法，因此只需要覆盖真正需要异步的阶段。
 * 同步的 {@link #run(SharedStore)} 不可用，请使用 {@link #runAsync(SharedStore)}。
 */
public class AsyncNode<P, E> extends Node<P, E> implements AsyncExecutable {

    public AsyncNode() {
        super();
    }

    public AsyncNode(int maxRetries, Duration wait) {
        super(maxRetries, wait);
    }

    public AsyncNode(RetryPolicy retryPolicy) {
        super(retryPolicy);
    }

    public Mono<P> prepAsync(SharedStore shared) {
        return Mono.fromSupplier(() -> prep(shared));
    }

    public Mono<E> execAsync(P prepRes) {
        return Mono.fromCallable(() -> exec(prepRes));
    }

    public Mono<E> execFallbackAsync(P prepRes, Exception lastError) {
        return Mono.fromCallable(() -> execFallback(prepRes, lastError));
    }

    public Mono<Action> postAsync(SharedStore shared, P prepRes, E execRes) {
        return Mono.fromSupplier(() -> post(shared, prepRes, execRes));
    }

    protected Mono<E> internalExecAsync(P prepRes) {
        return ReactiveRetryExecutor.execute(getName(), getRetryPolicy(),
                attempt -> {
                    setCurrentRetry(attempt);
                    return execAsync(prepRes);
                },
                lastError -> execFallbackAsync(prepRes, lastError),
                getMonitor());
    }

    @Override
    public Mono<Action> internalRunAsync(SharedStore shared) {
        // Mono 不能携带 null，prep/exec 的 null 结果用 Optional 传递
        return Mono.defer(() -> prepAsync(shared))
                .map(Optional::ofNullable)
                .defaultIfEmpty(Optional.empty())
                .flatMap(prepRes -> internalExecAsync(prepRes.orElse(null))
                        .map(Optional::ofNullable)
                        .defaultIfEmpty(Optional.empty())
                        .flatMap(execRes -> postAsync(shared, prepRes.orElse(null), execRes.orElse(null))))
                .defaultIfEmpty(Action.DEFAULT)
                .map(Action::normalize);
    }

    /**
     * 单独异步运行该节点。存在后继时只记录警告，不会沿后继继续执行。
     */
    public Mono<Action> runAsync(SharedStore shared) {
        return Mono.defer(() -> {
            warnIfSuccessorsIgnored();
            return internalRunAsync(shared);
        });
    }

    @Override
    protected Action internalRun(SharedStore shared) {
        throw new UnsupportedOperationException("异步节点 '" + getName() + "' 不能同步运行，请使用 runAsync 或 AsyncFlow");
    }

    @Override
    public Action run(SharedStore shared) {
        return internalRun(shared);
    }
}
