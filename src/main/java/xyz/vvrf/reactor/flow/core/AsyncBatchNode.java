package xyz.vvrf.reactor.flow.core;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import xyz.vvrf.reactor.flow.execution.ReactiveRetryExecutor;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * {@link BatchNode} 的异步版本：逐项依次执行 {@link #execItemAsync(Object)}，每项单独重试。
 */
public class AsyncBatchNode<I, R> extends AsyncNode<List<I>, List<R>> {

    public AsyncBatchNode() {
        super();
    }

    public AsyncBatchNode(int maxRetries, Duration wait) {
        super(maxRetries, wait);
    }

    public AsyncBatchNode(RetryPolicy retryPolicy) {
        super(retryPolicy);
    }

    public Mono<R> execItemAsync(I item) {
        return Mono.empty();
    }

    public Mono<R> execItemFallbackAsync(I item, Exception lastError) {
        return Mono.error(lastError);
    }

    @Override
    public final Mono<List<R>> execAsync(List<I> items) {
        return Mono.error(new UnsupportedOperationException(
                "AsyncBatchNode '" + getName() + "' 不支持 execAsync，请实现 execItemAsync"));
    }

    @Override
    protected Mono<List<R>> internalExecAsync(List<I> items) {
        if (items == null || items.isEmpty()) {
            return Mono.fromSupplier(ArrayList::new);
        }
        return dispatch(items)
                .collectList()
                .map(results -> {
                    List<R> unwrapped = new ArrayList<>(results.size());
                    for (Optional<R> result : results) {
                        unwrapped.add(result.orElse(null));
                    }
                    return unwrapped;
                });
    }

    /**
     * 按输入顺序发出每一项的结果。
     */
    protected Flux<Optional<R>> dispatch(List<I> items) {
        return Flux.range(0, items.size())
                .concatMap(index -> execItemWithRetry(index, items.get(index)));
    }

    protected final Mono<Optional<R>> execItemWithRetry(int index, I item) {
        return ReactiveRetryExecutor.execute(getName() + "[" + index + "]", getRetryPolicy(),
                        attempt -> {
                            setCurrentRetry(attempt);
                            return execItemAsync(item);
                        },
                        lastError -> execItemFallbackAsync(item, lastError),
                        getMonitor())
                .map(Optional::ofNullable)
                .defaultIfEmpty(Optional.empty());
    }
}
