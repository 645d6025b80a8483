package xyz.vvrf.reactor.flow.core;

import reactor.core.publisher.Flux;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * 所有项同时执行的 {@link AsyncBatchNode}。
 * 并发度不设上限 (等于批次大小)；各项可能乱序完成，但交给 post 的结果始终保持输入顺序。
 */
public class AsyncParallelBatchNode<I, R> extends AsyncBatchNode<I, R> {

    public AsyncParallelBatchNode() {
        super();
    }

    public AsyncParallelBatchNode(int maxRetries, Duration wait) {
        super(maxRetries, wait);
    }

    public AsyncParallelBatchNode(RetryPolicy retryPolicy) {
        super(retryPolicy);
    }

    @Override
    protected Flux<Optional<R>> dispatch(List<I> items) {
        return Flux.range(0, items.size())
                .flatMapSequential(index -> execItemWithRetry(index, items.get(index)), Math.max(1, items.size()));
    }
}
