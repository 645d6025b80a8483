package xyz.vvrf.reactor.flow.core;

import xyz.vvrf.reactor.flow.execution.BlockingRetryExecutor;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * 对 prep 返回的每一项依次执行 {@link #execItem(Object)}，每一项单独应用重试和回退。
 * 结果按输入顺序交给 post；任何一项最终失败都会中止整个批次。
 *
 * @param <I> 单项输入类型
 * @param <R> 单项结果类型
 */
public class BatchNode<I, R> extends Node<List<I>, List<R>> {

    public BatchNode() {
        super();
    }

    public BatchNode(int maxRetries, Duration wait) {
        super(maxRetries, wait);
    }

    public BatchNode(RetryPolicy retryPolicy) {
        super(retryPolicy);
    }

    public R execItem(I item) throws Exception {
        return null;
    }

    public R execItemFallback(I item, Exception lastError) throws Exception {
        throw lastError;
    }

    /**
     * 批处理节点按项执行，请覆盖 {@link #execItem(Object)}。
     */
    @Override
    public final List<R> exec(List<I> items) {
        throw new UnsupportedOperationException("BatchNode '" + getName() + "' 不支持 exec，请实现 execItem");
    }

    @Override
    protected List<R> internalExec(List<I> items) {
        List<R> results = new ArrayList<>(items == null ? 0 : items.size());
        if (items == null) {
            return results;
        }
        for (int i = 0; i < items.size(); i++) {
            I item = items.get(i);
            results.add(BlockingRetryExecutor.execute(getName() + "[" + i + "]", getRetryPolicy(),
                    attempt -> {
                        setCurrentRetry(attempt);
                        return execItem(item);
                    },
                    lastError -> execItemFallback(item, lastError),
                    getMonitor()));
        }
        return results;
    }
}
