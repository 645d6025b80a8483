package xyz.vvrf.reactor.flow.core;

import reactor.core.publisher.Flux;

import java.util.List;
import java.util.Map;

/**
 * 各组参数同时遍历的 {@link AsyncBatchFlow}，并发度不设上限，终止动作按参数组顺序收集。
 * <p>
 * 所有遍历共享同一个 {@link SharedStore}，引擎不做隔离：并发分支应写入互不相同的键。
 */
public class AsyncParallelBatchFlow extends AsyncBatchFlow {

    public AsyncParallelBatchFlow() {
        super();
    }

    public AsyncParallelBatchFlow(BaseNode<?, ?> startNode) {
        super(startNode);
    }

    @Override
    protected Flux<Action> dispatch(SharedStore shared, List<Map<String, Object>> paramSets) {
        return Flux.fromIterable(paramSets)
                .flatMapSequential(params -> orchestrateAsync(shared, params), Math.max(1, paramSets.size()));
    }
}
