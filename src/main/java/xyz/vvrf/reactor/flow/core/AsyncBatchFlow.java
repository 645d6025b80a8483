package xyz.vvrf.reactor.flow.core;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * {@link BatchFlow} 的异步版本：对每组参数依次执行一次异步遍历。
 */
public class AsyncBatchFlow extends AbstractFlow<List<Map<String, Object>>, List<Action>> implements AsyncExecutable {

    public AsyncBatchFlow() {
        super();
    }

    public AsyncBatchFlow(BaseNode<?, ?> startNode) {
        super(startNode);
    }

    public Mono<List<Map<String, Object>>> prepAsync(SharedStore shared) {
        return Mono.fromSupplier(() -> prep(shared));
    }

    public Mono<Action> postAsync(SharedStore shared, List<Map<String, Object>> prepRes, List<Action> execRes) {
        return Mono.fromSupplier(() -> post(shared, prepRes, execRes));
    }

    @Override
    public Mono<Action> internalRunAsync(SharedStore shared) {
        return Mono.defer(() -> prepAsync(shared))
                .map(Optional::ofNullable)
                .defaultIfEmpty(Optional.empty())
                .flatMap(prepRes -> {
                    List<Map<String, Object>> paramSets = new ArrayList<>();
                    for (Map<String, Object> batchParams : prepRes.orElse(Collections.emptyList())) {
                        paramSets.add(mergeParams(batchParams));
                    }
                    return dispatch(shared, paramSets)
                            .collectList()
                            .flatMap(terminals -> postAsync(shared, prepRes.orElse(null), terminals));
                })
                .defaultIfEmpty(Action.DEFAULT)
                .map(Action::normalize);
    }

    /**
     * 按参数组顺序发出每次遍历的终止动作。
     *
     * @param paramSets 已与流程参数合并的参数组
     */
    protected Flux<Action> dispatch(SharedStore shared, List<Map<String, Object>> paramSets) {
        return Flux.fromIterable(paramSets)
                .concatMap(params -> orchestrateAsync(shared, params));
    }

    public Mono<Action> runAsync(SharedStore shared) {
        return Mono.defer(() -> {
            warnIfSuccessorsIgnored();
            return internalRunAsync(shared);
        });
    }

    @Override
    protected Action internalRun(SharedStore shared) {
        throw new UnsupportedOperationException("异步流程 '" + getName() + "' 不能同步运行，请使用 runAsync");
    }

    @Override
    public Action run(SharedStore shared) {
        return internalRun(shared);
    }
}
