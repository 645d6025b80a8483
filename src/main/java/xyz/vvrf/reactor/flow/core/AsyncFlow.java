package xyz.vvrf.reactor.flow.core;

import reactor.core.publisher.Mono;

import java.util.Map;
import java.util.Optional;

/**
 * 异步流程：遍历可以同时包含同步节点和 {@link AsyncExecutable} 节点 (包括嵌套的异步流程)。
 * 同步的 {@link #run(SharedStore)} 不可用，请使用 {@link #runAsync(SharedStore)}。
 */
public class AsyncFlow extends AbstractFlow<Map<String, Object>, Action> implements AsyncExecutable {

    public AsyncFlow() {
        super();
    }

    public AsyncFlow(BaseNode<?, ?> startNode) {
        super(startNode);
    }

    @Override
    public Map<String, Object> prep(SharedStore shared) {
        return getParams();
    }

    @Override
    public Action post(SharedStore shared, Map<String, Object> prepRes, Action execRes) {
        return execRes;
    }

    public Mono<Map<String, Object>> prepAsync(SharedStore shared) {
        return Mono.fromSupplier(() -> prep(shared));
    }

    public Mono<Action> postAsync(SharedStore shared, Map<String, Object> prepRes, Action execRes) {
        return Mono.fromSupplier(() -> post(shared, prepRes, execRes));
    }

    @Override
    public Mono<Action> internalRunAsync(SharedStore shared) {
        return Mono.defer(() -> prepAsync(shared))
                .map(Optional::ofNullable)
                .defaultIfEmpty(Optional.empty())
                .flatMap(prepRes -> orchestrateAsync(shared, mergeParams(prepRes.orElse(null)))
                        .flatMap(terminal -> postAsync(shared, prepRes.orElse(null), terminal)))
                .defaultIfEmpty(Action.DEFAULT)
                .map(Action::normalize);
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
