package xyz.vvrf.reactor.flow.core;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import xyz.vvrf.reactor.flow.exception.FlowConfigurationException;
import xyz.vvrf.reactor.flow.monitor.FlowMonitor;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 流程的公共部分：起始节点、图遍历 (同步与异步) 和参数合并。
 * 流程本身也是节点，可以作为另一个流程的后继或起始节点。
 * <p>
 * 遍历规则：从起始节点开始，执行节点的完整生命周期，按返回动作的标签在该节点的后继表中查找下一个节点；
 * 找不到时停止，并返回最后的动作。
 */
@Slf4j
public abstract class AbstractFlow<P, E> extends BaseNode<P, E> {

    private BaseNode<?, ?> startNode;

    protected AbstractFlow() {
    }

    protected AbstractFlow(BaseNode<?, ?> startNode) {
        this.startNode = startNode;
    }

    /**
     * 设置起始节点。
     *
     * @return 起始节点，便于继续构建边
     */
    public <N extends BaseNode<?, ?>> N start(N node) {
        this.startNode = Objects.requireNonNull(node, "起始节点不能为空");
        return node;
    }

    public BaseNode<?, ?> getStartNode() {
        return startNode;
    }

    protected BaseNode<?, ?> requireStartNode() {
        if (startNode == null) {
            throw new FlowConfigurationException("流程 '" + getName() + "' 未设置起始节点");
        }
        return startNode;
    }

    /**
     * 流程不直接执行 exec，遍历在 {@link #internalRun(SharedStore)} 中完成。
     */
    @Override
    public E exec(P prepRes) {
        throw new UnsupportedOperationException("流程 '" + getName() + "' 不能直接调用 exec");
    }

    protected BaseNode<?, ?> getNextNode(BaseNode<?, ?> current, Action action) {
        BaseNode<?, ?> next = current.getSuccessor(action);
        if (next == null && !current.getSuccessors().isEmpty()) {
            FlowMonitor m = getMonitor();
            log.warn("[RequestId: {}][Flow: {}] 流程结束: 节点 '{}' 返回的动作 '{}' 不在其后继 {} 中",
                    m.getRequestId(), getName(), current.getName(), Action.labelOf(action), current.getSuccessors().keySet());
        }
        return next;
    }

    /**
     * @return 流程参数与覆盖参数的合并结果，覆盖参数优先
     */
    protected Map<String, Object> mergeParams(Map<String, Object> overrides) {
        Map<String, Object> merged = new LinkedHashMap<>(getParams());
        if (overrides != null) {
            merged.putAll(overrides);
        }
        return merged;
    }

    /**
     * 为一步遍历准备节点副本：设置参数并传递监控器。
     */
    protected BaseNode<?, ?> prepareStep(BaseNode<?, ?> node, Map<String, Object> params) {
        BaseNode<?, ?> step = node.copy();
        step.setParams(params);
        step.setMonitor(getMonitor());
        return step;
    }

    /**
     * 同步遍历。
     *
     * @return 最后一个节点返回的动作，不为 null
     */
    protected Action orchestrate(SharedStore shared, Map<String, Object> params) {
        BaseNode<?, ?> current = requireStartNode();
        Action last = Action.DEFAULT;
        while (current != null) {
            BaseNode<?, ?> step = prepareStep(current, params);
            last = runStep(step, shared);
            current = getNextNode(current, last);
        }
        return last;
    }

    private Action runStep(BaseNode<?, ?> step, SharedStore shared) {
        FlowMonitor m = getMonitor();
        String nodeName = step.getName();
        Instant startTime = Instant.now();
        log.debug("[RequestId: {}][Flow: {}] 执行节点 '{}' (类: {})",
                m.getRequestId(), getName(), nodeName, step.getClass().getSimpleName());
        m.nodeStart(nodeName, step);
        try {
            Action action = step.internalRun(shared);
            m.nodeSuccess(nodeName, Duration.between(startTime, Instant.now()), action);
            log.debug("[RequestId: {}][Flow: {}] 节点 '{}' 完成，动作: '{}'",
                    m.getRequestId(), getName(), nodeName, Action.labelOf(action));
            return action;
        } catch (RuntimeException e) {
            m.nodeFailure(nodeName, Duration.between(startTime, Instant.now()), e);
            throw e;
        }
    }

    /**
     * 异步遍历。同步节点在当前线程内联执行，{@link AsyncExecutable} 节点非阻塞执行。
     * 使用 repeat 迭代，长时间的循环遍历不会增加调用栈深度。
     */
    protected Mono<Action> orchestrateAsync(SharedStore shared, Map<String, Object> params) {
        return Mono.defer(() -> {
            AtomicReference<BaseNode<?, ?>> current = new AtomicReference<>(requireStartNode());
            AtomicReference<Action> last = new AtomicReference<>(Action.DEFAULT);
            return Mono.defer(() -> {
                        BaseNode<?, ?> node = current.get();
                        return runStepAsync(prepareStep(node, params), shared)
                                .doOnNext(action -> {
                                    last.set(action);
                                    current.set(getNextNode(node, action));
                                });
                    })
                    .repeat(() -> current.get() != null)
                    .then(Mono.fromSupplier(last::get));
        });
    }

    private Mono<Action> runStepAsync(BaseNode<?, ?> step, SharedStore shared) {
        return Mono.defer(() -> {
            FlowMonitor m = getMonitor();
            String nodeName = step.getName();
            Instant startTime = Instant.now();
            log.debug("[RequestId: {}][Flow: {}] 执行节点 '{}' (类: {}, 异步: {})",
                    m.getRequestId(), getName(), nodeName, step.getClass().getSimpleName(), step instanceof AsyncExecutable);
            m.nodeStart(nodeName, step);
            Mono<Action> lifecycle = (step instanceof AsyncExecutable)
                    ? ((AsyncExecutable) step).internalRunAsync(shared)
                    : Mono.fromCallable(() -> step.internalRun(shared));
            return lifecycle
                    .defaultIfEmpty(Action.DEFAULT)
                    .map(Action::normalize)
                    .doOnNext(action -> m.nodeSuccess(nodeName, Duration.between(startTime, Instant.now()), action))
                    .doOnError(e -> m.nodeFailure(nodeName, Duration.between(startTime, Instant.now()), e));
        });
    }
}
