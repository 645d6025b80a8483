package xyz.vvrf.reactor.flow.execution;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import xyz.vvrf.reactor.flow.core.Action;
import xyz.vvrf.reactor.flow.core.AsyncExecutable;
import xyz.vvrf.reactor.flow.core.BaseNode;
import xyz.vvrf.reactor.flow.core.SharedStore;
import xyz.vvrf.reactor.flow.monitor.FlowMonitor;
import xyz.vvrf.reactor.flow.monitor.FlowMonitorListener;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * FlowEngine 的标准实现。
 * 每次运行复制根节点并绑定一个 {@link FlowMonitor}，因此同一个流程定义可以被并发运行。
 */
@Slf4j
public class StandardFlowEngine implements FlowEngine {

    private final List<FlowMonitorListener> monitorListeners;

    public StandardFlowEngine(List<FlowMonitorListener> monitorListeners) {
        this.monitorListeners = (monitorListeners != null)
                ? Collections.unmodifiableList(new ArrayList<>(monitorListeners))
                : Collections.emptyList();
        log.info("StandardFlowEngine 已初始化，监听器数量: {}", this.monitorListeners.size());
    }

    public List<FlowMonitorListener> getMonitorListeners() {
        return monitorListeners;
    }

    @Override
    public Action run(BaseNode<?, ?> root, SharedStore shared, String requestId) {
        Objects.requireNonNull(root, "根节点不能为空");
        Objects.requireNonNull(shared, "SharedStore 不能为空");
        if (root instanceof AsyncExecutable) {
            throw new UnsupportedOperationException("'" + root.getName() + "' 是异步节点，请使用 runAsync");
        }
        BaseNode<?, ?> copy = prepareRoot(root, effectiveRequestId(requestId));
        FlowMonitor monitor = copy.getMonitor();
        Instant startTime = Instant.now();
        log.info("[RequestId: {}][Flow: {}] 开始执行", monitor.getRequestId(), monitor.getFlowName());
        monitor.flowStart(copy);
        try {
            Action terminal = Action.normalize(copy.run(shared));
            Duration duration = Duration.between(startTime, Instant.now());
            log.info("[RequestId: {}][Flow: {}] 执行完成，耗时 {}ms，终止动作: '{}'",
                    monitor.getRequestId(), monitor.getFlowName(), duration.toMillis(), terminal.label());
            monitor.flowComplete(duration, terminal, null);
            return terminal;
        } catch (RuntimeException e) {
            Duration duration = Duration.between(startTime, Instant.now());
            log.error("[RequestId: {}][Flow: {}] 执行失败，耗时 {}ms: {}",
                    monitor.getRequestId(), monitor.getFlowName(), duration.toMillis(), e.getMessage(), e);
            monitor.flowComplete(duration, null, e);
            throw e;
        }
    }

    @Override
    public Mono<Action> runAsync(BaseNode<?, ?> root, SharedStore shared, String requestId) {
        Objects.requireNonNull(root, "根节点不能为空");
        Objects.requireNonNull(shared, "SharedStore 不能为空");
        return Mono.defer(() -> {
            BaseNode<?, ?> copy = prepareRoot(root, effectiveRequestId(requestId));
            FlowMonitor monitor = copy.getMonitor();
            Instant startTime = Instant.now();
            log.info("[RequestId: {}][Flow: {}] 开始异步执行", monitor.getRequestId(), monitor.getFlowName());
            monitor.flowStart(copy);

            Mono<Action> execution = (copy instanceof AsyncExecutable)
                    ? ((AsyncExecutable) copy).internalRunAsync(shared)
                    : Mono.fromCallable(() -> copy.run(shared));
            return execution
                    .defaultIfEmpty(Action.DEFAULT)
                    .map(Action::normalize)
                    .doOnNext(terminal -> {
                        Duration duration = Duration.between(startTime, Instant.now());
                        log.info("[RequestId: {}][Flow: {}] 异步执行完成，耗时 {}ms，终止动作: '{}'",
                                monitor.getRequestId(), monitor.getFlowName(), duration.toMillis(), terminal.label());
                        monitor.flowComplete(duration, terminal, null);
                    })
                    .doOnError(e -> {
                        Duration duration = Duration.between(startTime, Instant.now());
                        log.error("[RequestId: {}][Flow: {}] 异步执行失败，耗时 {}ms: {}",
                                monitor.getRequestId(), monitor.getFlowName(), duration.toMillis(), e.getMessage(), e);
                        monitor.flowComplete(duration, null, e);
                    });
        });
    }

    private BaseNode<?, ?> prepareRoot(BaseNode<?, ?> root, String requestId) {
        BaseNode<?, ?> copy = root.copy();
        copy.setMonitor(new FlowMonitor(requestId, root.getName(), monitorListeners));
        return copy;
    }

    private static String effectiveRequestId(String requestId) {
        return (requestId == null || requestId.trim().isEmpty()) ? FlowEngine.generateRequestId() : requestId;
    }
}
