package xyz.vvrf.reactor.flow.monitor;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.reactor.flow.core.Action;
import xyz.vvrf.reactor.flow.core.BaseNode;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * 一次运行的监控通知器：绑定请求 ID、流程名称和监听器列表。
 * 由 {@link xyz.vvrf.reactor.flow.execution.FlowEngine} 在运行开始时创建，
 * 随节点副本在整个图 (包括嵌套流程) 中传递。
 */
@Slf4j
@Getter
public final class FlowMonitor {

    /** 不通知任何监听器 */
    public static final FlowMonitor NOOP = new FlowMonitor("-", "-", Collections.emptyList());

    private final String requestId;
    private final String flowName;
    private final List<FlowMonitorListener> listeners;

    public FlowMonitor(String requestId, String flowName, List<FlowMonitorListener> listeners) {
        this.requestId = Objects.requireNonNull(requestId, "请求 ID 不能为空");
        this.flowName = Objects.requireNonNull(flowName, "流程名称不能为空");
        this.listeners = (listeners != null) ? Collections.unmodifiableList(new ArrayList<>(listeners)) : Collections.emptyList();
    }

    public boolean isActive() {
        return !listeners.isEmpty();
    }

    public void flowStart(BaseNode<?, ?> flow) {
        safeNotifyListeners(l -> l.onFlowStart(requestId, flowName, flow));
    }

    public void flowComplete(Duration totalDuration, Action terminalAction, Throwable error) {
        safeNotifyListeners(l -> l.onFlowComplete(requestId, flowName, totalDuration, terminalAction, error));
    }

    public void nodeStart(String nodeName, BaseNode<?, ?> node) {
        safeNotifyListeners(l -> l.onNodeStart(requestId, flowName, nodeName, node));
    }

    public void nodeSuccess(String nodeName, Duration duration, Action action) {
        safeNotifyListeners(l -> l.onNodeSuccess(requestId, flowName, nodeName, duration, action));
    }

    public void nodeFailure(String nodeName, Duration duration, Throwable error) {
        safeNotifyListeners(l -> l.onNodeFailure(requestId, flowName, nodeName, duration, error));
    }

    public void nodeRetry(String nodeName, int attempt, Throwable error) {
        safeNotifyListeners(l -> l.onNodeRetry(requestId, flowName, nodeName, attempt, error));
    }

    public void nodeFallback(String nodeName, Throwable error) {
        safeNotifyListeners(l -> l.onNodeFallback(requestId, flowName, nodeName, error));
    }

    private void safeNotifyListeners(Consumer<FlowMonitorListener> notification) {
        if (listeners.isEmpty()) {
            return;
        }
        for (FlowMonitorListener listener : listeners) {
            try {
                notification.accept(listener);
            } catch (Exception e) {
                log.error("流程监控监听器 {} 在通知期间抛出异常: {}", listener.getClass().getName(), e.getMessage(), e);
            }
        }
    }
}
