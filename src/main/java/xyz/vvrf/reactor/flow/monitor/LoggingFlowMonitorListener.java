package xyz.vvrf.reactor.flow.monitor;

import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.reactor.flow.core.Action;
import xyz.vvrf.reactor.flow.core.BaseNode;

import java.time.Duration;

@Slf4j
public class LoggingFlowMonitorListener implements FlowMonitorListener {

    @Override
    public void onFlowStart(String requestId, String flowName, BaseNode<?, ?> flow) {
        log.info("[MONITOR] 请求:[{}] 流程:[{}] 开始。 类:[{}]",
                requestId, flowName, flow.getClass().getSimpleName());
    }

    @Override
    public void onFlowComplete(String requestId, String flowName, Duration totalDuration, Action terminalAction, Throwable error) {
        if (error == null) {
            log.info("[MONITOR] 请求:[{}] 流程:[{}] 完成。 耗时:[{}ms], 终止动作:[{}]",
                    requestId, flowName, totalDuration.toMillis(), Action.labelOf(terminalAction));
        } else {
            log.error("[MONITOR] 请求:[{}] 流程:[{}] 失败。 耗时:[{}ms], 错误:[{}]",
                    requestId, flowName, totalDuration.toMillis(), error.getMessage());
        }
    }

    @Override
    public void onNodeStart(String requestId, String flowName, String nodeName, BaseNode<?, ?> node) {
        log.info("[MONITOR] 请求:[{}] 流程:[{}] 节点:[{}] 开始。 类:[{}]",
                requestId, flowName, nodeName, node.getClass().getSimpleName());
    }

    @Override
    public void onNodeSuccess(String requestId, String flowName, String nodeName, Duration duration, Action action) {
        log.info("[MONITOR] 请求:[{}] 流程:[{}] 节点:[{}] 成功。 耗时:[{}ms], 动作:[{}]",
                requestId, flowName, nodeName, duration.toMillis(), Action.labelOf(action));
    }

    @Override
    public void onNodeFailure(String requestId, String flowName, String nodeName, Duration duration, Throwable error) {
        log.error("[MONITOR] 请求:[{}] 流程:[{}] 节点:[{}] 失败。 耗时:[{}ms], 错误:[{}]",
                requestId, flowName, nodeName, duration.toMillis(), error.getMessage(), error);
    }

    @Override
    public void onNodeRetry(String requestId, String flowName, String nodeName, int attempt, Throwable error) {
        log.warn("[MONITOR] 请求:[{}] 流程:[{}] 节点:[{}] 第 {} 次尝试失败，准备重试。 错误:[{}]",
                requestId, flowName, nodeName, attempt, error.getMessage());
    }

    @Override
    public void onNodeFallback(String requestId, String flowName, String nodeName, Throwable error) {
        log.warn("[MONITOR] 请求:[{}] 流程:[{}] 节点:[{}] 重试用尽，已使用回退结果。 最后错误:[{}]",
                requestId, flowName, nodeName, error.getMessage());
    }
}
