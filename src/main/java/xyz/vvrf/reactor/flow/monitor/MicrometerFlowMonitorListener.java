package xyz.vvrf.reactor.flow.monitor;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.reactor.flow.core.Action;
import xyz.vvrf.reactor.flow.core.BaseNode;
import xyz.vvrf.reactor.flow.exception.NodeExecutionException;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

@Slf4j
public class MicrometerFlowMonitorListener implements FlowMonitorListener {

    private final MeterRegistry meterRegistry;

    // 指标名称
    public static final String METRIC_FLOW_EXECUTION_TIME = "flow.execution.time";
    public static final String METRIC_NODE_EXECUTION_TIME = "flow.node.execution.time";
    public static final String METRIC_NODE_EXECUTION_TOTAL = "flow.node.execution.total";
    public static final String METRIC_NODE_RETRY_TOTAL = "flow.node.retry.total";
    public static final String METRIC_NODE_FALLBACK_TOTAL = "flow.node.fallback.total";

    // 标签键
    private static final String TAG_FLOW_NAME = "flow.name";
    private static final String TAG_NODE_NAME = "node.name";
    private static final String TAG_STATUS = "status";
    private static final String TAG_ERROR = "error";
    private static final String TAG_ACTION = "action";

    // 状态标签值
    static final String STATUS_SUCCESS = "SUCCESS";
    static final String STATUS_FAILURE = "FAILURE";
    static final String STATUS_EXHAUSTED = "EXHAUSTED";

    public MicrometerFlowMonitorListener(MeterRegistry meterRegistry) {
        this.meterRegistry = Objects.requireNonNull(meterRegistry, "MeterRegistry 不能为空");
    }

    @Override
    public void onFlowStart(String requestId, String flowName, BaseNode<?, ?> flow) {
        // 计时器在结束时记录
    }

    @Override
    public void onFlowComplete(String requestId, String flowName, Duration totalDuration, Action terminalAction, Throwable error) {
        Tags tags = Tags.of(
                Tag.of(TAG_FLOW_NAME, flowName),
                Tag.of(TAG_STATUS, error == null ? STATUS_SUCCESS : STATUS_FAILURE)
        );
        recordTimer(METRIC_FLOW_EXECUTION_TIME, "流程总执行时间", tags, totalDuration);
    }

    @Override
    public void onNodeStart(String requestId, String flowName, String nodeName, BaseNode<?, ?> node) {
    }

    @Override
    public void onNodeSuccess(String requestId, String flowName, String nodeName, Duration duration, Action action) {
        Tags tags = Tags.of(
                Tag.of(TAG_FLOW_NAME, flowName),
                Tag.of(TAG_NODE_NAME, nodeName),
                Tag.of(TAG_STATUS, STATUS_SUCCESS),
                Tag.of(TAG_ACTION, Action.labelOf(action))
        );
        recordTimer(METRIC_NODE_EXECUTION_TIME, "流程节点执行时间", tags, duration);
        incrementCounter(METRIC_NODE_EXECUTION_TOTAL, "按状态统计的流程节点执行总数", tags);
    }

    @Override
    public void onNodeFailure(String requestId, String flowName, String nodeName, Duration duration, Throwable error) {
        String errorTagValue = error != null ? error.getClass().getSimpleName() : "Unknown";
        // 区分 exec 用尽重试与 prep/post 直接失败
        String status = (error instanceof NodeExecutionException) ? STATUS_EXHAUSTED : STATUS_FAILURE;

        Tags tags = Tags.of(
                Tag.of(TAG_FLOW_NAME, flowName),
                Tag.of(TAG_NODE_NAME, nodeName),
                Tag.of(TAG_STATUS, status),
                Tag.of(TAG_ERROR, errorTagValue)
        );
        recordTimer(METRIC_NODE_EXECUTION_TIME, "流程节点执行时间", tags, duration);
        incrementCounter(METRIC_NODE_EXECUTION_TOTAL, "按状态统计的流程节点执行总数", tags);
    }

    @Override
    public void onNodeRetry(String requestId, String flowName, String nodeName, int attempt, Throwable error) {
        Tags tags = Tags.of(
                Tag.of(TAG_FLOW_NAME, flowName),
                Tag.of(TAG_NODE_NAME, nodeName)
        );
        incrementCounter(METRIC_NODE_RETRY_TOTAL, "流程节点 exec 重试次数", tags);
    }

    @Override
    public void onNodeFallback(String requestId, String flowName, String nodeName, Throwable error) {
        Tags tags = Tags.of(
                Tag.of(TAG_FLOW_NAME, flowName),
                Tag.of(TAG_NODE_NAME, nodeName)
        );
        incrementCounter(METRIC_NODE_FALLBACK_TOTAL, "流程节点使用回退结果的次数", tags);
        log.debug("Micrometer 监听器捕获到节点 {} 的回退事件", nodeName);
    }

    private void recordTimer(String name, String description, Tags tags, Duration duration) {
        try {
            Timer timer = Timer.builder(name)
                    .tags(tags)
                    .description(description)
                    .register(meterRegistry);
            timer.record(duration.toNanos(), TimeUnit.NANOSECONDS);
        } catch (Exception e) {
            log.error("记录计时器指标失败: {}", e.getMessage(), e);
        }
    }

    private void incrementCounter(String name, String description, Tags tags) {
        try {
            Counter counter = Counter.builder(name)
                    .tags(tags)
                    .description(description)
                    .register(meterRegistry);
            counter.increment();
        } catch (Exception e) {
            log.error("增加计数器指标失败: {}", e.getMessage(), e);
        }
    }
}
