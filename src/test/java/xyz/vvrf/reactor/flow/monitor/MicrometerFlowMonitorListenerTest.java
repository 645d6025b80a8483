package xyz.vvrf.reactor.flow.monitor;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import xyz.vvrf.reactor.flow.core.Action;
import xyz.vvrf.reactor.flow.exception.NodeExecutionException;

import java.time.Duration;

class MicrometerFlowMonitorListenerTest {

    private SimpleMeterRegistry registry;
    private MicrometerFlowMonitorListener listener;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        listener = new MicrometerFlowMonitorListener(registry);
    }

    @Test
    void testOnNodeSuccess_ShouldRecordTimerAndCounterWithActionTag() {
        listener.onNodeSuccess("r", "flow", "node", Duration.ofMillis(30), Action.of("approve"));

        Assertions.assertEquals(1L, registry.get(MicrometerFlowMonitorListener.METRIC_NODE_EXECUTION_TIME)
                .tags("node.name", "node", "status", "SUCCESS", "action", "approve").timer().count());
        Assertions.assertEquals(1.0, registry.get(MicrometerFlowMonitorListener.METRIC_NODE_EXECUTION_TOTAL)
                .tags("flow.name", "flow", "status", "SUCCESS").counter().count());
    }

    @Test
    void testOnNodeFailure_ShouldDistinguishExhaustedRetriesFromOtherFailures() {
        listener.onNodeFailure("r", "flow", "a", Duration.ZERO,
                new NodeExecutionException("a", 3, new IllegalStateException("x")));
        listener.onNodeFailure("r", "flow", "b", Duration.ZERO, new IllegalArgumentException("prep"));

        Assertions.assertEquals(1.0, registry.get(MicrometerFlowMonitorListener.METRIC_NODE_EXECUTION_TOTAL)
                .tags("node.name", "a", "status", "EXHAUSTED", "error", "NodeExecutionException").counter().count());
        Assertions.assertEquals(1.0, registry.get(MicrometerFlowMonitorListener.METRIC_NODE_EXECUTION_TOTAL)
                .tags("node.name", "b", "status", "FAILURE", "error", "IllegalArgumentException").counter().count());
    }

    @Test
    void testRetryAndFallback_ShouldIncrementCounters() {
        listener.onNodeRetry("r", "flow", "n", 1, new RuntimeException());
        listener.onNodeRetry("r", "flow", "n", 2, new RuntimeException());
        listener.onNodeFallback("r", "flow", "n", new RuntimeException());

        Assertions.assertEquals(2.0, registry.get(MicrometerFlowMonitorListener.METRIC_NODE_RETRY_TOTAL)
                .tag("node.name", "n").counter().count());
        Assertions.assertEquals(1.0, registry.get(MicrometerFlowMonitorListener.METRIC_NODE_FALLBACK_TOTAL)
                .tag("node.name", "n").counter().count());
    }

    @Test
    void testOnFlowComplete_ShouldTagFailureStatus() {
        listener.onFlowComplete("r", "flow", Duration.ofMillis(5), null, new IllegalStateException());

        Assertions.assertEquals(1L, registry.get(MicrometerFlowMonitorListener.METRIC_FLOW_EXECUTION_TIME)
                .tags("flow.name", "flow", "status", "FAILURE").timer().count());
    }
}
