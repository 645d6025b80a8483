package xyz.vvrf.reactor.flow.core;

import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;
import xyz.vvrf.reactor.flow.exception.FlowConfigurationException;
import xyz.vvrf.reactor.flow.test.util.TestNode;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

@Slf4j
class AsyncFlowTest {

    /**
     * 把参数中的 key 对应的值延迟写入共享存储。
     */
    private static AsyncNode<Object, Object> delayedWriter(String name, String key, Duration delay, String action) {
        AsyncNode<Object, Object> node = new AsyncNode<Object, Object>() {
            @Override
            public Mono<Object> execAsync(Object prepRes) {
                return Mono.just((Object) name).delayElement(delay);
            }

            @Override
            public Action post(SharedStore shared, Object prepRes, Object execRes) {
                shared.put(key, execRes);
                return action == null ? Action.DEFAULT : Action.of(action);
            }
        };
        node.setName(name);
        return node;
    }

    @Test
    void testRunAsync_WhenMixingSyncAndAsyncNodes_ShouldFollowActions() {
        // Given
        AsyncNode<Object, Object> fetch = delayedWriter("fetch", "fetched", Duration.ofMillis(10), "ok");
        TestNode transform = TestNode.builder("transform")
                .post((shared, p, e) -> {
                    shared.put("transformed", shared.get("fetched") + "!");
                    return Action.of("finish");
                })
                .build();
        TestNode skipped = TestNode.builder("skipped").build();
        fetch.next(transform, "ok");
        fetch.next(skipped, "error");
        AsyncFlow flow = new AsyncFlow(fetch);
        SharedStore shared = new SharedStore();

        // When & Then
        StepVerifier.create(flow.runAsync(shared))
                .assertNext(action -> Assertions.assertEquals("finish", action.label()))
                .verifyComplete();
        Assertions.assertEquals("fetch!", shared.get("transformed"));
        Assertions.assertEquals(0, skipped.getExecCount());
    }

    @Test
    void testRunAsync_WhenFlowsNested_ShouldRunInnerSyncAndAsyncFlows() {
        // Given
        Flow innerSync = new Flow(TestNode.builder("sync-step")
                .post((shared, p, e) -> {
                    shared.put("sync", true);
                    return Action.DEFAULT;
                })
                .build());
        AsyncFlow innerAsync = new AsyncFlow(delayedWriter("async-step", "async", Duration.ofMillis(5), "inner-done"));
        innerSync.next(innerAsync);
        TestNode last = TestNode.builder("last").build();
        innerAsync.next(last, "inner-done");
        AsyncFlow outer = new AsyncFlow(innerSync);
        SharedStore shared = new SharedStore();

        // When & Then
        StepVerifier.create(outer.runAsync(shared)).expectNext(Action.DEFAULT).verifyComplete();
        Assertions.assertEquals(Boolean.TRUE, shared.get("sync"));
        Assertions.assertEquals("async-step", shared.get("async"));
        Assertions.assertEquals(1, last.getExecCount());
    }

    @Test
    void testRunAsync_WhenLoopIsLong_ShouldNotOverflowStack() {
        // Given
        AsyncNode<Object, Object> loop = new AsyncNode<Object, Object>() {
            @Override
            public Action post(SharedStore shared, Object prepRes, Object execRes) {
                int n = shared.getOrDefault("n", Integer.class, 0) + 1;
                shared.put("n", n);
                return n < 5000 ? Action.of("again") : Action.of("stop");
            }
        };
        loop.next(loop, "again");
        SharedStore shared = new SharedStore();

        // When & Then
        StepVerifier.create(new AsyncFlow(loop).runAsync(shared))
                .assertNext(action -> Assertions.assertEquals("stop", action.label()))
                .verifyComplete();
        Assertions.assertEquals(5000, shared.get("n"));
    }

    @Test
    void testRunAsync_WhenNoStartNode_ShouldErrorWithConfigurationException() {
        StepVerifier.create(new AsyncFlow().runAsync(new SharedStore()))
                .expectError(FlowConfigurationException.class)
                .verify();
    }

    @Test
    void testRun_OnAsyncFlow_ShouldBeUnsupported() {
        Assertions.assertThrows(UnsupportedOperationException.class, () -> new AsyncFlow().run(new SharedStore()));
    }

    @Test
    void testAsyncBatchFlow_ShouldRunParameterSetsSequentially() {
        // Given
        List<Object> order = new CopyOnWriteArrayList<>();
        AsyncNode<Object, Object> step = new AsyncNode<Object, Object>() {
            @Override
            public Mono<Object> execAsync(Object prepRes) {
                String id = (String) getParams().get("id");
                long delay = ((Number) getParams().get("delay")).longValue();
                return Mono.just((Object) id).delayElement(Duration.ofMillis(delay)).doOnNext(order::add);
            }
        };
        AsyncBatchFlow flow = new AsyncBatchFlow(step) {
            @Override
            public List<Map<String, Object>> prep(SharedStore shared) {
                return List.of(Map.of("id", "slow", "delay", 60), Map.of("id", "fast", "delay", 1));
            }
        };

        // When & Then
        StepVerifier.create(flow.runAsync(new SharedStore())).expectNext(Action.DEFAULT).verifyComplete();
        Assertions.assertEquals(List.of("slow", "fast"), order);
    }

    @Test
    void testAsyncParallelBatchFlow_ShouldRunConcurrentlyAndCollectActionsInOrder() {
        // Given
        List<Object> completion = new CopyOnWriteArrayList<>();
        List<String> terminals = new CopyOnWriteArrayList<>();
        AsyncNode<Object, Object> step = new AsyncNode<Object, Object>() {
            @Override
            public Mono<Object> execAsync(Object prepRes) {
                String id = (String) getParams().get("id");
                long delay = ((Number) getParams().get("delay")).longValue();
                return Mono.just((Object) id).delayElement(Duration.ofMillis(delay)).doOnNext(completion::add);
            }

            @Override
            public Action post(SharedStore shared, Object prepRes, Object execRes) {
                // 每个分支写入不同的键
                shared.put("result-" + execRes, getParams().get("region"));
                return Action.of("end-" + execRes);
            }
        };
        AsyncParallelBatchFlow flow = new AsyncParallelBatchFlow(step) {
            @Override
            public List<Map<String, Object>> prep(SharedStore shared) {
                return List.of(Map.of("id", "slow", "delay", 150), Map.of("id", "fast", "delay", 1));
            }

            @Override
            public Action post(SharedStore shared, List<Map<String, Object>> prepRes, List<Action> execRes) {
                execRes.forEach(a -> terminals.add(a.label()));
                return Action.of("all-done");
            }
        };
        flow.setParams(Map.of("region", "eu"));
        SharedStore shared = new SharedStore();

        // When & Then
        StepVerifier.create(flow.runAsync(shared))
                .assertNext(action -> Assertions.assertEquals("all-done", action.label()))
                .verifyComplete();
        Assertions.assertEquals(List.of("fast", "slow"), completion);
        Assertions.assertEquals(List.of("end-slow", "end-fast"), terminals);
        Assertions.assertEquals("eu", shared.get("result-slow"));
        Assertions.assertEquals("eu", shared.get("result-fast"));
    }
}
