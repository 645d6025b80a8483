package xyz.vvrf.reactor.flow.spring.boot;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;
import reactor.test.StepVerifier;
import xyz.vvrf.reactor.flow.annotation.FlowProvider;
import xyz.vvrf.reactor.flow.core.Action;
import xyz.vvrf.reactor.flow.core.Flow;
import xyz.vvrf.reactor.flow.core.RetryPolicy;
import xyz.vvrf.reactor.flow.core.SharedStore;
import xyz.vvrf.reactor.flow.execution.FlowEngine;
import xyz.vvrf.reactor.flow.execution.StandardFlowEngine;
import xyz.vvrf.reactor.flow.monitor.LoggingFlowMonitorListener;
import xyz.vvrf.reactor.flow.monitor.MicrometerFlowMonitorListener;
import xyz.vvrf.reactor.flow.nodes.LlmNode;
import xyz.vvrf.reactor.flow.nodes.NodeFactory;
import xyz.vvrf.reactor.flow.provider.LlmProvider;
import xyz.vvrf.reactor.flow.provider.LlmRouter;
import xyz.vvrf.reactor.flow.provider.SearchProvider;
import xyz.vvrf.reactor.flow.provider.SearchResult;
import xyz.vvrf.reactor.flow.provider.SearchRouter;
import xyz.vvrf.reactor.flow.registry.ProviderRegistry;

import java.time.Duration;
import java.util.List;
import java.util.Map;

class FlowFrameworkAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(FlowFrameworkAutoConfiguration.class));

    @FlowProvider("upper")
    static class UpperCaseLlm implements LlmProvider {
        @Override
        public String call(String prompt, String model, Map<String, Object> options) {
            return prompt.toUpperCase();
        }
    }

    @FlowProvider("reverse")
    static class ReverseLlm implements LlmProvider {
        @Override
        public String call(String prompt, String model, Map<String, Object> options) {
            return new StringBuilder(prompt).reverse().toString();
        }
    }

    static class PlainSearch implements SearchProvider {
        @Override
        public List<SearchResult> search(String query, int numResults, Map<String, Object> options) {
            return List.of(SearchResult.of(query, String.valueOf(numResults), "u"));
        }
    }

    @Configuration
    static class ProviderConfig {

        @Bean
        UpperCaseLlm upperCaseLlm() {
            return new UpperCaseLlm();
        }

        @Bean
        ReverseLlm reverseLlm() {
            return new ReverseLlm();
        }

        @Bean
        PlainSearch plainSearch() {
            return new PlainSearch();
        }
    }

    @Configuration
    static class MetricsConfig {

        @Bean
        MeterRegistry meterRegistry() {
            return new SimpleMeterRegistry();
        }
    }

    @Configuration
    static class CustomSchedulerConfig {

        @Bean(destroyMethod = "dispose")
        Scheduler myScheduler() {
            return Schedulers.newSingle("my-custom", true);
        }
    }

    /**
     * 在调度器上运行一个任务，返回执行线程的名称。
     */
    private static String threadNameOn(Scheduler scheduler) {
        return Mono.fromCallable(() -> Thread.currentThread().getName())
                .subscribeOn(scheduler)
                .block(Duration.ofSeconds(5));
    }

    @Test
    void testDefaults_ShouldCreateCoreBeans() {
        contextRunner.run(context -> {
            Assertions.assertNotNull(context.getBean(FlowEngine.class));
            Assertions.assertNotNull(context.getBean(NodeFactory.class));
            Assertions.assertNotNull(context.getBean(FlowFrameworkAutoConfiguration.PROVIDER_SCHEDULER_BEAN, Scheduler.class));
            RetryPolicy policy = context.getBean(RetryPolicy.class);
            Assertions.assertEquals(1, policy.getMaxRetries());
            Assertions.assertEquals(Duration.ZERO, policy.getWait());
            Assertions.assertTrue(context.getBeansOfType(LoggingFlowMonitorListener.class).isEmpty());
            Assertions.assertTrue(context.getBeansOfType(MicrometerFlowMonitorListener.class).isEmpty());
            Assertions.assertEquals(SearchRouter.DEFAULT_NUM_RESULTS, context.getBean(SearchRouter.class).getDefaultNumResults());
        });
    }

    @Test
    @SuppressWarnings("unchecked")
    void testProviders_ShouldBeRegisteredUnderAnnotatedOrBeanNames() {
        contextRunner
                .withUserConfiguration(ProviderConfig.class)
                .withPropertyValues("flow.provider.default-llm=reverse", "flow.search.num-results=7")
                .run(context -> {
                    ProviderRegistry<LlmProvider> llm = context.getBean("llmProviderRegistry", ProviderRegistry.class);
                    Assertions.assertTrue(llm.contains("upper"));
                    Assertions.assertTrue(llm.contains("reverse"));
                    Assertions.assertEquals("reverse", llm.getDefaultProvider().orElse(null));

                    ProviderRegistry<SearchProvider> search = context.getBean("searchProviderRegistry", ProviderRegistry.class);
                    Assertions.assertEquals(List.of("plainSearch"), search.getProviderNames());

                    LlmRouter router = context.getBean(LlmRouter.class);
                    Assertions.assertEquals("cba", router.call("abc", null));
                    Assertions.assertEquals("ABC", router.call("abc", "upper/any"));
                    Assertions.assertEquals("7", context.getBean(SearchRouter.class).search("q").get(0).getSnippet());
                });
    }

    @Test
    void testNodeDefaults_ShouldComeFromProperties() {
        contextRunner
                .withUserConfiguration(ProviderConfig.class)
                .withPropertyValues("flow.node.max-retries=4", "flow.node.wait=20ms")
                .run(context -> {
                    LlmNode node = context.getBean(NodeFactory.class).llm().build();
                    Assertions.assertEquals(4, node.getRetryPolicy().getMaxRetries());
                    Assertions.assertEquals(Duration.ofMillis(20), node.getRetryPolicy().getWait());
                });
    }

    @Test
    void testInvalidRetryCount_ShouldFailStartup() {
        contextRunner
                .withPropertyValues("flow.node.max-retries=0")
                .run(context -> Assertions.assertNotNull(context.getStartupFailure()));
    }

    @Test
    void testLoggingListener_WhenEnabled_ShouldBeWiredIntoEngine() {
        contextRunner
                .withPropertyValues("flow.monitor.logging-enabled=true")
                .run(context -> {
                    LoggingFlowMonitorListener listener = context.getBean(LoggingFlowMonitorListener.class);
                    StandardFlowEngine engine = (StandardFlowEngine) context.getBean(FlowEngine.class);
                    Assertions.assertTrue(engine.getMonitorListeners().contains(listener));
                });
    }

    @Test
    void testMicrometerListener_WhenMeterRegistryPresent_ShouldRecordFlowMetrics() {
        contextRunner
                .withUserConfiguration(ProviderConfig.class, MetricsConfig.class)
                .run(context -> {
                    Assertions.assertNotNull(context.getBean(MicrometerFlowMonitorListener.class));
                    FlowEngine engine = context.getBean(FlowEngine.class);
                    LlmNode node = context.getBean(NodeFactory.class).llm().name("shout").build();
                    Flow flow = new Flow(node);
                    flow.setName("greeting");
                    SharedStore shared = SharedStore.of(Map.of("input", "hi"));

                    Action result = engine.run(flow, shared);

                    Assertions.assertEquals(Action.DEFAULT, result);
                    Assertions.assertEquals("HI", shared.get("output"));
                    MeterRegistry registry = context.getBean(MeterRegistry.class);
                    Assertions.assertEquals(1L, registry.get(MicrometerFlowMonitorListener.METRIC_FLOW_EXECUTION_TIME)
                            .tag("flow.name", "greeting").timer().count());
                    Assertions.assertEquals(1.0, registry.get(MicrometerFlowMonitorListener.METRIC_NODE_EXECUTION_TOTAL)
                            .tag("node.name", "shout").counter().count());
                });
    }

    @Test
    void testScheduler_WhenBoundedElastic_ShouldUseNamePrefix() {
        contextRunner
                .withPropertyValues("flow.scheduler.name-prefix=llm-io")
                .run(context -> {
                    Scheduler scheduler = context.getBean(FlowFrameworkAutoConfiguration.PROVIDER_SCHEDULER_BEAN, Scheduler.class);
                    Assertions.assertTrue(threadNameOn(scheduler).startsWith("llm-io"));
                });
    }

    @Test
    void testScheduler_WhenParallel_ShouldCreateParallelScheduler() {
        contextRunner
                .withPropertyValues("flow.scheduler.type=PARALLEL", "flow.scheduler.name-prefix=flow-par",
                        "flow.scheduler.parallel.parallelism=2")
                .run(context -> {
                    Scheduler scheduler = context.getBean(FlowFrameworkAutoConfiguration.PROVIDER_SCHEDULER_BEAN, Scheduler.class);
                    Assertions.assertTrue(threadNameOn(scheduler).startsWith("flow-par"));
                });
    }

    @Test
    void testScheduler_WhenSingle_ShouldCreateSingleScheduler() {
        contextRunner
                .withPropertyValues("flow.scheduler.type=SINGLE", "flow.scheduler.name-prefix=flow-one")
                .run(context -> {
                    Scheduler scheduler = context.getBean(FlowFrameworkAutoConfiguration.PROVIDER_SCHEDULER_BEAN, Scheduler.class);
                    String first = threadNameOn(scheduler);
                    Assertions.assertTrue(first.startsWith("flow-one"));
                    Assertions.assertEquals(first, threadNameOn(scheduler));
                });
    }

    @Test
    void testScheduler_WhenCustom_ShouldUseNamedBean() {
        contextRunner
                .withUserConfiguration(CustomSchedulerConfig.class, ProviderConfig.class)
                .withPropertyValues("flow.scheduler.type=CUSTOM", "flow.scheduler.custom-bean-name=myScheduler")
                .run(context -> {
                    Scheduler custom = context.getBean("myScheduler", Scheduler.class);
                    Assertions.assertSame(custom, context.getBean(FlowFrameworkAutoConfiguration.PROVIDER_SCHEDULER_BEAN, Scheduler.class));
                    StepVerifier.create(context.getBean(LlmRouter.class).callAsync("abc", "upper/any", null))
                            .expectNext("ABC")
                            .verifyComplete();
                });
    }

    @Test
    void testScheduler_WhenCustomBeanMissing_ShouldFallBackToBoundedElastic() {
        contextRunner
                .withPropertyValues("flow.scheduler.type=CUSTOM", "flow.scheduler.custom-bean-name=doesNotExist",
                        "flow.scheduler.name-prefix=flow-x")
                .run(context -> {
                    Scheduler scheduler = context.getBean(FlowFrameworkAutoConfiguration.PROVIDER_SCHEDULER_BEAN, Scheduler.class);
                    Assertions.assertTrue(threadNameOn(scheduler).startsWith("flow-x-fallback-custom-failed"));
                });
    }

    @Test
    void testScheduler_WhenCustomNameBlank_ShouldFallBackToBoundedElastic() {
        contextRunner
                .withPropertyValues("flow.scheduler.type=CUSTOM", "flow.scheduler.name-prefix=flow-y")
                .run(context -> {
                    Scheduler scheduler = context.getBean(FlowFrameworkAutoConfiguration.PROVIDER_SCHEDULER_BEAN, Scheduler.class);
                    Assertions.assertTrue(threadNameOn(scheduler).startsWith("flow-y-fallback"));
                });
    }
}
