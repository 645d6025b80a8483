package xyz.vvrf.reactor.flow.spring.boot;

import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfigureAfter;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ApplicationContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;
import xyz.vvrf.reactor.flow.core.RetryPolicy;
import xyz.vvrf.reactor.flow.execution.FlowEngine;
import xyz.vvrf.reactor.flow.execution.StandardFlowEngine;
import xyz.vvrf.reactor.flow.monitor.FlowMonitorListener;
import xyz.vvrf.reactor.flow.monitor.LoggingFlowMonitorListener;
import xyz.vvrf.reactor.flow.monitor.MicrometerFlowMonitorListener;
import xyz.vvrf.reactor.flow.nodes.NodeFactory;
import xyz.vvrf.reactor.flow.provider.EmbeddingProvider;
import xyz.vvrf.reactor.flow.provider.EmbeddingRouter;
import xyz.vvrf.reactor.flow.provider.LlmProvider;
import xyz.vvrf.reactor.flow.provider.LlmRouter;
import xyz.vvrf.reactor.flow.provider.SearchProvider;
import xyz.vvrf.reactor.flow.provider.SearchRouter;
import xyz.vvrf.reactor.flow.registry.ProviderRegistry;
import xyz.vvrf.reactor.flow.registry.SimpleProviderRegistry;

import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 流程框架的 Spring Boot 自动配置类。
 * 职责:
 * 1. 启用并绑定 {@link FlowFrameworkProperties}。
 * 2. 提供路由器异步调用 Provider 使用的 {@link Scheduler} Bean ("flowProviderScheduler")，可由属性配置。
 * 3. 创建 LLM、搜索、向量化三个 {@link ProviderRegistry}，并注册上下文中所有对应的 Provider Bean
 *    (名称取自 {@link xyz.vvrf.reactor.flow.annotation.FlowProvider}，否则为 Bean 名称)。
 * 4. 提供三个路由器、{@link NodeFactory} 和默认 {@link RetryPolicy}。
 * 5. 收集所有的 {@link FlowMonitorListener} Bean 到一个列表 Bean ("flowMonitorListeners")，并创建 {@link FlowEngine}。
 * <p>
 * 所有 Bean 都可以被用户自定义的同类型 (或同名) Bean 替换。
 */
@Configuration
@AutoConfigureAfter(name = {
        "org.springframework.boot.actuate.autoconfigure.metrics.MetricsAutoConfiguration",
        "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration"
})
@EnableConfigurationProperties(FlowFrameworkProperties.class)
@Slf4j
public class FlowFrameworkAutoConfiguration {

    public static final String PROVIDER_SCHEDULER_BEAN = "flowProviderScheduler";

    private final ApplicationContext applicationContext;

    public FlowFrameworkAutoConfiguration(ApplicationContext applicationContext) {
        this.applicationContext = applicationContext;
        log.info("流程框架自动配置 (FlowFrameworkAutoConfiguration) 已加载。");
    }

    /**
     * 路由器异步调用 Provider 时使用的调度器。
     * 如果已存在名为 "flowProviderScheduler" 的 Bean，则不创建此默认 Bean。
     */
    @Bean(name = PROVIDER_SCHEDULER_BEAN)
    @ConditionalOnMissingBean(name = PROVIDER_SCHEDULER_BEAN)
    public Scheduler flowProviderScheduler(FlowFrameworkProperties properties) {
        FlowFrameworkProperties.SchedulerProps schedulerProps = properties.getScheduler();
        String namePrefix = schedulerProps.getNamePrefix();

        switch (schedulerProps.getType()) {
            case BOUNDED_ELASTIC:
                FlowFrameworkProperties.BoundedElasticProps beProps = schedulerProps.getBoundedElastic();
                log.info("正在创建 '{}' (BoundedElastic): prefix={}, cap={}, queue={}, ttl={}s",
                        PROVIDER_SCHEDULER_BEAN, namePrefix, beProps.getThreadCap(), beProps.getQueuedTaskCap(), beProps.getTtlSeconds());
                return boundedElastic(schedulerProps, namePrefix);
            case PARALLEL:
                FlowFrameworkProperties.ParallelProps pProps = schedulerProps.getParallel();
                log.info("正在创建 '{}' (Parallel): prefix={}, parallelism={}", PROVIDER_SCHEDULER_BEAN, namePrefix, pProps.getParallelism());
                return Schedulers.newParallel(namePrefix, pProps.getParallelism(), true);
            case SINGLE:
                log.info("正在创建 '{}' (Single): prefix={}", PROVIDER_SCHEDULER_BEAN, namePrefix);
                return Schedulers.newSingle(namePrefix, true);
            case CUSTOM:
                String customBeanName = schedulerProps.getCustomBeanName();
                if (customBeanName == null || customBeanName.trim().isEmpty()) {
                    log.error("'flow.scheduler.type=CUSTOM' 但 'flow.scheduler.custom-bean-name' 未配置。回退到默认 BoundedElastic。");
                    return boundedElastic(schedulerProps, namePrefix + "-fallback");
                }
                log.info("正在从 Spring 上下文获取自定义 Scheduler Bean，名称: {}", customBeanName);
                try {
                    return applicationContext.getBean(customBeanName, Scheduler.class);
                } catch (Exception e) {
                    log.error("获取自定义 Scheduler Bean '{}' 失败。回退到默认 BoundedElastic。", customBeanName, e);
                    return boundedElastic(schedulerProps, namePrefix + "-fallback-custom-failed");
                }
            default:
                log.warn("未知的 'flow.scheduler.type': {}. 回退到默认 BoundedElastic。", schedulerProps.getType());
                return boundedElastic(schedulerProps, namePrefix + "-default");
        }
    }

    private static Scheduler boundedElastic(FlowFrameworkProperties.SchedulerProps schedulerProps, String name) {
        FlowFrameworkProperties.BoundedElasticProps beProps = schedulerProps.getBoundedElastic();
        return Schedulers.newBoundedElastic(beProps.getThreadCap(), beProps.getQueuedTaskCap(), name, beProps.getTtlSeconds(), true);
    }

    /**
     * 由 {@link NodeFactory} 创建的节点的默认重试策略。
     */
    @Bean
    @ConditionalOnMissingBean
    public RetryPolicy flowDefaultRetryPolicy(FlowFrameworkProperties properties) {
        RetryPolicy policy = RetryPolicy.of(properties.getNode().getMaxRetries(), properties.getNode().getWait());
        log.info("框架默认重试策略: {}", policy);
        return policy;
    }

    // --- Provider 注册表 ---

    @Bean
    @ConditionalOnMissingBean(name = "llmProviderRegistry")
    public ProviderRegistry<LlmProvider> llmProviderRegistry(FlowFrameworkProperties properties, ListableBeanFactory beanFactory) {
        ProviderRegistry<LlmProvider> registry = new SimpleProviderRegistry<>("llm", properties.getProvider().getDefaultLlm());
        ProviderRegistrar.registerAll(beanFactory, LlmProvider.class, registry);
        return registry;
    }

    @Bean
    @ConditionalOnMissingBean(name = "searchProviderRegistry")
    public ProviderRegistry<SearchProvider> searchProviderRegistry(FlowFrameworkProperties properties, ListableBeanFactory beanFactory) {
        ProviderRegistry<SearchProvider> registry = new SimpleProviderRegistry<>("search", properties.getProvider().getDefaultSearch());
        ProviderRegistrar.registerAll(beanFactory, SearchProvider.class, registry);
        return registry;
    }

    @Bean
    @ConditionalOnMissingBean(name = "embeddingProviderRegistry")
    public ProviderRegistry<EmbeddingProvider> embeddingProviderRegistry(FlowFrameworkProperties properties, ListableBeanFactory beanFactory) {
        ProviderRegistry<EmbeddingProvider> registry = new SimpleProviderRegistry<>("embedding", properties.getProvider().getDefaultEmbedding());
        ProviderRegistrar.registerAll(beanFactory, EmbeddingProvider.class, registry);
        return registry;
    }

    // --- 路由器 ---

    @Bean
    @ConditionalOnMissingBean
    public LlmRouter llmRouter(@Qualifier("llmProviderRegistry") ProviderRegistry<LlmProvider> registry,
                               @Qualifier(PROVIDER_SCHEDULER_BEAN) Scheduler scheduler) {
        return new LlmRouter(registry, scheduler);
    }

    @Bean
    @ConditionalOnMissingBean
    public SearchRouter searchRouter(@Qualifier("searchProviderRegistry") ProviderRegistry<SearchProvider> registry,
                                     @Qualifier(PROVIDER_SCHEDULER_BEAN) Scheduler scheduler,
                                     FlowFrameworkProperties properties) {
        return new SearchRouter(registry, scheduler, properties.getSearch().getNumResults());
    }

    @Bean
    @ConditionalOnMissingBean
    public EmbeddingRouter embeddingRouter(@Qualifier("embeddingProviderRegistry") ProviderRegistry<EmbeddingProvider> registry,
                                           @Qualifier(PROVIDER_SCHEDULER_BEAN) Scheduler scheduler) {
        return new EmbeddingRouter(registry, scheduler);
    }

    @Bean
    @ConditionalOnMissingBean
    public NodeFactory flowNodeFactory(LlmRouter llmRouter,
                                       SearchRouter searchRouter,
                                       EmbeddingRouter embeddingRouter,
                                       RetryPolicy flowDefaultRetryPolicy) {
        return new NodeFactory(llmRouter, searchRouter, embeddingRouter, flowDefaultRetryPolicy);
    }

    // --- 监控与引擎 ---

    @Bean
    @ConditionalOnProperty(prefix = "flow.monitor", name = "logging-enabled", havingValue = "true")
    @ConditionalOnMissingBean(LoggingFlowMonitorListener.class)
    public LoggingFlowMonitorListener loggingFlowMonitorListener() {
        log.info("已启用 LoggingFlowMonitorListener。");
        return new LoggingFlowMonitorListener();
    }

    @Configuration
    @ConditionalOnClass(MeterRegistry.class)
    static class MicrometerMonitorConfiguration {

        @Bean
        @ConditionalOnBean(MeterRegistry.class)
        @ConditionalOnMissingBean(MicrometerFlowMonitorListener.class)
        public MicrometerFlowMonitorListener micrometerFlowMonitorListener(MeterRegistry meterRegistry) {
            log.info("检测到 MeterRegistry，已启用 MicrometerFlowMonitorListener。");
            return new MicrometerFlowMonitorListener(meterRegistry);
        }
    }

    /**
     * 收集在应用上下文中定义的所有 FlowMonitorListener Bean，作为名为 "flowMonitorListeners" 的不可变列表提供。
     */
    @Bean(name = "flowMonitorListeners")
    @ConditionalOnMissingBean(name = "flowMonitorListeners")
    public List<FlowMonitorListener> flowMonitorListeners(ObjectProvider<FlowMonitorListener> listenersProvider) {
        log.info("正在收集 FlowMonitorListener Bean...");
        List<FlowMonitorListener> listeners = listenersProvider.orderedStream().collect(Collectors.toList());
        if (listeners.isEmpty()) {
            log.info("在 Spring 上下文中未找到 FlowMonitorListener Bean。");
        } else {
            log.info("收集到 {} 个 FlowMonitorListener Bean: {}", listeners.size(),
                    listeners.stream().map(l -> l.getClass().getSimpleName()).collect(Collectors.joining(", ")));
        }
        return Collections.unmodifiableList(listeners);
    }

    @Bean
    @ConditionalOnMissingBean(FlowEngine.class)
    public FlowEngine flowEngine(@Qualifier("flowMonitorListeners") List<FlowMonitorListener> flowMonitorListeners) {
        log.info("正在创建 StandardFlowEngine Bean...");
        return new StandardFlowEngine(flowMonitorListeners);
    }
}
