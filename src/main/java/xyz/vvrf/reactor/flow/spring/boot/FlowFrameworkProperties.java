package xyz.vvrf.reactor.flow.spring.boot;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;
import reactor.core.scheduler.Schedulers;

import javax.validation.Valid;
import javax.validation.constraints.Min;
import javax.validation.constraints.NotBlank;
import javax.validation.constraints.NotNull;
import java.time.Duration;

/**
 * 流程框架的配置属性类。
 * 绑定 'flow' 前缀下的属性。
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "flow")
@Validated
public class FlowFrameworkProperties {

    @Valid
    private final Node node = new Node();
    @Valid
    private final SchedulerProps scheduler = new SchedulerProps();
    @Valid
    private final Provider provider = new Provider();
    @Valid
    private final Search search = new Search();
    @Valid
    private final Monitor monitor = new Monitor();

    @Getter
    @Setter
    public static class Node {
        /**
         * 由 NodeFactory 创建的节点的默认总尝试次数 (1 表示不重试)。
         */
        @Min(1)
        private int maxRetries = 1;

        /**
         * 两次尝试之间的默认等待时间。
         */
        @NotNull
        private Duration wait = Duration.ZERO;
    }

    @Getter
    @Setter
    public static class SchedulerProps {
        /**
         * 路由器异步调用 Provider 时使用的调度器类型。
         */
        @NotNull
        private SchedulerType type = SchedulerType.BOUNDED_ELASTIC;

        /**
         * 调度器线程名称前缀。
         */
        @NotBlank
        private String namePrefix = "flow-provider";

        @Valid
        private final BoundedElasticProps boundedElastic = new BoundedElasticProps();

        @Valid
        private final ParallelProps parallel = new ParallelProps();

        /**
         * 当 type 为 CUSTOM 时，自定义 Scheduler Bean 的名称。
         */
        private String customBeanName;
    }

    public enum SchedulerType {
        BOUNDED_ELASTIC, PARALLEL, SINGLE, CUSTOM
    }

    @Getter
    @Setter
    public static class BoundedElasticProps {
        @Min(1)
        private int threadCap = Schedulers.DEFAULT_BOUNDED_ELASTIC_SIZE;
        @Min(1)
        private int queuedTaskCap = Schedulers.DEFAULT_BOUNDED_ELASTIC_QUEUESIZE;
        @Min(0)
        private int ttlSeconds = 60;
    }

    @Getter
    @Setter
    public static class ParallelProps {
        @Min(1)
        private int parallelism = Runtime.getRuntime().availableProcessors();
    }

    @Getter
    @Setter
    public static class Provider {
        /**
         * 默认 LLM Provider 名称。为空时第一个注册的 Provider 成为默认值。
         */
        private String defaultLlm;
        private String defaultSearch;
        private String defaultEmbedding;
    }

    @Getter
    @Setter
    public static class Search {
        /**
         * 未指定时每次搜索返回的结果数量。
         */
        @Min(1)
        private int numResults = 5;
    }

    @Getter
    @Setter
    public static class Monitor {
        /**
         * 是否注册 LoggingFlowMonitorListener。
         */
        private boolean loggingEnabled = false;
    }

    @Override
    public String toString() {
        return "FlowFrameworkProperties{" +
                "node={maxRetries=" + node.maxRetries +
                ", wait=" + node.wait +
                "}, scheduler={type=" + scheduler.type +
                ", namePrefix='" + scheduler.namePrefix + '\'' +
                ", boundedElastic={threadCap=" + scheduler.boundedElastic.threadCap +
                ", queuedTaskCap=" + scheduler.boundedElastic.queuedTaskCap +
                ", ttlSeconds=" + scheduler.boundedElastic.ttlSeconds +
                "}, parallel={parallelism=" + scheduler.parallel.parallelism +
                "}, customBeanName='" + scheduler.customBeanName + '\'' +
                "}, provider={defaultLlm='" + provider.defaultLlm + '\'' +
                ", defaultSearch='" + provider.defaultSearch + '\'' +
                ", defaultEmbedding='" + provider.defaultEmbedding + '\'' +
                "}, search={numResults=" + search.numResults +
                "}, monitor={loggingEnabled=" + monitor.loggingEnabled +
                "}}";
    }
}
