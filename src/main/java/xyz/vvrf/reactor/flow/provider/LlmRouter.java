package xyz.vvrf.reactor.flow.provider;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;
import xyz.vvrf.reactor.flow.registry.ProviderRegistry;
import xyz.vvrf.reactor.flow.registry.ResolvedProvider;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;

/**
 * 按模型说明符把 LLM 调用路由到已注册的 Provider。
 * <p>
 * 说明符 {@code "openai/gpt-4o"} 选择 Provider {@code openai}、模型 {@code gpt-4o}；
 * 不含 "/" 的说明符 (或 null) 使用默认 Provider。
 */
@Slf4j
public class LlmRouter {

    private final ProviderRegistry<LlmProvider> registry;
    private final Scheduler scheduler;

    public LlmRouter(ProviderRegistry<LlmProvider> registry) {
        this(registry, Schedulers.boundedElastic());
    }

    /**
     * @param scheduler 异步调用时订阅 Provider 的调度器 (Provider 的默认异步实现是阻塞的)
     */
    public LlmRouter(ProviderRegistry<LlmProvider> registry, Scheduler scheduler) {
        this.registry = Objects.requireNonNull(registry, "ProviderRegistry 不能为空");
        this.scheduler = Objects.requireNonNull(scheduler, "Scheduler 不能为空");
    }

    public ProviderRegistry<LlmProvider> getRegistry() {
        return registry;
    }

    public String call(String prompt, String modelSpecifier, Map<String, Object> options) throws Exception {
        ResolvedProvider<LlmProvider> resolved = registry.resolve(modelSpecifier);
        log.debug("调用 LLM Provider '{}', 模型: {}", resolved.getProviderName(), resolved.getModelName());
        return resolved.getProvider().call(prompt, resolved.getModelName(), safeOptions(options));
    }

    public String call(String prompt, String modelSpecifier) throws Exception {
        return call(prompt, modelSpecifier, null);
    }

    /**
     * 查找错误以 Mono 错误信号发出。
     */
    public Mono<String> callAsync(String prompt, String modelSpecifier, Map<String, Object> options) {
        return Mono.defer(() -> {
            ResolvedProvider<LlmProvider> resolved = registry.resolve(modelSpecifier);
            log.debug("异步调用 LLM Provider '{}', 模型: {}", resolved.getProviderName(), resolved.getModelName());
            return resolved.getProvider()
                    .callAsync(prompt, resolved.getModelName(), safeOptions(options))
                    .subscribeOn(scheduler);
        });
    }

    static Map<String, Object> safeOptions(Map<String, Object> options) {
        return options != null ? Collections.unmodifiableMap(options) : Collections.emptyMap();
    }
}
