package xyz.vvrf.reactor.flow.provider;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;
import xyz.vvrf.reactor.flow.registry.ProviderRegistry;
import xyz.vvrf.reactor.flow.registry.ResolvedProvider;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 按模型说明符把向量化请求路由到已注册的 Provider，规则与 {@link LlmRouter} 相同。
 */
@Slf4j
public class EmbeddingRouter {

    private final ProviderRegistry<EmbeddingProvider> registry;
    private final Scheduler scheduler;

    public EmbeddingRouter(ProviderRegistry<EmbeddingProvider> registry) {
        this(registry, Schedulers.boundedElastic());
    }

    public EmbeddingRouter(ProviderRegistry<EmbeddingProvider> registry, Scheduler scheduler) {
        this.registry = Objects.requireNonNull(registry, "ProviderRegistry 不能为空");
        this.scheduler = Objects.requireNonNull(scheduler, "Scheduler 不能为空");
    }

    public ProviderRegistry<EmbeddingProvider> getRegistry() {
        return registry;
    }

    public List<Double> embed(String text, String modelSpecifier, Map<String, Object> options) throws Exception {
        ResolvedProvider<EmbeddingProvider> resolved = registry.resolve(modelSpecifier);
        log.debug("调用 Embedding Provider '{}', 模型: {}", resolved.getProviderName(), resolved.getModelName());
        return resolved.getProvider().embed(text, resolved.getModelName(), LlmRouter.safeOptions(options));
    }

    public List<Double> embed(String text, String modelSpecifier) throws Exception {
        return embed(text, modelSpecifier, null);
    }

    public Mono<List<Double>> embedAsync(String text, String modelSpecifier, Map<String, Object> options) {
        return Mono.defer(() -> {
            ResolvedProvider<EmbeddingProvider> resolved = registry.resolve(modelSpecifier);
            return resolved.getProvider()
                    .embedAsync(text, resolved.getModelName(), LlmRouter.safeOptions(options))
                    .subscribeOn(scheduler);
        });
    }
}
