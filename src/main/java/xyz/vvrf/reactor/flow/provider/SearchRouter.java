package xyz.vvrf.reactor.flow.provider;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;
import xyz.vvrf.reactor.flow.registry.ProviderRegistry;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 按 Provider 名称 (null 表示默认 Provider) 路由搜索请求。
 */
@Slf4j
public class SearchRouter {

    public static final int DEFAULT_NUM_RESULTS = 5;

    private final ProviderRegistry<SearchProvider> registry;
    private final Scheduler scheduler;
    private final int defaultNumResults;

    public SearchRouter(ProviderRegistry<SearchProvider> registry) {
        this(registry, Schedulers.boundedElastic(), DEFAULT_NUM_RESULTS);
    }

    public SearchRouter(ProviderRegistry<SearchProvider> registry, Scheduler scheduler, int defaultNumResults) {
        this.registry = Objects.requireNonNull(registry, "ProviderRegistry 不能为空");
        this.scheduler = Objects.requireNonNull(scheduler, "Scheduler 不能为空");
        if (defaultNumResults < 1) {
            throw new IllegalArgumentException("defaultNumResults 必须 >= 1，实际为: " + defaultNumResults);
        }
        this.defaultNumResults = defaultNumResults;
    }

    public ProviderRegistry<SearchProvider> getRegistry() {
        return registry;
    }

    public int getDefaultNumResults() {
        return defaultNumResults;
    }

    /**
     * @param providerName Provider 名称，null 表示默认 Provider
     * @throws IllegalArgumentException 如果 query 为 null
     */
    public List<SearchResult> search(String query, String providerName, int numResults, Map<String, Object> options) throws Exception {
        requireQuery(query);
        SearchProvider provider = registry.lookup(providerName);
        log.debug("调用搜索 Provider '{}', 结果数: {}", providerName != null ? providerName : "<默认>", numResults);
        return provider.search(query, numResults, LlmRouter.safeOptions(options));
    }

    public List<SearchResult> search(String query) throws Exception {
        return search(query, null, defaultNumResults, null);
    }

    public Mono<List<SearchResult>> searchAsync(String query, String providerName, int numResults, Map<String, Object> options) {
        return Mono.defer(() -> {
            requireQuery(query);
            SearchProvider provider = registry.lookup(providerName);
            return provider.searchAsync(query, numResults, LlmRouter.safeOptions(options))
                    .subscribeOn(scheduler);
        });
    }

    private static void requireQuery(String query) {
        if (query == null) {
            throw new IllegalArgumentException("搜索词不能为 null");
        }
    }
}
