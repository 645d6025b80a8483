package xyz.vvrf.reactor.flow.provider;

import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

/**
 * 网页搜索的 Provider。
 */
@FunctionalInterface
public interface SearchProvider {

    /**
     * @param query      搜索词
     * @param numResults 期望返回的结果数量
     * @param options    透传给 Provider 的额外参数
     */
    List<SearchResult> search(String query, int numResults, Map<String, Object> options) throws Exception;

    default Mono<List<SearchResult>> searchAsync(String query, int numResults, Map<String, Object> options) {
        return Mono.fromCallable(() -> search(query, numResults, options));
    }
}
