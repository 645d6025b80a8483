package xyz.vvrf.reactor.flow.provider;

import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

/**
 * 文本向量化的 Provider。
 */
@FunctionalInterface
public interface EmbeddingProvider {

    List<Double> embed(String text, String model, Map<String, Object> options) throws Exception;

    default Mono<List<Double>> embedAsync(String text, String model, Map<String, Object> options) {
        return Mono.fromCallable(() -> embed(text, model, options));
    }
}
