package xyz.vvrf.reactor.flow.nodes;

import lombok.Builder;
import lombok.Getter;
import xyz.vvrf.reactor.flow.core.Action;
import xyz.vvrf.reactor.flow.core.Node;
import xyz.vvrf.reactor.flow.core.RetryPolicy;
import xyz.vvrf.reactor.flow.core.SharedStore;
import xyz.vvrf.reactor.flow.provider.EmbeddingRouter;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 把 {@code inputKey} 的文本向量化，结果写入 {@code outputKey}。
 */
@Getter
public class EmbeddingNode extends Node<String, List<Double>> {

    public static final String DEFAULT_INPUT_KEY = "text";
    public static final String DEFAULT_OUTPUT_KEY = "embedding";

    private final EmbeddingRouter router;
    private final String inputKey;
    private final String outputKey;
    private final String model;
    private final Map<String, Object> options;

    @Builder
    private EmbeddingNode(String name,
                          EmbeddingRouter router,
                          String inputKey,
                          String outputKey,
                          String model,
                          Map<String, Object> options,
                          Integer maxRetries,
                          Duration retryWait) {
        super(RetryPolicy.of(maxRetries != null ? maxRetries : LlmNode.DEFAULT_MAX_RETRIES,
                retryWait != null ? retryWait : LlmNode.DEFAULT_WAIT));
        this.router = Objects.requireNonNull(router, "EmbeddingRouter 不能为空");
        this.inputKey = inputKey != null ? inputKey : DEFAULT_INPUT_KEY;
        this.outputKey = outputKey != null ? outputKey : DEFAULT_OUTPUT_KEY;
        this.model = model;
        this.options = options != null ? Collections.unmodifiableMap(new LinkedHashMap<>(options)) : Collections.emptyMap();
        if (name != null) {
            setName(name);
        }
    }

    @Override
    public String prep(SharedStore shared) {
        Object text = shared.getOrDefault(inputKey, "");
        return text == null ? "" : String.valueOf(text);
    }

    @Override
    public List<Double> exec(String text) throws Exception {
        return router.embed(text, model, options);
    }

    /**
     * 把结果写入 {@code outputKey}。结果为 null 时 (例如回退返回 null) 该键被移除，
     * 而不是保留上一次的值，见 {@link SharedStore#put}。
     */
    @Override
    public Action post(SharedStore shared, String prepRes, List<Double> execRes) {
        shared.put(outputKey, execRes);
        return Action.DEFAULT;
    }
}
