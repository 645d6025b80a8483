package xyz.vvrf.reactor.flow.nodes;

import lombok.Builder;
import lombok.Getter;
import reactor.core.publisher.Mono;
import xyz.vvrf.reactor.flow.core.Action;
import xyz.vvrf.reactor.flow.core.AsyncNode;
import xyz.vvrf.reactor.flow.core.RetryPolicy;
import xyz.vvrf.reactor.flow.core.SharedStore;
import xyz.vvrf.reactor.flow.provider.LlmRouter;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * {@link LlmNode} 的异步版本：通过 {@link LlmRouter#callAsync} 调用模型，重试等待不阻塞线程。
 */
@Getter
public class AsyncLlmNode extends AsyncNode<Map<String, Object>, String> {

    private final LlmRouter router;
    private final String inputKey;
    private final String outputKey;
    private final PromptTemplate promptTemplate;
    private final String model;
    private final Map<String, Object> options;

    @Builder
    private AsyncLlmNode(String name,
                         LlmRouter router,
                         String inputKey,
                         String outputKey,
                         String promptTemplate,
                         String model,
                         Map<String, Object> options,
                         Integer maxRetries,
                         Duration retryWait) {
        super(RetryPolicy.of(maxRetries != null ? maxRetries : LlmNode.DEFAULT_MAX_RETRIES,
                retryWait != null ? retryWait : LlmNode.DEFAULT_WAIT));
        this.router = Objects.requireNonNull(router, "LlmRouter 不能为空");
        this.inputKey = inputKey != null ? inputKey : LlmNode.DEFAULT_INPUT_KEY;
        this.outputKey = outputKey != null ? outputKey : LlmNode.DEFAULT_OUTPUT_KEY;
        this.promptTemplate = PromptTemplate.of(promptTemplate != null ? promptTemplate : PromptTemplate.DEFAULT_TEMPLATE);
        this.model = model;
        this.options = options != null ? Collections.unmodifiableMap(new LinkedHashMap<>(options)) : Collections.emptyMap();
        if (name != null) {
            setName(name);
        }
    }

    @Override
    public Map<String, Object> prep(SharedStore shared) {
        return promptTemplate.gather(shared, inputKey);
    }

    @Override
    public Mono<String> execAsync(Map<String, Object> context) {
        return router.callAsync(promptTemplate.render(context), model, options);
    }

    /**
     * 把结果写入 {@code outputKey}。结果为 null 时 (例如回退返回 null) 该键被移除，
     * 而不是保留上一次的值，见 {@link SharedStore#put}。
     */
    @Override
    public Action post(SharedStore shared, Map<String, Object> prepRes, String execRes) {
        shared.put(outputKey, execRes);
        return Action.DEFAULT;
    }
}
