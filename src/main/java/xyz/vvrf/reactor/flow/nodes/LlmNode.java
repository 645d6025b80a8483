package xyz.vvrf.reactor.flow.nodes;

import lombok.Builder;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.reactor.flow.core.Action;
import xyz.vvrf.reactor.flow.core.Node;
import xyz.vvrf.reactor.flow.core.RetryPolicy;
import xyz.vvrf.reactor.flow.core.SharedStore;
import xyz.vvrf.reactor.flow.provider.LlmRouter;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * 用提示词模板调用 LLM 的节点。
 * <p>
 * prep 从共享存储收集模板占位符的值 (见 {@link PromptTemplate#gather})，
 * exec 渲染模板并通过 {@link LlmRouter} 调用模型，post 把回复写入 {@code outputKey}。
 * <pre>{@code
 * LlmNode summarize = LlmNode.builder()
 *         .router(router)
 *         .inputKey("document")
 *         .outputKey("summary")
 *         .promptTemplate("Summarize this in 3 sentences:\n\n{document}")
 *         .model("openai/gpt-4o")
 *         .build();
 * }</pre>
 */
@Slf4j
@Getter
public class LlmNode extends Node<Map<String, Object>, String> {

    public static final String DEFAULT_INPUT_KEY = "input";
    public static final String DEFAULT_OUTPUT_KEY = "output";
    public static final int DEFAULT_MAX_RETRIES = 3;
    public static final Duration DEFAULT_WAIT = Duration.ofSeconds(1);

    private final LlmRouter router;
    private final String inputKey;
    private final String outputKey;
    private final PromptTemplate promptTemplate;
    private final String model;
    private final Map<String, Object> options;

    /**
     * 未设置的参数使用默认值：inputKey "input"、outputKey "output"、模板 "{input}"、
     * 默认 Provider、重试 3 次、间隔 1 秒。
     */
    @Builder
    private LlmNode(String name,
                    LlmRouter router,
                    String inputKey,
                    String outputKey,
                    String promptTemplate,
                    String model,
                    Map<String, Object> options,
                    Integer maxRetries,
                    Duration retryWait) {
        super(RetryPolicy.of(maxRetries != null ? maxRetries : DEFAULT_MAX_RETRIES,
                retryWait != null ? retryWait : DEFAULT_WAIT));
        this.router = Objects.requireNonNull(router, "LlmRouter 不能为空");
        this.inputKey = inputKey != null ? inputKey : DEFAULT_INPUT_KEY;
        this.outputKey = outputKey != null ? outputKey : DEFAULT_OUTPUT_KEY;
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
    public String exec(Map<String, Object> context) throws Exception {
        String prompt = promptTemplate.render(context);
        log.trace("节点 '{}' 渲染的提示词长度: {}", getName(), prompt.length());
        return router.call(prompt, model, options);
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
