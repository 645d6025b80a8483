package xyz.vvrf.reactor.flow.nodes;

import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.reactor.flow.core.RetryPolicy;
import xyz.vvrf.reactor.flow.provider.EmbeddingRouter;
import xyz.vvrf.reactor.flow.provider.LlmRouter;
import xyz.vvrf.reactor.flow.provider.SearchRouter;

import java.util.Objects;

/**
 * 创建已绑定路由器和默认重试策略的节点构建器。
 * 返回的构建器可以继续覆盖任何参数。
 */
@Slf4j
public class NodeFactory {

    private final LlmRouter llmRouter;
    private final SearchRouter searchRouter;
    private final EmbeddingRouter embeddingRouter;
    private final RetryPolicy defaultRetryPolicy;

    public NodeFactory(LlmRouter llmRouter,
                       SearchRouter searchRouter,
                       EmbeddingRouter embeddingRouter,
                       RetryPolicy defaultRetryPolicy) {
        this.llmRouter = Objects.requireNonNull(llmRouter, "LlmRouter 不能为空");
        this.searchRouter = Objects.requireNonNull(searchRouter, "SearchRouter 不能为空");
        this.embeddingRouter = Objects.requireNonNull(embeddingRouter, "EmbeddingRouter 不能为空");
        this.defaultRetryPolicy = Objects.requireNonNull(defaultRetryPolicy, "默认 RetryPolicy 不能为空");
        log.info("NodeFactory 已创建，默认重试策略: {}", defaultRetryPolicy);
    }

    public RetryPolicy getDefaultRetryPolicy() {
        return defaultRetryPolicy;
    }

    public LlmNode.LlmNodeBuilder llm() {
        return LlmNode.builder()
                .router(llmRouter)
                .maxRetries(defaultRetryPolicy.getMaxRetries())
                .retryWait(defaultRetryPolicy.getWait());
    }

    public AsyncLlmNode.AsyncLlmNodeBuilder asyncLlm() {
        return AsyncLlmNode.builder()
                .router(llmRouter)
                .maxRetries(defaultRetryPolicy.getMaxRetries())
                .retryWait(defaultRetryPolicy.getWait());
    }

    public SearchNode.SearchNodeBuilder search() {
        return SearchNode.builder()
                .router(searchRouter)
                .maxRetries(defaultRetryPolicy.getMaxRetries())
                .retryWait(defaultRetryPolicy.getWait());
    }

    public EmbeddingNode.EmbeddingNodeBuilder embedding() {
        return EmbeddingNode.builder()
                .router(embeddingRouter)
                .maxRetries(defaultRetryPolicy.getMaxRetries())
                .retryWait(defaultRetryPolicy.getWait());
    }
}
