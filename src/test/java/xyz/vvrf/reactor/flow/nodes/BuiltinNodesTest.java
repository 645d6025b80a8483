package xyz.vvrf.reactor.flow.nodes;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.core.scheduler.Schedulers;
import reactor.test.StepVerifier;
import xyz.vvrf.reactor.flow.core.Action;
import xyz.vvrf.reactor.flow.core.Flow;
import xyz.vvrf.reactor.flow.core.RetryPolicy;
import xyz.vvrf.reactor.flow.core.SharedStore;
import xyz.vvrf.reactor.flow.exception.NodeExecutionException;
import xyz.vvrf.reactor.flow.exception.ProviderLookupException;
import xyz.vvrf.reactor.flow.provider.EmbeddingProvider;
import xyz.vvrf.reactor.flow.provider.EmbeddingRouter;
import xyz.vvrf.reactor.flow.provider.LlmProvider;
import xyz.vvrf.reactor.flow.provider.LlmRouter;
import xyz.vvrf.reactor.flow.provider.SearchProvider;
import xyz.vvrf.reactor.flow.provider.SearchResult;
import xyz.vvrf.reactor.flow.provider.SearchRouter;
import xyz.vvrf.reactor.flow.registry.SimpleProviderRegistry;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

class BuiltinNodesTest {

    private final List<String> prompts = new CopyOnWriteArrayList<>();
    private final List<Integer> searchCounts = new CopyOnWriteArrayList<>();
    private SimpleProviderRegistry<LlmProvider> llmRegistry;
    private NodeFactory factory;

    @BeforeEach
    void setUp() {
        llmRegistry = new SimpleProviderRegistry<>("llm");
        llmRegistry.register("echo", (prompt, model, options) -> {
            prompts.add(prompt);
            return "echo(" + model + "): " + prompt;
        });
        SimpleProviderRegistry<SearchProvider> searchRegistry = new SimpleProviderRegistry<>("search");
        searchRegistry.register("fake", (query, numResults, options) -> {
            searchCounts.add(numResults);
            return List.of(SearchResult.of("Reactor", "Reactive library", "https://projectreactor.io"),
                    SearchResult.builder().build());
        });
        SimpleProviderRegistry<EmbeddingProvider> embeddingRegistry = new SimpleProviderRegistry<>("embedding");
        embeddingRegistry.register("fake", (text, model, options) -> List.of(0.5, (double) text.length()));
        factory = new NodeFactory(
                new LlmRouter(llmRegistry, Schedulers.immediate()),
                new SearchRouter(searchRegistry, Schedulers.immediate(), 4),
                new EmbeddingRouter(embeddingRegistry, Schedulers.immediate()),
                RetryPolicy.of(2, Duration.ZERO));
    }

    @Nested
    @DisplayName("LLM 节点")
    class Llm {

        @Test
        void testLlmNode_WithDefaults_ShouldPassInputThrough() {
            LlmNode node = factory.llm().build();
            SharedStore shared = SharedStore.of(Map.of("input", "hello"));

            Action action = node.run(shared);

            Assertions.assertEquals(Action.DEFAULT, action);
            Assertions.assertEquals("echo(null): hello", shared.get("output"));
            Assertions.assertEquals(2, node.getRetryPolicy().getMaxRetries());
        }

        @Test
        void testLlmNode_WithTemplateAndModel_ShouldRenderPrompt() {
            LlmNode node = factory.llm()
                    .name("summarize")
                    .inputKey("article")
                    .outputKey("summary")
                    .promptTemplate("Summarize in {lang}: {input}")
                    .model("echo/tiny")
                    .build();
            SharedStore shared = SharedStore.of(Map.of("article", "Flows are graphs.", "lang", "French"));

            node.run(shared);

            Assertions.assertEquals("summarize", node.getName());
            Assertions.assertEquals(List.of("Summarize in French: Flows are graphs."), prompts);
            Assertions.assertEquals("echo(tiny): Summarize in French: Flows are graphs.", shared.get("summary"));
        }

        @Test
        void testLlmNode_WhenProviderFails_ShouldRetryThenFail() {
            AtomicInteger calls = new AtomicInteger();
            llmRegistry.register("flaky", (prompt, model, options) -> {
                calls.incrementAndGet();
                throw new IllegalStateException("rate limited");
            });
            LlmNode node = factory.llm().model("flaky/any").build();

            NodeExecutionException ex = Assertions.assertThrows(NodeExecutionException.class, () -> node.run(new SharedStore()));

            Assertions.assertEquals(2, calls.get());
            Assertions.assertTrue(ex.getCause() instanceof IllegalStateException);
        }

        @Test
        void testLlmNode_WhenResultIsNull_ShouldRemoveStaleOutput() {
            llmRegistry.register("silent", (prompt, model, options) -> null);
            LlmNode node = factory.llm().model("silent/any").build();
            SharedStore shared = SharedStore.of(Map.of("input", "hello", "output", "stale answer"));

            Action action = node.run(shared);

            Assertions.assertEquals(Action.DEFAULT, action);
            Assertions.assertFalse(shared.containsKey("output"));
            Assertions.assertEquals("hello", shared.get("input"));
        }

        @Test
        void testLlmNode_WhenProviderUnknown_ShouldFailAfterRetries() {
            LlmNode node = factory.llm().model("missing/any").build();

            NodeExecutionException ex = Assertions.assertThrows(NodeExecutionException.class, () -> node.run(new SharedStore()));

            Assertions.assertTrue(ex.getCause() instanceof ProviderLookupException);
        }

        @Test
        void testAsyncLlmNode_ShouldWriteOutputInAsyncFlow() {
            AsyncLlmNode node = factory.asyncLlm().outputKey("answer").build();
            SharedStore shared = SharedStore.of(Map.of("input", "ping"));

            StepVerifier.create(node.runAsync(shared)).expectNext(Action.DEFAULT).verifyComplete();

            Assertions.assertEquals("echo(null): ping", shared.get("answer"));
        }

        @Test
        void testLlmNodes_ChainedInFlow_ShouldFeedOutputForward() {
            LlmNode first = factory.llm().outputKey("draft").build();
            LlmNode second = factory.llm().inputKey("draft").promptTemplate("Improve: {input}").outputKey("final").build();
            first.next(second);
            SharedStore shared = SharedStore.of(Map.of("input", "text"));

            new Flow(first).run(shared);

            Assertions.assertEquals("echo(null): Improve: echo(null): text", shared.get("final"));
        }
    }

    @Nested
    @DisplayName("搜索和向量化节点")
    class SearchAndEmbedding {

        @Test
        void testSearchNode_ShouldStoreRawResults() {
            SearchNode node = factory.search().build();
            SharedStore shared = SharedStore.of(Map.of("query", "reactor"));

            node.run(shared);

            Object stored = shared.get("search_results");
            Assertions.assertTrue(stored instanceof List);
            Assertions.assertEquals(2, ((List<?>) stored).size());
            Assertions.assertEquals(List.of(4), searchCounts);
        }

        @Test
        void testSearchNode_WhenFormatting_ShouldRenderNumberedText() {
            SearchNode node = factory.search().formatResults(true).numResults(2).outputKey("context").build();
            SharedStore shared = SharedStore.of(Map.of("query", "reactor"));

            node.run(shared);

            String expected = "1. Reactor\n   Reactive library\n   URL: https://projectreactor.io\n\n"
                    + "2. No title\n   No description\n   URL: ";
            Assertions.assertEquals(expected, shared.get("context"));
            Assertions.assertEquals(List.of(2), searchCounts);
        }

        @Test
        void testSearchNode_WhenQueryEmpty_ShouldSkipProvider() {
            SearchNode node = factory.search().build();
            SharedStore shared = new SharedStore();

            node.run(shared);

            Assertions.assertEquals(new ArrayList<SearchResult>(), shared.get("search_results"));
            Assertions.assertTrue(searchCounts.isEmpty());
        }

        @Test
        void testFormat_WhenNoResults_ShouldReturnPlaceholder() {
            Assertions.assertEquals(SearchNode.NO_RESULTS, SearchNode.format(List.of()));
            Assertions.assertEquals(SearchNode.NO_RESULTS, SearchNode.format(null));
        }

        @Test
        void testEmbeddingNode_ShouldStoreVector() {
            EmbeddingNode node = factory.embedding().model("fake/small").build();
            SharedStore shared = SharedStore.of(Map.of("text", "abc"));

            node.run(shared);

            Assertions.assertEquals(List.of(0.5, 3.0), shared.get("embedding"));
        }
    }
}
