package xyz.vvrf.reactor.flow.nodes;

import lombok.Builder;
import lombok.Getter;
import xyz.vvrf.reactor.flow.core.Action;
import xyz.vvrf.reactor.flow.core.Node;
import xyz.vvrf.reactor.flow.core.RetryPolicy;
import xyz.vvrf.reactor.flow.core.SharedStore;
import xyz.vvrf.reactor.flow.provider.SearchResult;
import xyz.vvrf.reactor.flow.provider.SearchRouter;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 网页搜索节点。从 {@code inputKey} 读取搜索词，把结果写入 {@code outputKey}。
 * {@code formatResults} 为 true 时写入格式化后的文本，否则写入 {@code List<SearchResult>}。
 * 空搜索词不调用 Provider，直接得到空列表 (或空字符串)。
 */
@Getter
public class SearchNode extends Node<String, Object> {

    public static final String DEFAULT_INPUT_KEY = "query";
    public static final String DEFAULT_OUTPUT_KEY = "search_results";
    public static final String NO_RESULTS = "No results found.";

    private final SearchRouter router;
    private final String inputKey;
    private final String outputKey;
    private final String provider;
    private final int numResults;
    private final boolean formatResults;
    private final Map<String, Object> options;

    @Builder
    private SearchNode(String name,
                       SearchRouter router,
                       String inputKey,
                       String outputKey,
                       String provider,
                       Integer numResults,
                       Boolean formatResults,
                       Map<String, Object> options,
                       Integer maxRetries,
                       Duration retryWait) {
        super(RetryPolicy.of(maxRetries != null ? maxRetries : LlmNode.DEFAULT_MAX_RETRIES,
                retryWait != null ? retryWait : LlmNode.DEFAULT_WAIT));
        this.router = Objects.requireNonNull(router, "SearchRouter 不能为空");
        this.inputKey = inputKey != null ? inputKey : DEFAULT_INPUT_KEY;
        this.outputKey = outputKey != null ? outputKey : DEFAULT_OUTPUT_KEY;
        this.provider = provider;
        this.numResults = numResults != null ? numResults : router.getDefaultNumResults();
        this.formatResults = formatResults != null && formatResults;
        this.options = options != null ? Collections.unmodifiableMap(new LinkedHashMap<>(options)) : Collections.emptyMap();
        if (name != null) {
            setName(name);
        }
    }

    @Override
    public String prep(SharedStore shared) {
        Object query = shared.getOrDefault(inputKey, "");
        return query == null ? "" : String.valueOf(query);
    }

    @Override
    public Object exec(String query) throws Exception {
        if (query == null || query.isEmpty()) {
            return formatResults ? "" : new ArrayList<SearchResult>();
        }
        List<SearchResult> results = router.search(query, provider, numResults, options);
        return formatResults ? format(results) : results;
    }

    /**
     * 把结果写入 {@code outputKey}。结果为 null 时 (例如回退返回 null) 该键被移除，
     * 而不是保留上一次的值，见 {@link SharedStore#put}。
     */
    @Override
    public Action post(SharedStore shared, String prepRes, Object execRes) {
        shared.put(outputKey, execRes);
        return Action.DEFAULT;
    }

    /**
     * 把搜索结果格式化为编号文本，各条之间空一行：
     * <pre>
     * 1. 标题
     *    摘要
     *    URL: 链接
     * </pre>
     * 缺失的标题、摘要和链接分别显示为 "No title"、"No description" 和空字符串。
     */
    public static String format(List<SearchResult> results) {
        if (results == null || results.isEmpty()) {
            return NO_RESULTS;
        }
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < results.size(); i++) {
            SearchResult r = results.get(i);
            if (i > 0) {
                sb.append("\n\n");
            }
            String title = r != null && r.getTitle() != null ? r.getTitle() : "No title";
            String snippet = r != null && r.getSnippet() != null ? r.getSnippet() : "No description";
            String url = r != null && r.getUrl() != null ? r.getUrl() : "";
            sb.append(i + 1).append(". ").append(title)
                    .append("\n   ").append(snippet)
                    .append("\n   URL: ").append(url);
        }
        return sb.toString();
    }
}
