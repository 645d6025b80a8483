package xyz.vvrf.reactor.flow.provider;

import lombok.Builder;
import lombok.Value;

/**
 * 单条搜索结果。字段可能为 null，格式化时使用占位文本。
 */
@Value
@Builder
public class SearchResult {
    String title;
    String snippet;
    String url;

    public static SearchResult of(String title, String snippet, String url) {
        return new SearchResult(title, snippet, url);
    }
}
