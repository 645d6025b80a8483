package xyz.vvrf.reactor.flow.nodes;

import xyz.vvrf.reactor.flow.core.SharedStore;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 带 {@code {name}} 占位符的提示词模板。
 * 占位符名称由字母、数字和下划线组成；渲染时缺失的值替换为空字符串。
 */
public final class PromptTemplate {

    /** 默认模板：直接传递输入 */
    public static final String DEFAULT_TEMPLATE = "{input}";
    /** 输入键的值总是可以通过这个占位符引用 */
    public static final String INPUT_PLACEHOLDER = "input";

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{(\\w+)}", Pattern.UNICODE_CHARACTER_CLASS);

    private final String template;
    private final Set<String> keys;

    private PromptTemplate(String template) {
        this.template = template;
        Set<String> found = new LinkedHashSet<>();
        Matcher matcher = PLACEHOLDER.matcher(template);
        while (matcher.find()) {
            found.add(matcher.group(1));
        }
        this.keys = Collections.unmodifiableSet(found);
    }

    public static PromptTemplate of(String template) {
        return new PromptTemplate(Objects.requireNonNull(template, "模板不能为空"));
    }

    public String getTemplate() {
        return template;
    }

    /**
     * @return 模板中出现的占位符名称，按首次出现的顺序
     */
    public Set<String> getKeys() {
        return keys;
    }

    public String render(Map<String, ?> values) {
        Matcher matcher = PLACEHOLDER.matcher(template);
        StringBuilder sb = new StringBuilder();
        while (matcher.find()) {
            Object value = values != null ? values.get(matcher.group(1)) : null;
            matcher.appendReplacement(sb, Matcher.quoteReplacement(value == null ? "" : String.valueOf(value)));
        }
        matcher.appendTail(sb);
        return sb.toString();
    }

    /**
     * 从共享存储收集渲染所需的值：所有占位符和 inputKey，缺失的值为 {@code ""}。
     * 模板使用 {@code {input}} 而 inputKey 不是 "input" 时，{@code input} 取 inputKey 的值。
     */
    public Map<String, Object> gather(SharedStore shared, String inputKey) {
        Map<String, Object> context = new LinkedHashMap<>();
        for (String key : keys) {
            context.put(key, shared.getOrDefault(key, ""));
        }
        if (!context.containsKey(inputKey)) {
            context.put(inputKey, shared.getOrDefault(inputKey, ""));
        }
        if (keys.contains(INPUT_PLACEHOLDER) && !INPUT_PLACEHOLDER.equals(inputKey)) {
            context.put(INPUT_PLACEHOLDER, shared.getOrDefault(inputKey, ""));
        }
        return context;
    }

    @Override
    public String toString() {
        return template;
    }
}
