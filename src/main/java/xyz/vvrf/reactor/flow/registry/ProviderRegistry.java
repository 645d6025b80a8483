package xyz.vvrf.reactor.flow.registry;

import java.util.List;
import java.util.Optional;

/**
 * Provider 注册表接口。
 * 负责管理 Provider 名称到 Provider 实现的映射，以及默认 Provider。
 * 每个注册表实例对应一类 Provider (LLM、搜索、向量化)。
 *
 * @param <F> Provider 类型
 */
public interface ProviderRegistry<F> {

    /**
     * {@code "provider/model"} 形式说明符中 Provider 与模型的分隔符。
     */
    String SEPARATOR = "/";

    /**
     * @return 注册表的类别名称，用于日志和异常信息 (例如 "llm")
     */
    String getCategory();

    /**
     * 注册一个 Provider。名称已存在时替换旧的实现。
     * 未配置默认 Provider 时，第一个注册的 Provider 成为默认值。
     *
     * @param name     Provider 名称 (非空、不含 "/"、不含空白字符)
     * @param provider Provider 实现 (不能为空)
     * @throws xyz.vvrf.reactor.flow.exception.FlowConfigurationException 如果名称或实现无效
     */
    void register(String name, F provider);

    /**
     * 移除一个 Provider。如果它是默认 Provider，则默认值被清空。
     *
     * @return 如果该名称之前已注册则为 true
     */
    boolean unregister(String name);

    /**
     * @throws xyz.vvrf.reactor.flow.exception.ProviderLookupException 如果该名称未注册
     */
    void setDefaultProvider(String name);

    Optional<String> getDefaultProvider();

    /**
     * @return 按注册顺序排列的 Provider 名称
     */
    List<String> getProviderNames();

    boolean contains(String name);

    /**
     * 按名称查找 Provider。
     *
     * @param name Provider 名称，null 表示默认 Provider
     * @throws xyz.vvrf.reactor.flow.exception.ProviderLookupException 如果未注册或没有默认 Provider
     */
    F lookup(String name);

    /**
     * 解析模型说明符。
     * <ul>
     *     <li>{@code "openai/gpt-4o"}: Provider {@code openai}，模型 {@code gpt-4o} (在第一个 "/" 处分割)。</li>
     *     <li>{@code "gpt-4o"} 或 null: 默认 Provider，模型为说明符本身。</li>
     * </ul>
     *
     * @throws xyz.vvrf.reactor.flow.exception.ProviderLookupException 如果 Provider 未注册或没有默认 Provider
     */
    ResolvedProvider<F> resolve(String specifier);
}
