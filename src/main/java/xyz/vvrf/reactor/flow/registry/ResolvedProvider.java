package xyz.vvrf.reactor.flow.registry;

import lombok.Value;

/**
 * 模型说明符的解析结果。
 */
@Value
public class ResolvedProvider<F> {
    String providerName;
    /** 模型名称，可能为 null (由 Provider 使用自己的默认模型) */
    String modelName;
    F provider;
}
