package xyz.vvrf.reactor.flow.exception;

import lombok.Getter;

import java.util.Collections;
import java.util.List;

/**
 * 请求的 Provider 未注册，或未指定 Provider 且没有配置默认 Provider。
 */
@Getter
public class ProviderLookupException extends FlowException {

    /** 请求的 Provider 名称，未指定且无默认值时为 null */
    private final String providerName;
    /** 查找时已注册的 Provider 名称 */
    private final List<String> availableProviders;

    public ProviderLookupException(String message, String providerName, List<String> availableProviders) {
        super(message);
        this.providerName = providerName;
        this.availableProviders = availableProviders == null
                ? Collections.emptyList()
                : Collections.unmodifiableList(availableProviders);
    }
}
