package xyz.vvrf.reactor.flow.provider;

import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * LLM 调用的 Provider。实现负责具体 API 的协议、认证和超时。
 */
@FunctionalInterface
public interface LlmProvider {

    /**
     * @param prompt  完整的提示词
     * @param model   模型名称，null 表示 Provider 的默认模型
     * @param options 透传给 Provider 的额外参数 (可能为空 Map，不为 null)
     * @return 模型回复文本
     */
    String call(String prompt, String model, Map<String, Object> options) throws Exception;

    /**
     * 异步调用。默认包装阻塞的 {@link #call}，由调用方决定在哪个 Scheduler 上订阅。
     */
    default Mono<String> callAsync(String prompt, String model, Map<String, Object> options) {
        return Mono.fromCallable(() -> call(prompt, model, options));
    }
}
