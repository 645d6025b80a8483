package xyz.vvrf.reactor.flow.execution;

import reactor.core.publisher.Mono;
import xyz.vvrf.reactor.flow.core.Action;
import xyz.vvrf.reactor.flow.core.BaseNode;
import xyz.vvrf.reactor.flow.core.SharedStore;

import java.util.UUID;

/**
 * 流程执行引擎接口。
 * 负责以一个请求 ID 运行顶层流程 (或单个节点)，并把执行事件通知给监控监听器。
 */
public interface FlowEngine {

    /**
     * 在调用线程上同步运行。
     *
     * @param root      顶层流程或节点 (不能是 {@link xyz.vvrf.reactor.flow.core.AsyncExecutable})
     * @param shared    共享存储
     * @param requestId 请求 ID，为 null 或空时自动生成
     * @return 终止动作，不为 null
     */
    Action run(BaseNode<?, ?> root, SharedStore shared, String requestId);

    /**
     * 异步运行。同步的根节点在订阅线程上执行。
     *
     * @return 发出终止动作的 Mono
     */
    Mono<Action> runAsync(BaseNode<?, ?> root, SharedStore shared, String requestId);

    default Action run(BaseNode<?, ?> root, SharedStore shared) {
        return run(root, shared, generateRequestId());
    }

    default Mono<Action> runAsync(BaseNode<?, ?> root, SharedStore shared) {
        return runAsync(root, shared, generateRequestId());
    }

    static String generateRequestId() {
        return "flow-req-" + UUID.randomUUID().toString().substring(0, 8);
    }
}
