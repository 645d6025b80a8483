package xyz.vvrf.reactor.flow.core;

import reactor.core.publisher.Mono;

/**
 * 能在 Reactor 上非阻塞地执行完整生命周期的节点或流程。
 * 异步遍历遇到实现了该接口的节点时使用 {@link #internalRunAsync(SharedStore)}，否则在当前线程同步执行。
 */
public interface AsyncExecutable {

    /**
     * 执行一次完整的生命周期，不检查后继。
     *
     * @return 规范化后的动作，不为空
     */
    Mono<Action> internalRunAsync(SharedStore shared);
}
