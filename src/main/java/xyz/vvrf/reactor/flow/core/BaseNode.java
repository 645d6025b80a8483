package xyz.vvrf.reactor.flow.core;

import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.reactor.flow.execution.BlockingRetryExecutor;
import xyz.vvrf.reactor.flow.monitor.FlowMonitor;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * 所有节点和流程的公共契约：三阶段生命周期 prep → exec → post、参数和后继表。
 * <p>
 * <ul>
 *     <li>{@link #prep(SharedStore)}: 从共享存储读取数据，为 exec 准备输入。</li>
 *     <li>{@link #exec(Object)}: 纯计算，不能访问共享存储。</li>
 *     <li>{@link #post(SharedStore, Object, Object)}: 写回共享存储，返回选择后继的动作。</li>
 * </ul>
 * 流程遍历时执行的是节点的浅拷贝 ({@link #copy()})，后继表在拷贝之间共享，参数和运行状态不共享。
 *
 * @param <P> prep 结果类型
 * @param <E> exec 结果类型
 */
@Slf4j
public abstract class BaseNode<P, E> implements Cloneable {

    private String name;
    private Map<String, Object> params = Collections.emptyMap();
    private Map<String, BaseNode<?, ?>> successors = new LinkedHashMap<>();
    private FlowMonitor monitor = FlowMonitor.NOOP;

    /**
     * 节点名称，用于日志、监控和异常信息。未设置时使用类的简单名称。
     */
    public String getName() {
        if (name != null) {
            return name;
        }
        String simpleName = getClass().getSimpleName();
        return simpleName.isEmpty() ? getClass().getName() : simpleName;
    }

    public void setName(String name) {
        this.name = name;
    }

    public Map<String, Object> getParams() {
        return params;
    }

    /**
     * 设置节点参数 (复制一份)。流程在每一步会用当前参数覆盖节点副本的参数。
     */
    public void setParams(Map<String, Object> params) {
        this.params = (params == null || params.isEmpty())
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(params));
    }

    public FlowMonitor getMonitor() {
        return monitor;
    }

    public void setMonitor(FlowMonitor monitor) {
        this.monitor = monitor != null ? monitor : FlowMonitor.NOOP;
    }

    /**
     * @return 后继表的只读视图：动作标签 → 下一个节点
     */
    public Map<String, BaseNode<?, ?>> getSuccessors() {
        return Collections.unmodifiableMap(successors);
    }

    /**
     * @return 动作对应的后继节点，没有时返回 null
     */
    public BaseNode<?, ?> getSuccessor(Action action) {
        return successors.get(Action.labelOf(action));
    }

    // --- 边构建 ---

    /**
     * 添加默认动作的边。
     *
     * @return 目标节点，便于链式调用 {@code a.next(b).next(c)}
     */
    public <N extends BaseNode<?, ?>> N next(N node) {
        return next(node, Action.DEFAULT);
    }

    public <N extends BaseNode<?, ?>> N next(N node, String action) {
        return next(node, Action.of(action));
    }

    /**
     * 添加带动作标签的边。同一标签重复注册时覆盖旧目标并记录警告。
     */
    public <N extends BaseNode<?, ?>> N next(N node, Action action) {
        Objects.requireNonNull(node, "后继节点不能为空");
        String label = Action.labelOf(action);
        BaseNode<?, ?> previous = successors.put(label, node);
        if (previous != null && previous != node) {
            log.warn("节点 '{}' 的动作 '{}' 已有后继 '{}'，将被覆盖为 '{}'",
                    getName(), label, previous.getName(), node.getName());
        }
        return node;
    }

    /**
     * {@code a.on("approve").then(b)} 形式的边构建。
     */
    public Transition on(String action) {
        return new Transition(this, Action.of(action));
    }

    public Transition on(Action action) {
        return new Transition(this, action);
    }

    // --- 生命周期 ---

    public P prep(SharedStore shared) {
        return null;
    }

    public E exec(P prepRes) throws Exception {
        return null;
    }

    public Action post(SharedStore shared, P prepRes, E execRes) {
        return Action.DEFAULT;
    }

    /**
     * 执行 exec 阶段。基类只尝试一次，{@link Node} 覆盖以加入重试和回退。
     */
    protected E internalExec(P prepRes) {
        return BlockingRetryExecutor.execute(getName(), RetryPolicy.NONE,
                attempt -> exec(prepRes),
                lastError -> {
                    throw lastError;
                },
                monitor);
    }

    /**
     * 执行一次完整的生命周期，返回规范化后的动作 (不为 null)。
     * prep 和 post 的异常不重试，直接传播；exec 失败时 post 不执行。
     */
    protected Action internalRun(SharedStore shared) {
        P prepRes = prep(shared);
        E execRes = internalExec(prepRes);
        return Action.normalize(post(shared, prepRes, execRes));
    }

    /**
     * 单独运行该节点。存在后继时只记录警告，不会沿后继继续执行；需要遍历请使用 {@link Flow}。
     */
    public Action run(SharedStore shared) {
        warnIfSuccessorsIgnored();
        return internalRun(shared);
    }

    protected void warnIfSuccessorsIgnored() {
        if (!successors.isEmpty()) {
            log.warn("节点 '{}' 存在后继节点 {}，单独运行时不会执行它们。请使用 Flow。",
                    getName(), successors.keySet());
        }
    }

    /**
     * 浅拷贝：后继表和起始节点等结构共享，参数和运行状态 (例如重试计数) 互不影响。
     */
    @SuppressWarnings("unchecked")
    public BaseNode<P, E> copy() {
        try {
            return (BaseNode<P, E>) super.clone();
        } catch (CloneNotSupportedException e) {
            throw new IllegalStateException("无法复制节点 '" + getName() + "'", e);
        }
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{name='" + getName() + "', successors=" + successors.keySet() + '}';
    }

    /**
     * 带动作标签的待完成边。
     */
    public static final class Transition {
        private final BaseNode<?, ?> source;
        private final Action action;

        private Transition(BaseNode<?, ?> source, Action action) {
            this.source = source;
            this.action = action;
        }

        public <N extends BaseNode<?, ?>> N then(N target) {
            return source.next(target, action);
        }
    }
}
