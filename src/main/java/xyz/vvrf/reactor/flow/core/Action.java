package xyz.vvrf.reactor.flow.core;

/**
 * 节点 post 阶段返回的动作，用于在后继表中选择下一个节点。
 * <p>
 * 后继表按 {@link #label()} 精确匹配，不同标签之间没有隐式回退。
 * 调用方可以为某个流程声明一组枚举动作：
 * <pre>{@code
 * enum ReviewAction implements Action {
 *     APPROVE, REJECT;
 *     public String label() { return name().toLowerCase(); }
 * }
 * }</pre>
 */
public interface Action {

    /** 默认动作的标签 */
    String DEFAULT_LABEL = "default";

    /** 默认动作：post 未返回动作 (null 或空标签) 时使用 */
    Action DEFAULT = new NamedAction(DEFAULT_LABEL);

    /**
     * @return 动作标签，用作后继表的键
     */
    String label();

    /**
     * 创建一个按字符串标签命名的动作。
     *
     * @param label 标签，null 或空串视为默认动作
     * @return 动作实例
     */
    static Action of(String label) {
        if (label == null || label.isEmpty()) {
            return DEFAULT;
        }
        return new NamedAction(label);
    }

    /**
     * 将可能为 null 的动作规范化。
     *
     * @param action 节点返回的动作
     * @return 非 null 的动作；null 或空标签返回 {@link #DEFAULT}
     */
    static Action normalize(Action action) {
        if (action == null || action.label() == null || action.label().isEmpty()) {
            return DEFAULT;
        }
        return action;
    }

    /**
     * 获取动作的规范化标签。
     */
    static String labelOf(Action action) {
        return normalize(action).label();
    }

    /**
     * 判断两个动作的标签是否相同 (枚举动作与 {@link #of(String)} 创建的动作可以互相比较)。
     */
    default boolean matches(Action other) {
        return labelOf(this).equals(labelOf(other));
    }
}
