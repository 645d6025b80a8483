package xyz.vvrf.reactor.flow.exception;

import lombok.Getter;

/**
 * 节点 exec (或批处理中某一项的 exec) 用尽全部重试且没有回退时抛出。
 * {@link #getCause()} 是最后一次尝试的异常 (或回退函数自身抛出的异常)。
 * 已经由前序节点写入 SharedStore 的数据不会回滚。
 */
@Getter
public class NodeExecutionException extends FlowException {

    /** 失败的节点名称 */
    private final String nodeName;
    /** 实际执行的尝试次数 */
    private final int attempts;

    public NodeExecutionException(String nodeName, int attempts, Throwable cause) {
        super(String.format("节点 '%s' 在 %d 次尝试后执行失败: %s",
                nodeName, attempts, cause == null ? "未知错误" : cause.getMessage()), cause);
        this.nodeName = nodeName;
        this.attempts = attempts;
    }
}
