package xyz.vvrf.reactor.flow.exception;

/**
 * 流程引擎所有异常的基类 (非受检)。
 */
public class FlowException extends RuntimeException {

    public FlowException(String message) {
        super(message);
    }

    public FlowException(String message, Throwable cause) {
        super(message, cause);
    }
}
