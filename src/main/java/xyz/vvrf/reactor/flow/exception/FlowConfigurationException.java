package xyz.vvrf.reactor.flow.exception;

/**
 * 配置期错误：非法的重试/等待参数、格式错误的 Provider 名称、缺少起始节点等。
 */
public class FlowConfigurationException extends FlowException {

    public FlowConfigurationException(String message) {
        super(message);
    }
}
