package xyz.vvrf.reactor.flow.core;

import java.util.Map;

/**
 * 同步流程。prep 默认返回流程自身的参数，post 默认返回遍历的终止动作。
 * <pre>{@code
 * Flow flow = new Flow();
 * flow.start(a).next(b);
 * a.next(c, "retry");
 * Action result = flow.run(shared);
 * }</pre>
 */
public class Flow extends AbstractFlow<Map<String, Object>, Action> {

    public Flow() {
        super();
    }

    public Flow(BaseNode<?, ?> startNode) {
        super(startNode);
    }

    @Override
    public Map<String, Object> prep(SharedStore shared) {
        return getParams();
    }

    @Override
    public Action post(SharedStore shared, Map<String, Object> prepRes, Action execRes) {
        return execRes;
    }

    @Override
    protected Action internalRun(SharedStore shared) {
        Map<String, Object> prepRes = prep(shared);
        Action terminal = orchestrate(shared, mergeParams(prepRes));
        return Action.normalize(post(shared, prepRes, terminal));
    }
}
