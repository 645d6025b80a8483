package xyz.vvrf.reactor.flow.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * 对 prep 返回的每组参数依次完整遍历一次图，每次从起始节点开始，节点参数为 {@code 流程参数 ∪ 该组参数}。
 * exec 结果是各次遍历的终止动作列表；post 默认返回 {@link Action#DEFAULT}。
 */
public class BatchFlow extends AbstractFlow<List<Map<String, Object>>, List<Action>> {

    public BatchFlow() {
        super();
    }

    public BatchFlow(BaseNode<?, ?> startNode) {
        super(startNode);
    }

    @Override
    protected Action internalRun(SharedStore shared) {
        List<Map<String, Object>> prepRes = prep(shared);
        List<Map<String, Object>> paramSets = prepRes != null ? prepRes : Collections.emptyList();
        List<Action> terminals = new ArrayList<>(paramSets.size());
        for (Map<String, Object> batchParams : paramSets) {
            terminals.add(orchestrate(shared, mergeParams(batchParams)));
        }
        return Action.normalize(post(shared, prepRes, terminals));
    }
}
