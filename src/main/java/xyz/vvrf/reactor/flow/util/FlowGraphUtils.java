package xyz.vvrf.reactor.flow.util;

import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.reactor.flow.core.AbstractFlow;
import xyz.vvrf.reactor.flow.core.Action;
import xyz.vvrf.reactor.flow.core.BaseNode;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * 流程图的检查工具：收集可达节点、导出 Graphviz DOT。
 * 节点按对象身份区分，名称相同的不同节点会分别出现。
 */
@Slf4j
public final class FlowGraphUtils {

    private FlowGraphUtils() {
    }

    /**
     * 从流程的起始节点出发，按广度优先顺序收集所有可达节点。可以处理有环的图。
     *
     * @return 可达节点；流程没有起始节点时为空列表
     */
    public static List<BaseNode<?, ?>> reachableNodes(AbstractFlow<?, ?> flow) {
        BaseNode<?, ?> start = flow.getStartNode();
        if (start == null) {
            return Collections.emptyList();
        }
        Map<BaseNode<?, ?>, Boolean> visited = new IdentityHashMap<>();
        List<BaseNode<?, ?>> order = new ArrayList<>();
        Deque<BaseNode<?, ?>> queue = new ArrayDeque<>();
        queue.add(start);
        visited.put(start, Boolean.TRUE);
        while (!queue.isEmpty()) {
            BaseNode<?, ?> current = queue.poll();
            order.add(current);
            for (BaseNode<?, ?> next : current.getSuccessors().values()) {
                if (visited.put(next, Boolean.TRUE) == null) {
                    queue.add(next);
                }
            }
        }
        return order;
    }

    /**
     * 生成流程的 DOT 表示。默认动作的边不带标签，其余边以动作标签作为 label。
     * 嵌套流程显示为一个普通节点。
     */
    public static String toDot(AbstractFlow<?, ?> flow) {
        List<BaseNode<?, ?>> nodes = reachableNodes(flow);
        Map<BaseNode<?, ?>, String> ids = new IdentityHashMap<>();
        for (int i = 0; i < nodes.size(); i++) {
            ids.put(nodes.get(i), "n" + i);
        }

        String safeFlowName = escapeDotString(flow.getName());
        StringBuilder dot = new StringBuilder();
        dot.append(String.format("digraph \"%s\" {\n", safeFlowName));
        dot.append("  rankdir=LR;\n");
        dot.append(String.format("  label=\"%s\";\n", safeFlowName));

        for (BaseNode<?, ?> node : nodes) {
            String shape = (node instanceof AbstractFlow) ? "box3d" : "box";
            String style = (node == flow.getStartNode()) ? ", style=bold" : "";
            dot.append(String.format("  %s [label=\"%s\", shape=%s%s];\n",
                    ids.get(node), escapeDotString(node.getName()), shape, style));
        }
        for (BaseNode<?, ?> node : nodes) {
            for (Map.Entry<String, BaseNode<?, ?>> edge : node.getSuccessors().entrySet()) {
                String from = ids.get(node);
                String to = ids.get(edge.getValue());
                if (Action.DEFAULT_LABEL.equals(edge.getKey())) {
                    dot.append(String.format("  %s -> %s;\n", from, to));
                } else {
                    dot.append(String.format("  %s -> %s [label=\"%s\"];\n", from, to, escapeDotString(edge.getKey())));
                }
            }
        }
        dot.append("}\n");
        log.debug("流程 '{}' 生成了 DOT 图，节点数: {}", flow.getName(), nodes.size());
        return dot.toString();
    }

    private static String escapeDotString(String input) {
        if (input == null) {
            return "";
        }
        return input.replace("\\", "\\\\").replace("\"", "\\\"");
    }
}
