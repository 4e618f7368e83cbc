package org.flowgraph.cfg;

import java.util.stream.Collectors;

/**
 * 把控制流图渲染成便于调试阅读的文本，每个节点一行：
 * <pre>
 * #2 [STATEMENT] x += 1 -> [3, 1]
 * </pre>
 */
public class CfgPrinter {

    public static String render(ControlFlowGraph graph) {
        StringBuilder sb = new StringBuilder();
        for (CfgNode node : graph.nodes()) {
            sb.append('#').append(node.id())
                    .append(" [").append(node.kind()).append("] ")
                    .append(node.label().replace('\n', ' '))
                    .append(" -> ")
                    .append(node.outgoing().stream().map(String::valueOf).collect(Collectors.joining(", ", "[", "]")))
                    .append(System.lineSeparator());
        }
        return sb.toString();
    }
}
