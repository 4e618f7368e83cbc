package org.flowgraph.cfg;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * 一个翻译单元（方法体或模块）的控制流图
 * <p>
 * 所有节点按创建顺序存放在 {@code nodes} 中，节点编号即下标；
 * 第一个节点是 START，{@link CfgBuilder} 收尾时追加的最后一个节点是 EXIT。
 * 收尾之后图只读，可以被多个线程同时遍历。
 */
public class ControlFlowGraph {
    // 按创建顺序收集的全部节点
    private final List<CfgNode> nodes = new ArrayList<>();

    private final int start;
    private int exit = -1;

    // 收尾标记（不输出 JSON）
    private transient boolean closed;

    ControlFlowGraph() {
        this.start = newNode("START", NodeKind.START, -1, -1);
    }

    /**
     * 分配一个新节点并返回其编号
     */
    int newNode(String label, NodeKind kind, int lineStart, int lineEnd) {
        checkOpen();
        int id = nodes.size();
        nodes.add(new CfgNode(id, label, kind, lineStart, lineEnd));
        return id;
    }

    /**
     * 建立 from -> to 的边，同时维护 to 的前驱列表。重复建边不产生任何效果。
     */
    void connect(int from, int to) {
        checkOpen();
        if (!owns(from) || !owns(to)) {
            throw new InvalidEdgeException(from, to, nodes.size());
        }
        CfgNode source = nodes.get(from);
        if (source.hasSuccessor(to)) {
            return;
        }
        source.addSuccessor(to);
        nodes.get(to).addPredecessor(from);
    }

    /**
     * 追加 EXIT 节点，把最终的开放前沿全部连到它，之后图不可再修改
     */
    void close(Iterable<Integer> frontier) {
        exit = newNode("EXIT", NodeKind.EXIT, -1, -1);
        for (Integer id : frontier) {
            connect(id, exit);
        }
        closed = true;
    }

    private void checkOpen() {
        if (closed) {
            throw new IllegalStateException("Control flow graph is already closed");
        }
    }

    private boolean owns(int id) {
        return id >= 0 && id < nodes.size();
    }

    public CfgNode node(int id) {
        if (!owns(id)) {
            throw new IndexOutOfBoundsException("No node #" + id + " in graph of size " + nodes.size());
        }
        return nodes.get(id);
    }

    public List<CfgNode> nodes() {
        return Collections.unmodifiableList(nodes);
    }

    public int size() {
        return nodes.size();
    }

    public CfgNode start() {
        return nodes.get(start);
    }

    public CfgNode exit() {
        if (exit < 0) {
            throw new IllegalStateException("Control flow graph has not been closed yet");
        }
        return nodes.get(exit);
    }

    public boolean hasEdge(int from, int to) {
        return owns(from) && nodes.get(from).hasSuccessor(to);
    }

    public int edgeCount() {
        int count = 0;
        for (CfgNode node : nodes) {
            count += node.outgoing().size();
        }
        return count;
    }

    /**
     * 按标签查找节点，返回第一个匹配项。
     * <p>
     * 标签只是源码文本，两条相同的语句会得到相同的标签，这时结果只是其中之一；
     * 构建和分析一律使用节点编号。
     */
    public Optional<Integer> lookupByLabel(String label) {
        for (CfgNode node : nodes) {
            if (node.label().equals(label)) {
                return Optional.of(node.id());
            }
        }
        return Optional.empty();
    }
}
