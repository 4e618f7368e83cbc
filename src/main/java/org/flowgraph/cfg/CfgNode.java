package org.flowgraph.cfg;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 控制流图中的一个节点（一条语句、一个条件判断或一个循环头）
 * <p>
 * 邻接关系只保存节点编号，节点本身由 {@link ControlFlowGraph} 统一持有。
 */
public class CfgNode {
    private final int id;               // 图内编号，即在 nodes 列表中的下标
    private final String label;         // 语句源码（仅用于展示，可能重复）
    private final NodeKind kind;
    private final int lineStart;        // 起始行号，未知时为 -1
    private final int lineEnd;          // 结束行号，未知时为 -1

    // 后继 / 前驱编号，按建边顺序排列
    private final List<Integer> outgoing = new ArrayList<>();
    private final List<Integer> ingoing = new ArrayList<>();

    CfgNode(int id, String label, NodeKind kind, int lineStart, int lineEnd) {
        this.id = id;
        this.label = label;
        this.kind = kind;
        this.lineStart = lineStart;
        this.lineEnd = lineEnd;
    }

    public int id() {
        return id;
    }

    public String label() {
        return label;
    }

    public NodeKind kind() {
        return kind;
    }

    public int lineStart() {
        return lineStart;
    }

    public int lineEnd() {
        return lineEnd;
    }

    public List<Integer> outgoing() {
        return Collections.unmodifiableList(outgoing);
    }

    public List<Integer> ingoing() {
        return Collections.unmodifiableList(ingoing);
    }

    boolean hasSuccessor(int to) {
        return outgoing.contains(to);
    }

    void addSuccessor(int to) {
        outgoing.add(to);
    }

    void addPredecessor(int from) {
        ingoing.add(from);
    }

    @Override
    public String toString() {
        return "#" + id + " " + label;
    }
}
