package org.flowgraph.cfg;

/**
 * 建边时引用了不属于当前图的节点编号。出现即说明构建逻辑有 bug，与输入无关。
 */
public class InvalidEdgeException extends IllegalArgumentException {
    private final int from;
    private final int to;

    public InvalidEdgeException(int from, int to, int size) {
        super("Invalid edge " + from + " -> " + to + ": graph has " + size + " nodes");
        this.from = from;
        this.to = to;
    }

    public int from() {
        return from;
    }

    public int to() {
        return to;
    }
}
