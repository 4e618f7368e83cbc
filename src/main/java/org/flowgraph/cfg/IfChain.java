package org.flowgraph.cfg;

import java.util.List;

/**
 * if / elif / else 链。orElse 为空表示没有末尾的 else。
 */
public record IfChain(List<Branch> branches, List<FlowStmt> orElse) implements FlowStmt {
    public IfChain {
        branches = List.copyOf(branches);
        orElse = List.copyOf(orElse);
    }

    public IfChain(List<Branch> branches) {
        this(branches, List.of());
    }

    @Override
    public Span span() {
        return branches.isEmpty() ? Span.UNKNOWN : branches.get(0).span();
    }
}
