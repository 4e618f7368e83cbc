package org.flowgraph.cfg;

import java.util.List;
import java.util.Objects;

/**
 * if / elif 链中的一个分支：条件 + 条件成立时执行的语句
 */
public record Branch(String condition, Span span, List<FlowStmt> body) {
    public Branch {
        Objects.requireNonNull(condition, "condition");
        span = span == null ? Span.UNKNOWN : span;
        body = List.copyOf(body);
    }

    public Branch(String condition, List<FlowStmt> body) {
        this(condition, Span.UNKNOWN, body);
    }
}
