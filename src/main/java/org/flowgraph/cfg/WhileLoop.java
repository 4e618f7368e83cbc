package org.flowgraph.cfg;

import java.util.List;
import java.util.Objects;

/**
 * while 循环，orElse 是循环正常结束（未提前退出）时执行的语句
 */
public record WhileLoop(String test, Span span, List<FlowStmt> body, List<FlowStmt> orElse) implements FlowStmt {
    public WhileLoop {
        Objects.requireNonNull(test, "test");
        span = span == null ? Span.UNKNOWN : span;
        body = List.copyOf(body);
        orElse = List.copyOf(orElse);
    }

    public WhileLoop(String test, List<FlowStmt> body, List<FlowStmt> orElse) {
        this(test, Span.UNKNOWN, body, orElse);
    }

    public WhileLoop(String test, List<FlowStmt> body) {
        this(test, Span.UNKNOWN, body, List.of());
    }
}
