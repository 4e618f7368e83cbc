package org.flowgraph.cfg;

import java.util.List;
import java.util.Objects;

/**
 * for 循环。head 是循环头的源码，每次取下一个元素（或判断条件）时经过它。
 */
public record ForLoop(String head, Span span, List<FlowStmt> body, List<FlowStmt> orElse) implements FlowStmt {
    public ForLoop {
        Objects.requireNonNull(head, "head");
        span = span == null ? Span.UNKNOWN : span;
        body = List.copyOf(body);
        orElse = List.copyOf(orElse);
    }

    public ForLoop(String head, List<FlowStmt> body, List<FlowStmt> orElse) {
        this(head, Span.UNKNOWN, body, orElse);
    }

    public ForLoop(String head, List<FlowStmt> body) {
        this(head, Span.UNKNOWN, body, List.of());
    }
}
