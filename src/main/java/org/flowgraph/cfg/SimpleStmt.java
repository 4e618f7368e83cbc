package org.flowgraph.cfg;

import java.util.Objects;

/**
 * 不产生分支的普通语句（赋值、调用、return、break 等）
 */
public record SimpleStmt(String code, Span span) implements FlowStmt {
    public SimpleStmt {
        Objects.requireNonNull(code, "code");
        span = span == null ? Span.UNKNOWN : span;
    }

    public SimpleStmt(String code) {
        this(code, Span.UNKNOWN);
    }
}
