package org.flowgraph.cfg;

/**
 * 源码行号范围，未知时为 -1
 */
public record Span(int lineStart, int lineEnd) {
    public static final Span UNKNOWN = new Span(-1, -1);
}
