package org.flowgraph.cfg;

/**
 * 构建器的输入：一条语句。
 * <p>
 * 支持的实现只有 {@link SimpleStmt}、{@link IfChain}、{@link WhileLoop} 和 {@link ForLoop}，
 * 其它实现会被 {@link CfgBuilder} 拒绝。
 */
public interface FlowStmt {

    /**
     * @return 语句在源码中的行号范围
     */
    Span span();
}
