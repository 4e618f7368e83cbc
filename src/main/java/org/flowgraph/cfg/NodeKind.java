package org.flowgraph.cfg;

/**
 * 节点类型：普通语句、条件判断、循环头，以及两个哨兵节点
 */
public enum NodeKind {
    START,
    EXIT,
    STATEMENT,
    CONDITION,
    LOOP
}
