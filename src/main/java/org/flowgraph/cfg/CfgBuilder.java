package org.flowgraph.cfg;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 构建控制流图 (CFG)
 * <p>
 * 从 START 开始顺序遍历语句列表，每一步维护一个“开放前沿”：
 * 后继尚未确定的节点集合。下一条语句创建的节点会接收前沿中所有节点的边，
 * 最后剩下的前沿全部连到 EXIT。
 * <p>
 * 循环体的出口除了回到循环头，还会直接连到整个循环之后的语句（跳过 else），
 * 用来保守地表示体内可能发生的提前退出。这里不区分体内是否真的有 break。
 */
public class CfgBuilder {

    /**
     * 为一个语句序列（模块顶层或方法体）构建控制流图
     *
     * @param program 顶层语句
     * @return 已收尾的只读图
     * @throws UnsupportedConstructException 遇到没有构建规则的语句
     */
    public static ControlFlowGraph build(List<? extends FlowStmt> program) {
        ControlFlowGraph graph = new ControlFlowGraph();
        Set<Integer> frontier = new LinkedHashSet<>();
        frontier.add(graph.start().id());

        Set<Integer> exits = new CFGVisitor(graph).visitBlock(program, frontier);

        graph.close(exits);
        return graph;
    }

    /**
     * 核心 Visitor：接收一组前驱节点 (prevIds)，返回一组出口节点
     */
    private static class CFGVisitor {
        private final ControlFlowGraph graph;

        CFGVisitor(ControlFlowGraph graph) {
            this.graph = graph;
        }

        Set<Integer> visit(FlowStmt stmt, Set<Integer> prevIds) {
            if (stmt instanceof SimpleStmt simple) {
                return visitSimple(simple, prevIds);
            } else if (stmt instanceof IfChain ifChain) {
                return visitIf(ifChain, prevIds);
            } else if (stmt instanceof WhileLoop whileLoop) {
                return visitLoop(whileLoop.test(), NodeKind.CONDITION, whileLoop.span(),
                        whileLoop.body(), whileLoop.orElse(), prevIds);
            } else if (stmt instanceof ForLoop forLoop) {
                return visitLoop(forLoop.head(), NodeKind.LOOP, forLoop.span(),
                        forLoop.body(), forLoop.orElse(), prevIds);
            }
            throw new UnsupportedConstructException(stmt == null ? "null" : stmt.getClass().getSimpleName());
        }

        // 空列表不创建节点，原样返回前沿
        Set<Integer> visitBlock(List<? extends FlowStmt> stmts, Set<Integer> prevIds) {
            Set<Integer> currentPrevs = prevIds;
            for (FlowStmt s : stmts) {
                currentPrevs = visit(s, currentPrevs);
            }
            return currentPrevs;
        }

        private Set<Integer> visitSimple(SimpleStmt stmt, Set<Integer> prevIds) {
            int id = newNode(stmt.code(), NodeKind.STATEMENT, stmt.span(), prevIds);
            return single(id);
        }

        private Set<Integer> visitIf(IfChain chain, Set<Integer> prevIds) {
            if (chain.branches().isEmpty()) {
                throw new UnsupportedConstructException("IfChain", "if chain without any condition");
            }

            // 所有分支的出口汇合到这里，交给 if 链之后的语句
            Set<Integer> finalExits = new LinkedHashSet<>();
            // 条件不成立时控制流所在的位置：第一个条件的入口是外部前沿，之后是上一个条件节点
            Set<Integer> falsePrevs = prevIds;

            for (Branch branch : chain.branches()) {
                int testId = newNode(branch.condition(), NodeKind.CONDITION, branch.span(), falsePrevs);
                Set<Integer> test = single(testId);

                // true 分支；分支体为空时条件节点直接汇合
                finalExits.addAll(visitBlock(branch.body(), test));

                falsePrevs = test;
            }

            // 末尾的 else 是无条件分支；没有 else 时最后一个条件节点直接流出
            finalExits.addAll(visitBlock(chain.orElse(), falsePrevs));
            return finalExits;
        }

        /**
         * while 和 for 共用的拓扑：
         * prev -> head -> body -> head（回边）
         * head -> else（条件不成立），body 出口 -> else（最后一轮后条件不成立）
         * body 出口 -> 循环之后（提前退出，跳过 else）
         */
        private Set<Integer> visitLoop(String head, NodeKind kind, Span span,
                                       List<FlowStmt> body, List<FlowStmt> orElse,
                                       Set<Integer> prevIds) {
            int headId = newNode(head, kind, span, prevIds);
            Set<Integer> loopEntry = single(headId);

            // 循环体为空时不产生回边，也就不会出现 head -> head 的自环
            Set<Integer> bodyExits = body.isEmpty()
                    ? Collections.emptySet()
                    : visitBlock(body, loopEntry);

            // Body 的正常出口 -> 回到循环头
            for (Integer exit : bodyExits) {
                graph.connect(exit, headId);
            }

            Set<Integer> loopExits = new LinkedHashSet<>();
            if (orElse.isEmpty()) {
                loopExits.add(headId);
            } else {
                Set<Integer> elseEntry = new LinkedHashSet<>(loopEntry);
                elseEntry.addAll(bodyExits);
                loopExits.addAll(visitBlock(orElse, elseEntry));
            }
            loopExits.addAll(bodyExits);
            return loopExits;
        }

        private int newNode(String label, NodeKind kind, Span span, Set<Integer> prevIds) {
            int id = graph.newNode(label, kind, span.lineStart(), span.lineEnd());
            for (Integer pid : prevIds) {
                graph.connect(pid, id);
            }
            return id;
        }

        private static Set<Integer> single(int id) {
            Set<Integer> set = new LinkedHashSet<>();
            set.add(id);
            return set;
        }
    }
}
