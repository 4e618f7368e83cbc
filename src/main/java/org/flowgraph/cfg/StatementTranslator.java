package org.flowgraph.cfg;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.NodeList;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.stmt.*;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 把 JavaParser 的语句树转换成构建器使用的 {@link FlowStmt}
 * <p>
 * BlockStmt 本身不建节点，只展开其中的语句；if / else if / else 合并为一条 {@link IfChain}。
 * Java 的循环没有 else 子句，转换出的循环 orElse 始终为空。
 */
public class StatementTranslator {

    /**
     * 转换一个语句块（通常是方法体）
     */
    public List<FlowStmt> translate(BlockStmt block) {
        List<FlowStmt> out = new ArrayList<>();
        for (Statement s : block.getStatements()) {
            collectStmtRecursive(s, out);
        }
        return out;
    }

    /**
     * 转换单条语句，块会被展开，因此可能得到零条或多条结果
     */
    public List<FlowStmt> translate(Statement stmt) {
        List<FlowStmt> out = new ArrayList<>();
        collectStmtRecursive(stmt, out);
        return out;
    }

    private void collectStmtRecursive(Statement s, List<FlowStmt> out) {
        // 如果是 BlockStmt，本身不建节点，只遍历里面的语句
        if (s.isBlockStmt()) {
            for (Statement child : s.asBlockStmt().getStatements()) {
                collectStmtRecursive(child, out);
            }
            return;
        }
        // 单独的分号
        if (s.isEmptyStmt()) {
            return;
        }

        if (s.isIfStmt()) {
            out.add(translateIf(s.asIfStmt()));
        } else if (s.isWhileStmt()) {
            WhileStmt ws = s.asWhileStmt();
            out.add(new WhileLoop(ws.getCondition().toString(), spanOf(ws), translate(ws.getBody()), List.of()));
        } else if (s.isForStmt()) {
            ForStmt fs = s.asForStmt();
            out.add(new ForLoop(forHead(fs), spanOf(fs), translate(fs.getBody()), List.of()));
        } else if (s.isForEachStmt()) {
            ForEachStmt fe = s.asForEachStmt();
            String head = "for (" + fe.getVariable() + " : " + fe.getIterable() + ")";
            out.add(new ForLoop(head, spanOf(fe), translate(fe.getBody()), List.of()));
        } else if (s.isDoStmt() || s.isSwitchStmt() || s.isTryStmt() || s.isSynchronizedStmt()
                || s.isLabeledStmt() || s.isUnparsableStmt()) {
            throw new UnsupportedConstructException(s.getClass().getSimpleName(),
                    "Unsupported construct " + s.getClass().getSimpleName() + " at line " + spanOf(s).lineStart());
        } else {
            // 其它类型语句（表达式、return、break 等）都是普通语句
            out.add(new SimpleStmt(s.toString(), spanOf(s)));
        }
    }

    // 沿 else if 链向下，直到遇到普通 else 或链结束
    private IfChain translateIf(IfStmt first) {
        List<Branch> branches = new ArrayList<>();
        IfStmt current = first;
        while (true) {
            branches.add(new Branch(current.getCondition().toString(), spanOf(current), translate(current.getThenStmt())));
            if (current.getElseStmt().isEmpty()) {
                return new IfChain(branches, List.of());
            }
            Statement elseStmt = current.getElseStmt().get();
            if (!elseStmt.isIfStmt()) {
                return new IfChain(branches, translate(elseStmt));
            }
            current = elseStmt.asIfStmt();
        }
    }

    private static String forHead(ForStmt fs) {
        return "for (" + join(fs.getInitialization()) + "; "
                + fs.getCompare().map(Expression::toString).orElse("") + "; "
                + join(fs.getUpdate()) + ")";
    }

    private static String join(NodeList<Expression> expressions) {
        return expressions.stream().map(Expression::toString).collect(Collectors.joining(", "));
    }

    private static Span spanOf(Node n) {
        return new Span(n.getBegin().map(p -> p.line).orElse(-1), n.getEnd().map(p -> p.line).orElse(-1));
    }
}
