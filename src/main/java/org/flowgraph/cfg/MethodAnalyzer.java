package org.flowgraph.cfg;

import com.github.javaparser.ast.body.MethodDeclaration;

import java.util.List;

/**
 * 方法分析器，用于分析 Java 方法并构建控制流图
 * <p>
 * 先用 {@link StatementTranslator} 把方法体转换成语句模型，再交给 {@link CfgBuilder}。
 * 没有方法体的方法（抽象方法、接口方法）得到只有 START -> EXIT 的图。
 */
public class MethodAnalyzer {

    private final StatementTranslator translator = new StatementTranslator();

    /**
     * 分析给定的方法声明并构建控制流图
     *
     * @param md 要分析的方法声明
     * @return 该方法体的控制流图
     * @throws UnsupportedConstructException 方法体中含有不支持的语句
     */
    public ControlFlowGraph analyze(MethodDeclaration md) {
        List<FlowStmt> body = md.getBody()
                .map(translator::translate)
                .orElseGet(List::of);
        return CfgBuilder.build(body);
    }
}
