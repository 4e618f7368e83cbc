package org.flowgraph.cfg;

import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.StaticJavaParser;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.body.MethodDeclaration;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * 读取一个 Java 文件，对其中的每个方法：
 * - 转换语句
 * - 构建 CFG
 * - 输出 JSON（或加 --text 输出文本）
 */
public class Main {

    private static final String DEFAULT_SOURCE = "src/test/resources/Sample.java";

    public static void main(String[] args) throws Exception {
        // 统一用 UTF-8 输出，不依赖控制台默认编码
        PrintStream out = new PrintStream(System.out, true, StandardCharsets.UTF_8);
        PrintStream err = new PrintStream(System.err, true, StandardCharsets.UTF_8);
        int status = run(args, out, err);
        out.flush();
        err.flush();
        if (status != 0) {
            System.exit(status);
        }
    }

    /**
     * @return 退出码：0 成功，1 源码有语法错误
     */
    static int run(String[] args, PrintStream out, PrintStream err) throws IOException {
        boolean text = false;
        String source = DEFAULT_SOURCE;
        for (String arg : args) {
            if ("--text".equals(arg)) {
                text = true;
            } else {
                source = arg;
            }
        }

        // 1. 配置解析器语言级别
        StaticJavaParser.setConfiguration(new ParserConfiguration()
                .setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17));

        // 2. 解析并做语法检查，失败时逐条打印错误位置
        Path file = Paths.get(source);
        SyntaxValidator.Result result = SyntaxValidator.validate(Files.readString(file, StandardCharsets.UTF_8));
        if (!result.isValid()) {
            err.println("[语法验证失败] " + file);
            result.problems().forEach(p -> err.println("   -> " + p));
            return 1;
        }
        CompilationUnit cu = result.unit();

        // 3. 遍历文件中的每个方法，构建控制流图并输出
        MethodAnalyzer analyzer = new MethodAnalyzer();
        for (MethodDeclaration md : cu.findAll(MethodDeclaration.class)) {
            out.println("===== Method: " + md.getNameAsString() + " =====");

            ControlFlowGraph graph;
            try {
                graph = analyzer.analyze(md);
            } catch (UnsupportedConstructException e) {
                err.println("Skipping " + md.getNameAsString() + ": " + e.getMessage());
                continue;
            }

            out.println(text ? CfgPrinter.render(graph) : GraphJson.toJson(graph));
        }
        return 0;
    }
}
