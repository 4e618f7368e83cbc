package org.flowgraph.cfg;

import com.github.javaparser.ParseProblemException;
import com.github.javaparser.Problem;
import com.github.javaparser.StaticJavaParser;
import com.github.javaparser.ast.CompilationUnit;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * 解析源码并收集语法错误。解析成功时直接返回语法树，调用方不必再解析一次。
 */
public class SyntaxValidator {

    /**
     * 一次解析的结果：成功时 unit 非空且 problems 为空，失败时相反
     */
    public record Result(CompilationUnit unit, List<String> problems) {
        public Result {
            problems = List.copyOf(problems);
        }

        public Optional<CompilationUnit> compilationUnit() {
            return Optional.ofNullable(unit);
        }

        public boolean isValid() {
            return unit != null;
        }
    }

    /**
     * @param codeString 源代码字符串
     * @return 语法树，或形如 {@code Line 3: ...} 的错误列表（获取不到行号时为 -1）
     */
    public static Result validate(String codeString) {
        if (codeString == null || codeString.trim().isEmpty()) {
            return new Result(null, List.of("Line -1: empty source"));
        }
        try {
            return new Result(StaticJavaParser.parse(codeString), List.of());
        } catch (ParseProblemException e) {
            return new Result(null, e.getProblems().stream()
                    .map(SyntaxValidator::describe)
                    .collect(Collectors.toList()));
        }
    }

    private static String describe(Problem p) {
        int line = p.getLocation()
                .flatMap(l -> l.getBegin().getRange())
                .map(r -> r.begin.line)
                .orElse(-1);
        return "Line " + line + ": " + p.getMessage();
    }
}
