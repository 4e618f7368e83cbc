package org.flowgraph.cfg;

import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.body.MethodDeclaration;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SyntaxValidatorTest {

    @Test
    void wellFormedSourceYieldsCompilationUnit() {
        SyntaxValidator.Result result = SyntaxValidator.validate("public class B { int x = 1; void f() { x++; } }");

        assertTrue(result.isValid());
        assertTrue(result.problems().isEmpty());
        CompilationUnit cu = result.compilationUnit().orElseThrow();
        assertEquals(1, cu.findAll(MethodDeclaration.class).size());
    }

    @Test
    void missingSemicolonIsReportedWithLine() {
        SyntaxValidator.Result result = SyntaxValidator.validate("public class A {\n  int x = 1\n}");

        assertFalse(result.isValid());
        assertTrue(result.compilationUnit().isEmpty());
        assertFalse(result.problems().isEmpty());
        assertTrue(result.problems().get(0).matches("(?s)Line \\d+: .*"), result.problems().get(0));
    }

    @Test
    void blankInputIsRejected() {
        assertEquals(List.of("Line -1: empty source"), SyntaxValidator.validate(null).problems());
        assertFalse(SyntaxValidator.validate("   ").isValid());
    }

    @Test
    void problemsAreImmutable() {
        SyntaxValidator.Result result = SyntaxValidator.validate("class {");

        assertThrows(UnsupportedOperationException.class, () -> result.problems().add("x"));
    }
}
