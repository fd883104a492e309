package com.jml.weaver.analysis;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.stmt.Statement;
import com.github.javaparser.ast.stmt.WhileStmt;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

class CompletionAnalyzerTest {

    private final CompletionAnalyzer analyzer = new CompletionAnalyzer();
    private final JavaParser javaParser = new JavaParser(
            new ParserConfiguration().setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17));

    private Statement statement(String source) {
        return javaParser.parseStatement(source).getResult().orElseThrow();
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "x++;",
            "{ int y = 1; y++; }",
            "if (x > 0) return;",
            "if (x > 0) { return; } else { x++; }",
            "while (x > 0) { return; }",
            "while (true) { if (x > 0) break; }",
            "for (int i = 0; i < 3; i++) { return; }",
            "for (String s : items) { return; }",
            "do { x++; } while (x < 3);",
            "do { if (x > 2) continue; return; } while (x < 3);",
            "outer: while (true) { while (true) { break outer; } }",
            "try { return; } catch (RuntimeException e) { x++; }",
            "switch (x) { case 1: return; default: x++; }",
            "switch (x) { case 1: return; }",
            "switch (x) { case 1 -> x++; default -> { return; } }",
            "synchronized (this) { x++; }",
            "label: { break label; }",
            "while (1 > 2 || x > 0) { x++; }",
            "while (1 / 0 == 0) { x++; }"
    })
    void completesNormally(String source) {
        assertThat(analyzer.canCompleteNormally(statement(source))).isTrue();
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "return;",
            "return x;",
            "throw new IllegalStateException();",
            "{ x++; return; }",
            "if (x > 0) { return; } else { throw new RuntimeException(); }",
            "while (true) { x++; }",
            "while ((true)) { x++; }",
            "for (;;) { x++; }",
            "do { return; } while (x < 3);",
            "do { x++; } while (true);",
            "outer: while (true) { while (true) { break; } }",
            "try { x++; } finally { return; }",
            "try { return; } catch (RuntimeException e) { throw e; }",
            "switch (x) { case 1: x++; default: return; }",
            "switch (x) { case 1 -> throw new RuntimeException(); default -> { return; } }",
            "synchronized (this) { return; }",
            "while (true) { Runnable r = () -> { while (true) { break; } }; }",
            "while (1 < 2) { x++; }",
            "while (!false) { x++; }",
            "for (; true && !(3 % 2 == 0);) { x++; }",
            "do { x++; } while ('a' + 1 == 98);",
            "while (true ? 1L << 3 == 8 : false) { x++; }"
    })
    void cannotCompleteNormally(String source) {
        assertThat(analyzer.canCompleteNormally(statement(source))).isFalse();
    }

    private WhileStmt loopIn(String classSource) {
        CompilationUnit cu = javaParser.parse(classSource).getResult().orElseThrow();
        return cu.findFirst(WhileStmt.class).orElseThrow();
    }

    @Test
    void staticFinalBooleanField_isAConstantCondition() {
        WhileStmt loop = loopIn("class Spin { static final boolean FOREVER = true;"
                + " void f(int[] xs) { while (FOREVER) { if (xs[0]++ > 3) return; } } }");

        assertThat(analyzer.canCompleteNormally(loop)).isFalse();
    }

    @Test
    void qualifiedFieldOfEnclosingType_isAConstantCondition() {
        WhileStmt loop = loopIn("class Spin { static final int LIMIT = 4; static final boolean ON = LIMIT > 0;"
                + " class Inner { void f() { while (Spin.ON) { } } } }");

        assertThat(analyzer.canCompleteNormally(loop)).isFalse();
    }

    @Test
    void interfaceField_isImplicitlyConstant() {
        WhileStmt loop = loopIn("interface Flags { boolean ON = true;"
                + " default void f() { while (ON) { } } }");

        assertThat(analyzer.canCompleteNormally(loop)).isFalse();
    }

    @Test
    void finalLocalWithConstantInitializer_isAConstantCondition() {
        WhileStmt loop = loopIn("class Spin { void f() { final boolean on = 2 > 1; while (on) { } } }");

        assertThat(analyzer.canCompleteNormally(loop)).isFalse();
    }

    @Test
    void nonFinalField_isNotAConstantCondition() {
        WhileStmt loop = loopIn("class Spin { static boolean running = true; void f() { while (running) { } } }");

        assertThat(analyzer.canCompleteNormally(loop)).isTrue();
    }

    @Test
    void parameterShadowingConstantField_isNotAConstantCondition() {
        WhileStmt loop = loopIn("class Spin { static final boolean on = true; void f(boolean on) { while (on) { } } }");

        assertThat(analyzer.canCompleteNormally(loop)).isTrue();
    }

    @Test
    void finalFieldWithNonConstantInitializer_isNotAConstantCondition() {
        WhileStmt loop = loopIn("class Spin { static final boolean ON = Boolean.getBoolean(\"on\");"
                + " void f() { while (ON) { } } }");

        assertThat(analyzer.canCompleteNormally(loop)).isTrue();
    }
}
