package com.jml.weaver.visitor;

import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.BodyDeclaration;
import com.github.javaparser.ast.body.ConstructorDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.expr.AnnotationExpr;
import com.github.javaparser.ast.stmt.IfStmt;
import com.jml.weaver.MalformedContractException;
import com.jml.weaver.analysis.ContractParser;
import com.jml.weaver.evaluation.WeavingMetrics;
import com.jml.weaver.processor.SourceWeaver;
import com.jml.weaver.weaving.InstrumentationToggle;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ContractWeavingVisitorTest {

    private static final String ACCOUNT = String.join("\n",
            "package bank;",
            "import com.jml.weaver.annotations.*;",
            "public class Account {",
            "    private long balance;",
            "    @Requires(\"amount > 0\")",
            "    @Ensures(\"result == balance\")",
            "    public long deposit(long amount) {",
            "        balance += amount;",
            "        return balance;",
            "    }",
            "    public long getBalance() {",
            "        return balance;",
            "    }",
            "}");

    private final SourceWeaver sourceWeaver = new SourceWeaver();

    @AfterEach
    void restoreToggle() {
        InstrumentationToggle.setInstrumentationEnabled(true);
    }

    private static MethodDeclaration method(CompilationUnit cu, String name) {
        return cu.findFirst(MethodDeclaration.class, m -> m.getNameAsString().equals(name)).orElseThrow();
    }

    private static Optional<AnnotationExpr> woven(BodyDeclaration<?> declaration) {
        return declaration.getAnnotations().stream()
                .filter(annotation -> annotation.getName().getIdentifier().equals("Woven"))
                .findFirst();
    }

    private static long checks(Node node) {
        return node.findAll(IfStmt.class, ifStmt -> ifStmt.getCondition().toString().startsWith("!(")).size();
    }

    @Test
    void contractedMethod_isWovenAndMarked() {
        CompilationUnit cu = sourceWeaver.weave(ACCOUNT);

        MethodDeclaration deposit = method(cu, "deposit");
        assertThat(checks(deposit)).isEqualTo(2);
        AnnotationExpr marker = woven(deposit).orElseThrow();
        assertThat(marker.getNameAsString()).isEqualTo(ContractWeavingVisitor.WOVEN_ANNOTATION);
        assertThat(marker.toString()).contains("contracts = true");

        MethodDeclaration getBalance = method(cu, "getBalance");
        assertThat(checks(getBalance)).isZero();
        assertThat(woven(getBalance)).isEmpty();
    }

    @Test
    void wovenSource_isNotWovenTwice() {
        String once = sourceWeaver.weave(ACCOUNT).toString();

        CompilationUnit twice = sourceWeaver.weave(once);

        assertThat(checks(method(twice, "deposit"))).isEqualTo(2);
        assertThat(method(twice, "deposit").getAnnotations())
                .filteredOn(a -> a.getName().getIdentifier().equals("Woven")).hasSize(1);
    }

    @Test
    void toggleOff_keepsBodyAndMarksMethod() {
        InstrumentationToggle.setInstrumentationEnabled(false);

        CompilationUnit cu = sourceWeaver.weave(ACCOUNT);

        MethodDeclaration deposit = method(cu, "deposit");
        assertThat(checks(deposit)).isZero();
        assertThat(woven(deposit).orElseThrow().toString()).contains("contracts = false");
    }

    @Test
    void loopInvariants_areWovenEvenWithToggleOff() {
        InstrumentationToggle.setInstrumentationEnabled(false);

        CompilationUnit cu = sourceWeaver.weave(String.join("\n",
                "class Counter {",
                "    int[] counts;",
                "    Counter(int n) {",
                "        counts = new int[n];",
                "        //@ loop_invariant counts.length == n;",
                "        for (int i = 0; i < n; i++) { counts[i] = i; }",
                "    }",
                "    @Requires(\"n >= 0\")",
                "    int total(int n) {",
                "        int t = 0;",
                "        //@ loop_invariant t >= 0;",
                "        while (n > 0) { t += n; n--; }",
                "        return t;",
                "    }",
                "}"));

        ConstructorDeclaration constructor = cu.findFirst(ConstructorDeclaration.class).orElseThrow();
        assertThat(checks(constructor)).isEqualTo(3);
        assertThat(woven(constructor)).isPresent();
        assertThat(checks(method(cu, "total"))).isEqualTo(5);
    }

    @Test
    void skipWeaving_leavesClassAndMethodsUntouched() {
        CompilationUnit cu = sourceWeaver.weave(String.join("\n",
                "import com.jml.weaver.annotations.*;",
                "class Outer {",
                "    @SkipWeaving(reason = \"hot path\")",
                "    @Requires(\"x > 0\") int fast(int x) { return x; }",
                "    @SkipWeaving",
                "    static class Inner {",
                "        @Requires(\"x > 0\") int slow(int x) { return x; }",
                "    }",
                "}"));

        assertThat(checks(cu)).isZero();
        assertThat(cu.findAll(AnnotationExpr.class, a -> a.getName().getIdentifier().equals("Woven"))).isEmpty();
    }

    @Test
    void foreignAnnotationsWithContractNames_areIgnored() {
        CompilationUnit cu = sourceWeaver.weave(String.join("\n",
                "import ch.ethz.intervals.quals.Requires;",
                "import com.jml.weaver.annotations.Ensures;",
                "class Task {",
                "    @Requires(\"sub.end.hb(this)\") void run() { }",
                "    @org.example.Ensures(\"not java\") void stop() { }",
                "    @Ensures(\"result > 0\") int size() { return 1; }",
                "}"));

        assertThat(woven(method(cu, "run"))).isEmpty();
        assertThat(woven(method(cu, "stop"))).isEmpty();
        assertThat(checks(method(cu, "size"))).isEqualTo(1);
    }

    @Test
    void methodsOfAnonymousClasses_areWoven() {
        CompilationUnit cu = sourceWeaver.weave(String.join("\n",
                "class Factory {",
                "    java.util.function.IntUnaryOperator doubler() {",
                "        return new java.util.function.IntUnaryOperator() {",
                "            @Ensures(\"result % 2 == 0\")",
                "            public int applyAsInt(int x) { return x * 2; }",
                "        };",
                "    }",
                "}"));

        assertThat(checks(method(cu, "applyAsInt"))).isEqualTo(1);
        assertThat(woven(method(cu, "doubler"))).isEmpty();
    }

    @Test
    void contractOnConstructor_isMalformed() {
        assertThatThrownBy(() -> sourceWeaver.weave(
                "class Point { @Requires(\"x > 0\") Point(int x) { } }"))
                .isInstanceOf(MalformedContractException.class)
                .hasMessageContaining("'Point'");
    }

    @Test
    void contractOnField_isMalformed() {
        assertThatThrownBy(() -> sourceWeaver.weave(
                "class Point { @Ensures(\"x > 0\") int x; }"))
                .isInstanceOf(MalformedContractException.class)
                .hasMessageContaining("'x'");
    }

    @Test
    void contractOnInterfaceMethodWithoutBody_isMalformed() {
        assertThatThrownBy(() -> sourceWeaver.weave(
                "interface Shape { @Ensures(\"result > 0\") double area(); }"))
                .isInstanceOf(MalformedContractException.class)
                .hasMessageContaining("no body");
    }

    @Test
    void metrics_recordWhatWasWoven() {
        WeavingMetrics metrics = new WeavingMetrics();
        ContractWeavingVisitor visitor = new ContractWeavingVisitor(new ContractParser(), metrics);
        CompilationUnit cu = sourceWeaver.parse(ACCOUNT);

        visitor.visit(cu, null);

        WeavingMetrics.MetricsReport report = metrics.generateReport();
        assertThat(visitor.hasModifications()).isTrue();
        assertThat(report.totalClasses).isEqualTo(1);
        assertThat(report.totalMethods).isEqualTo(2);
        assertThat(report.contractedMethods).isEqualTo(1);
        assertThat(report.requirementChecks).isEqualTo(1);
        assertThat(report.ensureChecks).isEqualTo(1);
        assertThat(report.exitPoints).isEqualTo(1);
    }
}
