package com.jml.weaver.runtime;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ViolationReporterTest {

    @Test
    void requirementMessage_namesExpressionAndFunction() {
        ContractViolation violation = ViolationReporter.report(ExpressionKind.REQUIREMENT, "x > 0", "sqrt");

        assertThat(violation).isInstanceOf(RequirementViolation.class);
        assertThat(violation.getMessage()).isEqualTo("Breach on Requirement Expression 'x > 0' in function 'sqrt'");
    }

    @Test
    void ensureMessage_keepsSourceTextVerbatim() {
        String text = "java.util.Arrays.stream(arr).sum() > 5";
        ContractViolation violation = ViolationReporter.report(ExpressionKind.ENSURE, text, "increment");

        assertThat(violation).isInstanceOf(EnsureViolation.class);
        assertThat(violation.getSourceText()).isEqualTo(text);
        assertThat(violation.getMessage())
                .isEqualTo("Breach on Ensure Expression 'java.util.Arrays.stream(arr).sum() > 5' in function 'increment'");
    }

    @Test
    void invariantMessage_usesInvariantKind() {
        ContractViolation violation = ViolationReporter.report(ExpressionKind.INVARIANT, "i <= n", "sum");

        assertThat(violation).isInstanceOf(InvariantViolation.class);
        assertThat(violation.getMessage()).isEqualTo("Breach on Invariant Expression 'i <= n' in function 'sum'");
    }

    @ParameterizedTest
    @EnumSource(ExpressionKind.class)
    void raise_throwsViolationOfMatchingKind(ExpressionKind kind) {
        assertThatThrownBy(() -> ViolationReporter.raise(kind, "a == b", "f"))
                .isInstanceOf(ContractViolation.class)
                .satisfies(e -> {
                    ContractViolation violation = (ContractViolation) e;
                    assertThat(violation.getKind()).isEqualTo(kind);
                    assertThat(violation.getFunctionName()).isEqualTo("f");
                    assertThat(violation.getSourceText()).isEqualTo("a == b");
                    assertThat(violation.getMessage()).startsWith("Breach on " + kind.getDisplayName() + " Expression");
                });
    }

    @Test
    void emptyFunctionName_isStillQuoted() {
        assertThat(ContractViolation.formatMessage(ExpressionKind.ENSURE, "true", ""))
                .isEqualTo("Breach on Ensure Expression 'true' in function ''");
    }
}
