package com.jml.weaver.analysis;

import com.github.javaparser.StaticJavaParser;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

class ConstantEvaluatorTest {

    private final ConstantEvaluator evaluator = new ConstantEvaluator();

    @Test
    void integralArithmetic_followsJavaSemantics() {
        assertThat(evaluator.evaluate(StaticJavaParser.parseExpression("7 / 2 * 2 + 7 % 2"))).contains(7);
        assertThat(evaluator.evaluate(StaticJavaParser.parseExpression("-1 >>> 28"))).contains(15);
        assertThat(evaluator.evaluate(StaticJavaParser.parseExpression("1L << 40"))).contains(1L << 40);
        assertThat(evaluator.evaluate(StaticJavaParser.parseExpression("Integer.MAX_VALUE + 1"))).isEmpty();
    }

    @ParameterizedTest
    @ValueSource(strings = {"x > 0", "1 / 0 == 0", "\"a\" == \"a\"", "1.0 < 2.0", "i++ > 0", "false"})
    void nonConstantOrFalse_isNotConstantTrue(String source) {
        assertThat(evaluator.isConstantTrue(StaticJavaParser.parseExpression(source))).isFalse();
    }
}
