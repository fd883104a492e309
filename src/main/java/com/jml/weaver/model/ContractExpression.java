package com.jml.weaver.model;

import com.github.javaparser.ast.expr.Expression;
import com.jml.weaver.runtime.ExpressionKind;

/**
 * A checked expression paired with the source text it was parsed from.
 * The text is captured at parse time and reported verbatim on violation.
 */
public class ContractExpression {

    private final ExpressionKind kind;
    private final String sourceText;
    private final Expression expression;

    public ContractExpression(ExpressionKind kind, String sourceText, Expression expression) {
        this.kind = kind;
        this.sourceText = sourceText;
        this.expression = expression;
    }

    public ExpressionKind getKind() {
        return kind;
    }

    public String getSourceText() {
        return sourceText;
    }

    /**
     * Returns a fresh copy of the parsed expression. Each inserted check owns its own tree.
     */
    public Expression copyExpression() {
        return expression.clone();
    }

    @Override
    public String toString() {
        return kind.getDisplayName() + "(" + sourceText + ")";
    }
}
