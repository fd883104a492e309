package com.jml.weaver.weaving;

import com.github.javaparser.ast.NodeList;
import com.github.javaparser.ast.expr.*;
import com.github.javaparser.ast.stmt.BlockStmt;
import com.github.javaparser.ast.stmt.ExpressionStmt;
import com.github.javaparser.ast.stmt.IfStmt;
import com.github.javaparser.ast.stmt.Statement;
import com.github.javaparser.utils.StringEscapeUtils;
import com.jml.weaver.model.ContractExpression;
import com.jml.weaver.runtime.ExpressionKind;
import com.jml.weaver.runtime.ViolationReporter;

/**
 * Builds the statement that checks one contract expression:
 * <pre>
 * if (!(expr)) {
 *     com.jml.weaver.runtime.ViolationReporter.raise(
 *         com.jml.weaver.runtime.ExpressionKind.REQUIREMENT, "expr", "function");
 * }
 * </pre>
 * Names are fully qualified so woven sources need no extra imports.
 */
public class CheckFactory {

    private static final String REPORTER = ViolationReporter.class.getName();
    private static final String KIND = ExpressionKind.class.getName();

    /**
     * Creates a check for an expression. The expression tree is copied, never shared.
     *
     * @param expression The expression to check
     * @param functionName The function named in the violation
     * @return A new if statement
     */
    public Statement createCheck(ContractExpression expression, String functionName) {
        Expression negated = new UnaryExpr(
                new EnclosedExpr(expression.copyExpression()),
                UnaryExpr.Operator.LOGICAL_COMPLEMENT);

        MethodCallExpr raise = new MethodCallExpr(new NameExpr(REPORTER), "raise", NodeList.nodeList(
                new FieldAccessExpr(new NameExpr(KIND), expression.getKind().name()),
                stringLiteral(expression.getSourceText()),
                stringLiteral(functionName)));

        BlockStmt thenBlock = new BlockStmt(NodeList.nodeList(new ExpressionStmt(raise)));
        return new IfStmt(negated, thenBlock, null);
    }

    private StringLiteralExpr stringLiteral(String text) {
        return new StringLiteralExpr(StringEscapeUtils.escapeJava(text));
    }
}
