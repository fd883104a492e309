package com.jml.weaver.model;

import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.stmt.ReturnStmt;

import java.util.Optional;

/**
 * A place where control leaves a function: either a return statement, or falling off
 * the end of the top-level block.
 */
public class ExitPoint {

    private final ReturnStmt returnStmt;

    private ExitPoint(ReturnStmt returnStmt) {
        this.returnStmt = returnStmt;
    }

    public static ExitPoint explicit(ReturnStmt returnStmt) {
        return new ExitPoint(returnStmt);
    }

    public static ExitPoint implicit() {
        return new ExitPoint(null);
    }

    public boolean isImplicit() {
        return returnStmt == null;
    }

    /**
     * @return The return statement, or empty for the implicit exit
     */
    public Optional<ReturnStmt> getReturnStmt() {
        return Optional.ofNullable(returnStmt);
    }

    /**
     * @return The returned value, or empty for {@code return;} and the implicit exit
     */
    public Optional<Expression> getReturnedExpression() {
        return returnStmt == null ? Optional.empty() : returnStmt.getExpression();
    }

    @Override
    public String toString() {
        if (returnStmt == null) {
            return "ExitPoint{implicit}";
        }
        return "ExitPoint{" + returnStmt + "}";
    }
}
