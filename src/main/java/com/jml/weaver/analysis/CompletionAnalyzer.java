package com.jml.weaver.analysis;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.BodyDeclaration;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.LambdaExpr;
import com.github.javaparser.ast.expr.SwitchExpr;
import com.github.javaparser.ast.stmt.*;

import java.util.List;
import java.util.Optional;

/**
 * Decides whether a statement can complete normally, following the structural rules of
 * JLS 14.22. The compiler rejects any statement placed after one that cannot complete
 * normally, so checks are only appended where this analyzer says control can flow on.
 *
 * Loop conditions are constant when {@link ConstantEvaluator} can fold them to {@code true}.
 */
public class CompletionAnalyzer {

    private final ConstantEvaluator constants = new ConstantEvaluator();

    /**
     * @param statement The statement to analyze
     * @return true if execution can continue with the statement that follows it
     */
    public boolean canCompleteNormally(Statement statement) {
        if (statement instanceof ReturnStmt || statement instanceof ThrowStmt
                || statement instanceof BreakStmt || statement instanceof ContinueStmt
                || statement instanceof YieldStmt) {
            return false;
        }
        if (statement instanceof BlockStmt) {
            return canCompleteNormally(((BlockStmt) statement).getStatements());
        }
        if (statement instanceof IfStmt) {
            IfStmt ifStmt = (IfStmt) statement;
            if (ifStmt.getElseStmt().isEmpty()) {
                return true;
            }
            return canCompleteNormally(ifStmt.getThenStmt()) || canCompleteNormally(ifStmt.getElseStmt().get());
        }
        if (statement instanceof WhileStmt) {
            WhileStmt whileStmt = (WhileStmt) statement;
            return !isConstantTrue(whileStmt.getCondition()) || hasBreakTargeting(whileStmt);
        }
        if (statement instanceof DoStmt) {
            DoStmt doStmt = (DoStmt) statement;
            if (hasBreakTargeting(doStmt)) {
                return true;
            }
            return !isConstantTrue(doStmt.getCondition())
                    && (canCompleteNormally(doStmt.getBody()) || hasContinueTargeting(doStmt));
        }
        if (statement instanceof ForStmt) {
            ForStmt forStmt = (ForStmt) statement;
            boolean infinite = forStmt.getCompare().map(this::isConstantTrue).orElse(true);
            return !infinite || hasBreakTargeting(forStmt);
        }
        if (statement instanceof LabeledStmt) {
            LabeledStmt labeled = (LabeledStmt) statement;
            return canCompleteNormally(labeled.getStatement()) || hasBreakTargeting(labeled);
        }
        if (statement instanceof SynchronizedStmt) {
            return canCompleteNormally(((SynchronizedStmt) statement).getBody());
        }
        if (statement instanceof TryStmt) {
            return canCompleteNormally((TryStmt) statement);
        }
        if (statement instanceof SwitchStmt) {
            return canCompleteNormally((SwitchStmt) statement);
        }
        // expression statements, declarations, enhanced for, assert, empty
        return true;
    }

    /**
     * A statement sequence completes normally when every statement in it does.
     */
    public boolean canCompleteNormally(List<Statement> statements) {
        for (Statement statement : statements) {
            if (!canCompleteNormally(statement)) {
                return false;
            }
        }
        return true;
    }

    private boolean canCompleteNormally(TryStmt tryStmt) {
        Optional<BlockStmt> finallyBlock = tryStmt.getFinallyBlock();
        if (finallyBlock.isPresent() && !canCompleteNormally(finallyBlock.get())) {
            return false;
        }
        if (canCompleteNormally(tryStmt.getTryBlock())) {
            return true;
        }
        return tryStmt.getCatchClauses().stream()
                .anyMatch(catchClause -> canCompleteNormally(catchClause.getBody()));
    }

    private boolean canCompleteNormally(SwitchStmt switchStmt) {
        if (hasBreakTargeting(switchStmt)) {
            return true;
        }
        boolean hasDefault = switchStmt.getEntries().stream().anyMatch(entry -> entry.getLabels().isEmpty());
        if (!hasDefault || switchStmt.getEntries().isEmpty()) {
            return true;
        }

        SwitchEntry last = switchStmt.getEntries().getLast().get();
        if (last.getType() == SwitchEntry.Type.STATEMENT_GROUP) {
            return canCompleteNormally(last.getStatements());
        }

        // Arrow form: no fall through, each rule stands alone
        for (SwitchEntry entry : switchStmt.getEntries()) {
            switch (entry.getType()) {
                case EXPRESSION -> {
                    return true;
                }
                case BLOCK -> {
                    if (canCompleteNormally(entry.getStatements())) {
                        return true;
                    }
                }
                default -> {
                    // THROWS_STATEMENT never completes
                }
            }
        }
        return false;
    }

    private boolean isConstantTrue(Expression expression) {
        return constants.isConstantTrue(expression);
    }

    private boolean hasBreakTargeting(Statement target) {
        return target.findAll(BreakStmt.class).stream()
                .anyMatch(breakStmt -> findTarget(breakStmt, breakStmt.getLabel().map(l -> l.asString())) == target);
    }

    private boolean hasContinueTargeting(Statement loop) {
        Node parent = loop.getParentNode().orElse(null);
        return loop.findAll(ContinueStmt.class).stream().anyMatch(continueStmt -> {
            if (continueStmt.getLabel().isPresent()) {
                Node labeled = findTarget(continueStmt, continueStmt.getLabel().map(l -> l.asString()));
                return labeled != null && labeled == parent;
            }
            return findLoop(continueStmt) == loop;
        });
    }

    /**
     * Resolves the statement a break (or labeled continue) transfers control out of.
     * Jumps never cross a lambda, a class body or a switch expression.
     */
    private Node findTarget(Statement jump, Optional<String> label) {
        Node current = jump.getParentNode().orElse(null);
        while (current != null && !isFunctionBoundary(current)) {
            if (label.isPresent()) {
                if (current instanceof LabeledStmt && ((LabeledStmt) current).getLabel().asString().equals(label.get())) {
                    return current;
                }
            } else if (isLoop(current) || current instanceof SwitchStmt) {
                return current;
            }
            current = current.getParentNode().orElse(null);
        }
        return null;
    }

    private Node findLoop(Statement jump) {
        Node current = jump.getParentNode().orElse(null);
        while (current != null && !isFunctionBoundary(current)) {
            if (isLoop(current)) {
                return current;
            }
            current = current.getParentNode().orElse(null);
        }
        return null;
    }

    private boolean isFunctionBoundary(Node node) {
        return node instanceof LambdaExpr || node instanceof BodyDeclaration || node instanceof SwitchExpr;
    }

    static boolean isLoop(Node node) {
        return node instanceof WhileStmt || node instanceof DoStmt
                || node instanceof ForStmt || node instanceof ForEachStmt;
    }
}
