package com.jml.weaver.analysis;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.CallableDeclaration;
import com.github.javaparser.ast.body.ClassOrInterfaceDeclaration;
import com.github.javaparser.ast.body.FieldDeclaration;
import com.github.javaparser.ast.body.Parameter;
import com.github.javaparser.ast.body.TypeDeclaration;
import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.expr.*;
import com.github.javaparser.ast.stmt.BlockStmt;
import com.github.javaparser.ast.stmt.CatchClause;
import com.github.javaparser.ast.stmt.ExpressionStmt;
import com.github.javaparser.ast.stmt.ForEachStmt;
import com.github.javaparser.ast.stmt.ForStmt;
import com.github.javaparser.ast.stmt.Statement;
import com.github.javaparser.ast.stmt.SwitchEntry;
import com.github.javaparser.ast.stmt.TryStmt;

import java.util.List;
import java.util.Optional;

/**
 * Evaluates boolean and integral constant expressions (JLS 15.29) well enough to decide
 * whether a loop condition is the constant {@code true}.
 *
 * Handles literals, parentheses, unary, binary and conditional operators, and simple or
 * type-qualified names of constant variables: final locals and final fields of an enclosing
 * type with a constant initializer. Floating point and string constants are not evaluated.
 * Anything not recognised is treated as not constant.
 */
public class ConstantEvaluator {

    private static final int MAX_DEPTH = 32;

    /**
     * @return true if the expression is a constant expression whose value is {@code true}
     */
    public boolean isConstantTrue(Expression expression) {
        return evaluate(expression).map(Boolean.TRUE::equals).orElse(false);
    }

    /**
     * @return The value as a {@code Boolean}, {@code Integer} or {@code Long}, or empty if the
     *         expression is not a constant this evaluator understands
     */
    public Optional<Object> evaluate(Expression expression) {
        return evaluate(expression, 0);
    }

    private Optional<Object> evaluate(Expression expression, int depth) {
        if (depth > MAX_DEPTH) {
            return Optional.empty();
        }
        if (expression instanceof BooleanLiteralExpr) {
            return Optional.of(((BooleanLiteralExpr) expression).getValue());
        }
        if (expression instanceof IntegerLiteralExpr) {
            return Optional.of(((IntegerLiteralExpr) expression).asNumber().intValue());
        }
        if (expression instanceof LongLiteralExpr) {
            return Optional.of(((LongLiteralExpr) expression).asNumber().longValue());
        }
        if (expression instanceof CharLiteralExpr) {
            return Optional.of((int) ((CharLiteralExpr) expression).asChar());
        }
        if (expression instanceof EnclosedExpr) {
            return evaluate(((EnclosedExpr) expression).getInner(), depth + 1);
        }
        if (expression instanceof UnaryExpr) {
            return evaluateUnary((UnaryExpr) expression, depth);
        }
        if (expression instanceof BinaryExpr) {
            return evaluateBinary((BinaryExpr) expression, depth);
        }
        if (expression instanceof ConditionalExpr) {
            ConditionalExpr conditional = (ConditionalExpr) expression;
            Optional<Object> condition = evaluate(conditional.getCondition(), depth + 1);
            Optional<Object> whenTrue = evaluate(conditional.getThenExpr(), depth + 1);
            Optional<Object> whenFalse = evaluate(conditional.getElseExpr(), depth + 1);
            if (condition.isEmpty() || !(condition.get() instanceof Boolean)
                    || whenTrue.isEmpty() || whenFalse.isEmpty()) {
                return Optional.empty();
            }
            return (Boolean) condition.get() ? whenTrue : whenFalse;
        }
        if (expression instanceof NameExpr) {
            return resolveName(expression, ((NameExpr) expression).getNameAsString(), depth);
        }
        if (expression instanceof FieldAccessExpr) {
            return resolveQualifiedName((FieldAccessExpr) expression, depth);
        }
        return Optional.empty();
    }

    private Optional<Object> evaluateUnary(UnaryExpr unary, int depth) {
        Optional<Object> operand = evaluate(unary.getExpression(), depth + 1);
        if (operand.isEmpty()) {
            return Optional.empty();
        }
        Object value = operand.get();
        switch (unary.getOperator()) {
            case LOGICAL_COMPLEMENT:
                return value instanceof Boolean ? Optional.of(!(Boolean) value) : Optional.empty();
            case PLUS:
                return value instanceof Boolean ? Optional.empty() : operand;
            case MINUS:
                if (value instanceof Integer) {
                    return Optional.of(-(Integer) value);
                }
                return value instanceof Long ? Optional.of(-(Long) value) : Optional.empty();
            case BITWISE_COMPLEMENT:
                if (value instanceof Integer) {
                    return Optional.of(~(Integer) value);
                }
                return value instanceof Long ? Optional.of(~(Long) value) : Optional.empty();
            default:
                // increments and decrements are never constant
                return Optional.empty();
        }
    }

    private Optional<Object> evaluateBinary(BinaryExpr binary, int depth) {
        Optional<Object> leftValue = evaluate(binary.getLeft(), depth + 1);
        Optional<Object> rightValue = evaluate(binary.getRight(), depth + 1);
        if (leftValue.isEmpty() || rightValue.isEmpty()) {
            return Optional.empty();
        }
        Object left = leftValue.get();
        Object right = rightValue.get();

        if (left instanceof Boolean && right instanceof Boolean) {
            boolean l = (Boolean) left;
            boolean r = (Boolean) right;
            switch (binary.getOperator()) {
                case AND:
                case BINARY_AND:
                    return Optional.of(l && r);
                case OR:
                case BINARY_OR:
                    return Optional.of(l || r);
                case XOR:
                case NOT_EQUALS:
                    return Optional.of(l != r);
                case EQUALS:
                    return Optional.of(l == r);
                default:
                    return Optional.empty();
            }
        }
        if (left instanceof Boolean || right instanceof Boolean) {
            return Optional.empty();
        }

        BinaryExpr.Operator operator = binary.getOperator();
        if (isShift(operator)) {
            return shift(operator, left, ((Number) right).longValue());
        }
        if (left instanceof Long || right instanceof Long) {
            return evaluateLong(operator, ((Number) left).longValue(), ((Number) right).longValue());
        }
        return evaluateInt(operator, (Integer) left, (Integer) right);
    }

    private boolean isShift(BinaryExpr.Operator operator) {
        return operator == BinaryExpr.Operator.LEFT_SHIFT
                || operator == BinaryExpr.Operator.SIGNED_RIGHT_SHIFT
                || operator == BinaryExpr.Operator.UNSIGNED_RIGHT_SHIFT;
    }

    /**
     * A shift takes the type of its left operand; the distance is masked the same way the JVM does.
     */
    private Optional<Object> shift(BinaryExpr.Operator operator, Object left, long distance) {
        if (left instanceof Long) {
            long l = (Long) left;
            switch (operator) {
                case LEFT_SHIFT: return Optional.of(l << distance);
                case SIGNED_RIGHT_SHIFT: return Optional.of(l >> distance);
                default: return Optional.of(l >>> distance);
            }
        }
        int l = (Integer) left;
        switch (operator) {
            case LEFT_SHIFT: return Optional.of(l << distance);
            case SIGNED_RIGHT_SHIFT: return Optional.of(l >> distance);
            default: return Optional.of(l >>> distance);
        }
    }

    private Optional<Object> evaluateInt(BinaryExpr.Operator operator, int l, int r) {
        switch (operator) {
            case PLUS: return Optional.of(l + r);
            case MINUS: return Optional.of(l - r);
            case MULTIPLY: return Optional.of(l * r);
            case DIVIDE: return r == 0 ? Optional.empty() : Optional.of(l / r);
            case REMAINDER: return r == 0 ? Optional.empty() : Optional.of(l % r);
            case BINARY_AND: return Optional.of(l & r);
            case BINARY_OR: return Optional.of(l | r);
            case XOR: return Optional.of(l ^ r);
            case EQUALS: return Optional.of(l == r);
            case NOT_EQUALS: return Optional.of(l != r);
            case LESS: return Optional.of(l < r);
            case LESS_EQUALS: return Optional.of(l <= r);
            case GREATER: return Optional.of(l > r);
            case GREATER_EQUALS: return Optional.of(l >= r);
            default: return Optional.empty();
        }
    }

    private Optional<Object> evaluateLong(BinaryExpr.Operator operator, long l, long r) {
        switch (operator) {
            case PLUS: return Optional.of(l + r);
            case MINUS: return Optional.of(l - r);
            case MULTIPLY: return Optional.of(l * r);
            case DIVIDE: return r == 0 ? Optional.empty() : Optional.of(l / r);
            case REMAINDER: return r == 0 ? Optional.empty() : Optional.of(l % r);
            case BINARY_AND: return Optional.of(l & r);
            case BINARY_OR: return Optional.of(l | r);
            case XOR: return Optional.of(l ^ r);
            case EQUALS: return Optional.of(l == r);
            case NOT_EQUALS: return Optional.of(l != r);
            case LESS: return Optional.of(l < r);
            case LESS_EQUALS: return Optional.of(l <= r);
            case GREATER: return Optional.of(l > r);
            case GREATER_EQUALS: return Optional.of(l >= r);
            default: return Optional.empty();
        }
    }

    /**
     * Resolves a simple name by walking outwards through the scopes that can declare it.
     * The first declaration found wins, so a non-final local shadows a constant field.
     */
    private Optional<Object> resolveName(Node use, String name, int depth) {
        Node child = use;
        Node scope = use.getParentNode().orElse(null);
        while (scope != null) {
            Optional<Optional<Object>> declared = declaredIn(scope, child, name, depth);
            if (declared.isPresent()) {
                return declared.get();
            }
            child = scope;
            scope = scope.getParentNode().orElse(null);
        }
        return Optional.empty();
    }

    /**
     * @return empty if the scope does not declare the name, otherwise the constant value of
     *         the declaration (itself empty when the variable is not a constant)
     */
    private Optional<Optional<Object>> declaredIn(Node scope, Node child, String name, int depth) {
        if (scope instanceof BlockStmt) {
            return declaredBefore(((BlockStmt) scope).getStatements(), child, name, depth);
        }
        if (scope instanceof SwitchEntry) {
            return declaredBefore(((SwitchEntry) scope).getStatements(), child, name, depth);
        }
        if (scope instanceof ForStmt) {
            for (Expression init : ((ForStmt) scope).getInitialization()) {
                Optional<Optional<Object>> found = declaredBy(init, name, depth);
                if (found.isPresent()) {
                    return found;
                }
            }
            return Optional.empty();
        }
        if (scope instanceof ForEachStmt) {
            return declaredBy(((ForEachStmt) scope).getVariable(), name, depth);
        }
        if (scope instanceof TryStmt) {
            for (Expression resource : ((TryStmt) scope).getResources()) {
                Optional<Optional<Object>> found = declaredBy(resource, name, depth);
                if (found.isPresent()) {
                    return found;
                }
            }
            return Optional.empty();
        }
        if (scope instanceof CatchClause) {
            return bindsName(((CatchClause) scope).getParameter(), name);
        }
        if (scope instanceof LambdaExpr) {
            for (Parameter parameter : ((LambdaExpr) scope).getParameters()) {
                if (parameter.getNameAsString().equals(name)) {
                    return Optional.of(Optional.empty());
                }
            }
            return Optional.empty();
        }
        if (scope instanceof CallableDeclaration) {
            for (Parameter parameter : ((CallableDeclaration<?>) scope).getParameters()) {
                if (parameter.getNameAsString().equals(name)) {
                    return Optional.of(Optional.empty());
                }
            }
            return Optional.empty();
        }
        if (scope instanceof TypeDeclaration) {
            return fieldOf((TypeDeclaration<?>) scope, name, depth);
        }
        return Optional.empty();
    }

    private Optional<Optional<Object>> declaredBefore(List<Statement> statements, Node child, String name, int depth) {
        for (Statement statement : statements) {
            if (statement == child) {
                break;
            }
            if (statement instanceof ExpressionStmt) {
                Optional<Optional<Object>> found = declaredBy(((ExpressionStmt) statement).getExpression(), name, depth);
                if (found.isPresent()) {
                    return found;
                }
            }
        }
        return Optional.empty();
    }

    private Optional<Optional<Object>> declaredBy(Expression expression, String name, int depth) {
        if (!(expression instanceof VariableDeclarationExpr)) {
            return Optional.empty();
        }
        VariableDeclarationExpr declaration = (VariableDeclarationExpr) expression;
        for (VariableDeclarator variable : declaration.getVariables()) {
            if (variable.getNameAsString().equals(name)) {
                if (!declaration.isFinal()) {
                    return Optional.of(Optional.empty());
                }
                return Optional.of(initializerValue(variable, depth));
            }
        }
        return Optional.empty();
    }

    private Optional<Optional<Object>> bindsName(Parameter parameter, String name) {
        return parameter.getNameAsString().equals(name) ? Optional.of(Optional.empty()) : Optional.empty();
    }

    private Optional<Optional<Object>> fieldOf(TypeDeclaration<?> type, String name, int depth) {
        boolean implicitlyFinal = type instanceof ClassOrInterfaceDeclaration
                && ((ClassOrInterfaceDeclaration) type).isInterface();
        for (FieldDeclaration field : type.getFields()) {
            for (VariableDeclarator variable : field.getVariables()) {
                if (variable.getNameAsString().equals(name)) {
                    if (!field.isFinal() && !implicitlyFinal) {
                        return Optional.of(Optional.empty());
                    }
                    return Optional.of(initializerValue(variable, depth));
                }
            }
        }
        return Optional.empty();
    }

    private Optional<Object> initializerValue(VariableDeclarator variable, int depth) {
        if (!variable.getType().isPrimitiveType()) {
            return Optional.empty();
        }
        return variable.getInitializer().flatMap(initializer -> evaluate(initializer, depth + 1));
    }

    /**
     * {@code Outer.NAME} or {@code Outer.Inner.NAME}, where the qualifier names an enclosing type.
     */
    private Optional<Object> resolveQualifiedName(FieldAccessExpr access, int depth) {
        String typeName = access.getScope().toString();
        Node current = access.getParentNode().orElse(null);
        while (current != null) {
            if (current instanceof TypeDeclaration) {
                TypeDeclaration<?> type = (TypeDeclaration<?>) current;
                String qualified = type.getFullyQualifiedName().orElse(type.getNameAsString());
                if (type.getNameAsString().equals(typeName) || qualified.equals(typeName)
                        || qualified.endsWith("." + typeName)) {
                    return fieldOf(type, access.getNameAsString(), depth).orElse(Optional.empty());
                }
            }
            current = current.getParentNode().orElse(null);
        }
        return Optional.empty();
    }
}
