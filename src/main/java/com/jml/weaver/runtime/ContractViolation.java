package com.jml.weaver.runtime;

/**
 * Raised by woven code when a checked expression evaluates to false.
 * Carries the kind of the check, the literal source text of the expression
 * and the name of the function it guards.
 */
public abstract class ContractViolation extends RuntimeException {

    private final ExpressionKind kind;
    private final String sourceText;
    private final String functionName;

    protected ContractViolation(ExpressionKind kind, String sourceText, String functionName) {
        super(formatMessage(kind, sourceText, functionName));
        this.kind = kind;
        this.sourceText = sourceText;
        this.functionName = functionName;
    }

    public ExpressionKind getKind() {
        return kind;
    }

    public String getSourceText() {
        return sourceText;
    }

    public String getFunctionName() {
        return functionName;
    }

    /**
     * Builds the human readable form of a violation.
     *
     * @return e.g. {@code Breach on Requirement Expression 'x > 0' in function 'sqrt'}
     */
    public static String formatMessage(ExpressionKind kind, String sourceText, String functionName) {
        return "Breach on " + kind.getDisplayName() + " Expression '" + sourceText
                + "' in function '" + functionName + "'";
    }
}
