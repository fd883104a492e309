package com.jml.weaver.runtime;

/**
 * Entry point called by woven code when a check fails.
 * Stateless; a violation is a programming error and is never retried.
 */
public final class ViolationReporter {

    private ViolationReporter() {
    }

    /**
     * Builds the violation matching the given kind.
     *
     * @param kind The role of the failed expression
     * @param sourceText Literal source text of the failed expression
     * @param functionName Name of the function the check guards
     * @return The violation, not yet thrown
     */
    public static ContractViolation report(ExpressionKind kind, String sourceText, String functionName) {
        return switch (kind) {
            case REQUIREMENT -> new RequirementViolation(sourceText, functionName);
            case ENSURE -> new EnsureViolation(sourceText, functionName);
            case INVARIANT -> new InvariantViolation(sourceText, functionName);
        };
    }

    /**
     * Builds and throws the violation matching the given kind. Never returns normally.
     */
    public static void raise(ExpressionKind kind, String sourceText, String functionName) {
        throw report(kind, sourceText, functionName);
    }
}
