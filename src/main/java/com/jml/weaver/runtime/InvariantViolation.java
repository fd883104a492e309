package com.jml.weaver.runtime;

/**
 * A loop invariant evaluated to false.
 */
public class InvariantViolation extends ContractViolation {

    public InvariantViolation(String sourceText, String functionName) {
        super(ExpressionKind.INVARIANT, sourceText, functionName);
    }
}
