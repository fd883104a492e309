package com.jml.weaver.runtime;

/**
 * A postcondition evaluated to false.
 */
public class EnsureViolation extends ContractViolation {

    public EnsureViolation(String sourceText, String functionName) {
        super(ExpressionKind.ENSURE, sourceText, functionName);
    }
}
