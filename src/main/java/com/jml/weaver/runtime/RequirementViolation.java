package com.jml.weaver.runtime;

/**
 * A precondition evaluated to false.
 */
public class RequirementViolation extends ContractViolation {

    public RequirementViolation(String sourceText, String functionName) {
        super(ExpressionKind.REQUIREMENT, sourceText, functionName);
    }
}
