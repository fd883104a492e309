package com.jml.weaver.model;

import com.github.javaparser.ast.stmt.BlockStmt;

/**
 * Outcome of weaving one contract: the instrumented body and what went into it.
 */
public class WeavingResult {

    private final BlockStmt body;
    private final boolean instrumented;
    private final int requirementChecks;
    private final int ensureChecks;
    private final int exitPoints;

    public WeavingResult(BlockStmt body, boolean instrumented, int requirementChecks, int ensureChecks, int exitPoints) {
        this.body = body;
        this.instrumented = instrumented;
        this.requirementChecks = requirementChecks;
        this.ensureChecks = ensureChecks;
        this.exitPoints = exitPoints;
    }

    public BlockStmt getBody() {
        return body;
    }

    /**
     * @return false when instrumentation was disabled and the body was emitted verbatim
     */
    public boolean isInstrumented() {
        return instrumented;
    }

    public int getRequirementChecks() {
        return requirementChecks;
    }

    public int getEnsureChecks() {
        return ensureChecks;
    }

    public int getExitPoints() {
        return exitPoints;
    }
}
