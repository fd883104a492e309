package com.jml.weaver.runtime;

/**
 * The role a checked expression plays in a contract.
 */
public enum ExpressionKind {
    REQUIREMENT("Requirement"),
    ENSURE("Ensure"),
    INVARIANT("Invariant");

    private final String displayName;

    ExpressionKind(String displayName) {
        this.displayName = displayName;
    }

    /**
     * @return The name used in violation messages, e.g. "Requirement"
     */
    public String getDisplayName() {
        return displayName;
    }
}
