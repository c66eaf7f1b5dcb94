package com.rusttrace.adapter.static_analysis;

/**
 * Kinds of traceable nodes. Only {@link #FUNCTION} and {@link #STRUCT} produce output records;
 * SOURCE and CONTEXT nodes just group and scope their children.
 */
public enum NodeKind {
    SOURCE("Module"),
    STRUCT("Struct"),
    ENUM("Enum"),
    TRAIT("Trait"),
    FUNCTION("Function"),
    CONTEXT("Context");

    private final String displayName;

    NodeKind(String displayName) {
        this.displayName = displayName;
    }

    /** Name used in the interchange output's {@code kind} field and in diagnostics. */
    public String displayName() {
        return displayName;
    }
}
