package com.anthem.iamx.graph.model;

public enum PolicyKind {
    /** Standalone policy identified by its ARN. */
    MANAGED,
    /** Policy embedded in a user, group or role. */
    INLINE,
    /** Role trust (assume-role) policy. */
    TRUST
}
