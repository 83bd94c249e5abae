package com.anthem.iamx.graph.model;

public enum EdgeKind {
    /** User to group. */
    MEMBER_OF,
    /** Identity to policy document (managed or inline). */
    ATTACHED,
    /** Principal to the role whose trust policy names it. */
    TRUSTS
}
