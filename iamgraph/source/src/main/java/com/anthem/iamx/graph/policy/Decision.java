package com.anthem.iamx.graph.policy;

public enum Decision {
    ALLOW,
    /** A matching Deny statement; always wins. */
    DENY,
    /** Nothing matched. Absence of an Allow is never an Allow. */
    IMPLICIT_DENY
}
