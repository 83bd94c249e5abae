package com.anthem.iamx.graph.exception;

/**
 * A query names an identity that is not in the graph.
 */
public class UnknownIdentityException extends IamGraphException {

    public static final String CODE = "UNKNOWN_IDENTITY";

    private final String identity;

    public UnknownIdentityException(String identity) {
        super(CODE, "Unknown identity: " + identity);
        this.identity = identity;
    }

    public UnknownIdentityException(String identity, String message) {
        super(CODE, message);
        this.identity = identity;
    }

    public String getIdentity() {
        return identity;
    }
}
