package com.anthem.iamx.graph.exception;

/**
 * A snapshot or persisted graph could not be read or written.
 */
public class GraphSerializationException extends IamGraphException {

    public static final String CODE = "SERIALIZATION_ERROR";

    public GraphSerializationException(String message) {
        super(CODE, message);
    }

    public GraphSerializationException(String message, Throwable cause) {
        super(CODE, message, cause);
    }
}
