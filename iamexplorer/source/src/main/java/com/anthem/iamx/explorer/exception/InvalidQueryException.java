package com.anthem.iamx.explorer.exception;

import com.anthem.iamx.graph.exception.IamGraphException;

/**
 * A batch line that is not a recognised query.
 */
public class InvalidQueryException extends IamGraphException {

    public static final String CODE = "INVALID_QUERY";

    public InvalidQueryException(String message) {
        super(CODE, message);
    }
}
