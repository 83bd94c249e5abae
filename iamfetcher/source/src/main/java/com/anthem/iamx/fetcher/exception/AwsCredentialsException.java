package com.anthem.iamx.fetcher.exception;

import com.anthem.iamx.graph.exception.IamGraphException;

/**
 * No usable AWS credentials: none configured, unknown profile, or rejected by STS.
 */
public class AwsCredentialsException extends IamGraphException {

    public static final String CODE = "AWS_CREDENTIALS";

    public AwsCredentialsException(String message, Throwable cause) {
        super(CODE, message, cause);
    }
}
