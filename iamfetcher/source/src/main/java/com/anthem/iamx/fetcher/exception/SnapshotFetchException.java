package com.anthem.iamx.fetcher.exception;

import com.anthem.iamx.graph.exception.IamGraphException;

/**
 * An IAM API call failed or returned a document that could not be decoded.
 */
public class SnapshotFetchException extends IamGraphException {

    public static final String CODE = "FETCH_FAILED";

    public SnapshotFetchException(String message) {
        super(CODE, message);
    }

    public SnapshotFetchException(String message, Throwable cause) {
        super(CODE, message, cause);
    }
}
