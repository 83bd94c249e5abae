package com.anthem.iamx.explorer.cli;

import com.anthem.iamx.fetcher.exception.AwsCredentialsException;
import com.anthem.iamx.fetcher.exception.SnapshotFetchException;
import com.anthem.iamx.graph.exception.InconsistentSnapshotException;
import com.anthem.iamx.graph.exception.MalformedEntityException;

/**
 * Process exit codes of the {@code iamx} commands.
 */
public final class ExitCodes {

    public static final int OK = 0;
    /** Bad arguments, unknown identity, malformed pattern, unreadable file. */
    public static final int INPUT_ERROR = 1;
    /** The snapshot could not be turned into a graph. */
    public static final int CONSTRUCTION_ERROR = 2;
    /** Credentials or IAM API failure. */
    public static final int AWS_ERROR = 3;

    private ExitCodes() {
    }

    public static int of(Throwable error) {
        if (error instanceof MalformedEntityException || error instanceof InconsistentSnapshotException) {
            return CONSTRUCTION_ERROR;
        }
        if (error instanceof AwsCredentialsException || error instanceof SnapshotFetchException) {
            return AWS_ERROR;
        }
        return INPUT_ERROR;
    }
}
