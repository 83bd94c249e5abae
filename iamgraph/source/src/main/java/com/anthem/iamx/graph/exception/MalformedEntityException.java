package com.anthem.iamx.graph.exception;

/**
 * A snapshot record is missing a required field or carries an invalid value.
 * Aborts graph construction.
 */
public class MalformedEntityException extends IamGraphException {

    public static final String CODE = "MALFORMED_ENTITY";

    private final String recordId;

    public MalformedEntityException(String recordId, String message) {
        super(CODE, String.format("Malformed record %s: %s", recordId, message));
        this.recordId = recordId;
    }

    public String getRecordId() {
        return recordId;
    }
}
