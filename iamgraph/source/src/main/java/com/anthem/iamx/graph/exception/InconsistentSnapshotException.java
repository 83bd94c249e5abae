package com.anthem.iamx.graph.exception;

/**
 * A snapshot record references a node that does not exist, e.g. an attachment to
 * a policy missing from the snapshot. Aborts graph construction: dropping the edge
 * would under-report permissions.
 */
public class InconsistentSnapshotException extends IamGraphException {

    public static final String CODE = "INCONSISTENT_SNAPSHOT";

    private final String recordId;
    private final String missingReference;

    public InconsistentSnapshotException(String recordId, String missingReference, String message) {
        super(CODE, String.format("Record %s references unknown %s: %s", recordId, message, missingReference));
        this.recordId = recordId;
        this.missingReference = missingReference;
    }

    public String getRecordId() {
        return recordId;
    }

    public String getMissingReference() {
        return missingReference;
    }
}
