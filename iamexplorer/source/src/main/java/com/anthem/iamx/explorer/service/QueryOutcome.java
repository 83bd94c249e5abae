package com.anthem.iamx.explorer.service;

import com.anthem.iamx.graph.query.AccessEntry;
import com.anthem.iamx.graph.query.ExcludedIdentity;
import com.anthem.iamx.graph.query.PermissionReport;
import com.anthem.iamx.graph.query.WhoCanDoReport;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Result of one batch query: the query result on success, or the error code and message.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class QueryOutcome {

    public enum Status { SUCCESS, FAILED, TIMEOUT }

    public static final String TIMEOUT_CODE = "TIMEOUT";

    String query;
    Status status;
    String errorCode;
    String message;

    /**
     * Set for a successful who-can-do query.
     */
    List<AccessEntry> entries;

    /**
     * Set for a successful who-can-do query that dropped identities on a conditioned Deny.
     */
    List<ExcludedIdentity> exclusions;

    /**
     * Set for a successful what-can-do query.
     */
    PermissionReport report;

    public static QueryOutcome whoCanDo(String query, WhoCanDoReport report) {
        return QueryOutcome.builder()
                .query(query)
                .status(Status.SUCCESS)
                .entries(report.getEntries())
                .exclusions(report.getExclusions().isEmpty() ? null : report.getExclusions())
                .build();
    }

    public static QueryOutcome whatCanDo(String query, PermissionReport report) {
        return QueryOutcome.builder().query(query).status(Status.SUCCESS).report(report).build();
    }

    public static QueryOutcome failed(String query, String errorCode, String message) {
        return QueryOutcome.builder().query(query).status(Status.FAILED).errorCode(errorCode).message(message).build();
    }

    public static QueryOutcome timedOut(String query) {
        return QueryOutcome.builder()
                .query(query)
                .status(Status.TIMEOUT)
                .errorCode(TIMEOUT_CODE)
                .message("Query did not finish within the batch timeout")
                .build();
    }

    @JsonIgnore
    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }
}
