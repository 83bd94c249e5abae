package com.anthem.iamx.graph.exception;

public class QueryCancelledException extends IamGraphException {

    public static final String CODE = "QUERY_CANCELLED";

    public QueryCancelledException(String query) {
        super(CODE, "Query cancelled: " + query);
    }
}
