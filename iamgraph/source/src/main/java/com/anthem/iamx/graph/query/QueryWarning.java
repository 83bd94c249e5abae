package com.anthem.iamx.graph.query;

import com.anthem.iamx.graph.policy.StatementMatch;
import lombok.Value;

/**
 * Non-fatal annotation attached to a query result.
 */
@Value
public class QueryWarning {

    public static final String EVALUATION_AMBIGUITY = "EVALUATION_AMBIGUITY";

    String code;
    String location;
    String message;

    /**
     * A matching statement carries a Condition block that was treated as always true.
     */
    public static QueryWarning ambiguity(StatementMatch match) {
        return new QueryWarning(EVALUATION_AMBIGUITY, match.getLocation(),
                "Condition not evaluated; statement treated as matching");
    }
}
