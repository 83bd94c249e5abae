package com.anthem.iamx.graph.policy;

import com.anthem.iamx.graph.model.PolicyDocument;
import com.anthem.iamx.graph.model.Statement;
import lombok.Value;

/**
 * A statement together with the document it came from.
 */
@Value
public class StatementMatch {

    PolicyDocument document;
    Statement statement;

    public String getLocation() {
        return statement.locationIn(document);
    }

    public boolean isConditioned() {
        return statement.hasCondition();
    }
}
