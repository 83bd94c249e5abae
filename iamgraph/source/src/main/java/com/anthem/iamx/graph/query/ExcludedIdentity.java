package com.anthem.iamx.graph.query;

import com.anthem.iamx.graph.model.IdentityType;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * An identity left out of a who-can-do result only because a Deny carrying a Condition
 * was treated as always applying. Under other request contexts it may be allowed.
 */
@Value
@Builder
public class ExcludedIdentity {

    String identityArn;
    String identityName;
    IdentityType identityType;

    /**
     * One {@code EVALUATION_AMBIGUITY} warning per conditioned Deny statement involved.
     */
    @Singular
    List<QueryWarning> warnings;
}
