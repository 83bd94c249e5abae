package com.anthem.iamx.graph.query;

import com.anthem.iamx.graph.Attribution;
import com.anthem.iamx.graph.model.IdentityType;
import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * One identity returned by a who-can-do query.
 */
@Value
@Builder(toBuilder = true)
public class AccessEntry {

    String identityArn;
    String identityName;
    IdentityType identityType;

    /**
     * Action elements of the Allow statements that overlap the query.
     */
    @Singular
    List<String> matchedActions;

    @Singular
    List<String> matchedResources;

    /**
     * Ids of the documents holding those statements.
     */
    @Singular
    List<String> sourcePolicies;

    /**
     * {@code direct}, {@code via-group:<name>} or {@code via-role:<chain>}.
     */
    Attribution attribution;

    @Singular
    List<QueryWarning> warnings;

    @JsonIgnore
    public boolean isViaRole() {
        return attribution.getKind() == Attribution.Kind.VIA_ROLE;
    }
}
