package com.anthem.iamx.graph.query;

import com.anthem.iamx.graph.Attribution;
import com.anthem.iamx.graph.model.IdentityType;
import com.anthem.iamx.graph.model.PolicyDocument;
import com.anthem.iamx.graph.policy.Decision;
import com.anthem.iamx.graph.policy.EvaluationResult;
import com.anthem.iamx.graph.policy.PolicyEvaluator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Result of a what-can-do query: every grant reachable from the identity, the role
 * chains it can assume and the warnings raised while collecting them.
 */
@Value
@Builder
public class PermissionReport {

    String identityArn;
    String identityName;
    IdentityType identityType;
    List<PermissionTuple> permissions;

    /**
     * Assumable roles in discovery order, each as the chain that reaches it.
     */
    List<Attribution> assumableRoles;

    List<QueryWarning> warnings;

    /**
     * Direct and group-inherited documents, for {@link #decide}.
     */
    @JsonIgnore
    List<PolicyDocument> effectivePolicies;

    @JsonIgnore
    PolicyEvaluator evaluator;

    /**
     * Evaluate a concrete action and resource against the identity's own effective
     * policies. Roles the identity could assume are not consulted.
     */
    public EvaluationResult decide(String action, String resource) {
        return evaluator.evaluateDetailed(effectivePolicies, action, resource);
    }

    public Decision decision(String action, String resource) {
        return decide(action, resource).getDecision();
    }

    @JsonIgnore
    public List<PermissionTuple> getAllows() {
        return permissions.stream().filter(t -> !t.isDeny()).collect(Collectors.toList());
    }

    @JsonIgnore
    public List<PermissionTuple> getDenies() {
        return permissions.stream().filter(PermissionTuple::isDeny).collect(Collectors.toList());
    }
}
