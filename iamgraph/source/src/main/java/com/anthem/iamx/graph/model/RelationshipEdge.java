package com.anthem.iamx.graph.model;

import lombok.Value;

/**
 * Typed edge of the permission graph.
 *
 * <p>For {@link EdgeKind#TRUSTS} the source is the principal value exactly as written in
 * the trust policy (an ARN pattern, an account, {@code *} or a service name) and
 * {@code principalType} holds its key ({@code AWS}, {@code Service}, {@code Federated}).
 */
@Value
public class RelationshipEdge {

    EdgeKind kind;
    String source;
    String target;
    String principalType;

    public static RelationshipEdge memberOf(String userArn, String groupArn) {
        return new RelationshipEdge(EdgeKind.MEMBER_OF, userArn, groupArn, null);
    }

    public static RelationshipEdge attached(String identityArn, String policyId) {
        return new RelationshipEdge(EdgeKind.ATTACHED, identityArn, policyId, null);
    }

    public static RelationshipEdge trusts(String principalType, String principal, String roleArn) {
        return new RelationshipEdge(EdgeKind.TRUSTS, principal, roleArn, principalType);
    }
}
