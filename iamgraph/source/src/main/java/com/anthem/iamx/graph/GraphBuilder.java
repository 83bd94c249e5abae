package com.anthem.iamx.graph;

import com.anthem.iamx.graph.exception.InconsistentSnapshotException;
import com.anthem.iamx.graph.exception.MalformedEntityException;
import com.anthem.iamx.graph.model.Identity;
import com.anthem.iamx.graph.model.IdentityType;
import com.anthem.iamx.graph.model.PolicyDocument;
import com.anthem.iamx.graph.model.PolicyKind;
import com.anthem.iamx.graph.model.RelationshipEdge;
import com.anthem.iamx.graph.model.Statement;
import com.anthem.iamx.graph.pattern.WildcardPattern;
import com.anthem.iamx.graph.policy.TrustPolicyEvaluator;
import com.anthem.iamx.graph.snapshot.PolicyDocumentCodec;
import com.anthem.iamx.graph.snapshot.Snapshot;
import com.anthem.iamx.graph.snapshot.SnapshotGroup;
import com.anthem.iamx.graph.snapshot.SnapshotPolicy;
import com.anthem.iamx.graph.snapshot.SnapshotRole;
import com.anthem.iamx.graph.snapshot.SnapshotUser;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Builds an immutable {@link PermissionGraph} from a snapshot.
 *
 * <p>Validation is strict: a malformed record or a reference to a group or managed
 * policy that the snapshot does not contain aborts the build. No partial graph is
 * ever returned.
 */
public class GraphBuilder {

    private static final Logger log = LoggerFactory.getLogger(GraphBuilder.class);

    // covers sts:AssumeRole, sts:AssumeRoleWithSAML and sts:AssumeRoleWithWebIdentity
    private static final WildcardPattern ANY_ASSUME_ROLE = WildcardPattern.of("sts:AssumeRole*");

    private final PolicyDocumentCodec codec;
    private final TrustPolicyEvaluator trustEvaluator;

    public GraphBuilder(PolicyDocumentCodec codec, TrustPolicyEvaluator trustEvaluator) {
        this.codec = codec;
        this.trustEvaluator = trustEvaluator;
    }

    public PermissionGraph build(Snapshot snapshot) {
        Set<String> seenIds = new LinkedHashSet<>();
        Map<String, PolicyDocument> policies = buildPolicies(snapshot.getPolicies(), seenIds);

        Map<String, Identity> identities = new LinkedHashMap<>();
        Map<String, Identity> groupsByRef = new LinkedHashMap<>();
        List<Identity> groups = new ArrayList<>();

        for (SnapshotGroup record : nullSafe(snapshot.getGroups())) {
            String arn = requireArn(record.getArn(), record.getName());
            requireUnique(arn, seenIds);
            Identity group = Identity.builder()
                    .arn(arn)
                    .name(record.getName())
                    .type(IdentityType.GROUP)
                    .path(record.getPath())
                    .attachedPolicyArns(checkAttachments(arn, record.getAttachedPolicies(), policies))
                    .inlinePolicies(parseInline(arn, record.getInlinePolicies()))
                    .build();
            groups.add(group);
            groupsByRef.put(arn, group);
            groupsByRef.putIfAbsent(group.getName(), group);
        }

        List<Identity> users = new ArrayList<>();
        for (SnapshotUser record : nullSafe(snapshot.getUsers())) {
            String arn = requireArn(record.getArn(), record.getName());
            requireUnique(arn, seenIds);
            List<String> groupArns = new ArrayList<>();
            for (String ref : nullSafe(record.getGroups())) {
                Identity group = groupsByRef.get(ref);
                if (group == null) {
                    throw new InconsistentSnapshotException(arn, ref, "group");
                }
                if (!groupArns.contains(group.getArn())) {
                    groupArns.add(group.getArn());
                }
            }
            users.add(Identity.builder()
                    .arn(arn)
                    .name(record.getName())
                    .type(IdentityType.USER)
                    .path(record.getPath())
                    .attachedPolicyArns(checkAttachments(arn, record.getAttachedPolicies(), policies))
                    .inlinePolicies(parseInline(arn, record.getInlinePolicies()))
                    .groupRefs(groupArns)
                    .build());
        }

        List<Identity> roles = new ArrayList<>();
        for (SnapshotRole record : nullSafe(snapshot.getRoles())) {
            String arn = requireArn(record.getArn(), record.getName());
            requireUnique(arn, seenIds);
            PolicyDocument trust = codec.parse(record.getAssumeRolePolicy(), PolicyKind.TRUST,
                    PolicyDocument.trustId(arn), "trust", arn, false);
            roles.add(Identity.builder()
                    .arn(arn)
                    .name(record.getName())
                    .type(IdentityType.ROLE)
                    .path(record.getPath())
                    .attachedPolicyArns(checkAttachments(arn, record.getAttachedPolicies(), policies))
                    .inlinePolicies(parseInline(arn, record.getInlinePolicies()))
                    .trustPolicy(trust)
                    .build());
        }

        // users, groups, roles: the section order of the snapshot file
        users.forEach(u -> identities.put(u.getArn(), u));
        groups.forEach(g -> identities.put(g.getArn(), g));
        roles.forEach(r -> identities.put(r.getArn(), r));

        Map<String, List<Identity>> groupsByUser = new LinkedHashMap<>();
        Map<String, List<Identity>> membersByGroup = new LinkedHashMap<>();
        List<RelationshipEdge> edges = new ArrayList<>();

        for (Identity identity : identities.values()) {
            for (String policyArn : identity.getAttachedPolicyArns()) {
                edges.add(RelationshipEdge.attached(identity.getArn(), policyArn));
            }
            for (PolicyDocument inline : identity.getInlinePolicies()) {
                edges.add(RelationshipEdge.attached(identity.getArn(), inline.getId()));
            }
            for (String groupArn : identity.getGroupRefs()) {
                Identity group = identities.get(groupArn);
                edges.add(RelationshipEdge.memberOf(identity.getArn(), groupArn));
                groupsByUser.computeIfAbsent(identity.getArn(), k -> new ArrayList<>()).add(group);
                membersByGroup.computeIfAbsent(groupArn, k -> new ArrayList<>()).add(identity);
            }
            identity.getTrustPolicy().ifPresent(trust -> edges.addAll(trustEdges(identity.getArn(), trust, identities)));
        }

        PermissionGraph graph = new PermissionGraph(identities, policies, edges, groupsByUser, membersByGroup,
                snapshot.getMetadata(), trustEvaluator);
        log.info("Permission graph built: users={}, groups={}, roles={}, policies={}, edges={}",
                users.size(), groups.size(), roles.size(),
                policies.size(), edges.size());
        return graph;
    }

    private Map<String, PolicyDocument> buildPolicies(List<SnapshotPolicy> records, Set<String> seenIds) {
        Map<String, PolicyDocument> policies = new LinkedHashMap<>();
        for (SnapshotPolicy record : nullSafe(records)) {
            String arn = requireArn(record.getArn(), record.getName());
            requireUnique(arn, seenIds);
            String name = record.getName() != null ? record.getName() : arn.substring(arn.lastIndexOf('/') + 1);
            policies.put(arn, codec.parse(record.getPolicyDocument(), PolicyKind.MANAGED, arn, name,
                    null, record.isAwsManaged()));
        }
        return policies;
    }

    private List<PolicyDocument> parseInline(String ownerArn, Map<String, JsonNode> inline) {
        List<PolicyDocument> documents = new ArrayList<>();
        if (inline == null) {
            return documents;
        }
        inline.forEach((name, document) -> documents.add(codec.parse(document, PolicyKind.INLINE,
                PolicyDocument.inlineId(ownerArn, name), name, ownerArn, false)));
        return documents;
    }

    private List<String> checkAttachments(String ownerArn, List<String> attached, Map<String, PolicyDocument> policies) {
        List<String> arns = new ArrayList<>();
        for (String policyArn : nullSafe(attached)) {
            if (!policies.containsKey(policyArn)) {
                throw new InconsistentSnapshotException(ownerArn, policyArn, "policy");
            }
            if (!arns.contains(policyArn)) {
                arns.add(policyArn);
            }
        }
        return arns;
    }

    /**
     * TRUSTS edges of one role. {@code AWS} principals follow the rule of
     * {@link TrustPolicyEvaluator}: the Allow must cover {@code sts:AssumeRole} itself and a
     * Deny naming the same principal removes the edge. Other principal types keep any
     * {@code sts:AssumeRole*} action, since no snapshot identity can act as them.
     */
    private List<RelationshipEdge> trustEdges(String roleArn, PolicyDocument trust, Map<String, Identity> identities) {
        Set<RelationshipEdge> edges = new LinkedHashSet<>();
        for (Statement statement : trust.getStatements()) {
            if (!statement.isAllow()) {
                continue;
            }
            statement.getPrincipals().forEach((type, values) -> {
                for (String value : values) {
                    boolean trusted = TrustPolicyEvaluator.AWS_PRINCIPAL.equals(type)
                            ? awsTrustHolds(statement, value, trust, identities.get(value))
                            : statement.getActions().overlaps(ANY_ASSUME_ROLE);
                    if (trusted) {
                        edges.add(RelationshipEdge.trusts(type, value, roleArn));
                    }
                }
            });
        }
        return new ArrayList<>(edges);
    }

    private boolean awsTrustHolds(Statement allow, String value, PolicyDocument trust, Identity named) {
        if (!allow.getActions().matches(TrustPolicyEvaluator.ASSUME_ROLE_ACTION)) {
            return false;
        }
        if (named != null) {
            return trustEvaluator.allowsAssumption(trust, named);
        }
        // account roots and patterns: only an explicit Deny on the same value removes them
        return trust.getStatements().stream().noneMatch(deny -> deny.isDeny()
                && deny.getActions().matches(TrustPolicyEvaluator.ASSUME_ROLE_ACTION)
                && deny.getPrincipals().getOrDefault(TrustPolicyEvaluator.AWS_PRINCIPAL, List.of()).contains(value));
    }

    private static String requireArn(String arn, String name) {
        if (arn == null || arn.isBlank()) {
            throw new MalformedEntityException(String.valueOf(name), "identifier (arn) is required");
        }
        return arn;
    }

    private static void requireUnique(String arn, Set<String> seenIds) {
        if (!seenIds.add(arn)) {
            throw new MalformedEntityException(arn, "duplicate identifier");
        }
    }

    private static <T> List<T> nullSafe(List<T> list) {
        return list == null ? List.of() : list;
    }
}
