package com.anthem.iamx.graph;

import com.anthem.iamx.graph.exception.UnknownIdentityException;
import com.anthem.iamx.graph.model.EdgeKind;
import com.anthem.iamx.graph.model.Identity;
import com.anthem.iamx.graph.model.IdentityType;
import com.anthem.iamx.graph.model.PolicyDocument;
import com.anthem.iamx.graph.model.RelationshipEdge;
import com.anthem.iamx.graph.policy.TrustPolicyEvaluator;
import com.anthem.iamx.graph.snapshot.SnapshotMetadata;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Relationship graph of one snapshot: identities, managed policies and the typed edges
 * between them.
 *
 * <p>Instances are created by {@link GraphBuilder} only and are immutable: every collection
 * is unmodifiable and no method changes state. A graph can therefore be shared by any
 * number of concurrent queries without locking.
 *
 * <p>Iteration order everywhere is snapshot insertion order.
 */
public final class PermissionGraph {

    private final Map<String, Identity> identities;
    private final Map<String, PolicyDocument> managedPolicies;
    private final List<RelationshipEdge> edges;
    private final Map<String, List<Identity>> groupsByUser;
    private final Map<String, List<Identity>> membersByGroup;
    private final SnapshotMetadata metadata;
    private final TrustPolicyEvaluator trustEvaluator;

    PermissionGraph(Map<String, Identity> identities,
                    Map<String, PolicyDocument> managedPolicies,
                    List<RelationshipEdge> edges,
                    Map<String, List<Identity>> groupsByUser,
                    Map<String, List<Identity>> membersByGroup,
                    SnapshotMetadata metadata,
                    TrustPolicyEvaluator trustEvaluator) {
        this.identities = Collections.unmodifiableMap(new LinkedHashMap<>(identities));
        this.managedPolicies = Collections.unmodifiableMap(new LinkedHashMap<>(managedPolicies));
        this.edges = List.copyOf(edges);
        this.groupsByUser = copyOf(groupsByUser);
        this.membersByGroup = copyOf(membersByGroup);
        this.metadata = metadata == null ? null : metadata.toBuilder().build();
        this.trustEvaluator = trustEvaluator;
    }

    /**
     * Every identity in snapshot insertion order. Each call returns a fresh stream.
     */
    public Stream<Identity> allIdentities() {
        return identities.values().stream();
    }

    public int identityCount() {
        return identities.size();
    }

    public Optional<Identity> getIdentity(String arn) {
        return Optional.ofNullable(identities.get(arn));
    }

    /**
     * Resolve an identity by ARN, by {@code Type:name} (e.g. {@code User:alice}) or by
     * display name. A display name shared by several identities is rejected as ambiguous.
     *
     * @throws UnknownIdentityException if nothing, or more than one identity, matches
     */
    public Identity findIdentity(String reference) {
        if (reference == null || reference.isBlank()) {
            throw new UnknownIdentityException(String.valueOf(reference), "Identity reference must not be empty");
        }
        Identity byArn = identities.get(reference);
        if (byArn != null) {
            return byArn;
        }

        IdentityType type = null;
        String name = reference;
        int colon = reference.indexOf(':');
        if (colon > 0 && !reference.startsWith("arn:")) {
            type = IdentityType.fromLabel(reference.substring(0, colon));
            if (type != null) {
                name = reference.substring(colon + 1);
            }
        }

        IdentityType wanted = type;
        String wantedName = name;
        List<Identity> candidates = identities.values().stream()
                .filter(i -> i.getName().equals(wantedName))
                .filter(i -> wanted == null || i.getType() == wanted)
                .collect(Collectors.toList());

        if (candidates.isEmpty()) {
            throw new UnknownIdentityException(reference);
        }
        if (candidates.size() > 1) {
            throw new UnknownIdentityException(reference, String.format(
                    "Ambiguous identity '%s' matches %s; use the ARN or Type:name",
                    reference,
                    candidates.stream().map(Identity::getDisplayName).collect(Collectors.toList())));
        }
        return candidates.get(0);
    }

    public Optional<PolicyDocument> getManagedPolicy(String arn) {
        return Optional.ofNullable(managedPolicies.get(arn));
    }

    public Collection<PolicyDocument> getManagedPolicies() {
        return managedPolicies.values();
    }

    public List<RelationshipEdge> getEdges() {
        return edges;
    }

    public Optional<SnapshotMetadata> getMetadata() {
        return Optional.ofNullable(metadata);
    }

    /**
     * Policies attached to the identity itself: managed policies in attachment order,
     * then inline policies.
     */
    public List<PolicyDocument> attachedPolicies(Identity identity) {
        List<PolicyDocument> documents = new ArrayList<>();
        for (String arn : identity.getAttachedPolicyArns()) {
            // attachments are validated at build time
            documents.add(managedPolicies.get(arn));
        }
        documents.addAll(identity.getInlinePolicies());
        return documents;
    }

    /**
     * Groups the user belongs to. Empty for groups and roles.
     */
    public List<Identity> groupsOf(Identity identity) {
        return groupsByUser.getOrDefault(identity.getArn(), List.of());
    }

    public List<Identity> membersOf(Identity group) {
        return membersByGroup.getOrDefault(group.getArn(), List.of());
    }

    /**
     * Policy documents reachable from the identity: direct attachments first, then those
     * inherited from each group (one level, groups do not nest). A document reachable on
     * several paths is listed once, with the first path found.
     */
    public List<PolicyGrant> effectivePolicyGrants(Identity identity) {
        Map<String, PolicyGrant> grants = new LinkedHashMap<>();
        for (PolicyDocument document : attachedPolicies(identity)) {
            grants.putIfAbsent(document.getId(), new PolicyGrant(document, Attribution.direct()));
        }
        for (Identity group : groupsOf(identity)) {
            Attribution viaGroup = Attribution.viaGroup(group.getName());
            for (PolicyDocument document : attachedPolicies(group)) {
                grants.putIfAbsent(document.getId(), new PolicyGrant(document, viaGroup));
            }
        }
        return new ArrayList<>(grants.values());
    }

    public List<PolicyDocument> effectivePolicies(Identity identity) {
        return effectivePolicyGrants(identity).stream()
                .map(PolicyGrant::getDocument)
                .collect(Collectors.toList());
    }

    /**
     * Roles whose trust policy lets this identity assume them, in snapshot order.
     * Only direct assumption; chains are followed by the query engine.
     */
    public Set<Identity> assumableRoles(Identity principal) {
        Set<Identity> roles = new LinkedHashSet<>();
        if (!principal.getType().canAssumeRoles()) {
            return roles;
        }
        for (Identity role : identities.values()) {
            if (role.getType() != IdentityType.ROLE) {
                continue;
            }
            PolicyDocument trust = role.getTrustPolicy().orElseThrow();
            if (trustEvaluator.allowsAssumption(trust, principal)) {
                roles.add(role);
            }
        }
        return roles;
    }

    /**
     * Nodes and edges for rendering. Trust sources that name an identity of the graph are
     * linked to it; any other principal (service, account, wildcard, foreign ARN) becomes a
     * {@code PRINCIPAL} node. An account or wildcard principal is drawn as one edge even
     * though {@link #assumableRoles} lets every matching identity assume the role.
     */
    public GraphExport export() {
        Map<String, GraphExport.Node> nodes = new LinkedHashMap<>();
        for (Identity identity : identities.values()) {
            nodes.put(identity.getArn(), new GraphExport.Node(identity.getArn(), identity.getName(),
                    GraphExport.NodeKind.valueOf(identity.getType().name())));
        }
        for (PolicyDocument policy : managedPolicies.values()) {
            nodes.put(policy.getId(), new GraphExport.Node(policy.getId(), policy.getName(), GraphExport.NodeKind.POLICY));
        }
        for (Identity identity : identities.values()) {
            for (PolicyDocument inline : identity.getInlinePolicies()) {
                nodes.put(inline.getId(), new GraphExport.Node(inline.getId(), inline.getName(), GraphExport.NodeKind.POLICY));
            }
        }

        List<GraphExport.Edge> exported = new ArrayList<>(edges.size());
        for (RelationshipEdge edge : edges) {
            String source = edge.getSource();
            if (edge.getKind() == EdgeKind.TRUSTS) {
                boolean knownIdentity = TrustPolicyEvaluator.AWS_PRINCIPAL.equals(edge.getPrincipalType())
                        && identities.containsKey(source);
                if (!knownIdentity) {
                    source = edge.getPrincipalType() + ":" + edge.getSource();
                    nodes.putIfAbsent(source, new GraphExport.Node(source, edge.getSource(), GraphExport.NodeKind.PRINCIPAL));
                }
            }
            exported.add(new GraphExport.Edge(edge.getKind(), source, edge.getTarget()));
        }
        return new GraphExport(List.copyOf(nodes.values()), exported);
    }

    public GraphStats stats() {
        Map<IdentityType, Long> byType = identities.values().stream()
                .collect(Collectors.groupingBy(Identity::getType, Collectors.counting()));
        int inline = identities.values().stream().mapToInt(i -> i.getInlinePolicies().size()).sum();
        int trusts = (int) edges.stream().filter(e -> e.getKind() == EdgeKind.TRUSTS).count();

        return GraphStats.builder()
                .totalNodes(export().getNodes().size())
                .totalEdges(edges.size())
                .users(byType.getOrDefault(IdentityType.USER, 0L).intValue())
                .groups(byType.getOrDefault(IdentityType.GROUP, 0L).intValue())
                .roles(byType.getOrDefault(IdentityType.ROLE, 0L).intValue())
                .policies(managedPolicies.size())
                .inlinePolicies(inline)
                .trustRelationships(trusts)
                .build();
    }

    private static Map<String, List<Identity>> copyOf(Map<String, List<Identity>> source) {
        Map<String, List<Identity>> copy = new LinkedHashMap<>();
        source.forEach((key, value) -> copy.put(key, List.copyOf(value)));
        return Collections.unmodifiableMap(copy);
    }
}
