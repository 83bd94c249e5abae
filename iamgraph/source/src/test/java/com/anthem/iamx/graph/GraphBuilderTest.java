package com.anthem.iamx.graph;

import com.anthem.iamx.graph.exception.InconsistentSnapshotException;
import com.anthem.iamx.graph.exception.MalformedEntityException;
import com.anthem.iamx.graph.model.EdgeKind;
import com.anthem.iamx.graph.model.Identity;
import com.anthem.iamx.graph.model.PolicyDocument;
import com.anthem.iamx.graph.model.RelationshipEdge;
import com.anthem.iamx.graph.snapshot.Snapshot;
import com.anthem.iamx.graph.snapshot.SnapshotGroup;
import com.anthem.iamx.graph.snapshot.SnapshotPolicy;
import com.anthem.iamx.graph.snapshot.SnapshotRole;
import com.anthem.iamx.graph.snapshot.SnapshotUser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.anthem.iamx.graph.SnapshotFixtures.groupArn;
import static com.anthem.iamx.graph.SnapshotFixtures.policy;
import static com.anthem.iamx.graph.SnapshotFixtures.policyArn;
import static com.anthem.iamx.graph.SnapshotFixtures.roleArn;
import static com.anthem.iamx.graph.SnapshotFixtures.trust;
import static com.anthem.iamx.graph.SnapshotFixtures.userArn;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GraphBuilderTest {

    private GraphBuilder builder;

    @BeforeEach
    void setUp() {
        builder = SnapshotFixtures.graphBuilder();
    }

    @Test
    void shouldBuildSampleGraphInSnapshotOrder() {
        PermissionGraph graph = SnapshotFixtures.sampleGraph();

        assertThat(graph.allIdentities().map(Identity::getName)).containsExactly(
                "alice", "bob", "carol", "dave", "developers", "readers",
                "DeployRole", "AuditRole", "CycleA", "CycleB");
        assertThat(graph.getManagedPolicies()).hasSize(4);
        assertThat(graph.getMetadata()).hasValueSatisfying(m -> assertThat(m.getRegion()).isEqualTo("us-east-1"));
    }

    @Test
    void allIdentitiesReturnsAFreshStreamEachCall() {
        PermissionGraph graph = SnapshotFixtures.sampleGraph();

        assertThat(graph.allIdentities().count()).isEqualTo(10);
        assertThat(graph.allIdentities().count()).isEqualTo(10);
    }

    @Test
    void shouldCreateTypedEdges() {
        PermissionGraph graph = SnapshotFixtures.sampleGraph();
        List<RelationshipEdge> edges = graph.getEdges();

        assertThat(edges).contains(
                RelationshipEdge.memberOf(userArn("alice"), groupArn("developers")),
                RelationshipEdge.memberOf(userArn("bob"), groupArn("readers")),
                RelationshipEdge.attached(groupArn("developers"), policyArn("S3FullAccess")),
                RelationshipEdge.attached(userArn("alice"), PolicyDocument.inlineId(userArn("alice"), "DenyDeleteBucket")),
                RelationshipEdge.trusts("AWS", userArn("carol"), roleArn("DeployRole")),
                RelationshipEdge.trusts("Service", "ec2.amazonaws.com", roleArn("AuditRole")));
        assertThat(edges).filteredOn(e -> e.getKind() == EdgeKind.TRUSTS).hasSize(5);
        assertThat(edges).hasSize(16);
    }

    @Test
    void trustEdgesFollowTheAssumptionRule() {
        // Given: frank is denied by name, gina only gets a SAML action, the account root stays
        Snapshot snapshot = Snapshot.builder()
                .users(List.of(
                        SnapshotUser.builder().arn(userArn("frank")).name("frank").build(),
                        SnapshotUser.builder().arn(userArn("gina")).name("gina").build()))
                .roles(List.of(SnapshotRole.builder()
                        .arn(roleArn("Guarded")).name("Guarded")
                        .assumeRolePolicy(SnapshotFixtures.json("""
                                {"Statement": [
                                  {"Effect": "Allow", "Action": "sts:AssumeRole",
                                   "Principal": {"AWS": ["arn:aws:iam::123456789012:user/frank",
                                                         "arn:aws:iam::123456789012:root"]}},
                                  {"Effect": "Allow", "Action": "sts:AssumeRoleWithSAML",
                                   "Principal": {"AWS": "arn:aws:iam::123456789012:user/gina",
                                                 "Federated": "arn:aws:iam::123456789012:saml-provider/corp"}},
                                  {"Effect": "Deny", "Action": "sts:AssumeRole",
                                   "Principal": {"AWS": "arn:aws:iam::123456789012:user/frank"}}
                                ]}"""))
                        .build()))
                .build();

        // When
        PermissionGraph graph = builder.build(snapshot);

        // Then
        assertThat(graph.getEdges()).filteredOn(e -> e.getKind() == EdgeKind.TRUSTS).containsExactlyInAnyOrder(
                RelationshipEdge.trusts("AWS", "arn:aws:iam::123456789012:root", roleArn("Guarded")),
                RelationshipEdge.trusts("Federated", "arn:aws:iam::123456789012:saml-provider/corp", roleArn("Guarded")));
        assertThat(graph.assumableRoles(graph.findIdentity("frank"))).isEmpty();
        assertThat(graph.assumableRoles(graph.findIdentity("gina"))).extracting(Identity::getName)
                .containsExactly("Guarded");
    }

    @Test
    void effectivePoliciesListDirectThenGroupWithoutDuplicates() {
        // Given: the user and its group both attach the same managed policy
        Snapshot snapshot = Snapshot.builder()
                .policies(List.of(managed("Shared", "s3:GetObject"), managed("GroupOnly", "sqs:*")))
                .groups(List.of(SnapshotGroup.builder()
                        .arn(groupArn("team")).name("team")
                        .attachedPolicies(List.of(policyArn("GroupOnly"), policyArn("Shared")))
                        .build()))
                .users(List.of(SnapshotUser.builder()
                        .arn(userArn("erin")).name("erin")
                        .attachedPolicies(List.of(policyArn("Shared")))
                        .inlinePolicies(Map.of("Own", policy("Allow", "sns:Publish", "*")))
                        .groups(List.of("team"))
                        .build()))
                .build();

        // When
        PermissionGraph graph = builder.build(snapshot);
        Identity erin = graph.findIdentity("erin");

        // Then
        assertThat(graph.effectivePolicies(erin)).extracting(PolicyDocument::getId).containsExactly(
                policyArn("Shared"), PolicyDocument.inlineId(userArn("erin"), "Own"), policyArn("GroupOnly"));
        assertThat(graph.effectivePolicyGrants(erin)).extracting(g -> g.getAttribution().getLabel())
                .containsExactly("direct", "direct", "via-group:team");
        assertThat(graph.membersOf(graph.findIdentity("Group:team"))).containsExactly(erin);
    }

    @Test
    void shouldRejectDuplicateIdentifier() {
        Snapshot snapshot = Snapshot.builder()
                .users(List.of(
                        SnapshotUser.builder().arn(userArn("dup")).name("dup").build(),
                        SnapshotUser.builder().arn(userArn("dup")).name("dup2").build()))
                .build();

        assertThatThrownBy(() -> builder.build(snapshot))
                .isInstanceOf(MalformedEntityException.class)
                .hasMessageContaining("duplicate identifier")
                .extracting("recordId").isEqualTo(userArn("dup"));
    }

    @Test
    void shouldRejectRecordWithoutArn() {
        Snapshot snapshot = Snapshot.builder()
                .users(List.of(SnapshotUser.builder().name("nameless").build()))
                .build();

        assertThatThrownBy(() -> builder.build(snapshot))
                .isInstanceOf(MalformedEntityException.class)
                .hasMessageContaining("identifier (arn) is required");
    }

    @Test
    void shouldRejectAttachmentToUnknownPolicy() {
        Snapshot snapshot = Snapshot.builder()
                .users(List.of(SnapshotUser.builder()
                        .arn(userArn("frank")).name("frank")
                        .attachedPolicies(List.of(policyArn("Missing")))
                        .build()))
                .build();

        assertThatThrownBy(() -> builder.build(snapshot))
                .isInstanceOf(InconsistentSnapshotException.class)
                .satisfies(e -> {
                    InconsistentSnapshotException ex = (InconsistentSnapshotException) e;
                    assertThat(ex.getRecordId()).isEqualTo(userArn("frank"));
                    assertThat(ex.getMissingReference()).isEqualTo(policyArn("Missing"));
                    assertThat(ex.getErrorCode()).isEqualTo("INCONSISTENT_SNAPSHOT");
                });
    }

    @Test
    void shouldRejectMembershipOfUnknownGroup() {
        Snapshot snapshot = Snapshot.builder()
                .users(List.of(SnapshotUser.builder()
                        .arn(userArn("gina")).name("gina")
                        .groups(List.of("ghosts"))
                        .build()))
                .build();

        assertThatThrownBy(() -> builder.build(snapshot))
                .isInstanceOf(InconsistentSnapshotException.class)
                .hasMessageContaining("ghosts");
    }

    @Test
    void shouldRejectRoleWithoutTrustPolicy() {
        Snapshot snapshot = Snapshot.builder()
                .roles(List.of(SnapshotRole.builder().arn(roleArn("NoTrust")).name("NoTrust").build()))
                .build();

        assertThatThrownBy(() -> builder.build(snapshot))
                .isInstanceOf(MalformedEntityException.class)
                .hasMessageContaining("policy document is missing");
    }

    @Test
    void assumableRolesFollowTrustPolicies() {
        PermissionGraph graph = SnapshotFixtures.sampleGraph();

        assertThat(graph.assumableRoles(graph.findIdentity("carol"))).extracting(Identity::getName)
                .containsExactly("DeployRole");
        assertThat(graph.assumableRoles(graph.findIdentity("DeployRole"))).extracting(Identity::getName)
                .containsExactly("CycleA");
        assertThat(graph.assumableRoles(graph.findIdentity("developers"))).isEmpty();
        assertThat(graph.assumableRoles(graph.findIdentity("alice"))).isEmpty();
    }

    @Test
    void wildcardTrustPrincipalAppliesToEveryUserAndRole() {
        Snapshot snapshot = Snapshot.builder()
                .users(List.of(SnapshotUser.builder().arn(userArn("hal")).name("hal").build()))
                .roles(List.of(SnapshotRole.builder()
                        .arn(roleArn("Open")).name("Open")
                        .assumeRolePolicy(trust("arn:aws:iam::123456789012:*"))
                        .build()))
                .build();

        PermissionGraph graph = builder.build(snapshot);

        assertThat(graph.assumableRoles(graph.findIdentity("hal"))).extracting(Identity::getName).containsExactly("Open");
    }

    private static SnapshotPolicy managed(String name, String action) {
        return SnapshotPolicy.builder()
                .arn(policyArn(name))
                .name(name)
                .policyDocument(policy("Allow", action, "*"))
                .build();
    }
}
