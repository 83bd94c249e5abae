package com.anthem.iamx.graph;

import com.anthem.iamx.graph.exception.UnknownIdentityException;
import com.anthem.iamx.graph.model.EdgeKind;
import com.anthem.iamx.graph.model.IdentityType;
import com.anthem.iamx.graph.snapshot.Snapshot;
import com.anthem.iamx.graph.snapshot.SnapshotGroup;
import com.anthem.iamx.graph.snapshot.SnapshotUser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.anthem.iamx.graph.SnapshotFixtures.groupArn;
import static com.anthem.iamx.graph.SnapshotFixtures.roleArn;
import static com.anthem.iamx.graph.SnapshotFixtures.userArn;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PermissionGraphTest {

    private PermissionGraph graph;

    @BeforeEach
    void setUp() {
        graph = SnapshotFixtures.sampleGraph();
    }

    @Test
    void findIdentityAcceptsArnTypedNameAndPlainName() {
        assertThat(graph.findIdentity(userArn("alice")).getName()).isEqualTo("alice");
        assertThat(graph.findIdentity("Role:DeployRole").getArn()).isEqualTo(roleArn("DeployRole"));
        assertThat(graph.findIdentity("readers").getType()).isEqualTo(IdentityType.GROUP);
    }

    @Test
    void findIdentityRejectsUnknownAndEmptyReferences() {
        assertThatThrownBy(() -> graph.findIdentity("mallory"))
                .isInstanceOf(UnknownIdentityException.class)
                .hasMessage("Unknown identity: mallory");
        assertThatThrownBy(() -> graph.findIdentity(""))
                .isInstanceOf(UnknownIdentityException.class);
    }

    @Test
    void findIdentityRejectsAmbiguousName() {
        // Given: a user and a group share a name
        PermissionGraph shared = SnapshotFixtures.graphBuilder().build(Snapshot.builder()
                .users(List.of(SnapshotUser.builder().arn(userArn("ops")).name("ops").build()))
                .groups(List.of(SnapshotGroup.builder().arn(groupArn("ops")).name("ops").build()))
                .build());

        // When / Then
        assertThatThrownBy(() -> shared.findIdentity("ops"))
                .isInstanceOf(UnknownIdentityException.class)
                .hasMessageContaining("Ambiguous")
                .hasMessageContaining("User:ops")
                .hasMessageContaining("Group:ops");
        assertThat(shared.findIdentity("Group:ops").getArn()).isEqualTo(groupArn("ops"));
    }

    @Test
    void exportLinksKnownPrincipalsAndAddsExternalOnes() {
        GraphExport export = graph.export();

        assertThat(export.getNodes()).hasSize(19);
        assertThat(export.getNodes()).filteredOn(n -> n.getKind() == GraphExport.NodeKind.PRINCIPAL)
                .extracting(GraphExport.Node::getId)
                .containsExactly("Service:ec2.amazonaws.com");
        assertThat(export.getEdges()).contains(
                new GraphExport.Edge(EdgeKind.TRUSTS, userArn("carol"), roleArn("DeployRole")),
                new GraphExport.Edge(EdgeKind.TRUSTS, "Service:ec2.amazonaws.com", roleArn("AuditRole")));
    }

    @Test
    void statsCountNodesAndEdges() {
        GraphStats stats = graph.stats();

        assertThat(stats.getUsers()).isEqualTo(4);
        assertThat(stats.getGroups()).isEqualTo(2);
        assertThat(stats.getRoles()).isEqualTo(4);
        assertThat(stats.getPolicies()).isEqualTo(4);
        assertThat(stats.getInlinePolicies()).isEqualTo(4);
        assertThat(stats.getTrustRelationships()).isEqualTo(5);
        assertThat(stats.getTotalEdges()).isEqualTo(16);
        assertThat(stats.getTotalNodes()).isEqualTo(19);
    }
}
