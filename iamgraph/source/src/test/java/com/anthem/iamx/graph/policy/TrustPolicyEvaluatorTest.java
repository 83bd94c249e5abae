package com.anthem.iamx.graph.policy;

import com.anthem.iamx.graph.SnapshotFixtures;
import com.anthem.iamx.graph.model.Identity;
import com.anthem.iamx.graph.model.IdentityType;
import com.anthem.iamx.graph.model.PolicyDocument;
import com.anthem.iamx.graph.model.PolicyKind;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static com.anthem.iamx.graph.SnapshotFixtures.json;
import static com.anthem.iamx.graph.SnapshotFixtures.trust;
import static com.anthem.iamx.graph.SnapshotFixtures.userArn;
import static org.assertj.core.api.Assertions.assertThat;

class TrustPolicyEvaluatorTest {

    private TrustPolicyEvaluator evaluator;
    private Identity alice;

    @BeforeEach
    void setUp() {
        evaluator = new TrustPolicyEvaluator();
        alice = Identity.builder().arn(userArn("alice")).name("alice").type(IdentityType.USER).build();
    }

    @Test
    void shouldAllowNamedPrincipal() {
        assertThat(evaluator.allowsAssumption(trustDoc(trust(userArn("alice"))), alice)).isTrue();
        assertThat(evaluator.allowsAssumption(trustDoc(trust(userArn("bob"))), alice)).isFalse();
    }

    @Test
    void shouldMatchAccountRootBareAccountAndWildcards() {
        assertThat(evaluator.allowsAssumption(trustDoc(trust("arn:aws:iam::123456789012:root")), alice)).isTrue();
        assertThat(evaluator.allowsAssumption(trustDoc(trust("123456789012")), alice)).isTrue();
        assertThat(evaluator.allowsAssumption(trustDoc(trust("arn:aws:iam::999999999999:root")), alice)).isFalse();
        assertThat(evaluator.allowsAssumption(trustDoc(trust("arn:aws:iam::123456789012:user/*")), alice)).isTrue();
        assertThat(evaluator.allowsAssumption(trustDoc(trust("*")), alice)).isTrue();
    }

    @Test
    void principalStarIsTreatedAsAnyAwsPrincipal() {
        JsonNode document = json("""
                {"Statement": [{"Effect": "Allow", "Principal": "*", "Action": "sts:AssumeRole"}]}""");

        assertThat(evaluator.allowsAssumption(trustDoc(document), alice)).isTrue();
    }

    @Test
    void serviceOnlyTrustNeverMatchesAnIdentity() {
        JsonNode document = json("""
                {"Statement": [{"Effect": "Allow", "Principal": {"Service": "lambda.amazonaws.com"},
                                "Action": "sts:AssumeRole"}]}""");

        assertThat(evaluator.allowsAssumption(trustDoc(document), alice)).isFalse();
    }

    @Test
    void denyStatementWinsOverAllow() {
        JsonNode document = json("""
                {"Statement": [
                  {"Effect": "Allow", "Principal": {"AWS": "123456789012"}, "Action": "sts:AssumeRole"},
                  {"Effect": "Deny", "Principal": {"AWS": "arn:aws:iam::123456789012:user/alice"}, "Action": "sts:*"}
                ]}""");

        EvaluationResult result = evaluator.evaluate(trustDoc(document), alice);

        assertThat(result.getDecision()).isEqualTo(Decision.DENY);
        assertThat(result.getMatchedAllows()).hasSize(1);
        assertThat(result.getMatchedDenies()).hasSize(1);
    }

    @Test
    void otherActionsDoNotGrantAssumption() {
        JsonNode document = json("""
                {"Statement": [{"Effect": "Allow", "Principal": {"AWS": "*"},
                                "Action": "sts:AssumeRoleWithWebIdentity"}]}""");

        assertThat(evaluator.allowsAssumption(trustDoc(document), alice)).isFalse();
    }

    @Test
    void groupsCannotAssumeRoles() {
        Identity group = Identity.builder()
                .arn("arn:aws:iam::123456789012:group/devs").name("devs").type(IdentityType.GROUP).build();

        assertThat(evaluator.allowsAssumption(trustDoc(trust("*")), group)).isFalse();
    }

    private PolicyDocument trustDoc(JsonNode document) {
        String roleArn = SnapshotFixtures.roleArn("Target");
        return SnapshotFixtures.codec().parse(document, PolicyKind.TRUST, PolicyDocument.trustId(roleArn),
                "trust", roleArn, false);
    }
}
