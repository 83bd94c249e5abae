package com.anthem.iamx.fetcher;

import com.anthem.iamx.fetcher.exception.SnapshotFetchException;
import com.anthem.iamx.graph.snapshot.Snapshot;
import com.anthem.iamx.graph.snapshot.SnapshotPolicy;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import software.amazon.awssdk.services.iam.IamClient;
import software.amazon.awssdk.services.iam.model.AttachedPolicy;
import software.amazon.awssdk.services.iam.model.GetAccountAuthorizationDetailsRequest;
import software.amazon.awssdk.services.iam.model.GetAccountAuthorizationDetailsResponse;
import software.amazon.awssdk.services.iam.model.GroupDetail;
import software.amazon.awssdk.services.iam.model.IamException;
import software.amazon.awssdk.services.iam.model.ManagedPolicyDetail;
import software.amazon.awssdk.services.iam.model.PolicyDetail;
import software.amazon.awssdk.services.iam.model.PolicyVersion;
import software.amazon.awssdk.services.iam.model.RoleDetail;
import software.amazon.awssdk.services.iam.model.UserDetail;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class IamSnapshotFetcherTest {

    private static final String ACCOUNT = "123456789012";
    private static final String S3_READ = "arn:aws:iam::" + ACCOUNT + ":policy/S3Read";
    private static final String AWS_READ_ONLY = "arn:aws:iam::aws:policy/ReadOnlyAccess";
    private static final String AWS_ADMIN = "arn:aws:iam::aws:policy/AdministratorAccess";

    @Mock
    private IamClient iamClient;

    private IamSnapshotFetcher fetcher;

    @BeforeEach
    void setUp() {
        fetcher = fetcher(false);
    }

    @Test
    void shouldFollowMarkersAcrossPages() {
        // Given
        when(iamClient.getAccountAuthorizationDetails(any(GetAccountAuthorizationDetailsRequest.class)))
                .thenReturn(firstPage(), secondPage());

        // When
        Snapshot snapshot = fetcher.fetch(ACCOUNT);

        // Then
        ArgumentCaptor<GetAccountAuthorizationDetailsRequest> requests =
                ArgumentCaptor.forClass(GetAccountAuthorizationDetailsRequest.class);
        verify(iamClient, times(2)).getAccountAuthorizationDetails(requests.capture());
        assertThat(requests.getAllValues().get(0).marker()).isNull();
        assertThat(requests.getAllValues().get(1).marker()).isEqualTo("page-2");

        assertThat(snapshot.getUsers()).hasSize(1);
        assertThat(snapshot.getUsers().get(0).getGroups()).containsExactly("readers");
        assertThat(snapshot.getRoles()).hasSize(1);
        assertThat(snapshot.getMetadata().getAccountId()).isEqualTo(ACCOUNT);
        assertThat(snapshot.getMetadata().getFetchTime()).isEqualTo("2024-06-01T00:00:00Z");
    }

    @Test
    void shouldDecodeUrlEncodedDocumentsAndKeepDefaultVersion() {
        when(iamClient.getAccountAuthorizationDetails(any(GetAccountAuthorizationDetailsRequest.class)))
                .thenReturn(firstPage(), secondPage());

        Snapshot snapshot = fetcher.fetch(ACCOUNT);

        SnapshotPolicy s3Read = snapshot.getPolicies().stream()
                .filter(p -> p.getArn().equals(S3_READ)).findFirst().orElseThrow();
        assertThat(s3Read.getPolicyDocument().path("Statement").get(0).path("Action").asText())
                .isEqualTo("s3:GetObject");
        assertThat(snapshot.getUsers().get(0).getInlinePolicies().get("Own").path("Statement").get(0)
                .path("Effect").asText()).isEqualTo("Deny");
        assertThat(snapshot.getRoles().get(0).getAssumeRolePolicy().path("Statement").get(0)
                .path("Principal").path("Service").asText()).isEqualTo("lambda.amazonaws.com");
    }

    @Test
    void shouldKeepOnlyAttachedAwsManagedPoliciesByDefault() {
        when(iamClient.getAccountAuthorizationDetails(any(GetAccountAuthorizationDetailsRequest.class)))
                .thenReturn(firstPage(), secondPage());

        Snapshot snapshot = fetcher.fetch(ACCOUNT);

        assertThat(snapshot.getPolicies()).extracting(SnapshotPolicy::getArn)
                .containsExactly(S3_READ, AWS_READ_ONLY);
        assertThat(snapshot.getPolicies()).filteredOn(SnapshotPolicy::isAwsManaged)
                .extracting(SnapshotPolicy::getArn).containsExactly(AWS_READ_ONLY);
    }

    @Test
    void shouldKeepAllAwsManagedPoliciesWhenRequested() {
        when(iamClient.getAccountAuthorizationDetails(any(GetAccountAuthorizationDetailsRequest.class)))
                .thenReturn(firstPage(), secondPage());

        Snapshot snapshot = fetcher(true).fetch(ACCOUNT);

        assertThat(snapshot.getPolicies()).extracting(SnapshotPolicy::getArn)
                .containsExactly(S3_READ, AWS_READ_ONLY, AWS_ADMIN);
    }

    @Test
    void shouldWrapIamFailures() {
        when(iamClient.getAccountAuthorizationDetails(any(GetAccountAuthorizationDetailsRequest.class)))
                .thenThrow(IamException.builder().message("Access denied").statusCode(403).build());

        assertThatThrownBy(() -> fetcher.fetch(ACCOUNT))
                .isInstanceOf(SnapshotFetchException.class)
                .hasMessageContaining("Access denied")
                .extracting("errorCode").isEqualTo(SnapshotFetchException.CODE);
    }

    @Test
    void shouldKeepLiteralPlusInPercentEncodedDocument() {
        // IAM leaves '+' unescaped and encodes spaces as %20
        String encoded = "%7B%22Statement%22%3A%5B%7B%22Effect%22%3A%22Allow%22%2C%20%22Action%22%3A%22s3%3AGetObject%22%2C"
                + "%22Resource%22%3A%22arn%3Aaws%3As3%3A%3A%3Areports/a+b%22%7D%5D%7D";

        assertThat(fetcher.decode(encoded, "plus").path("Statement").get(0).path("Resource").asText())
                .isEqualTo("arn:aws:s3:::reports/a+b");
    }

    @Test
    void shouldRejectUndecodableDocument() {
        assertThatThrownBy(() -> fetcher.decode("%7Bnot-json", "bad"))
                .isInstanceOf(SnapshotFetchException.class)
                .hasMessageContaining("bad");
    }

    private IamSnapshotFetcher fetcher(boolean includeAwsManaged) {
        FetcherConfig config = FetcherConfig.builder()
                .profile("audit")
                .includeAwsManaged(includeAwsManaged)
                .build();
        return new IamSnapshotFetcher(iamClient, new ObjectMapper(), config,
                Clock.fixed(Instant.parse("2024-06-01T00:00:00Z"), ZoneOffset.UTC));
    }

    private static GetAccountAuthorizationDetailsResponse firstPage() {
        return GetAccountAuthorizationDetailsResponse.builder()
                .userDetailList(UserDetail.builder()
                        .arn("arn:aws:iam::" + ACCOUNT + ":user/alice")
                        .userName("alice")
                        .path("/")
                        .groupList("readers")
                        .userPolicyList(PolicyDetail.builder()
                                .policyName("Own")
                                .policyDocument(encode("{\"Statement\":[{\"Effect\":\"Deny\",\"Action\":\"iam:*\",\"Resource\":\"*\"}]}"))
                                .build())
                        .build())
                .groupDetailList(GroupDetail.builder()
                        .arn("arn:aws:iam::" + ACCOUNT + ":group/readers")
                        .groupName("readers")
                        .path("/")
                        .attachedManagedPolicies(AttachedPolicy.builder().policyArn(S3_READ).policyName("S3Read").build())
                        .build())
                .policies(managed(S3_READ, "S3Read", "s3:GetObject"))
                .isTruncated(true)
                .marker("page-2")
                .build();
    }

    private static GetAccountAuthorizationDetailsResponse secondPage() {
        return GetAccountAuthorizationDetailsResponse.builder()
                .roleDetailList(RoleDetail.builder()
                        .arn("arn:aws:iam::" + ACCOUNT + ":role/Worker")
                        .roleName("Worker")
                        .path("/")
                        .assumeRolePolicyDocument(encode("{\"Statement\":[{\"Effect\":\"Allow\","
                                + "\"Principal\":{\"Service\":\"lambda.amazonaws.com\"},\"Action\":\"sts:AssumeRole\"}]}"))
                        .attachedManagedPolicies(AttachedPolicy.builder().policyArn(AWS_READ_ONLY).policyName("ReadOnlyAccess").build())
                        .build())
                .policies(managed(AWS_READ_ONLY, "ReadOnlyAccess", "s3:Get*"),
                        managed(AWS_ADMIN, "AdministratorAccess", "*"))
                .isTruncated(false)
                .build();
    }

    private static ManagedPolicyDetail managed(String arn, String name, String action) {
        return ManagedPolicyDetail.builder()
                .arn(arn)
                .policyName(name)
                .defaultVersionId("v2")
                .policyVersionList(
                        PolicyVersion.builder().versionId("v1").isDefaultVersion(false)
                                .document(encode("{\"Statement\":[{\"Effect\":\"Allow\",\"Action\":\"old:Action\",\"Resource\":\"*\"}]}"))
                                .build(),
                        PolicyVersion.builder().versionId("v2").isDefaultVersion(true)
                                .document(encode("{\"Statement\":[{\"Effect\":\"Allow\",\"Action\":\"" + action + "\",\"Resource\":\"*\"}]}"))
                                .build())
                .build();
    }

    private static String encode(String json) {
        return URLEncoder.encode(json, StandardCharsets.UTF_8);
    }
}
