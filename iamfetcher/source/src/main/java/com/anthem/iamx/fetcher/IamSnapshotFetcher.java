package com.anthem.iamx.fetcher;

import com.anthem.iamx.fetcher.exception.SnapshotFetchException;
import com.anthem.iamx.graph.snapshot.PolicyDocumentCodec;
import com.anthem.iamx.graph.snapshot.Snapshot;
import com.anthem.iamx.graph.snapshot.SnapshotGroup;
import com.anthem.iamx.graph.snapshot.SnapshotMetadata;
import com.anthem.iamx.graph.snapshot.SnapshotPolicy;
import com.anthem.iamx.graph.snapshot.SnapshotRole;
import com.anthem.iamx.graph.snapshot.SnapshotUser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.iam.IamClient;
import software.amazon.awssdk.services.iam.model.AttachedPolicy;
import software.amazon.awssdk.services.iam.model.EntityType;
import software.amazon.awssdk.services.iam.model.GetAccountAuthorizationDetailsRequest;
import software.amazon.awssdk.services.iam.model.GetAccountAuthorizationDetailsResponse;
import software.amazon.awssdk.services.iam.model.GroupDetail;
import software.amazon.awssdk.services.iam.model.ManagedPolicyDetail;
import software.amazon.awssdk.services.iam.model.PolicyDetail;
import software.amazon.awssdk.services.iam.model.PolicyVersion;
import software.amazon.awssdk.services.iam.model.RoleDetail;
import software.amazon.awssdk.services.iam.model.UserDetail;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Reads users, groups, roles and managed policies of one account through
 * {@code GetAccountAuthorizationDetails} and normalizes them into a {@link Snapshot}.
 *
 * <p>Only the default version of a managed policy is kept. AWS-managed policies are kept
 * when attached to some identity, or all of them with
 * {@link FetcherConfig#isIncludeAwsManaged()}.
 */
public class IamSnapshotFetcher {

    private static final Logger log = LoggerFactory.getLogger(IamSnapshotFetcher.class);

    private static final String AWS_MANAGED_PREFIX = "arn:aws:iam::aws:policy/";

    private final IamClient iamClient;
    private final ObjectMapper objectMapper;
    private final FetcherConfig config;
    private final Clock clock;

    public IamSnapshotFetcher(IamClient iamClient, ObjectMapper objectMapper, FetcherConfig config) {
        this(iamClient, objectMapper, config, Clock.systemUTC());
    }

    public IamSnapshotFetcher(IamClient iamClient, ObjectMapper objectMapper, FetcherConfig config, Clock clock) {
        this.iamClient = iamClient;
        this.objectMapper = objectMapper;
        this.config = config;
        this.clock = clock;
    }

    /**
     * @param accountId account the credentials belong to, recorded in the snapshot metadata
     * @throws SnapshotFetchException if an IAM call fails or a document cannot be decoded
     */
    public Snapshot fetch(String accountId) {
        log.info("Fetching IAM authorization details: profile={}, includeAwsManaged={}",
                config.getProfile(), config.isIncludeAwsManaged());

        List<UserDetail> users = new ArrayList<>();
        List<GroupDetail> groups = new ArrayList<>();
        List<RoleDetail> roles = new ArrayList<>();
        List<ManagedPolicyDetail> policies = new ArrayList<>();

        String marker = null;
        int pages = 0;
        do {
            GetAccountAuthorizationDetailsResponse page = requestPage(marker);
            users.addAll(page.userDetailList());
            groups.addAll(page.groupDetailList());
            roles.addAll(page.roleDetailList());
            policies.addAll(page.policies());
            pages++;
            marker = Boolean.TRUE.equals(page.isTruncated()) ? page.marker() : null;
        } while (marker != null);

        Snapshot snapshot = new Snapshot();
        snapshot.setUsers(users.stream().map(this::toUser).collect(Collectors.toList()));
        snapshot.setGroups(groups.stream().map(this::toGroup).collect(Collectors.toList()));
        snapshot.setRoles(roles.stream().map(this::toRole).collect(Collectors.toList()));
        snapshot.setPolicies(toPolicies(policies, attachedArns(snapshot)));
        snapshot.setMetadata(SnapshotMetadata.builder()
                .fetchTime(Instant.now(clock).toString())
                .profile(config.getProfile())
                .region(config.getRegion())
                .accountId(accountId)
                .build());

        log.info("Fetched IAM data: pages={}, users={}, groups={}, roles={}, policies={}",
                pages, snapshot.getUsers().size(), snapshot.getGroups().size(),
                snapshot.getRoles().size(), snapshot.getPolicies().size());
        return snapshot;
    }

    private GetAccountAuthorizationDetailsResponse requestPage(String marker) {
        GetAccountAuthorizationDetailsRequest request = GetAccountAuthorizationDetailsRequest.builder()
                .filter(EntityType.USER, EntityType.GROUP, EntityType.ROLE,
                        EntityType.LOCAL_MANAGED_POLICY, EntityType.AWS_MANAGED_POLICY)
                .marker(marker)
                .build();
        try {
            return iamClient.getAccountAuthorizationDetails(request);
        } catch (SdkException e) {
            log.error("GetAccountAuthorizationDetails failed: marker={}, error={}", marker, e.getMessage());
            throw new SnapshotFetchException("Failed to fetch IAM authorization details: " + e.getMessage(), e);
        }
    }

    private SnapshotUser toUser(UserDetail user) {
        return SnapshotUser.builder()
                .arn(user.arn())
                .name(user.userName())
                .path(user.path())
                .attachedPolicies(policyArns(user.attachedManagedPolicies()))
                .inlinePolicies(inline(user.arn(), user.userPolicyList()))
                .groups(new ArrayList<>(user.groupList()))
                .build();
    }

    private SnapshotGroup toGroup(GroupDetail group) {
        return SnapshotGroup.builder()
                .arn(group.arn())
                .name(group.groupName())
                .path(group.path())
                .attachedPolicies(policyArns(group.attachedManagedPolicies()))
                .inlinePolicies(inline(group.arn(), group.groupPolicyList()))
                .build();
    }

    private SnapshotRole toRole(RoleDetail role) {
        return SnapshotRole.builder()
                .arn(role.arn())
                .name(role.roleName())
                .path(role.path())
                .assumeRolePolicy(decode(role.assumeRolePolicyDocument(), role.arn() + "#trust"))
                .attachedPolicies(policyArns(role.attachedManagedPolicies()))
                .inlinePolicies(inline(role.arn(), role.rolePolicyList()))
                .build();
    }

    private List<SnapshotPolicy> toPolicies(List<ManagedPolicyDetail> details, Set<String> attached) {
        List<SnapshotPolicy> policies = new ArrayList<>();
        int skipped = 0;
        for (ManagedPolicyDetail detail : details) {
            boolean awsManaged = detail.arn().startsWith(AWS_MANAGED_PREFIX);
            if (awsManaged && !config.isIncludeAwsManaged() && !attached.contains(detail.arn())) {
                skipped++;
                continue;
            }
            policies.add(SnapshotPolicy.builder()
                    .arn(detail.arn())
                    .name(detail.policyName())
                    .policyDocument(decode(defaultVersion(detail).document(), detail.arn()))
                    .awsManaged(awsManaged)
                    .build());
        }
        log.debug("Skipped unattached AWS-managed policies: count={}", skipped);
        return policies;
    }

    private PolicyVersion defaultVersion(ManagedPolicyDetail detail) {
        return detail.policyVersionList().stream()
                .filter(v -> Boolean.TRUE.equals(v.isDefaultVersion())
                        || (detail.defaultVersionId() != null && detail.defaultVersionId().equals(v.versionId())))
                .findFirst()
                .orElseThrow(() -> new SnapshotFetchException("Managed policy has no default version: " + detail.arn()));
    }

    private Map<String, JsonNode> inline(String ownerArn, List<PolicyDetail> details) {
        Map<String, JsonNode> documents = new LinkedHashMap<>();
        for (PolicyDetail detail : details) {
            documents.put(detail.policyName(), decode(detail.policyDocument(), ownerArn + "#" + detail.policyName()));
        }
        return documents;
    }

    private static List<String> policyArns(List<AttachedPolicy> attached) {
        return attached.stream().map(AttachedPolicy::policyArn).collect(Collectors.toList());
    }

    private static Set<String> attachedArns(Snapshot snapshot) {
        Set<String> arns = new HashSet<>();
        snapshot.getUsers().forEach(u -> arns.addAll(u.getAttachedPolicies()));
        snapshot.getGroups().forEach(g -> arns.addAll(g.getAttachedPolicies()));
        snapshot.getRoles().forEach(r -> arns.addAll(r.getAttachedPolicies()));
        return arns;
    }

    /**
     * IAM returns policy documents URL-encoded (RFC 3986).
     */
    JsonNode decode(String document, String id) {
        if (document == null) {
            throw new SnapshotFetchException("Policy document missing: " + id);
        }
        String json = document.trim().startsWith("{") ? document : PolicyDocumentCodec.urlDecode(document);
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new SnapshotFetchException("Policy document of " + id + " is not valid JSON", e);
        }
    }
}
