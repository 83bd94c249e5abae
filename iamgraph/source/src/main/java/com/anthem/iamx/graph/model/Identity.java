package com.anthem.iamx.graph.model;

import com.anthem.iamx.graph.exception.MalformedEntityException;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Optional;

/**
 * A user, group or role of the snapshot.
 *
 * <p>Holds the identity's own data only; managed policy attachments and group
 * memberships are kept as references and resolved by the graph.
 */
@Value
public class Identity {

    String arn;
    String name;
    IdentityType type;
    String path;
    List<String> attachedPolicyArns;
    List<PolicyDocument> inlinePolicies;
    List<String> groupRefs;
    PolicyDocument trustPolicy;

    @Builder
    public Identity(String arn, String name, IdentityType type, String path, List<String> attachedPolicyArns,
                    List<PolicyDocument> inlinePolicies, List<String> groupRefs, PolicyDocument trustPolicy) {
        String recordId = arn != null ? arn : String.valueOf(name);
        if (arn == null || arn.isBlank()) {
            throw new MalformedEntityException(recordId, "identifier (arn) is required");
        }
        if (name == null || name.isBlank()) {
            throw new MalformedEntityException(recordId, "name is required");
        }
        if (type == null) {
            throw new MalformedEntityException(recordId, "identity type is required");
        }
        if (type != IdentityType.USER && groupRefs != null && !groupRefs.isEmpty()) {
            throw new MalformedEntityException(recordId, type.getLabel() + " cannot be a member of a group");
        }
        if (type != IdentityType.ROLE && trustPolicy != null) {
            throw new MalformedEntityException(recordId, "only roles carry a trust policy");
        }
        if (type == IdentityType.ROLE && trustPolicy == null) {
            throw new MalformedEntityException(recordId, "role is missing its trust policy");
        }

        this.arn = arn;
        this.name = name;
        this.type = type;
        this.path = path != null ? path : "/";
        this.attachedPolicyArns = attachedPolicyArns == null ? List.of() : List.copyOf(attachedPolicyArns);
        this.inlinePolicies = inlinePolicies == null ? List.of() : List.copyOf(inlinePolicies);
        this.groupRefs = groupRefs == null ? List.of() : List.copyOf(groupRefs);
        this.trustPolicy = trustPolicy;
    }

    public Optional<PolicyDocument> getTrustPolicy() {
        return Optional.ofNullable(trustPolicy);
    }

    /**
     * Account id taken from the ARN ({@code arn:aws:iam::123456789012:user/alice}),
     * or null when the ARN has no account field.
     */
    public String getAccountId() {
        String[] parts = arn.split(":", 6);
        if (parts.length < 6 || parts[4].isEmpty()) {
            return null;
        }
        return parts[4];
    }

    /**
     * Display form used in logs and reports, e.g. {@code User:alice}.
     */
    public String getDisplayName() {
        return type.getLabel() + ":" + name;
    }
}
