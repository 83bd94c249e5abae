package com.anthem.iamx.fetcher;

import lombok.Builder;
import lombok.Value;

/**
 * Connection settings for the IAM and STS clients.
 */
@Value
@Builder(toBuilder = true)
public class FetcherConfig {

    /**
     * Named profile from the shared AWS config files; null for the default provider chain.
     */
    String profile;

    @Builder.Default
    String region = "us-east-1";

    /**
     * Endpoint override, e.g. {@code http://localhost:4566} for LocalStack. When set, the
     * clients use static test credentials.
     */
    String endpoint;

    /**
     * Keep every AWS-managed policy, not only those attached to an identity.
     */
    boolean includeAwsManaged;

    public boolean isLocal() {
        return endpoint != null && !endpoint.isBlank();
    }
}
