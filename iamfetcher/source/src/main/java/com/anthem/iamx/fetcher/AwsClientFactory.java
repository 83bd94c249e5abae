package com.anthem.iamx.fetcher;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.ProfileCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.iam.IamClient;
import software.amazon.awssdk.services.iam.IamClientBuilder;
import software.amazon.awssdk.services.sts.StsClient;
import software.amazon.awssdk.services.sts.StsClientBuilder;

import java.net.URI;

/**
 * Builds the IAM and STS clients for a {@link FetcherConfig}.
 *
 * <p>IAM is a global service and is addressed through {@link Region#AWS_GLOBAL}, except
 * against a local endpoint where the configured region is used.
 */
public class AwsClientFactory {

    private static final Logger log = LoggerFactory.getLogger(AwsClientFactory.class);

    private final FetcherConfig config;

    public AwsClientFactory(FetcherConfig config) {
        this.config = config;
    }

    public IamClient iamClient() {
        IamClientBuilder builder = IamClient.builder().credentialsProvider(credentials());
        if (config.isLocal()) {
            builder.endpointOverride(URI.create(config.getEndpoint())).region(Region.of(config.getRegion()));
        } else {
            builder.region(Region.AWS_GLOBAL);
        }
        log.debug("Creating IAM client: profile={}, endpoint={}", config.getProfile(), config.getEndpoint());
        return builder.build();
    }

    public StsClient stsClient() {
        StsClientBuilder builder = StsClient.builder()
                .credentialsProvider(credentials())
                .region(Region.of(config.getRegion()));
        if (config.isLocal()) {
            builder.endpointOverride(URI.create(config.getEndpoint()));
        }
        log.debug("Creating STS client: profile={}, region={}", config.getProfile(), config.getRegion());
        return builder.build();
    }

    AwsCredentialsProvider credentials() {
        if (config.isLocal()) {
            return StaticCredentialsProvider.create(AwsBasicCredentials.create("test", "test"));
        }
        if (config.getProfile() != null && !config.getProfile().isBlank()) {
            return ProfileCredentialsProvider.create(config.getProfile());
        }
        return DefaultCredentialsProvider.create();
    }
}
