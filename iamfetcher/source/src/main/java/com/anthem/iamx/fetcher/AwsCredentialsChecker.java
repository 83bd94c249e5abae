package com.anthem.iamx.fetcher;

import com.anthem.iamx.fetcher.exception.AwsCredentialsException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.awscore.exception.AwsServiceException;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.sts.StsClient;
import software.amazon.awssdk.services.sts.model.GetCallerIdentityResponse;

import java.util.Set;

/**
 * Verifies the configured credentials with STS {@code GetCallerIdentity} before a fetch,
 * turning SDK failures into a readable {@link AwsCredentialsException}.
 */
public class AwsCredentialsChecker {

    private static final Logger log = LoggerFactory.getLogger(AwsCredentialsChecker.class);

    private static final Set<String> REJECTED_TOKEN_CODES = Set.of(
            "InvalidClientTokenId", "ExpiredToken", "SignatureDoesNotMatch", "UnrecognizedClientException");

    private final StsClient stsClient;

    public AwsCredentialsChecker(StsClient stsClient) {
        this.stsClient = stsClient;
    }

    public CallerIdentity check() {
        try {
            GetCallerIdentityResponse identity = stsClient.getCallerIdentity();
            log.info("AWS credentials valid: account={}, arn={}", identity.account(), identity.arn());
            return new CallerIdentity(identity.account(), identity.arn(), identity.userId());
        } catch (AwsServiceException e) {
            String code = e.awsErrorDetails() != null ? e.awsErrorDetails().errorCode() : null;
            log.error("AWS credential check rejected: code={}, message={}", code, e.getMessage());
            if (code != null && REJECTED_TOKEN_CODES.contains(code)) {
                throw new AwsCredentialsException("AWS credentials are invalid or expired (" + code + ")", e);
            }
            if (e.statusCode() == 403) {
                throw new AwsCredentialsException("Access denied calling sts:GetCallerIdentity", e);
            }
            throw new AwsCredentialsException("AWS credential check failed: " + e.getMessage(), e);
        } catch (SdkClientException e) {
            log.error("AWS credential check failed: {}", e.getMessage());
            throw new AwsCredentialsException(describeClientFailure(e), e);
        } catch (SdkException e) {
            log.error("AWS credential check failed: {}", e.getMessage());
            throw new AwsCredentialsException("AWS credential check failed: " + e.getMessage(), e);
        }
    }

    private static String describeClientFailure(SdkClientException e) {
        String message = e.getMessage() != null ? e.getMessage() : "";
        if (message.contains("Profile file contained no credentials for profile")
                || message.contains("does not exist in the profile file")) {
            return "AWS profile not found or has no credentials: " + message;
        }
        if (message.contains("Unable to load credentials")) {
            return "No AWS credentials found. Configure them with 'aws configure' or pass --profile";
        }
        return "AWS credential check failed: " + message;
    }
}
