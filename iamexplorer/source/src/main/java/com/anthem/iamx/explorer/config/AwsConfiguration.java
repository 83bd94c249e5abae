package com.anthem.iamx.explorer.config;

import com.anthem.iamx.fetcher.FetcherConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.context.annotation.Profile;

/**
 * Default AWS connection settings for {@code fetch}. Clients are created per command run,
 * after the command-line overrides are applied.
 */
@Configuration
public class AwsConfiguration {

    private static final Logger log = LoggerFactory.getLogger(AwsConfiguration.class);

    @Bean
    public FetcherConfig fetcherConfig(IamxProperties properties) {
        IamxProperties.Aws aws = properties.getAws();
        return FetcherConfig.builder()
                .profile(aws.getProfile())
                .region(aws.getRegion())
                .endpoint(aws.getEndpoint())
                .includeAwsManaged(aws.isIncludeAwsManaged())
                .build();
    }

    /**
     * Points the clients at LocalStack with static test credentials.
     */
    @Bean
    @Primary
    @Profile({"local", "docker"})
    public FetcherConfig localFetcherConfig(
            IamxProperties properties,
            @Value("${iamx.aws.endpoint:http://localhost:4566}") String endpoint) {
        log.info("Using local AWS endpoint: endpoint={}, region={}", endpoint, properties.getAws().getRegion());
        return FetcherConfig.builder()
                .region(properties.getAws().getRegion())
                .endpoint(endpoint)
                .includeAwsManaged(properties.getAws().isIncludeAwsManaged())
                .build();
    }
}
