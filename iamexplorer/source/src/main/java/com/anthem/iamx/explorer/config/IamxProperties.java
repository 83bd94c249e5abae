package com.anthem.iamx.explorer.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Settings under {@code iamx.*}. Command-line options take precedence over these values.
 */
@Data
@ConfigurationProperties(prefix = "iamx")
public class IamxProperties {

    /**
     * Snapshot written by {@code fetch} and read by {@code build-graph}.
     */
    private String snapshotFile = "iam_data.json";

    /**
     * Persisted graph written by {@code build-graph} and read by the query commands.
     */
    private String graphFile = "iam_graph.json";

    private String dotFile = "iam_graph.dot";

    /**
     * {@code table} or {@code json}.
     */
    private String format = "table";

    private Batch batch = new Batch();

    private Aws aws = new Aws();

    @Data
    public static class Batch {

        private int workers = 4;

        /**
         * Overall limit for one batch; unfinished queries are reported as TIMEOUT.
         */
        private Duration timeout = Duration.ofSeconds(60);
    }

    @Data
    public static class Aws {

        private String profile;

        private String region = "us-east-1";

        /**
         * Endpoint override, set by the {@code local} profile for LocalStack.
         */
        private String endpoint;

        private boolean includeAwsManaged;
    }
}
