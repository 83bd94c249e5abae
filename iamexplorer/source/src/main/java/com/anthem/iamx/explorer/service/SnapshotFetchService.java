package com.anthem.iamx.explorer.service;

import com.anthem.iamx.fetcher.AwsClientFactory;
import com.anthem.iamx.fetcher.AwsCredentialsChecker;
import com.anthem.iamx.fetcher.CallerIdentity;
import com.anthem.iamx.fetcher.FetcherConfig;
import com.anthem.iamx.fetcher.IamSnapshotFetcher;
import com.anthem.iamx.graph.snapshot.Snapshot;
import com.anthem.iamx.graph.snapshot.SnapshotWriter;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import software.amazon.awssdk.services.iam.IamClient;
import software.amazon.awssdk.services.sts.StsClient;

import java.nio.file.Path;
import java.util.function.Function;

/**
 * Checks the AWS credentials, pulls the account's IAM data and writes the snapshot file.
 */
@Slf4j
@Service
public class SnapshotFetchService {

    private final ObjectMapper objectMapper;
    private final SnapshotWriter snapshotWriter;
    private final Function<FetcherConfig, AwsClientFactory> clientFactories;

    @Autowired
    public SnapshotFetchService(ObjectMapper objectMapper, SnapshotWriter snapshotWriter) {
        this(objectMapper, snapshotWriter, AwsClientFactory::new);
    }

    SnapshotFetchService(ObjectMapper objectMapper, SnapshotWriter snapshotWriter,
                         Function<FetcherConfig, AwsClientFactory> clientFactories) {
        this.objectMapper = objectMapper;
        this.snapshotWriter = snapshotWriter;
        this.clientFactories = clientFactories;
    }

    /**
     * @throws com.anthem.iamx.fetcher.exception.AwsCredentialsException if the credentials are missing or rejected
     * @throws com.anthem.iamx.fetcher.exception.SnapshotFetchException if an IAM call fails
     */
    public Snapshot fetch(FetcherConfig config, Path outputFile) {
        AwsClientFactory factory = clientFactories.apply(config);

        CallerIdentity caller;
        try (StsClient sts = factory.stsClient()) {
            caller = new AwsCredentialsChecker(sts).check();
        }

        Snapshot snapshot;
        try (IamClient iam = factory.iamClient()) {
            snapshot = new IamSnapshotFetcher(iam, objectMapper, config).fetch(caller.getAccount());
        }

        snapshotWriter.write(snapshot, outputFile);
        log.info("Snapshot fetched: account={}, file={}", caller.getAccount(), outputFile);
        return snapshot;
    }
}
