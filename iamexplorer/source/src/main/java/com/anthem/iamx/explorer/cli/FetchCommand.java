package com.anthem.iamx.explorer.cli;

import com.anthem.iamx.explorer.config.IamxProperties;
import com.anthem.iamx.explorer.service.SnapshotFetchService;
import com.anthem.iamx.fetcher.FetcherConfig;
import com.anthem.iamx.graph.snapshot.Snapshot;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.nio.file.Path;
import java.util.concurrent.Callable;

@Component
@RequiredArgsConstructor
@Command(name = "fetch", mixinStandardHelpOptions = true,
        description = "Fetch users, groups, roles and policies from AWS IAM into a snapshot file.")
public class FetchCommand implements Callable<Integer> {

    private final SnapshotFetchService fetchService;
    private final FetcherConfig defaults;
    private final IamxProperties properties;

    @Spec
    CommandSpec spec;

    @Option(names = {"-p", "--profile"}, description = "AWS profile to use")
    String profile;

    @Option(names = {"-r", "--region"}, description = "AWS region for STS (default: iamx.aws.region)")
    String region;

    @Option(names = "--endpoint", description = "Endpoint override, e.g. http://localhost:4566")
    String endpoint;

    @Option(names = "--include-aws-managed",
            description = "Keep every AWS-managed policy, not only the attached ones")
    boolean includeAwsManaged;

    @Option(names = {"-o", "--output"}, paramLabel = "FILE",
            description = "Snapshot file to write (default: iamx.snapshot-file, iam_data.json)")
    Path output;

    @Override
    public Integer call() {
        FetcherConfig.FetcherConfigBuilder config = defaults.toBuilder();
        if (profile != null) {
            config.profile(profile);
        }
        if (region != null) {
            config.region(region);
        }
        if (endpoint != null) {
            config.endpoint(endpoint);
        }
        if (includeAwsManaged) {
            config.includeAwsManaged(true);
        }
        Path file = output != null ? output : Path.of(properties.getSnapshotFile());

        Snapshot snapshot = fetchService.fetch(config.build(), file);

        spec.commandLine().getOut().printf("Saved IAM data to %s (users=%d, groups=%d, roles=%d, policies=%d)%n",
                file, snapshot.getUsers().size(), snapshot.getGroups().size(),
                snapshot.getRoles().size(), snapshot.getPolicies().size());
        return ExitCodes.OK;
    }
}
