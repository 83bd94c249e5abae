package com.anthem.iamx.explorer.cli;

import com.anthem.iamx.explorer.config.IamxProperties;
import com.anthem.iamx.explorer.service.GraphStore;
import com.anthem.iamx.graph.GraphStats;
import com.anthem.iamx.graph.PermissionGraph;
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
@Command(name = "build-graph", mixinStandardHelpOptions = true,
        description = "Build the permission graph from a snapshot file and save it.")
public class BuildGraphCommand implements Callable<Integer> {

    private final GraphStore graphStore;
    private final IamxProperties properties;

    @Spec
    CommandSpec spec;

    @Option(names = {"-i", "--input"}, paramLabel = "FILE",
            description = "Snapshot file (default: iamx.snapshot-file, iam_data.json)")
    Path input;

    @Option(names = {"-o", "--output"}, paramLabel = "FILE",
            description = "Graph file to write (default: iamx.graph-file, iam_graph.json)")
    Path output;

    @Override
    public Integer call() {
        Path snapshotFile = input != null ? input : Path.of(properties.getSnapshotFile());
        Path graphFile = output != null ? output : Path.of(properties.getGraphFile());

        PermissionGraph graph = graphStore.build(snapshotFile, graphFile);

        GraphStats stats = graph.stats();
        spec.commandLine().getOut().printf("Graph saved to %s (nodes=%d, edges=%d, trust relationships=%d)%n",
                graphFile, stats.getTotalNodes(), stats.getTotalEdges(), stats.getTrustRelationships());
        return ExitCodes.OK;
    }
}
