package com.anthem.iamx.explorer.cli;

import com.anthem.iamx.explorer.config.IamxProperties;
import com.anthem.iamx.explorer.render.DotRenderer;
import com.anthem.iamx.explorer.service.GraphStore;
import com.anthem.iamx.graph.PermissionGraph;
import com.anthem.iamx.graph.exception.GraphSerializationException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

@Component
@RequiredArgsConstructor
@Command(name = "visualize", mixinStandardHelpOptions = true,
        description = "Write the permission graph as a Graphviz DOT file.")
public class VisualizeCommand implements Callable<Integer> {

    private final GraphStore graphStore;
    private final DotRenderer dotRenderer;
    private final IamxProperties properties;

    @Spec
    CommandSpec spec;

    @Option(names = {"-g", "--graph"}, paramLabel = "FILE",
            description = "Persisted graph file (default: iamx.graph-file, iam_graph.json)")
    Path graphFile;

    @Option(names = {"-o", "--output"}, paramLabel = "FILE",
            description = "DOT file to write (default: iamx.dot-file, iam_graph.dot)")
    Path output;

    @Option(names = "--filter", paramLabel = "NAME",
            description = "Only show these identities or policies and their neighbours (repeatable)")
    List<String> filter = new ArrayList<>();

    @Override
    public Integer call() {
        PermissionGraph graph = graphStore.load(graphFile != null ? graphFile : Path.of(properties.getGraphFile()));
        Path file = output != null ? output : Path.of(properties.getDotFile());

        String dot = dotRenderer.render(graph.export(), filter);
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(file, dot, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new GraphSerializationException("Failed to write DOT file: " + file, e);
        }

        spec.commandLine().getOut().printf("DOT graph written to %s; render with: dot -Tpng %s -o iam_graph.png%n",
                file, file);
        return ExitCodes.OK;
    }
}
