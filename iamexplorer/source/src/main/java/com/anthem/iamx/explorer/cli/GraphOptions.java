package com.anthem.iamx.explorer.cli;

import com.anthem.iamx.explorer.config.IamxProperties;
import com.anthem.iamx.explorer.service.OutputFormat;
import picocli.CommandLine.Option;

import java.nio.file.Path;

/**
 * Options shared by the commands that read a persisted graph.
 */
public class GraphOptions {

    @Option(names = {"-g", "--graph"}, paramLabel = "FILE",
            description = "Persisted graph file (default: iamx.graph-file, iam_graph.json)")
    Path graphFile;

    @Option(names = {"-f", "--format"}, paramLabel = "FORMAT",
            description = "Output format: ${COMPLETION-CANDIDATES} (default: iamx.format, table)")
    OutputFormat format;

    Path graphFile(IamxProperties properties) {
        return graphFile != null ? graphFile : Path.of(properties.getGraphFile());
    }

    OutputFormat format(IamxProperties properties) {
        return format != null ? format : OutputFormat.from(properties.getFormat());
    }
}
