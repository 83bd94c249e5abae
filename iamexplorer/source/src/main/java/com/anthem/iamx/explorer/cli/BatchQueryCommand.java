package com.anthem.iamx.explorer.cli;

import com.anthem.iamx.explorer.config.IamxProperties;
import com.anthem.iamx.explorer.exception.InvalidQueryException;
import com.anthem.iamx.explorer.service.BatchQueryService;
import com.anthem.iamx.explorer.service.GraphStore;
import com.anthem.iamx.explorer.service.QueryOutcome;
import com.anthem.iamx.explorer.service.ResultFormatter;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

@Component
@RequiredArgsConstructor
@Command(name = "batch", mixinStandardHelpOptions = true,
        description = "Run the queries of a file concurrently, one per line: "
                + "'who-can-do <action> [resource]' or 'what-can-do <identity>'.")
public class BatchQueryCommand implements Callable<Integer> {

    private final GraphStore graphStore;
    private final BatchQueryService batchQueryService;
    private final ResultFormatter formatter;
    private final IamxProperties properties;

    @Spec
    CommandSpec spec;

    @Mixin
    GraphOptions graphOptions = new GraphOptions();

    @Parameters(index = "0", paramLabel = "FILE", description = "Query file")
    Path queryFile;

    @Override
    public Integer call() {
        List<String> lines;
        try {
            lines = Files.readAllLines(queryFile, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new InvalidQueryException("Cannot read query file: " + queryFile);
        }

        List<QueryOutcome> outcomes = batchQueryService.runLines(
                graphStore.queryEngine(graphOptions.graphFile(properties)), lines);
        spec.commandLine().getOut().print(formatter.batch(outcomes, graphOptions.format(properties)));

        return outcomes.stream().allMatch(QueryOutcome::isSuccess) ? ExitCodes.OK : ExitCodes.INPUT_ERROR;
    }
}
