package com.anthem.iamx.explorer.cli;

import com.anthem.iamx.explorer.config.IamxProperties;
import com.anthem.iamx.explorer.service.GraphStore;
import com.anthem.iamx.explorer.service.ResultFormatter;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

import java.util.concurrent.Callable;

@Component
@RequiredArgsConstructor
@Command(name = "stats", mixinStandardHelpOptions = true, description = "Show node and edge counts of the graph.")
public class StatsCommand implements Callable<Integer> {

    private final GraphStore graphStore;
    private final ResultFormatter formatter;
    private final IamxProperties properties;

    @Spec
    CommandSpec spec;

    @Mixin
    GraphOptions graphOptions = new GraphOptions();

    @Override
    public Integer call() {
        spec.commandLine().getOut().print(formatter.stats(
                graphStore.load(graphOptions.graphFile(properties)).stats(), graphOptions.format(properties)));
        return ExitCodes.OK;
    }
}
