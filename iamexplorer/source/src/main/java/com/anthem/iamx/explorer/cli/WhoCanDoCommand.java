package com.anthem.iamx.explorer.cli;

import com.anthem.iamx.explorer.config.IamxProperties;
import com.anthem.iamx.explorer.service.GraphStore;
import com.anthem.iamx.explorer.service.ResultFormatter;
import com.anthem.iamx.graph.query.WhoCanDoReport;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.util.concurrent.Callable;

@Component
@RequiredArgsConstructor
@Command(name = "who-can-do", mixinStandardHelpOptions = true,
        description = "List identities that can perform an action, directly, through a group or by assuming roles.")
public class WhoCanDoCommand implements Callable<Integer> {

    private final GraphStore graphStore;
    private final ResultFormatter formatter;
    private final IamxProperties properties;

    @Spec
    CommandSpec spec;

    @Mixin
    GraphOptions graphOptions = new GraphOptions();

    @Parameters(index = "0", paramLabel = "ACTION", description = "Action pattern, e.g. s3:GetObject or *:Delete*")
    String action;

    @Option(names = {"-r", "--resource"}, defaultValue = "*", paramLabel = "PATTERN",
            description = "Resource pattern (default: ${DEFAULT-VALUE})")
    String resource;

    @Override
    public Integer call() {
        WhoCanDoReport report = graphStore.queryEngine(graphOptions.graphFile(properties))
                .whoCanDoReport(action, resource);
        spec.commandLine().getOut().print(formatter.whoCanDo(report, graphOptions.format(properties)));
        return ExitCodes.OK;
    }
}
