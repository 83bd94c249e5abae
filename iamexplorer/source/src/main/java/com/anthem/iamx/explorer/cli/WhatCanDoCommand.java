package com.anthem.iamx.explorer.cli;

import com.anthem.iamx.explorer.config.IamxProperties;
import com.anthem.iamx.explorer.service.GraphStore;
import com.anthem.iamx.explorer.service.ResultFormatter;
import com.anthem.iamx.graph.query.PermissionReport;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.util.concurrent.Callable;

@Component
@RequiredArgsConstructor
@Command(name = "what-can-do", mixinStandardHelpOptions = true,
        description = "List every permission an identity holds, including those of roles it can assume.")
public class WhatCanDoCommand implements Callable<Integer> {

    private final GraphStore graphStore;
    private final ResultFormatter formatter;
    private final IamxProperties properties;

    @Spec
    CommandSpec spec;

    @Mixin
    GraphOptions graphOptions = new GraphOptions();

    @Parameters(index = "0", paramLabel = "IDENTITY", description = "ARN, Type:name (e.g. User:alice) or name")
    String identity;

    @Override
    public Integer call() {
        PermissionReport report = graphStore.queryEngine(graphOptions.graphFile(properties)).whatCanDo(identity);
        spec.commandLine().getOut().print(formatter.whatCanDo(report, graphOptions.format(properties)));
        return ExitCodes.OK;
    }
}
