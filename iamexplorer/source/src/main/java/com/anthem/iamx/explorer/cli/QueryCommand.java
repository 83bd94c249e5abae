package com.anthem.iamx.explorer.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

@Component
@Command(name = "query", mixinStandardHelpOptions = true,
        description = "Query a persisted permission graph.",
        subcommands = {
                WhoCanDoCommand.class,
                WhatCanDoCommand.class,
                BatchQueryCommand.class
        })
public class QueryCommand implements Runnable {

    @Spec
    CommandSpec spec;

    @Override
    public void run() {
        spec.commandLine().usage(spec.commandLine().getOut());
    }
}
