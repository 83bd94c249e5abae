package com.anthem.iamx.explorer.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

@Component
@Command(name = "iamx", mixinStandardHelpOptions = true, version = "iamx 1.0.0",
        description = "Explore who can do what in an AWS account's IAM configuration.",
        subcommands = {
                FetchCommand.class,
                BuildGraphCommand.class,
                QueryCommand.class,
                VisualizeCommand.class,
                StatsCommand.class
        })
public class IamxCommand implements Runnable {

    @Spec
    CommandSpec spec;

    @Override
    public void run() {
        spec.commandLine().usage(spec.commandLine().getOut());
    }
}
