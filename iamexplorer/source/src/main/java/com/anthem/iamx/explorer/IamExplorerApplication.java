package com.anthem.iamx.explorer;

import com.anthem.iamx.explorer.cli.CliExceptionHandler;
import com.anthem.iamx.explorer.cli.IamxCommand;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

/**
 * Entry point of the {@code iamx} command line. Spring builds the graph services and the
 * command beans; picocli parses the arguments and runs one command, whose return value
 * becomes the process exit code.
 */
@SpringBootApplication
public class IamExplorerApplication implements CommandLineRunner, ExitCodeGenerator {

    private final IamxCommand iamxCommand;
    private final IFactory factory;
    private final CliExceptionHandler exceptionHandler;

    private int exitCode;

    public IamExplorerApplication(IamxCommand iamxCommand, IFactory factory, CliExceptionHandler exceptionHandler) {
        this.iamxCommand = iamxCommand;
        this.factory = factory;
        this.exceptionHandler = exceptionHandler;
    }

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(IamExplorerApplication.class, args)));
    }

    @Override
    public void run(String... args) {
        CommandLine commandLine = exceptionHandler.configure(new CommandLine(iamxCommand, factory));
        exitCode = commandLine.execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
