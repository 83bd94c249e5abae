package com.anthem.iamx.explorer.cli;

import com.anthem.iamx.graph.exception.IamGraphException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IExecutionExceptionHandler;
import picocli.CommandLine.IParameterExceptionHandler;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.ParseResult;

import java.io.PrintWriter;

/**
 * Turns command failures into an error line on stderr and an {@link ExitCodes} value.
 */
@Slf4j
@Component
public class CliExceptionHandler implements IExecutionExceptionHandler, IParameterExceptionHandler {

    public CommandLine configure(CommandLine commandLine) {
        return commandLine
                .setCaseInsensitiveEnumValuesAllowed(true)
                .setExecutionExceptionHandler(this)
                .setParameterExceptionHandler(this);
    }

    @Override
    public int handleExecutionException(Exception ex, CommandLine commandLine, ParseResult parseResult) {
        PrintWriter err = commandLine.getErr();
        if (ex instanceof IamGraphException) {
            IamGraphException error = (IamGraphException) ex;
            err.println("Error [" + error.getErrorCode() + "]: " + error.getMessage());
            log.debug("Command failed: command={}, code={}", commandLine.getCommandName(), error.getErrorCode(), ex);
        } else {
            err.println("Error: " + ex.getMessage());
            log.error("Command failed unexpectedly: command={}", commandLine.getCommandName(), ex);
        }
        err.flush();
        return ExitCodes.of(ex);
    }

    @Override
    public int handleParseException(ParameterException ex, String[] args) {
        CommandLine commandLine = ex.getCommandLine();
        PrintWriter err = commandLine.getErr();
        err.println("Error: " + ex.getMessage());
        commandLine.usage(err);
        err.flush();
        return ExitCodes.INPUT_ERROR;
    }
}
