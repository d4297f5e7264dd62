package com.ippcode.analyzer.cli;

import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Runs {@link ParseCommand} over the process streams when the {@code cli} profile is active.
 */
@Component
@ConditionalOnProperty(prefix = "ippcode.analyzer.cli", name = "enabled", havingValue = "true")
public class ParseCommandLineRunner implements ApplicationRunner, ExitCodeGenerator {

    private final ParseCommand command;
    private int exitCode;

    public ParseCommandLineRunner(ParseCommand command) {
        this.command = command;
    }

    @Override
    public void run(ApplicationArguments args) {
        List<String> arguments = Arrays.stream(args.getSourceArgs())
            .filter(argument -> !argument.startsWith("--spring."))
            .collect(Collectors.toList());

        exitCode = command.run(arguments, System.in, System.out, System.err);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
