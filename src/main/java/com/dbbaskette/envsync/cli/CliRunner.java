package com.dbbaskette.envsync.cli;

import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;
import picocli.CommandLine;

import java.util.Arrays;

/**
 * Runs {@link DistributeCommand} with the process arguments when the {@code cli} profile is active.
 */
@Component
@Profile("cli")
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private final DistributeCommand command;
    private int exitCode;

    public CliRunner(DistributeCommand command) {
        this.command = command;
    }

    @Override
    public void run(String... args) {
        exitCode = new CommandLine(command).execute(withoutSpringArguments(args));
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    static String[] withoutSpringArguments(String[] args) {
        return Arrays.stream(args)
                .filter(arg -> !arg.startsWith("--spring."))
                .toArray(String[]::new);
    }
}
