package com.swarmcore.dispatch.cli;

import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

/**
 * Bridges picocli with Spring Boot lifecycle.
 * Parses CLI arguments and delegates to the swarmcore command tree, so that running a
 * task plan or checking engine health happens inside the Spring context that wires the
 * coordination manager. The picocli exit code becomes the process exit code: 0 when
 * every task of a plan completed or every component is UP, 1 when tasks failed, were
 * cancelled or timed out or a component is degraded, 2 for an unreadable or invalid plan.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private final SwarmcoreCommand swarmcoreCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(SwarmcoreCommand swarmcoreCommand, IFactory factory) {
        this.swarmcoreCommand = swarmcoreCommand;
        this.factory = factory;
    }

    @Override
    public void run(String... args) {
        exitCode = new CommandLine(swarmcoreCommand, factory).execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
