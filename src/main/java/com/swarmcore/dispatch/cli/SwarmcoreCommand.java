package com.swarmcore.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for swarmcore.
 * Routes to subcommands: {@code run} submits a JSON plan of agents and dependent tasks
 * to the coordination engine and waits for it to settle; {@code health} reports the
 * state of the graph, pool, circuit breakers, router and agents.
 */
@Command(
        name = "swarmcore",
        mixinStandardHelpOptions = true,
        version = "swarmcore 0.1.0",
        description = "Coordinates a swarm of worker agents over a dependency graph of tasks",
        subcommands = {
                RunCommand.class,
                HealthCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class SwarmcoreCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // When no subcommand is given, show usage help
        new CommandLine(this).usage(System.out);
    }
}
