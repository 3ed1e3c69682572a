package com.rolloutstream.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for rollout-stream.
 * Routes to subcommands: serve, tail, targets, health.
 */
@Command(
        name = "rollout-stream",
        mixinStandardHelpOptions = true,
        version = "rollout-stream 0.1.0",
        description = "Aggregated log streaming for Kubernetes rollouts",
        subcommands = {
                ServeCommand.class,
                TailCommand.class,
                TargetsCommand.class,
                HealthCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class RolloutStreamCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        new CommandLine(this).usage(System.out);
    }
}
