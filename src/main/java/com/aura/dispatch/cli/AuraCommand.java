package com.aura.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level CLI command for Aura.
 * Routes to subcommands: health, inspect, audit, serve.
 */
@Command(
        name = "aura",
        mixinStandardHelpOptions = true,
        version = "Aura 0.1.0",
        description = "Self-extending prototype object runtime",
        subcommands = {
                HealthCommand.class,
                InspectCommand.class,
                AuditCommand.class,
                ServeCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class AuraCommand implements Runnable {

    @Spec
    private CommandSpec spec;

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        spec.commandLine().usage(System.out);
    }
}
