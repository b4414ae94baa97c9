package com.toolgate.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level CLI command for Toolgate.
 * Routes to subcommands: check, session, modes, policy, serve.
 */
@Command(
        name = "toolgate",
        mixinStandardHelpOptions = true,
        version = "Toolgate 0.1.0",
        description = "Authorization gatekeeper for AI agent tool calls",
        subcommands = {
                CheckCommand.class,
                SessionCommand.class,
                ModesCommand.class,
                PolicyCommand.class,
                ServeCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class ToolgateCommand implements Runnable {

    @Spec
    private CommandSpec spec;

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        spec.commandLine().usage(System.out);
    }
}
