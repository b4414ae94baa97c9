package com.toolgate.dispatch.cli;

import com.toolgate.core.policy.PermissionPolicy;
import com.toolgate.core.policy.PolicySnapshot;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

/**
 * CLI command: toolgate policy [tool]
 * <p>
 * Shows the configured tool rules, or the effective rule of a single tool.
 */
@Command(name = "policy", mixinStandardHelpOptions = true, description = "Show tool permission policy")
@Component
public class PolicyCommand implements Runnable {

    @Parameters(index = "0", arity = "0..1", description = "Tool to show (default: all configured tools)")
    private String toolName;

    private final PermissionPolicy policy;

    public PolicyCommand(PermissionPolicy policy) {
        this.policy = policy;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        PolicySnapshot snapshot = policy.snapshot();
        ConsoleOutput.info("Policy file: " + policy.location());
        ConsoleOutput.info("Default permission: " + snapshot.defaultPermission().configValue());
        System.out.println();

        if (toolName != null) {
            ConsoleOutput.rule(toolName, snapshot.ruleFor(toolName), snapshot.isConfigured(toolName));
            return;
        }
        if (snapshot.rules().isEmpty()) {
            ConsoleOutput.info("No tools configured.");
            return;
        }
        snapshot.sortedRules().forEach((name, rule) -> ConsoleOutput.rule(name, rule, true));
    }
}
