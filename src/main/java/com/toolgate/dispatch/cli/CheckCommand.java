package com.toolgate.dispatch.cli;

import com.toolgate.core.approval.ApprovalGateway;
import com.toolgate.core.mode.ModeManager;
import com.toolgate.core.mode.OperatingMode;
import com.toolgate.core.model.ApprovalDecision;
import com.toolgate.core.model.ToolCallRequest;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * CLI command: toolgate check &lt;tool&gt; [-a key=value]... [--mode MODE]
 * <p>
 * Evaluates a single tool call and prints the decision. Exits 0 when the call
 * may execute and 1 when it is skipped.
 */
@Command(name = "check", mixinStandardHelpOptions = true,
        description = "Decide whether a single tool call may run")
@Component
public class CheckCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Tool name, e.g. bash or write_file")
    private String toolName;

    @Option(names = {"--arg", "-a"}, description = "Tool argument as key=value (repeatable)")
    private List<String> args;

    @Option(names = {"--mode", "-m"}, description = "Operating mode for this check: ${COMPLETION-CANDIDATES}")
    private OperatingMode mode;

    private final ApprovalGateway gateway;
    private final ModeManager modeManager;

    public CheckCommand(ApprovalGateway gateway, ModeManager modeManager) {
        this.gateway = gateway;
        this.modeManager = modeManager;
    }

    @Override
    public Integer call() {
        Map<String, Object> toolArgs;
        try {
            toolArgs = CallArguments.parsePairs(args);
        } catch (IllegalArgumentException e) {
            ConsoleOutput.error(e.getMessage());
            return 2;
        }

        if (mode != null) {
            modeManager.setMode(mode);
        }
        ConsoleOutput.info("Mode: " + modeManager.indicator());

        ApprovalDecision decision = gateway.decide(ToolCallRequest.of(toolName, toolArgs));
        ConsoleOutput.decision(toolName, decision);
        return decision.isExecute() ? 0 : 1;
    }
}
