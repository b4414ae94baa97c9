package com.toolgate.dispatch.cli;

import com.toolgate.core.approval.ApprovalGateway;
import com.toolgate.core.mode.ModeChange;
import com.toolgate.core.mode.ModeManager;
import com.toolgate.core.mode.OperatingMode;
import com.toolgate.core.model.ApprovalDecision;
import com.toolgate.core.model.ToolCallRequest;
import com.toolgate.core.permission.GrantStatus;
import com.toolgate.core.permission.PermissionTracker;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * CLI command: toolgate session
 * <p>
 * Interactive loop that evaluates one tool call per line, for example
 * {@code bash command="git push"}. Grants issued during the session apply to later
 * lines. Slash commands: {@code /mode}, {@code /mode <name>}, {@code /grants},
 * {@code /quit}.
 */
@Command(name = "session", mixinStandardHelpOptions = true,
        description = "Evaluate tool calls interactively, keeping grants between calls")
@Component
public class SessionCommand implements Runnable {

    private final ApprovalGateway gateway;
    private final ModeManager modeManager;
    private final PermissionTracker tracker;
    private final TerminalInput input;

    public SessionCommand(ApprovalGateway gateway, ModeManager modeManager,
                          PermissionTracker tracker, TerminalInput input) {
        this.gateway = gateway;
        this.modeManager = modeManager;
        this.tracker = tracker;
        this.input = input;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Mode: " + modeManager.indicator());
        ConsoleOutput.info("Enter a tool call as: <tool> key=value ...   (/quit to exit)");

        while (true) {
            System.out.print(modeManager.currentMode().name().toLowerCase(Locale.ROOT) + "> ");
            System.out.flush();
            String line = input.readLine();
            if (line == null) {
                break;
            }
            line = line.trim();
            if (line.isEmpty()) {
                continue;
            }
            if (line.startsWith("/")) {
                if (!handleSlashCommand(line)) {
                    break;
                }
                continue;
            }
            evaluateLine(line);
        }
        ConsoleOutput.info("Session ended.");
    }

    private void evaluateLine(String line) {
        List<String> tokens;
        Map<String, Object> args;
        try {
            tokens = CallArguments.tokenize(line);
            args = CallArguments.parsePairs(tokens.subList(1, tokens.size()));
        } catch (IllegalArgumentException e) {
            ConsoleOutput.error(e.getMessage());
            return;
        }
        String toolName = tokens.get(0);
        ApprovalDecision decision = gateway.decide(ToolCallRequest.of(toolName, args));
        ConsoleOutput.decision(toolName, decision);
    }

    /**
     * @return false when the session should end
     */
    private boolean handleSlashCommand(String line) {
        String[] parts = line.split("\\s+", 2);
        switch (parts[0]) {
            case "/quit", "/exit" -> {
                return false;
            }
            case "/mode" -> {
                ModeChange change;
                if (parts.length > 1) {
                    try {
                        change = modeManager.setMode(OperatingMode.fromName(parts[1]));
                    } catch (IllegalArgumentException e) {
                        ConsoleOutput.error("Unknown mode: " + parts[1]);
                        return true;
                    }
                } else {
                    change = modeManager.cycleMode();
                }
                ConsoleOutput.success("Mode: " + change.previous() + " -> " + modeManager.indicator());
            }
            case "/grants" -> {
                List<GrantStatus> grants = tracker.activeGrantStatuses();
                if (grants.isEmpty()) {
                    ConsoleOutput.info("No active grants.");
                } else {
                    grants.forEach(ConsoleOutput::grant);
                }
            }
            default -> ConsoleOutput.error("Unknown command: " + parts[0] + " (try /mode, /grants, /quit)");
        }
        return true;
    }
}
