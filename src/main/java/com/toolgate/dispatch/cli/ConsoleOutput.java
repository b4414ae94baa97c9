package com.toolgate.dispatch.cli;

import com.toolgate.core.approval.ApprovalPrompt;
import com.toolgate.core.mode.OperatingMode;
import com.toolgate.core.model.ApprovalDecision;
import com.toolgate.core.permission.GrantStatus;
import com.toolgate.core.policy.ToolRule;
import picocli.CommandLine;

import java.util.Map;
import java.util.stream.Collectors;

/**
 * ANSI-colored terminal output utilities for the Toolgate CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) TOOLGATE v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [TOOLGATE]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void warn(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(yellow) !|@ " + message));
    }

    public static void decision(String toolName, ApprovalDecision decision) {
        if (decision.isExecute()) {
            String reason = decision.reason() != null ? " (" + decision.reason() + ")" : "";
            System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "@|fg(green),bold EXECUTE|@ " + toolName + reason));
        } else {
            System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "@|fg(red),bold SKIP|@ " + toolName + " [" + decision.denial() + "] " + decision.reason()));
        }
    }

    public static void mode(OperatingMode mode, boolean current) {
        String marker = current ? "@|bold,fg(green) *|@" : " ";
        String flags = (mode.readOnly() ? "read-only " : "") + (mode.autoApprove() ? "auto-approve" : "");
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  " + marker + " @|bold " + String.format("%-10s", mode.name()) + "|@ "
                        + String.format("%-26s", flags.trim()) + mode.description()));
    }

    public static void prompt(ApprovalPrompt prompt) {
        System.out.println();
        if (prompt.expirationNotice() != null) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "@|fg(yellow) " + prompt.expirationNotice() + "|@"));
        }
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(cyan) [APPROVAL]|@ " + prompt.toolName() + " " + formatArgs(prompt.request().args())));
        String options = "  [y] yes  [n] no (optional feedback)  [a] always";
        if (prompt.offersTemporaryGrant()) {
            options += "  [t] for " + prompt.defaultDuration().toMinutes() + " min (t <minutes>)"
                    + "  [i] for " + prompt.defaultIterations() + " uses (i <count>)";
        }
        System.out.println(options);
        System.out.print("> ");
        System.out.flush();
    }

    public static void grant(GrantStatus status) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|fg(magenta) " + String.format("%-20s", status.toolName()) + "|@ "
                        + String.format("%-12s", status.kind()) + status.describe()));
    }

    public static void rule(String toolName, ToolRule rule, boolean configured) {
        String source = configured ? "" : " @|faint (default)|@";
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|bold " + String.format("%-20s", toolName) + "|@ "
                        + rule.permission().configValue() + source));
        if (!rule.allowlist().isEmpty()) {
            System.out.println("      allow: " + String.join(", ", rule.allowlist()));
        }
        if (!rule.denylist().isEmpty()) {
            System.out.println("      deny:  " + String.join(", ", rule.denylist()));
        }
    }

    static String formatArgs(Map<String, Object> args) {
        if (args.isEmpty()) {
            return "";
        }
        return args.entrySet().stream()
                .map(e -> e.getKey() + "=" + e.getValue())
                .collect(Collectors.joining(" ", "{", "}"));
    }
}
