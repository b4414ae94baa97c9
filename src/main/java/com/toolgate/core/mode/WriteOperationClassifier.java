package com.toolgate.core.mode;

import com.toolgate.core.model.ToolArguments;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Decides whether a tool call could modify the workspace.
 * <p>
 * Stateless and pure: the answer depends only on the tool name and its arguments.
 * Anything the classifier does not recognise is treated as a write.
 */
public final class WriteOperationClassifier {

    public static final Set<String> READ_ONLY_TOOLS = Set.of(
            "read_file", "grep", "list_files", "find_files", "view_file", "search_files",
            "get_file_contents", "read",
            "git_status", "git_log", "git_diff", "git_show", "git_branch",
            "todo_read", "list_todos", "get_todos",
            "get_time", "get_context", "get_cwd", "get_working_directory",
            "mcp_read", "mcp_get", "mcp_list", "mcp_search"
    );

    public static final Set<String> WRITE_TOOLS = Set.of(
            "write_file", "create_file", "delete_file", "remove_file", "edit_file",
            "patch_file", "search_replace", "modify_file",
            "todo_write", "todo_create", "todo_update"
    );

    public static final Set<String> SHELL_TOOLS = Set.of("bash", "shell", "run_command", "execute_command");

    static final Set<String> READ_ONLY_COMMANDS = Set.of(
            "ls", "cat", "head", "tail", "find", "grep", "egrep", "fgrep", "wc", "file",
            "which", "whereis", "pwd", "echo", "date", "whoami", "tree", "less", "more",
            "stat", "du", "df", "env", "printenv", "hostname", "uname", "id", "groups",
            "type", "command", "git"
    );

    static final Set<String> SAFE_GIT_SUBCOMMANDS = Set.of(
            "status", "log", "diff", "show", "branch", "tag", "describe", "ls-files",
            "ls-tree", "ls-remote", "remote", "config", "help", "version", "reflog",
            "shortlog", "blame", "annotate", "grep", "rev-parse", "rev-list", "cat-file",
            "fsck", "count-objects"
    );

    private static final List<Pattern> WRITE_PATTERNS = compile(
            // filesystem mutation
            "\\brm[\\s$]", "\\brmdir\\b", "\\bmv[\\s$]", "\\bcp[\\s$]", "\\btouch[\\s$]",
            "\\bmkdir[\\s$]", "\\btruncate[\\s$]", "\\bshred[\\s$]",
            // redirection
            ">", ">>", "\\|&", "tee\\b",
            // in-place edits
            "\\bsed\\s+.*-i", "\\bawk\\s+.*-i", "\\bperl\\s+.*-i",
            // permissions and ownership
            "\\bchmod[\\s$]", "\\bchown[\\s$]", "\\bchgrp[\\s$]", "\\bchattr[\\s$]",
            // shell manipulation
            "\\beval[\\s$]", "\\bsource[\\s$]", "\\b\\.[\\s$]", "\\bexec[\\s$]", "\\bdd[\\s$]",
            "\\bmknod[\\s$]", "\\bmkfifo[\\s$]",
            // evasion
            "\\$\\{IFS\\}", "\\$IFS", ">\\s*\\(", "<\\s*\\(",
            // git mutations
            "\\bgit\\s+commit\\b", "\\bgit\\s+push\\b", "\\bgit\\s+checkout\\b", "\\bgit\\s+reset\\b",
            "\\bgit\\s+rebase\\b", "\\bgit\\s+merge\\b", "\\bgit\\s+stash\\b", "\\bgit\\s+cherry-pick\\b",
            "\\bgit\\s+clean\\b", "\\bgit\\s+apply\\b", "\\bgit\\s+rm\\b", "\\bgit\\s+mv\\b",
            "\\bgit\\s+init\\b", "\\bgit\\s+clone\\b", "\\bgit\\s+restore\\b", "\\bgit\\s+switch\\b",
            "\\bgit\\s+pull\\b", "\\bgit\\s+config\\s+.*core\\.editor",
            // downloads to disk
            "\\bcurl\\s+.*-[oO#]", "\\bwget\\s+.*-O",
            // package managers
            "\\bpip\\s+(?:install|uninstall)\\b", "\\bpip3\\s+(?:install|uninstall)\\b",
            "\\buv\\s+(?:pip|add|remove)\\b", "\\bnpm\\s+(?:install|i|add|remove|update)\\b",
            "\\byarn\\s+(?:add|remove)\\b", "\\bpnpm\\s+(?:add|remove)\\b",
            "\\bapt\\s+(?:install|remove|purge)\\b", "\\bapt-get\\s+(?:install|remove|purge)\\b",
            "\\byum\\s+(?:install|remove)\\b", "\\bdnf\\s+(?:install|remove)\\b",
            "\\bbrew\\s+(?:install|uninstall)\\b", "\\bpacman\\s+-[RS]",
            "\\bgem\\s+(?:install|uninstall)\\b", "\\bcargo\\s+(?:install|uninstall)\\b",
            // privilege escalation
            "\\bsudo[\\s$]", "\\bsu[\\s$]", "\\bdoas[\\s$]"
    );

    private WriteOperationClassifier() {}

    public static boolean isWriteOperation(String toolName, Map<String, Object> args) {
        if (toolName == null) {
            return true;
        }
        if (WRITE_TOOLS.contains(toolName)) {
            return true;
        }
        if (SHELL_TOOLS.contains(toolName)) {
            return isWriteCommand(ToolArguments.command(args));
        }
        if (READ_ONLY_TOOLS.contains(toolName)) {
            return false;
        }
        return true;
    }

    public static boolean isReadOnlyTool(String toolName) {
        return toolName != null && READ_ONLY_TOOLS.contains(toolName);
    }

    /**
     * Classifies raw shell command text. Write patterns are checked first so that
     * {@code echo hi > file} counts as a write even though {@code echo} is read-only.
     */
    public static boolean isWriteCommand(String command) {
        if (command == null || command.isBlank()) {
            return false;
        }
        String trimmed = command.strip();
        for (Pattern pattern : WRITE_PATTERNS) {
            if (pattern.matcher(trimmed).find()) {
                return true;
            }
        }

        String[] parts = trimmed.split("\\s+");
        String base = parts[0];
        if ("git".equals(base) && parts.length > 1) {
            return !SAFE_GIT_SUBCOMMANDS.contains(parts[1]);
        }
        return !READ_ONLY_COMMANDS.contains(base);
    }

    private static List<Pattern> compile(String... regexes) {
        return Arrays.stream(regexes).map(Pattern::compile).toList();
    }
}
