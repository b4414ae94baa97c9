package com.toolgate.core.model;

import java.util.List;
import java.util.Map;

/**
 * Helpers for pulling well-known values out of loosely typed tool arguments.
 */
public final class ToolArguments {

    private static final List<String> COMMAND_KEYS = List.of("command", "cmd", "CommandLine", "commandLine");
    private static final List<String> PATH_KEYS = List.of("path", "file_path", "filepath");
    private static final List<String> URL_KEYS = List.of("url");

    private ToolArguments() {}

    /** The shell command text, or an empty string if the arguments carry none. */
    public static String command(Map<String, Object> args) {
        return firstNonBlank(args, COMMAND_KEYS);
    }

    /**
     * The value allow/deny globs are matched against: the command, else the path, else the URL.
     * Empty when the call has none of them.
     */
    public static String subject(Map<String, Object> args) {
        String command = firstNonBlank(args, COMMAND_KEYS);
        if (!command.isEmpty()) {
            return command;
        }
        String path = firstNonBlank(args, PATH_KEYS);
        if (!path.isEmpty()) {
            return path;
        }
        return firstNonBlank(args, URL_KEYS);
    }

    private static String firstNonBlank(Map<String, Object> args, List<String> keys) {
        if (args == null || args.isEmpty()) {
            return "";
        }
        for (String key : keys) {
            Object value = args.get(key);
            if (value != null) {
                String text = String.valueOf(value).trim();
                if (!text.isEmpty()) {
                    return text;
                }
            }
        }
        return "";
    }
}
