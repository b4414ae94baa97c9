package com.toolgate.dispatch.cli;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Parses tool arguments typed on the command line as {@code key=value} pairs.
 * Quoted values may contain spaces: {@code command="git push origin main"}.
 */
final class CallArguments {

    private CallArguments() {}

    static Map<String, Object> parsePairs(List<String> pairs) {
        Map<String, Object> args = new LinkedHashMap<>();
        if (pairs == null) {
            return args;
        }
        for (String pair : pairs) {
            int eq = pair.indexOf('=');
            if (eq <= 0) {
                throw new IllegalArgumentException("Expected key=value but got '" + pair + "'");
            }
            args.put(pair.substring(0, eq).trim(), pair.substring(eq + 1));
        }
        return args;
    }

    /**
     * Splits a line on whitespace, keeping single- or double-quoted runs together
     * and dropping the quotes.
     */
    static List<String> tokenize(String line) {
        List<String> tokens = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        char quote = 0;
        boolean inToken = false;
        for (char c : line.toCharArray()) {
            if (quote != 0) {
                if (c == quote) {
                    quote = 0;
                } else {
                    current.append(c);
                }
            } else if (c == '"' || c == '\'') {
                quote = c;
                inToken = true;
            } else if (Character.isWhitespace(c)) {
                if (inToken) {
                    tokens.add(current.toString());
                    current.setLength(0);
                    inToken = false;
                }
            } else {
                current.append(c);
                inToken = true;
            }
        }
        if (quote != 0) {
            throw new IllegalArgumentException("Unterminated quote in: " + line);
        }
        if (inToken) {
            tokens.add(current.toString());
        }
        return tokens;
    }
}
