package com.toolgate.core.policy;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Shell-style glob matching for allow/deny lists, following fnmatch: {@code *} matches any
 * run of characters, {@code ?} a single character, and {@code [...]} one character from a
 * class ({@code [a-z]}, {@code [/~]}, negated with {@code [!...]}). A {@code [} without a
 * closing bracket is literal. Everything else is literal and the whole subject must match.
 */
final class ArgumentGlobMatcher {

    private ArgumentGlobMatcher() {}

    static boolean matchesAny(List<String> globs, String subject) {
        if (subject == null || subject.isEmpty()) {
            return false;
        }
        for (String glob : globs) {
            if (matches(glob, subject)) {
                return true;
            }
        }
        return false;
    }

    static boolean matches(String glob, String subject) {
        if (glob == null || subject == null) {
            return false;
        }
        return toPattern(glob.trim()).matcher(subject.trim()).matches();
    }

    static Pattern toPattern(String glob) {
        StringBuilder regex = new StringBuilder();
        StringBuilder literal = new StringBuilder();
        int i = 0;
        while (i < glob.length()) {
            char c = glob.charAt(i);
            if (c == '*' || c == '?') {
                flush(regex, literal);
                regex.append(c == '*' ? ".*" : ".");
                i++;
                continue;
            }
            if (c == '[') {
                int close = classEnd(glob, i);
                if (close > 0) {
                    flush(regex, literal);
                    regex.append(characterClass(glob.substring(i + 1, close)));
                    i = close + 1;
                    continue;
                }
            }
            literal.append(c);
            i++;
        }
        flush(regex, literal);
        return Pattern.compile(regex.toString(), Pattern.DOTALL);
    }

    private static void flush(StringBuilder regex, StringBuilder literal) {
        if (literal.length() > 0) {
            regex.append(Pattern.quote(literal.toString()));
            literal.setLength(0);
        }
    }

    /** Index of the bracket closing the class opened at {@code open}, or -1. A leading ] is a member. */
    private static int classEnd(String glob, int open) {
        int j = open + 1;
        if (j < glob.length() && glob.charAt(j) == '!') {
            j++;
        }
        if (j < glob.length() && glob.charAt(j) == ']') {
            j++;
        }
        return glob.indexOf(']', j);
    }

    private static String characterClass(String body) {
        StringBuilder cls = new StringBuilder("[");
        int k = 0;
        if (body.startsWith("!")) {
            cls.append('^');
            k = 1;
        }
        for (; k < body.length(); k++) {
            char c = body.charAt(k);
            if (c == '\\' || c == '[' || c == ']' || c == '^' || c == '&') {
                cls.append('\\');
            }
            cls.append(c);
        }
        return cls.append(']').toString();
    }
}
