package com.toolgate.dispatch.cli;

import com.toolgate.core.approval.ApprovalPrompt;
import com.toolgate.core.approval.ApprovalResponse;

import java.time.Duration;
import java.util.Locale;
import java.util.Optional;

/**
 * Parses a terminal reply to an approval prompt:
 * {@code y}, {@code n [feedback]}, {@code a}, {@code t [minutes]}, {@code i [count]}.
 * Time and iteration replies are accepted only when the prompt offers temporary grants.
 */
final class ApprovalReplyParser {

    private ApprovalReplyParser() {}

    static Optional<ApprovalResponse> parse(String line, ApprovalPrompt prompt) {
        if (line == null) {
            return Optional.empty();
        }
        String trimmed = line.trim();
        if (trimmed.isEmpty()) {
            return Optional.empty();
        }
        int space = trimmed.indexOf(' ');
        String word = (space < 0 ? trimmed : trimmed.substring(0, space)).toLowerCase(Locale.ROOT);
        String rest = space < 0 ? "" : trimmed.substring(space + 1).trim();

        switch (word) {
            case "y", "yes" -> {
                return Optional.of(new ApprovalResponse.Yes());
            }
            case "n", "no" -> {
                return Optional.of(new ApprovalResponse.No(rest.isEmpty() ? null : rest));
            }
            case "a", "always" -> {
                return Optional.of(new ApprovalResponse.Always());
            }
            case "t", "time" -> {
                if (!prompt.offersTemporaryGrant()) {
                    return Optional.empty();
                }
                if (rest.isEmpty()) {
                    return Optional.of(new ApprovalResponse.YesTime(prompt.defaultDuration()));
                }
                return positiveInt(rest).map(m -> new ApprovalResponse.YesTime(Duration.ofMinutes(m)));
            }
            case "i", "iterations" -> {
                if (!prompt.offersTemporaryGrant()) {
                    return Optional.empty();
                }
                if (rest.isEmpty()) {
                    return Optional.of(new ApprovalResponse.YesIterations(prompt.defaultIterations()));
                }
                return positiveInt(rest).map(ApprovalResponse.YesIterations::new);
            }
            default -> {
                return Optional.empty();
            }
        }
    }

    private static Optional<Integer> positiveInt(String text) {
        try {
            int value = Integer.parseInt(text.trim());
            return value > 0 ? Optional.of(value) : Optional.empty();
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }
}
