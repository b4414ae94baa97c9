package com.toolgate.dispatch.cli;

import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.Future;

/**
 * Line reader over standard input, shared by the interactive session and the console
 * approval prompter so both consume the same buffered stream.
 * <p>
 * A reader that gave up while blocked (an approval that timed out or was cancelled)
 * hands the line it received back; the next {@link #readLine()} returns it.
 */
@Component
public class TerminalInput {

    private final BufferedReader reader;
    private String pushedBack;

    public TerminalInput() {
        this(new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)));
    }

    public TerminalInput(BufferedReader reader) {
        this.reader = reader;
    }

    /**
     * @return the next line, or null at end of input
     */
    public synchronized String readLine() {
        if (pushedBack != null) {
            String line = pushedBack;
            pushedBack = null;
            return line;
        }
        try {
            return reader.readLine();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read from terminal", e);
        }
    }

    /**
     * Reads a line on behalf of {@code waiter}. If the waiter is already done when the
     * line arrives, the line is kept for the next reader and null is returned.
     *
     * @return the next line, or null at end of input or when the waiter no longer wants it
     */
    public synchronized String readLineFor(Future<?> waiter) {
        if (waiter.isDone()) {
            return null;
        }
        String line = readLine();
        if (line != null && waiter.isDone()) {
            pushedBack = line;
            return null;
        }
        return line;
    }
}
