package com.toolgate.dispatch.cli;

import com.toolgate.core.approval.ApprovalPrompt;
import com.toolgate.core.approval.ApprovalPrompter;
import com.toolgate.core.approval.ApprovalResponse;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;

/**
 * Asks for approval on the terminal. Prompts are shown one at a time on a dedicated
 * thread; end of input cancels the pending prompt. Once the returned future completes
 * elsewhere (timeout, cancel) the prompt stops reading and leaves the terminal to the session.
 */
@Component
@ConditionalOnProperty(name = "toolgate.approval.channel", havingValue = "console", matchIfMissing = true)
public class ConsoleApprovalPrompter implements ApprovalPrompter {

    private static final Logger log = LoggerFactory.getLogger(ConsoleApprovalPrompter.class);

    private final TerminalInput input;
    private final ExecutorService executor;

    @Autowired
    public ConsoleApprovalPrompter(TerminalInput input) {
        this(input, Executors.newSingleThreadExecutor(r -> {
            Thread thread = new Thread(r, "toolgate-approval");
            thread.setDaemon(true);
            return thread;
        }));
    }

    ConsoleApprovalPrompter(TerminalInput input, ExecutorService executor) {
        this.input = input;
        this.executor = executor;
    }

    @Override
    public CompletableFuture<ApprovalResponse> requestApproval(ApprovalPrompt prompt) {
        CompletableFuture<ApprovalResponse> future = new CompletableFuture<>();
        try {
            executor.execute(() -> ask(prompt, future));
        } catch (RejectedExecutionException e) {
            future.completeExceptionally(e);
        }
        return future;
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdownNow();
    }

    private void ask(ApprovalPrompt prompt, CompletableFuture<ApprovalResponse> future) {
        try {
            while (!future.isDone()) {
                ConsoleOutput.prompt(prompt);
                String line = input.readLineFor(future);
                if (line == null && future.isDone()) {
                    log.debug("Approval for {} resolved elsewhere; leaving the terminal", prompt.toolName());
                    return;
                }
                if (line == null) {
                    log.info("Terminal closed while asking about {}", prompt.toolName());
                    future.completeExceptionally(new CancellationException("Terminal input closed"));
                    return;
                }
                Optional<ApprovalResponse> response = ApprovalReplyParser.parse(line, prompt);
                if (response.isPresent()) {
                    future.complete(response.get());
                    return;
                }
                ConsoleOutput.warn("Unrecognized reply: '" + line.trim() + "'");
            }
        } catch (RuntimeException e) {
            future.completeExceptionally(e);
        }
    }
}
