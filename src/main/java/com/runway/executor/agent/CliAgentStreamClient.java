package com.runway.executor.agent;

import com.runway.executor.OutputCollector;
import com.runway.executor.ProcessLauncher;
import com.runway.executor.ProcessSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Runs the agent CLI in print mode with {@code --output-format stream-json} and
 * {@code --permission-mode bypassPermissions}, decoding stdout line by line.
 */
public class CliAgentStreamClient implements AgentStreamClient {

    private static final Logger log = LoggerFactory.getLogger(CliAgentStreamClient.class);

    static final String PERMISSION_MODE = "bypassPermissions";

    private final String agentCommand;
    private final ProcessLauncher launcher;
    private final AgentStreamParser parser;
    private final Executor ioExecutor;

    public CliAgentStreamClient(String agentCommand, ProcessLauncher launcher,
                                AgentStreamParser parser, Executor ioExecutor) {
        this.agentCommand = agentCommand;
        this.launcher = launcher;
        this.parser = parser;
        this.ioExecutor = ioExecutor;
    }

    @Override
    public CompletableFuture<Void> stream(AgentStreamRequest request, Consumer<AgentStreamEvent> onEvent) {
        Process process;
        try {
            process = launcher.start(new ProcessSpec(
                    arguments(request), request.environment(), request.workingDirectory(), false));
            process.getOutputStream().close();
        } catch (IOException e) {
            return CompletableFuture.failedFuture(
                    new AgentStreamException("Failed to start " + agentCommand + ": " + e.getMessage(), e));
        }

        var sawResult = new AtomicBoolean(false);
        var stderr = OutputCollector.collect(process.getErrorStream(), ioExecutor);
        var stdout = OutputCollector.forEachLine(process.getInputStream(), ioExecutor, line -> {
            List<AgentStreamEvent> events;
            try {
                events = parser.parseLine(line);
            } catch (AgentStreamException e) {
                log.warn("Skipping agent stream line: {}", e.getMessage());
                return;
            }
            for (var event : events) {
                if (event instanceof AgentStreamEvent.TerminalResult) {
                    sawResult.set(true);
                }
                try {
                    onEvent.accept(event);
                } catch (RuntimeException e) {
                    log.warn("Agent stream listener failed on {} event: {}", event.eventType(), e.getMessage());
                }
            }
        });

        return CompletableFuture.allOf(process.onExit(), stdout, stderr)
                .thenCompose(ignored -> {
                    int exitCode = process.exitValue();
                    if (exitCode != 0 && !sawResult.get()) {
                        String err = stderr.join().strip();
                        return CompletableFuture.failedFuture(new AgentStreamException(
                                agentCommand + " exited with code " + exitCode
                                        + (err.isEmpty() ? "" : ": " + err)));
                    }
                    return CompletableFuture.completedFuture(null);
                });
    }

    List<String> arguments(AgentStreamRequest request) {
        var args = new ArrayList<String>();
        args.add(agentCommand);
        args.add("-p");
        args.add(request.prompt());
        args.add("--output-format");
        args.add("stream-json");
        args.add("--verbose");
        args.add("--permission-mode");
        args.add(PERMISSION_MODE);
        if (request.conversationHandle() != null && !request.conversationHandle().isBlank()) {
            args.add("--resume");
            args.add(request.conversationHandle());
        }
        return args;
    }
}
