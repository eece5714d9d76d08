package com.runway.dispatch.cli;

import com.runway.core.engine.SessionOrchestrator;
import com.runway.core.model.SessionStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.concurrent.CancellationException;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;

/**
 * CLI command: runway attach &lt;session-id&gt; [--auto-play]
 * <p>
 * Drives one session from this process until the remote store marks it terminal.
 * The notification server runs alongside so completion notifications reach the
 * orchestrator. Exit code 0 when the session completes, 1 otherwise.
 */
@Command(name = "attach", mixinStandardHelpOptions = true,
        description = "Run a session's commands until it completes")
@Component
public class AttachCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(AttachCommand.class);

    @Parameters(index = "0", description = "Session ID")
    private String sessionId;

    @Option(names = {"--auto-play", "-a"},
            description = "Run each next command as soon as the previous one completes")
    private boolean autoPlay;

    private final SessionOrchestrator orchestrator;

    public AttachCommand(SessionOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Attaching to session " + sessionId + (autoPlay ? " with auto-play" : ""));

        var terminal = orchestrator.attach(sessionId, autoPlay);
        try {
            SessionStatus status = terminal.get();
            if (status == SessionStatus.COMPLETE) {
                ConsoleOutput.success("Session " + sessionId + " complete");
                return 0;
            }
            ConsoleOutput.error("Session " + sessionId + " " + status.wireName());
            return 1;
        } catch (CancellationException e) {
            ConsoleOutput.error("Session " + sessionId + " was cleaned up before it finished");
            return 1;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            ConsoleOutput.error("Interrupted while waiting for session " + sessionId);
            return 1;
        } catch (ExecutionException e) {
            log.error("Session {} ended abnormally", sessionId, e.getCause());
            ConsoleOutput.error("Session " + sessionId + " ended abnormally: " + e.getCause().getMessage());
            return 1;
        } finally {
            orchestrator.cleanup(sessionId);
        }
    }

    String getSessionId() {
        return sessionId;
    }

    boolean isAutoPlay() {
        return autoPlay;
    }
}
