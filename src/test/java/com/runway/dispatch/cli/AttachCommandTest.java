package com.runway.dispatch.cli;

import com.runway.core.engine.SessionOrchestrator;
import com.runway.core.model.SessionStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class AttachCommandTest {

    private SessionOrchestrator orchestrator;
    private AttachCommand command;

    @BeforeEach
    void setUp() {
        orchestrator = mock(SessionOrchestrator.class);
        command = new AttachCommand(orchestrator);
    }

    @Test
    @DisplayName("exits 0 when the session completes")
    void complete() {
        when(orchestrator.attach("s-1", true)).thenReturn(CompletableFuture.completedFuture(SessionStatus.COMPLETE));

        int exitCode = new CommandLine(command).execute("s-1", "--auto-play");

        assertEquals(0, exitCode);
        assertTrue(command.isAutoPlay());
        verify(orchestrator).cleanup("s-1");
    }

    @Test
    @DisplayName("exits 1 when the session fails")
    void failed() {
        when(orchestrator.attach("s-1", false)).thenReturn(CompletableFuture.completedFuture(SessionStatus.FAILED));

        assertEquals(1, new CommandLine(command).execute("s-1"));
        assertEquals("s-1", command.getSessionId());
    }

    @Test
    @DisplayName("exits 1 when the session is cleaned up before it ends")
    void cancelled() {
        var terminal = new CompletableFuture<SessionStatus>();
        terminal.cancel(false);
        when(orchestrator.attach("s-1", true)).thenReturn(terminal);

        assertEquals(1, new CommandLine(command).execute("s-1", "-a"));
    }

    @Test
    @DisplayName("the session id is required")
    void missingSessionId() {
        assertEquals(CommandLine.ExitCode.USAGE, new CommandLine(command).execute());
        verifyNoInteractions(orchestrator);
    }
}
