package com.runway.executor;

import com.runway.core.metrics.RunwayMetrics;
import com.runway.core.model.Command;
import com.runway.core.model.CommandResult;
import com.runway.core.model.ExecutionMode;
import com.runway.core.model.Interaction;
import com.runway.core.model.Session;
import com.runway.core.remote.RemoteStoreProperties;
import com.runway.core.resources.TempResourceManager;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class BackgroundShellExecutorTest {

    @TempDir
    Path tempDir;

    private ExecutorService pool;
    private ExecutionProperties properties;
    private SimpleMeterRegistry registry;
    private TempResourceManager resources;

    @BeforeEach
    void setUp() {
        pool = Executors.newCachedThreadPool();
        properties = new ExecutionProperties();
        registry = new SimpleMeterRegistry();
        resources = new TempResourceManager(tempDir.resolve("scratch"), new RemoteStoreProperties());
    }

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
    }

    private BackgroundShellExecutor executor(ProcessLauncher launcher) {
        return new BackgroundShellExecutor(launcher, resources, properties, new RunwayMetrics(registry), pool);
    }

    private CommandResult run(BackgroundShellExecutor executor, Command command) throws Exception {
        var session = new Session("s-1", ExecutionMode.AGENTIC, List.of(), null, null);
        return executor.execute("s-1", new Interaction("i-1", command, null), session).get(10, TimeUnit.SECONDS);
    }

    @Test
    @DisplayName("captures stdout and exit code 0")
    void capturesStdout() throws Exception {
        var result = run(executor(new LocalProcessLauncher()), Command.of("echo hello"));

        assertEquals("hello\n", result.stdout());
        assertEquals("", result.stderr());
        assertEquals(0, result.exitCode());
        assertTrue(result.durationMs() >= 0);
        assertEquals(1, registry.find("runway.command.duration").tag("outcome", "ok").timer().count());
    }

    @Test
    @DisplayName("captures stderr and a nonzero exit code")
    void capturesFailure() throws Exception {
        var result = run(executor(new LocalProcessLauncher()), Command.of("echo broken 1>&2; exit 4"));

        assertEquals("broken\n", result.stderr());
        assertEquals(4, result.exitCode());
    }

    @Test
    @DisplayName("passes session and metadata environment to the process")
    void environment() throws Exception {
        var command = new Command("echo $RUNWAY_SESSION_ID $GREETING", Map.of(Command.ENV, Map.of("GREETING", "hi")));

        var result = run(executor(new LocalProcessLauncher()), command);

        assertEquals("s-1 hi\n", result.stdout());
    }

    @Test
    @DisplayName("runs in the metadata working directory")
    void workingDirectory() throws Exception {
        var command = new Command("pwd", Map.of(Command.CWD, tempDir.toString()));

        var result = run(executor(new LocalProcessLauncher()), command);

        assertEquals(tempDir.toRealPath(), Path.of(result.stdout().strip()).toRealPath());
    }

    @Test
    @DisplayName("bounds captured output")
    void boundsOutput() throws Exception {
        properties.getExecutor().setMaxOutputChars(10);

        var result = run(executor(new LocalProcessLauncher()), Command.of("printf abcdefghijklmnopqrstuvwxyz"));

        assertTrue(result.stdout().contains("[truncated 16 chars]"));
    }

    @Test
    @DisplayName("an empty command is a no-op that spawns nothing")
    void emptyCommand() throws Exception {
        var launcher = mock(ProcessLauncher.class);

        var result = run(executor(launcher), Command.of("   "));

        assertEquals(CommandResult.empty(), result);
        verify(launcher, never()).start(any());
    }

    @Test
    @DisplayName("a spawn failure becomes exit code 1 with the error as stderr")
    void spawnFailure() throws Exception {
        var launcher = mock(ProcessLauncher.class);
        when(launcher.start(any())).thenThrow(new IOException("No such file"));

        var result = run(executor(launcher), Command.of("echo hi"));

        assertEquals(1, result.exitCode());
        assertEquals("No such file", result.stderr());
    }

    @Test
    @DisplayName("a missing shell binary is a spawn failure, not an exception")
    void missingShell() throws Exception {
        properties.getExecutor().setShell(tempDir.resolve("no-such-shell").toString());

        var result = run(executor(new LocalProcessLauncher()), Command.of("echo hi"));

        assertEquals(1, result.exitCode());
        assertFalse(result.stderr().isBlank());
    }

    @Test
    @DisplayName("an agent command is rejected before anything starts")
    void rejectsAgentCommand() throws Exception {
        var launcher = mock(ProcessLauncher.class);
        var command = new Command("do it", Map.of(Command.PROMPT, "write tests"));

        assertThrows(CommandValidationException.class, () -> run(executor(launcher), command));
        verify(launcher, never()).start(any());
    }
}
