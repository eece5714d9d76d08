package com.runway.executor;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.runway.bridge.CallbackBridgeRegistry;
import com.runway.core.events.RemoteEvent;
import com.runway.core.metrics.RunwayMetrics;
import com.runway.core.model.Command;
import com.runway.core.model.CommandResult;
import com.runway.core.model.ExecutionMode;
import com.runway.core.model.Interaction;
import com.runway.core.model.Session;
import com.runway.core.remote.RemoteStore;
import com.runway.core.remote.RemoteStoreProperties;
import com.runway.core.resources.TempResourceManager;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class InteractiveAgentExecutorTest {

    @TempDir
    Path tempDir;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private RemoteStore remoteStore;
    private ProcessLauncher launcher;
    private ExecutionProperties properties;
    private SimpleMeterRegistry registry;
    private CallbackBridgeRegistry bridges;
    private InteractiveAgentExecutor executor;

    private final CompletableFuture<ProcessSpec> launched = new CompletableFuture<>();

    @BeforeEach
    void setUp() {
        remoteStore = mock(RemoteStore.class);
        launcher = mock(ProcessLauncher.class);
        properties = new ExecutionProperties();
        registry = new SimpleMeterRegistry();
        var metrics = new RunwayMetrics(registry);
        bridges = new CallbackBridgeRegistry(remoteStore, objectMapper, metrics, properties);
        executor = new InteractiveAgentExecutor(launcher,
                new TempResourceManager(tempDir, new RemoteStoreProperties()),
                bridges, objectMapper, properties, metrics);
    }

    @AfterEach
    void tearDown() {
        bridges.release("s-1");
    }

    private void launchRealProcess(String script) throws IOException {
        when(launcher.start(any())).thenAnswer(inv -> {
            launched.complete(inv.getArgument(0));
            return new ProcessBuilder("/bin/sh", "-c", script).start();
        });
    }

    private CompletableFuture<CommandResult> execute(Command command, String conversationHandle) {
        var session = new Session("s-1", ExecutionMode.MANUAL, List.of(), conversationHandle, null);
        return executor.execute("s-1", new Interaction("i-1", command, null), session);
    }

    private static int deliverHook(String url) throws Exception {
        var request = HttpRequest.newBuilder(URI.create(url))
                .POST(HttpRequest.BodyPublishers.ofString("{\"hook_event_name\":\"Stop\"}"))
                .build();
        return HttpClient.newHttpClient().send(request, HttpResponse.BodyHandlers.ofString()).statusCode();
    }

    @Test
    @DisplayName("waits for process exit and hook delivery, then returns the process result")
    void bothSignals() throws Exception {
        launchRealProcess("exit 3");

        var result = execute(new Command("claude", Map.of(Command.PROMPT, "add tests")), null);
        var spec = launched.get(5, TimeUnit.SECONDS);
        String callbackUrl = spec.environment().get(TempResourceManager.ENV_CALLBACK_URL);

        assertNotNull(callbackUrl);
        assertTrue(callbackUrl.endsWith("/callback/i-1"));
        assertEquals(200, deliverHook(callbackUrl));

        var commandResult = result.get(10, TimeUnit.SECONDS);
        assertEquals(3, commandResult.exitCode());
        assertNull(registry.find("runway.hook.timeouts").counter());
        verify(remoteStore).postEvent(any(RemoteEvent.class));
        assertTrue(spec.visible());
    }

    @Test
    @DisplayName("falls back to the process result when no hook arrives in time")
    void timeoutFallback() throws Exception {
        properties.getExecutor().setHookTimeout(Duration.ofMillis(200));
        launchRealProcess("exit 0");

        var commandResult = execute(Command.of("claude fix the build"), null).get(10, TimeUnit.SECONDS);

        assertEquals(0, commandResult.exitCode());
        assertEquals(1.0, registry.find("runway.hook.timeouts").counter().count());
        // a late delivery can still be forwarded
        var bridge = bridges.find("s-1").orElseThrow();
        assertEquals(0, bridge.pendingCount());
        assertEquals(1, bridge.forwardOnlyCount());
    }

    @Test
    @DisplayName("the same interaction can run again after a hook timeout")
    void rerunAfterTimeout() throws Exception {
        properties.getExecutor().setHookTimeout(Duration.ofMillis(200));
        var specs = new CopyOnWriteArrayList<ProcessSpec>();
        when(launcher.start(any())).thenAnswer(inv -> {
            specs.add(inv.getArgument(0));
            return new ProcessBuilder("/bin/sh", "-c", "exit 0").start();
        });

        var first = execute(Command.of("claude fix the build"), null).get(10, TimeUnit.SECONDS);
        properties.getExecutor().setHookTimeout(Duration.ofSeconds(5));
        var second = execute(Command.of("claude fix the build"), null);
        assertEquals(2, specs.size());
        assertEquals(200, deliverHook(specs.get(1).environment().get(TempResourceManager.ENV_CALLBACK_URL)));

        assertEquals(0, first.exitCode());
        assertEquals(0, second.get(10, TimeUnit.SECONDS).exitCode());
        assertEquals(1.0, registry.find("runway.hook.timeouts").counter().count());
        var bridge = bridges.find("s-1").orElseThrow();
        assertEquals(0, bridge.pendingCount());
        assertEquals(0, bridge.forwardOnlyCount());
    }

    @Test
    @DisplayName("a launch failure cancels the registration and yields exit code 1")
    void launchFailure() throws Exception {
        when(launcher.start(any())).thenThrow(new IOException("claude: not found"));

        var commandResult = execute(Command.of("claude"), null).get(5, TimeUnit.SECONDS);

        assertEquals(1, commandResult.exitCode());
        assertEquals("claude: not found", commandResult.stderr());
        assertEquals(0, bridges.find("s-1").orElseThrow().pendingCount());
    }

    @Test
    @DisplayName("a shell command is rejected")
    void rejectsShellCommand() {
        assertThrows(CommandValidationException.class, () -> execute(Command.of("ls"), null));
    }

    @Test
    @DisplayName("agent arguments carry settings, resume handle and prompt")
    void agentArguments() {
        var settings = Path.of("/tmp/hooks.json");

        var withPrompt = executor.agentArguments(new Command("claude", Map.of(Command.PROMPT, "do it")),
                settings, new Session("s-1", null, null, "conv-1", null));
        var fromText = executor.agentArguments(Command.of("claude explain this"), settings, null);

        assertEquals(List.of("claude", "--settings", "/tmp/hooks.json", "--resume", "conv-1", "do it"), withPrompt);
        assertEquals(List.of("claude", "--settings", "/tmp/hooks.json", "explain this"), fromText);
    }

    @Test
    @DisplayName("hook settings register a Stop hook posting to the callback URL")
    void hookSettings() throws Exception {
        launchRealProcess("exit 0");
        properties.getExecutor().setHookTimeout(Duration.ofMillis(50));

        execute(Command.of("claude"), null).get(10, TimeUnit.SECONDS);
        var spec = launched.get();
        var settingsFile = Path.of(spec.command().get(2));

        var json = objectMapper.readTree(Files.readString(settingsFile));
        var hook = json.get("hooks").get("Stop").get(0).get("hooks").get(0);
        assertEquals("command", hook.get("type").asText());
        assertTrue(hook.get("command").asText().contains("$RUNWAY_CALLBACK_URL"));
    }
}
