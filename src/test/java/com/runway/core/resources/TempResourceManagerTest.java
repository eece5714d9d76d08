package com.runway.core.resources;

import com.runway.core.model.Command;
import com.runway.core.remote.RemoteStoreProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class TempResourceManagerTest {

    @TempDir
    Path root;

    private RemoteStoreProperties remote;
    private TempResourceManager manager;

    @BeforeEach
    void setUp() {
        remote = new RemoteStoreProperties();
        remote.setBaseUrl("https://store.example.com/");
        manager = new TempResourceManager(root, remote);
    }

    @Test
    @DisplayName("creates tracked files under the session directory")
    void createTempFile() throws Exception {
        Path file = manager.createTempFile("s-1", "hooks-", ".json", "{}");

        assertTrue(file.isAbsolute());
        assertEquals("{}", Files.readString(file));
        assertEquals(root.resolve("s-1"), file.getParent());
        assertEquals(1, manager.trackedFiles("s-1").size());
    }

    @Test
    @DisplayName("session ids are sanitized into directory names")
    void sanitizesSessionId() {
        assertEquals(root.resolve("a_b_.._c"), manager.sessionDirectory("a/b/../c"));
    }

    @Test
    @DisplayName("cleanup deletes files and directory and tolerates unknown sessions")
    void cleanup() {
        Path file = manager.createTempFile("s-1", "x-", ".txt", "data");

        manager.cleanup("s-1");
        manager.cleanup("s-1");
        manager.cleanup("never-used");

        assertFalse(Files.exists(file));
        assertFalse(Files.exists(root.resolve("s-1")));
        assertTrue(manager.trackedFiles("s-1").isEmpty());
    }

    @Test
    @DisplayName("environment: session, API URL, callback URL, then user env which wins")
    void buildEnvironment() {
        remote.setToken("tok");
        var command = new Command("ls", Map.of(Command.ENV, Map.of("FOO", "bar", "RUNWAY_SESSION_ID", "override")));

        var env = manager.buildEnvironment("s-1", command, "http://127.0.0.1:1234/callback/i-1");

        assertEquals("override", env.get(TempResourceManager.ENV_SESSION_ID));
        assertEquals("https://store.example.com", env.get(TempResourceManager.ENV_API_URL));
        assertEquals("tok", env.get(TempResourceManager.ENV_API_TOKEN));
        assertEquals("http://127.0.0.1:1234/callback/i-1", env.get(TempResourceManager.ENV_CALLBACK_URL));
        assertEquals("bar", env.get("FOO"));
    }

    @Test
    @DisplayName("no token and no callback URL leaves those variables out")
    void minimalEnvironment() {
        var env = manager.buildEnvironment("s-1", Command.of("ls"), null);

        assertEquals("s-1", env.get(TempResourceManager.ENV_SESSION_ID));
        assertFalse(env.containsKey(TempResourceManager.ENV_API_TOKEN));
        assertFalse(env.containsKey(TempResourceManager.ENV_CALLBACK_URL));
    }
}
