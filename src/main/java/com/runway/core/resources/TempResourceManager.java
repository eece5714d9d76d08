package com.runway.core.resources;

import com.runway.core.model.Command;
import com.runway.core.remote.RemoteStoreProperties;
import com.runway.executor.ExecutionProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Creates and tracks per-session scratch files and composes the environment handed
 * to spawned processes.
 *
 * <p>Files live under {@code <temp-dir>/<sessionId>/} and are deleted together by
 * {@link #cleanup(String)}.
 */
@Service
public class TempResourceManager {

    private static final Logger log = LoggerFactory.getLogger(TempResourceManager.class);

    public static final String ENV_SESSION_ID = "RUNWAY_SESSION_ID";
    public static final String ENV_API_URL = "RUNWAY_API_URL";
    public static final String ENV_API_TOKEN = "RUNWAY_API_TOKEN";
    public static final String ENV_CALLBACK_URL = "RUNWAY_CALLBACK_URL";

    private final Path root;
    private final RemoteStoreProperties remoteProperties;
    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Path>> sessionFiles = new ConcurrentHashMap<>();

    @Autowired
    public TempResourceManager(ExecutionProperties properties, RemoteStoreProperties remoteProperties) {
        this(properties.getTempDirectory(), remoteProperties);
    }

    public TempResourceManager(Path root, RemoteStoreProperties remoteProperties) {
        this.root = root;
        this.remoteProperties = remoteProperties;
    }

    /**
     * Writes {@code content} to a new scratch file owned by the session.
     *
     * @return the absolute path of the created file
     * @throws UncheckedIOException if the file cannot be written
     */
    public Path createTempFile(String sessionId, String prefix, String suffix, String content) {
        try {
            Path dir = sessionDirectory(sessionId);
            Files.createDirectories(dir);
            Path file = Files.createTempFile(dir, prefix, suffix);
            Files.writeString(file, content == null ? "" : content);
            sessionFiles.computeIfAbsent(sessionId, k -> new CopyOnWriteArrayList<>()).add(file);
            log.debug("Created scratch file {} for session {}", file, sessionId);
            return file.toAbsolutePath();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to create scratch file for session " + sessionId, e);
        }
    }

    public List<Path> trackedFiles(String sessionId) {
        var files = sessionFiles.get(sessionId);
        return files == null ? List.of() : List.copyOf(files);
    }

    /**
     * Environment additions for a process run on behalf of a session: session id,
     * remote API URL and token, the callback URL when given, then the user's
     * key/value pairs from command metadata (which win on conflict).
     */
    public Map<String, String> buildEnvironment(String sessionId, Command command, String callbackUrl) {
        var env = new LinkedHashMap<String, String>();
        env.put(ENV_SESSION_ID, sessionId);
        env.put(ENV_API_URL, remoteProperties.normalizedBaseUrl());
        if (remoteProperties.hasToken()) {
            env.put(ENV_API_TOKEN, remoteProperties.getToken());
        }
        if (callbackUrl != null) {
            env.put(ENV_CALLBACK_URL, callbackUrl);
        }
        if (command != null) {
            env.putAll(command.env());
        }
        return env;
    }

    /**
     * Deletes every scratch file of the session. Safe to call when none were created.
     */
    public void cleanup(String sessionId) {
        var files = sessionFiles.remove(sessionId);
        var failed = new ArrayList<Path>();
        if (files != null) {
            for (Path file : files) {
                try {
                    Files.deleteIfExists(file);
                } catch (IOException e) {
                    failed.add(file);
                }
            }
        }
        Path dir = sessionDirectory(sessionId);
        try {
            Files.deleteIfExists(dir);
        } catch (IOException e) {
            log.debug("Could not remove scratch directory {}: {}", dir, e.getMessage());
        }
        if (!failed.isEmpty()) {
            log.warn("Could not delete {} scratch file(s) for session {}: {}", failed.size(), sessionId, failed);
        }
    }

    Path sessionDirectory(String sessionId) {
        return root.resolve(sessionId.replaceAll("[^A-Za-z0-9._-]", "_"));
    }
}
