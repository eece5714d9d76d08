package com.runway.executor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Launches processes on this machine. Visible processes inherit this process's
 * terminal so the user sees them run; hidden processes have stdout and stderr piped.
 */
public class LocalProcessLauncher implements ProcessLauncher {

    private static final Logger log = LoggerFactory.getLogger(LocalProcessLauncher.class);

    @Override
    public Process start(ProcessSpec spec) throws IOException {
        var builder = new ProcessBuilder(spec.command());
        builder.environment().putAll(spec.environment());
        if (spec.workingDirectory() != null) {
            builder.directory(spec.workingDirectory().toFile());
        }
        if (spec.visible()) {
            builder.inheritIO();
        }
        log.debug("Starting {} process {} in {}", spec.visible() ? "visible" : "background",
                spec.command().get(0), spec.workingDirectory());
        return builder.start();
    }
}
