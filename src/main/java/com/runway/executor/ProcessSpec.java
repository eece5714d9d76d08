package com.runway.executor;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * What to launch.
 *
 * @param command          program and arguments
 * @param environment      variables added to the inherited environment
 * @param workingDirectory directory the process starts in
 * @param visible          true to attach the process to the user's terminal
 */
public record ProcessSpec(
    List<String> command,
    Map<String, String> environment,
    Path workingDirectory,
    boolean visible
) {

    public ProcessSpec {
        command = List.copyOf(command);
        environment = environment == null ? Map.of() : Map.copyOf(environment);
    }
}
