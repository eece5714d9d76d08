package com.runway.core.model;

/**
 * Outcome of exactly one executor invocation for an interaction.
 *
 * @param stdout     captured standard output (empty for commands shown in a terminal)
 * @param stderr     captured standard error, or the failure message
 * @param exitCode   process exit code (0 = success)
 * @param durationMs wall-clock time in milliseconds
 */
public record CommandResult(
    String stdout,
    String stderr,
    int exitCode,
    long durationMs
) {

    public CommandResult {
        stdout = stdout == null ? "" : stdout;
        stderr = stderr == null ? "" : stderr;
    }

    /** Result for an empty or whitespace-only command: nothing ran. */
    public static CommandResult empty() {
        return new CommandResult("", "", 0, 0);
    }

    public static CommandResult failure(String message, long durationMs) {
        return new CommandResult("", message, 1, durationMs);
    }

    public boolean succeeded() {
        return exitCode == 0;
    }
}
