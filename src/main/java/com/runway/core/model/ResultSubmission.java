package com.runway.core.model;

/**
 * The result of an interaction as submitted to (and stored by) the remote store.
 *
 * @param status   {@code ok} when the command exited 0, otherwise {@code error}
 * @param stdout   captured standard output
 * @param stderr   captured standard error
 * @param exitCode process exit code
 * @param duration wall-clock time in milliseconds
 * @param message  human-readable error message, null on success
 */
public record ResultSubmission(
    ResultStatus status,
    String stdout,
    String stderr,
    int exitCode,
    long duration,
    String message
) {

    public static ResultSubmission from(CommandResult result) {
        if (result.succeeded()) {
            return new ResultSubmission(ResultStatus.OK, result.stdout(), result.stderr(),
                    0, result.durationMs(), null);
        }
        String detail = result.stderr().isBlank() ? "" : ": " + firstLine(result.stderr());
        return new ResultSubmission(ResultStatus.ERROR, result.stdout(), result.stderr(),
                result.exitCode(), result.durationMs(),
                "Command failed with exit code " + result.exitCode() + detail);
    }

    private static String firstLine(String text) {
        String trimmed = text.strip();
        int newline = trimmed.indexOf('\n');
        return newline < 0 ? trimmed : trimmed.substring(0, newline);
    }
}
