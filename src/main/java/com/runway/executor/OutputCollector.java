package com.runway.executor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Consumer;

/**
 * Reads a process stream incrementally on a worker thread.
 */
public final class OutputCollector {

    private static final Logger log = LoggerFactory.getLogger(OutputCollector.class);

    private OutputCollector() {}

    /**
     * Accumulates the whole stream. Completes with what was read so far if the
     * stream breaks.
     */
    public static CompletableFuture<String> collect(InputStream stream, Executor executor) {
        return CompletableFuture.supplyAsync(() -> {
            var sb = new StringBuilder();
            try (var reader = new InputStreamReader(stream, StandardCharsets.UTF_8)) {
                char[] buffer = new char[4096];
                int n;
                while ((n = reader.read(buffer)) != -1) {
                    sb.append(buffer, 0, n);
                }
            } catch (IOException e) {
                log.debug("Output stream closed early: {}", e.getMessage());
            }
            return sb.toString();
        }, executor);
    }

    /**
     * Hands each line to {@code onLine} as it arrives. Completes when the stream ends.
     */
    public static CompletableFuture<Void> forEachLine(InputStream stream, Executor executor, Consumer<String> onLine) {
        return CompletableFuture.runAsync(() -> {
            try (var reader = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    onLine.accept(line);
                }
            } catch (IOException e) {
                log.debug("Line stream closed early: {}", e.getMessage());
            }
        }, executor);
    }

    /**
     * Truncates output to {@code maxChars} keeping the head and tail for context.
     */
    public static String truncate(String output, int maxChars) {
        if (output == null || maxChars <= 0 || output.length() <= maxChars) return output;
        int headSize = maxChars / 2;
        int tailSize = maxChars - headSize;
        return output.substring(0, headSize)
                + "\n\n... [truncated " + (output.length() - maxChars) + " chars] ...\n\n"
                + output.substring(output.length() - tailSize);
    }
}
