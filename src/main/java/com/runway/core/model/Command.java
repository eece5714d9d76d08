package com.runway.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * An instruction issued by the remote store. Immutable once issued.
 *
 * @param text     the textual instruction (shell command line or agent invocation)
 * @param metadata optional keys: {@code prompt}, {@code cwd}, {@code env}, {@code childSessionIds}
 */
public record Command(
    String text,
    Map<String, Object> metadata
) {

    public static final String PROMPT = "prompt";
    public static final String CWD = "cwd";
    public static final String ENV = "env";
    public static final String CHILD_SESSION_IDS = "childSessionIds";

    public Command {
        metadata = metadata == null ? Map.of() : Map.copyOf(withoutNullValues(metadata));
    }

    public static Command of(String text) {
        return new Command(text, Map.of());
    }

    @JsonIgnore
    public boolean isBlank() {
        return text == null || text.isBlank();
    }

    /** First whitespace-delimited word of the command text, or empty. */
    @JsonIgnore
    public String programName() {
        if (isBlank()) return "";
        return text.trim().split("\\s+", 2)[0];
    }

    /** Command text after the program name, or empty. */
    @JsonIgnore
    public String arguments() {
        if (isBlank()) return "";
        String[] parts = text.trim().split("\\s+", 2);
        return parts.length > 1 ? parts[1] : "";
    }

    @JsonIgnore
    public String prompt() {
        Object value = metadata.get(PROMPT);
        return value instanceof String s ? s : null;
    }

    @JsonIgnore
    public String workingDirectory() {
        Object value = metadata.get(CWD);
        return value instanceof String s && !s.isBlank() ? s : null;
    }

    @JsonIgnore
    public Map<String, String> env() {
        Object value = metadata.get(ENV);
        if (!(value instanceof Map<?, ?> raw)) {
            return Map.of();
        }
        var env = new LinkedHashMap<String, String>();
        raw.forEach((k, v) -> {
            if (k != null && v != null) {
                env.put(k.toString(), v.toString());
            }
        });
        return env;
    }

    /** Child session ids in first-seen order, blanks and repeats removed. */
    @JsonIgnore
    public List<String> childSessionIds() {
        Object value = metadata.get(CHILD_SESSION_IDS);
        if (!(value instanceof List<?> raw)) {
            return List.of();
        }
        return raw.stream()
                .filter(id -> id != null && !id.toString().isBlank())
                .map(Object::toString)
                .distinct()
                .toList();
    }

    private static Map<String, Object> withoutNullValues(Map<String, Object> source) {
        var copy = new LinkedHashMap<String, Object>();
        source.forEach((k, v) -> {
            if (k != null && v != null) copy.put(k, v);
        });
        return copy;
    }
}
