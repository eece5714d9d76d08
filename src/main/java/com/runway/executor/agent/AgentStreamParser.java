package com.runway.executor.agent;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Decodes one line of the agent's stream JSON output into typed events.
 *
 * <p>A line is one JSON object with a {@code type} of {@code system}, {@code assistant},
 * {@code user} or {@code result}. Assistant and user lines may carry several content
 * blocks and so produce several events. Lines of other types produce none.
 */
public class AgentStreamParser {

    private static final Logger log = LoggerFactory.getLogger(AgentStreamParser.class);
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    public AgentStreamParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * @throws AgentStreamException if the line is not a JSON object
     */
    public List<AgentStreamEvent> parseLine(String line) {
        if (line == null || line.isBlank()) {
            return List.of();
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(line);
        } catch (JsonProcessingException e) {
            throw new AgentStreamException("Malformed agent stream line: " + abbreviate(line), e);
        }
        if (root == null || !root.isObject()) {
            throw new AgentStreamException("Agent stream line is not a JSON object: " + abbreviate(line));
        }

        String type = text(root, "type");
        if (type == null) {
            return List.of();
        }
        return switch (type) {
            case "system" -> parseSystem(root);
            case "assistant" -> parseContent(root, false);
            case "user" -> parseContent(root, true);
            case "result" -> List.of(parseResult(root));
            default -> {
                log.debug("Ignoring agent stream event of type {}", type);
                yield List.of();
            }
        };
    }

    private List<AgentStreamEvent> parseSystem(JsonNode root) {
        String handle = text(root, "session_id");
        if ("init".equals(text(root, "subtype")) && handle != null) {
            return List.of(new AgentStreamEvent.ConversationHandle(handle, toMap(root)));
        }
        return List.of();
    }

    private List<AgentStreamEvent> parseContent(JsonNode root, boolean fromUser) {
        JsonNode content = root.path("message").path("content");
        var events = new ArrayList<AgentStreamEvent>();
        if (content.isTextual() && !fromUser) {
            events.add(new AgentStreamEvent.AssistantText(content.asText(), toMap(root)));
            return events;
        }
        if (!content.isArray()) {
            return events;
        }
        for (JsonNode block : content) {
            String blockType = text(block, "type");
            if (blockType == null) continue;
            switch (blockType) {
                case "text" -> {
                    if (!fromUser) {
                        events.add(new AgentStreamEvent.AssistantText(block.path("text").asText(""), toMap(block)));
                    }
                }
                case "tool_use" -> events.add(new AgentStreamEvent.ToolInvocation(
                        text(block, "id"), text(block, "name"),
                        block.has("input") ? toMap(block.get("input")) : Map.of(),
                        toMap(block)));
                case "tool_result" -> events.add(new AgentStreamEvent.ToolResult(
                        text(block, "tool_use_id"), contentText(block.get("content")),
                        block.path("is_error").asBoolean(false),
                        toMap(block)));
                default -> log.debug("Ignoring content block of type {}", blockType);
            }
        }
        return events;
    }

    private AgentStreamEvent parseResult(JsonNode root) {
        return new AgentStreamEvent.TerminalResult(
                root.path("is_error").asBoolean(false),
                text(root, "subtype"),
                text(root, "result"),
                text(root, "session_id"),
                toMap(root));
    }

    private String contentText(JsonNode content) {
        if (content == null || content.isNull()) return "";
        if (content.isTextual()) return content.asText();
        if (content.isArray()) {
            var sb = new StringBuilder();
            for (JsonNode item : content) {
                if (item.has("text")) {
                    if (sb.length() > 0) sb.append('\n');
                    sb.append(item.get("text").asText());
                }
            }
            return sb.toString();
        }
        return content.toString();
    }

    private Map<String, Object> toMap(JsonNode node) {
        if (node == null || !node.isObject()) return Map.of();
        return objectMapper.convertValue(node, MAP_TYPE);
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && value.isTextual() ? value.asText() : null;
    }

    private static String abbreviate(String line) {
        return line.length() <= 200 ? line : line.substring(0, 200) + "...";
    }
}
