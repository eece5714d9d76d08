package com.runway.executor.agent;

import java.util.Map;

/**
 * One decoded event from the agent's JSON event stream.
 *
 * <p>{@link #raw()} keeps the undecoded JSON object so it can be forwarded unmodified.
 */
public sealed interface AgentStreamEvent {

    /** Event type name used when forwarding to the remote store. */
    String eventType();

    Map<String, Object> raw();

    record AssistantText(String text, Map<String, Object> raw) implements AgentStreamEvent {
        @Override
        public String eventType() {
            return "assistant_text";
        }
    }

    record ToolInvocation(String toolUseId, String toolName, Map<String, Object> input,
                          Map<String, Object> raw) implements AgentStreamEvent {
        @Override
        public String eventType() {
            return "tool_use";
        }
    }

    record ToolResult(String toolUseId, String content, boolean isError,
                      Map<String, Object> raw) implements AgentStreamEvent {
        @Override
        public String eventType() {
            return "tool_result";
        }
    }

    /**
     * End of the run.
     *
     * @param isError true when the run failed
     * @param subtype e.g. {@code success}, {@code error_max_turns}, {@code error_during_execution}
     * @param result  final text reported by the agent, nullable
     */
    record TerminalResult(boolean isError, String subtype, String result, String conversationHandle,
                          Map<String, Object> raw) implements AgentStreamEvent {
        @Override
        public String eventType() {
            return "result";
        }
    }

    /** Identifier of the agent conversation, usable to resume it later. */
    record ConversationHandle(String handle, Map<String, Object> raw) implements AgentStreamEvent {
        @Override
        public String eventType() {
            return "conversation_handle";
        }
    }
}
