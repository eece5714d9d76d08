package com.runway.executor.agent;

import java.nio.file.Path;
import java.util.Map;

/**
 * @param prompt             the prompt to send
 * @param workingDirectory   directory the agent works in
 * @param environment        variables added to the agent's environment
 * @param conversationHandle conversation to resume, nullable
 */
public record AgentStreamRequest(
    String prompt,
    Path workingDirectory,
    Map<String, String> environment,
    String conversationHandle
) {}
