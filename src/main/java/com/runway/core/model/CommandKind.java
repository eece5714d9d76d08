package com.runway.core.model;

/**
 * What a command asks for: a shell command line, or a prompt for the external agent.
 */
public enum CommandKind {
    SHELL,
    AGENT;

    /**
     * Classifies a command. It is an agent command when its metadata carries a
     * non-blank prompt or when its first word is the agent command name.
     */
    public static CommandKind of(Command command, String agentCommandName) {
        if (command == null) {
            return SHELL;
        }
        if (command.prompt() != null && !command.prompt().isBlank()) {
            return AGENT;
        }
        return agentCommandName != null && agentCommandName.equals(command.programName())
                ? AGENT
                : SHELL;
    }
}
