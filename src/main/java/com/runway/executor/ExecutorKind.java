package com.runway.executor;

import com.runway.core.model.CommandKind;
import com.runway.core.model.ExecutionMode;

/**
 * The four execution strategies. Selection is a pure function of
 * (execution mode, command kind).
 *
 * <pre>
 *   manual  + shell -> INTERACTIVE_SHELL   visible, waits on process exit
 *   manual  + agent -> INTERACTIVE_AGENT   visible, waits on process exit and hook delivery
 *   agentic + shell -> BACKGROUND_SHELL    hidden,  waits on process exit
 *   agentic + agent -> BACKGROUND_AGENT    hidden,  waits on stream completion
 * </pre>
 */
public enum ExecutorKind {
    INTERACTIVE_SHELL(CommandKind.SHELL, true),
    INTERACTIVE_AGENT(CommandKind.AGENT, true),
    BACKGROUND_SHELL(CommandKind.SHELL, false),
    BACKGROUND_AGENT(CommandKind.AGENT, false);

    private final CommandKind commandKind;
    private final boolean visible;

    ExecutorKind(CommandKind commandKind, boolean visible) {
        this.commandKind = commandKind;
        this.visible = visible;
    }

    public CommandKind commandKind() {
        return commandKind;
    }

    public boolean visible() {
        return visible;
    }

    public static ExecutorKind select(ExecutionMode mode, CommandKind kind) {
        return switch (mode) {
            case MANUAL -> kind == CommandKind.AGENT ? INTERACTIVE_AGENT : INTERACTIVE_SHELL;
            case AGENTIC -> kind == CommandKind.AGENT ? BACKGROUND_AGENT : BACKGROUND_SHELL;
        };
    }
}
