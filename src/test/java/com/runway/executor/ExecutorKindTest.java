package com.runway.executor;

import com.runway.core.model.CommandKind;
import com.runway.core.model.ExecutionMode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ExecutorKindTest {

    @Test
    @DisplayName("selection matrix maps every (mode, kind) pair to its strategy")
    void selectionMatrix() {
        assertEquals(ExecutorKind.INTERACTIVE_SHELL, ExecutorKind.select(ExecutionMode.MANUAL, CommandKind.SHELL));
        assertEquals(ExecutorKind.INTERACTIVE_AGENT, ExecutorKind.select(ExecutionMode.MANUAL, CommandKind.AGENT));
        assertEquals(ExecutorKind.BACKGROUND_SHELL, ExecutorKind.select(ExecutionMode.AGENTIC, CommandKind.SHELL));
        assertEquals(ExecutorKind.BACKGROUND_AGENT, ExecutorKind.select(ExecutionMode.AGENTIC, CommandKind.AGENT));
    }

    @Test
    @DisplayName("manual strategies are visible, agentic ones are not")
    void visibility() {
        for (ExecutorKind kind : ExecutorKind.values()) {
            assertEquals(kind.name().startsWith("INTERACTIVE"), kind.visible(), kind.name());
        }
    }

    @Test
    @DisplayName("each strategy declares the command kind it accepts")
    void commandKinds() {
        for (ExecutionMode mode : ExecutionMode.values()) {
            for (CommandKind kind : CommandKind.values()) {
                assertEquals(kind, ExecutorKind.select(mode, kind).commandKind());
            }
        }
    }
}
