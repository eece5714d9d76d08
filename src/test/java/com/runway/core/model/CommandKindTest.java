package com.runway.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CommandKindTest {

    @Test
    @DisplayName("a prompt in metadata makes an agent command")
    void promptMeansAgent() {
        var command = new Command("anything", Map.of(Command.PROMPT, "fix the tests"));
        assertEquals(CommandKind.AGENT, CommandKind.of(command, "claude"));
    }

    @Test
    @DisplayName("the agent command name as first word makes an agent command")
    void agentProgramName() {
        assertEquals(CommandKind.AGENT, CommandKind.of(Command.of("claude refactor the parser"), "claude"));
        assertEquals(CommandKind.AGENT, CommandKind.of(Command.of("  claude"), "claude"));
    }

    @Test
    @DisplayName("anything else is a shell command")
    void shellOtherwise() {
        assertEquals(CommandKind.SHELL, CommandKind.of(Command.of("ls -la"), "claude"));
        assertEquals(CommandKind.SHELL, CommandKind.of(Command.of("claudette run"), "claude"));
        assertEquals(CommandKind.SHELL, CommandKind.of(new Command("echo hi", Map.of(Command.PROMPT, "  ")), "claude"));
    }
}
