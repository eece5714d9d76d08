package com.runway.executor;

import com.runway.core.model.CommandKind;
import com.runway.core.model.ExecutionMode;

import java.util.Collection;
import java.util.EnumMap;
import java.util.Map;

/**
 * Holds exactly one executor per {@link ExecutorKind} and resolves the one for an
 * (execution mode, command kind) pair.
 */
public class ExecutorRegistry {

    private final Map<ExecutorKind, CommandExecutor> executors = new EnumMap<>(ExecutorKind.class);

    public ExecutorRegistry(Collection<? extends CommandExecutor> all) {
        for (CommandExecutor executor : all) {
            if (executors.putIfAbsent(executor.kind(), executor) != null) {
                throw new IllegalArgumentException("Duplicate executor for " + executor.kind());
            }
        }
        for (ExecutorKind kind : ExecutorKind.values()) {
            if (!executors.containsKey(kind)) {
                throw new IllegalArgumentException("No executor registered for " + kind);
            }
        }
    }

    public CommandExecutor select(ExecutionMode mode, CommandKind commandKind) {
        return executors.get(ExecutorKind.select(mode, commandKind));
    }

    public CommandExecutor get(ExecutorKind kind) {
        return executors.get(kind);
    }
}
