package com.openforge.parley.decompose;

import java.util.List;
import java.util.Objects;

/**
 * One subtask of a decomposed utterance.
 *
 * Conditional tasks carry their condition and branch texts; deciding which
 * branch runs is up to the caller. Comparison tasks carry the subject they
 * cover (equal to {@code text}).
 *
 * @param dependencies indices of tasks that must complete first
 */
public record Task(int index,
                   String text,
                   TaskType type,
                   List<Integer> dependencies,
                   TaskStatus status,
                   String condition,
                   String thenBranch,
                   String elseBranch,
                   String subject) {

    public Task {
        if (index < 0) {
            throw new IllegalArgumentException("Task index must be >= 0, got " + index);
        }
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(type, "type");
        dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
        status = status == null ? TaskStatus.PENDING : status;
    }

    public static Task simple(String text) {
        return new Task(0, text, TaskType.SIMPLE, List.of(), TaskStatus.PENDING, null, null, null, null);
    }

    public static Task of(int index, String text, TaskType type, List<Integer> dependencies) {
        return new Task(index, text, type, dependencies, TaskStatus.PENDING, null, null, null, null);
    }

    public static Task conditional(String text, String condition, String thenBranch, String elseBranch) {
        return new Task(0, text, TaskType.CONDITIONAL, List.of(), TaskStatus.PENDING,
                condition, thenBranch, elseBranch, null);
    }

    public static Task comparison(int index, String subject) {
        return new Task(index, subject, TaskType.COMPARISON, List.of(), TaskStatus.PENDING,
                null, null, null, subject);
    }

    public Task withStatus(TaskStatus newStatus) {
        return new Task(index, text, type, dependencies, newStatus, condition, thenBranch, elseBranch, subject);
    }

    public boolean hasElseBranch() {
        return elseBranch != null;
    }
}
