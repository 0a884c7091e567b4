package com.openforge.parley.decompose;

import java.util.List;

/**
 * Dependency-respecting order of a task list.
 *
 * @param executionOrder task indices, every task after its dependencies
 * @param estimatedSteps number of tasks to run
 * @param stages         waves of task indices whose dependencies all sit in earlier waves
 */
public record ExecutionPlan(List<Integer> executionOrder, int estimatedSteps, List<List<Integer>> stages) {

    public ExecutionPlan {
        executionOrder = List.copyOf(executionOrder);
        stages = stages.stream().map(List::copyOf).toList();
    }

    public static ExecutionPlan empty() {
        return new ExecutionPlan(List.of(), 0, List.of());
    }
}
