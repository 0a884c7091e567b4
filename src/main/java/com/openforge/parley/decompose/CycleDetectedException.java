package com.openforge.parley.decompose;

import java.util.List;

/**
 * Thrown when task dependencies form a cycle. Tasks built by
 * {@link QueryDecomposer} never do, so this signals a programming error.
 */
public class CycleDetectedException extends RuntimeException {

    private final List<Integer> unresolved;

    public CycleDetectedException(List<Integer> unresolved) {
        super("Task dependencies form a cycle among tasks " + unresolved);
        this.unresolved = List.copyOf(unresolved);
    }

    /** Indices of the tasks that could not be ordered. */
    public List<Integer> unresolved() {
        return unresolved;
    }
}
