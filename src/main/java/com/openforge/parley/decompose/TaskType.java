package com.openforge.parley.decompose;

public enum TaskType {
    SIMPLE,
    SEQUENTIAL,
    PARALLEL,
    CONDITIONAL,
    COMPARISON
}
