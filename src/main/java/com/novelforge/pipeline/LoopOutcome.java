package com.novelforge.pipeline;

/**
 * How a generation loop ended without an error.
 */
public enum LoopOutcome {
    COMPLETED,
    ITERATION_LIMIT_REACHED
}
