package com.visprog.generator.codegen.diagnostics;

/**
 * Errors a generation run can report. An error marks the run as failed but
 * does not stop generation of the rest of the graph.
 */
public enum CodeGenErrorCode {
    NO_START_NODE,
    MULTIPLE_START_NODES,

    /**
     * A data dependency leads back to the node being resolved.
     */
    CYCLE_DETECTED,
    UNCONNECTED_REQUIRED_PORT,
    UNKNOWN_NODE_TYPE,
    TYPE_MISMATCH,
    UNREACHABLE_NODE,

    /**
     * A call node lacks the function id or name needed to emit the call.
     */
    MISSING_FUNCTION_REFERENCE,

    /**
     * Nested blocks exceed {@code GenerationOptions.maxNestingDepth}.
     */
    NESTING_TOO_DEEP
}
