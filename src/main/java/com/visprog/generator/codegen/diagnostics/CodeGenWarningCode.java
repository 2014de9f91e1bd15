package com.visprog.generator.codegen.diagnostics;

/**
 * Non-fatal findings. Output is still produced.
 */
public enum CodeGenWarningCode {
    UNUSED_NODE,
    UNINITIALIZED_VARIABLE,
    EMPTY_BRANCH,

    /**
     * Loop condition is the literal {@code true}.
     */
    INFINITE_LOOP,
    DIVISION_BY_ZERO,
    MODULO_BY_ZERO,

    /**
     * Fewer fan-out branches are connected than the node declares.
     */
    UNCONNECTED_BRANCHES,
    NO_CONNECTED_OUTPUTS,

    /**
     * A return node with no function it belongs to.
     */
    ORPHAN_FUNCTION_RETURN
}
