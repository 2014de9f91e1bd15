package com.visprog.generator.codegen.generator;

import java.util.List;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Lines a generator emitted for one node, and whether the driver continues
 * to the node's {@code exec-out} successor afterwards.
 */
@Value
@Builder
public class NodeGenerationResult {

    @Singular
    List<String> lines;

    boolean followExecutionFlow;

    /**
     * The generator already emitted its own successors (branches, loops).
     */
    boolean customExecutionHandling;

    public static NodeGenerationResult noop() {
        return NodeGenerationResult.builder().followExecutionFlow(true).build();
    }

    public static NodeGenerationResult code(List<String> lines, boolean followExecutionFlow) {
        return NodeGenerationResult.builder()
                .lines(lines)
                .followExecutionFlow(followExecutionFlow)
                .build();
    }

    public static NodeGenerationResult customExecution(List<String> lines) {
        return NodeGenerationResult.builder()
                .lines(lines)
                .followExecutionFlow(false)
                .customExecutionHandling(true)
                .build();
    }

    public boolean isEmpty() {
        return lines.isEmpty();
    }
}
