package com.visprog.generator.codegen.generator;

import java.util.List;
import java.util.Optional;

import com.visprog.generator.codegen.model.core.context.GenerationContext;
import com.visprog.generator.model.GraphNode;

/**
 * Emits C++ for the node types it declares.
 *
 * Implementations hold no per-run state; everything a run accumulates lives in
 * the {@link GenerationContext}, so one instance can serve concurrent runs.
 */
public interface NodeGenerator {

    /**
     * Node type tags this generator handles.
     */
    List<String> getNodeTypes();

    NodeGenerationResult generate(GraphNode node, GenerationContext context, GeneratorHelpers helpers);

    /**
     * Expression for one of the node's output ports. Empty when the node has
     * no value to offer for that port.
     */
    default Optional<String> getOutputExpression(GraphNode node, String portId,
                                                 GenerationContext context, GeneratorHelpers helpers) {
        return Optional.empty();
    }
}
