package com.visprog.generator.codegen.generator.other;

import java.util.List;

import com.visprog.generator.codegen.generator.BaseNodeGenerator;
import com.visprog.generator.codegen.generator.GeneratorHelpers;
import com.visprog.generator.codegen.generator.NodeGenerationResult;
import com.visprog.generator.codegen.model.core.context.GenerationContext;
import com.visprog.generator.model.GraphNode;
import com.visprog.generator.model.StandardNodeType;

/**
 * Node types without C++ semantics of their own leave a marker line and let
 * execution continue.
 */
public class FallbackNodeGenerator extends BaseNodeGenerator {

    public FallbackNodeGenerator() {
        super(StandardNodeType.CUSTOM, StandardNodeType.FUNCTION, StandardNodeType.FUNCTION_CALL,
                StandardNodeType.EVENT);
    }

    @Override
    public NodeGenerationResult generate(GraphNode node, GenerationContext context, GeneratorHelpers helpers) {
        return code(List.of(helpers.indent() + "// TODO: " + node.getType() + " - " + node.getLabel()));
    }
}
