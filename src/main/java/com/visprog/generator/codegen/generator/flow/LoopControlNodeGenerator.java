package com.visprog.generator.codegen.generator.flow;

import java.util.List;

import com.visprog.generator.codegen.generator.BaseNodeGenerator;
import com.visprog.generator.codegen.generator.GeneratorHelpers;
import com.visprog.generator.codegen.generator.NodeGenerationResult;
import com.visprog.generator.codegen.model.core.context.GenerationContext;
import com.visprog.generator.model.GraphNode;
import com.visprog.generator.model.StandardNodeType;

/**
 * Break and Continue. Terminal.
 */
public class LoopControlNodeGenerator extends BaseNodeGenerator {

    public LoopControlNodeGenerator() {
        super(StandardNodeType.BREAK, StandardNodeType.CONTINUE);
    }

    @Override
    public NodeGenerationResult generate(GraphNode node, GenerationContext context, GeneratorHelpers helpers) {
        String statement = StandardNodeType.BREAK.is(node) ? "break;" : "continue;";
        return code(List.of(helpers.indent() + statement), false);
    }
}
