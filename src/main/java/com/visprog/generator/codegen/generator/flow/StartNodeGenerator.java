package com.visprog.generator.codegen.generator.flow;

import com.visprog.generator.codegen.generator.BaseNodeGenerator;
import com.visprog.generator.codegen.generator.GeneratorHelpers;
import com.visprog.generator.codegen.generator.NodeGenerationResult;
import com.visprog.generator.codegen.model.core.context.GenerationContext;
import com.visprog.generator.model.GraphNode;
import com.visprog.generator.model.StandardNodeType;

/**
 * Traversal anchor, emits nothing.
 */
public class StartNodeGenerator extends BaseNodeGenerator {

    public StartNodeGenerator() {
        super(StandardNodeType.START);
    }

    @Override
    public NodeGenerationResult generate(GraphNode node, GenerationContext context, GeneratorHelpers helpers) {
        return noop();
    }
}
