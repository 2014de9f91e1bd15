package com.visprog.generator.codegen.generator.math;

import java.util.Optional;

import com.visprog.generator.codegen.generator.BaseNodeGenerator;
import com.visprog.generator.codegen.generator.GeneratorHelpers;
import com.visprog.generator.codegen.generator.NodeGenerationResult;
import com.visprog.generator.codegen.model.core.context.GenerationContext;
import com.visprog.generator.model.GraphNode;
import com.visprog.generator.model.StandardNodeType;

public class NotNodeGenerator extends BaseNodeGenerator {

    public NotNodeGenerator() {
        super(StandardNodeType.NOT);
    }

    @Override
    public NodeGenerationResult generate(GraphNode node, GenerationContext context, GeneratorHelpers helpers) {
        return noop();
    }

    @Override
    public Optional<String> getOutputExpression(GraphNode node, String portId,
                                                GenerationContext context, GeneratorHelpers helpers) {
        String a = helpers.getInputExpression(node, "a").orElse("false");
        return Optional.of("(!" + a + ")");
    }
}
