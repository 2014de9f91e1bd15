package com.visprog.generator.codegen.generator.other;

import java.util.Optional;

import com.visprog.generator.codegen.generator.BaseNodeGenerator;
import com.visprog.generator.codegen.generator.GeneratorHelpers;
import com.visprog.generator.codegen.generator.NodeGenerationResult;
import com.visprog.generator.codegen.model.core.context.GenerationContext;
import com.visprog.generator.model.GraphNode;
import com.visprog.generator.model.StandardNodeType;

/**
 * Passes its {@code in} expression through unchanged.
 */
public class RerouteNodeGenerator extends BaseNodeGenerator {

    public RerouteNodeGenerator() {
        super(StandardNodeType.REROUTE);
    }

    @Override
    public NodeGenerationResult generate(GraphNode node, GenerationContext context, GeneratorHelpers helpers) {
        return noop();
    }

    @Override
    public Optional<String> getOutputExpression(GraphNode node, String portId,
                                                GenerationContext context, GeneratorHelpers helpers) {
        return Optional.of(helpers.getInputExpression(node, "in").orElse("0"));
    }
}
