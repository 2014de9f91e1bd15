package com.visprog.generator.codegen.generator.flow;

import java.util.ArrayList;
import java.util.List;

import com.visprog.generator.codegen.generator.BaseNodeGenerator;
import com.visprog.generator.codegen.generator.GeneratorHelpers;
import com.visprog.generator.codegen.generator.NodeGenerationResult;
import com.visprog.generator.codegen.model.core.context.GenerationContext;
import com.visprog.generator.model.GraphNode;
import com.visprog.generator.model.StandardNodeType;

/**
 * Emits the chains behind {@code then-0}, {@code then-1}, ... back to back.
 */
public class SequenceNodeGenerator extends BaseNodeGenerator {

    public SequenceNodeGenerator() {
        super(StandardNodeType.SEQUENCE);
    }

    @Override
    public NodeGenerationResult generate(GraphNode node, GenerationContext context, GeneratorHelpers helpers) {
        List<String> lines = new ArrayList<>();
        for (String thenSuffix : numberedOutputs(node, "then-")) {
            lines.addAll(followOutput(node, thenSuffix, helpers));
        }
        return customExecution(lines);
    }
}
