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
 * Post-condition loop: the body runs at least once.
 */
public class DoWhileNodeGenerator extends BaseNodeGenerator {

    public DoWhileNodeGenerator() {
        super(StandardNodeType.DO_WHILE);
    }

    @Override
    public NodeGenerationResult generate(GraphNode node, GenerationContext context, GeneratorHelpers helpers) {
        String ind = helpers.indent();
        List<String> lines = new ArrayList<>();

        String condition = helpers.getInputExpression(node, "condition").orElse("true");
        LoopConditions.warnIfAlwaysTrue(node, condition, helpers);

        lines.add(ind + "do {");
        lines.addAll(nestedBlock(node, "loop-body", helpers));
        lines.add(ind + "} while (" + condition + ");");

        lines.addAll(followOutput(node, "completed", helpers));
        return customExecution(lines);
    }
}
