package com.visprog.generator.codegen.generator.io;

import java.util.List;

import com.visprog.generator.codegen.generator.BaseNodeGenerator;
import com.visprog.generator.codegen.generator.GeneratorHelpers;
import com.visprog.generator.codegen.generator.NodeGenerationResult;
import com.visprog.generator.codegen.model.core.context.GenerationContext;
import com.visprog.generator.model.GraphNode;
import com.visprog.generator.model.StandardNodeType;

public class PrintNodeGenerator extends BaseNodeGenerator {

    public PrintNodeGenerator() {
        super(StandardNodeType.PRINT);
    }

    @Override
    public NodeGenerationResult generate(GraphNode node, GenerationContext context, GeneratorHelpers helpers) {
        String text = helpers.getInputExpression(node, "string").orElse("\"\"");
        return code(List.of(helpers.indent() + "std::cout << " + text + " << std::endl;"));
    }
}
