package com.visprog.generator.codegen.generator.flow;

import java.util.List;
import java.util.Optional;

import com.visprog.generator.codegen.generator.BaseNodeGenerator;
import com.visprog.generator.codegen.generator.GeneratorHelpers;
import com.visprog.generator.codegen.generator.NodeGenerationResult;
import com.visprog.generator.codegen.model.core.context.GenerationContext;
import com.visprog.generator.model.GraphNode;
import com.visprog.generator.model.StandardNodeType;

/**
 * End and Return. A Return with a connected non-zero value returns it,
 * everything else returns 0. Terminal.
 */
public class EndNodeGenerator extends BaseNodeGenerator {

    public EndNodeGenerator() {
        super(StandardNodeType.END, StandardNodeType.RETURN);
    }

    @Override
    public NodeGenerationResult generate(GraphNode node, GenerationContext context, GeneratorHelpers helpers) {
        String ind = helpers.indent();

        if (StandardNodeType.RETURN.is(node)) {
            Optional<String> returnValue = helpers.getInputExpression(node, "value");
            if (returnValue.isPresent() && !"0".equals(returnValue.get())) {
                return code(List.of(ind + "return " + returnValue.get() + ";"), false);
            }
        }

        return code(List.of(ind + "return 0;"), false);
    }
}
