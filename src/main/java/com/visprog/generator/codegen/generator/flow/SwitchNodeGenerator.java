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
 * switch over {@code selection} (default 0). Each connected {@code case-N}
 * output gets a case closed by {@code break;}; unconnected cases are left out
 * so their values reach the default arm.
 */
public class SwitchNodeGenerator extends BaseNodeGenerator {

    public SwitchNodeGenerator() {
        super(StandardNodeType.SWITCH);
    }

    @Override
    public NodeGenerationResult generate(GraphNode node, GenerationContext context, GeneratorHelpers helpers) {
        String ind = helpers.indent();
        List<String> lines = new ArrayList<>();

        String selection = helpers.getInputExpression(node, "selection").orElse("0");
        lines.add(ind + "switch (" + selection + ") {");

        for (String caseSuffix : numberedOutputs(node, "case-")) {
            if (helpers.getExecutionTarget(node, caseSuffix).isEmpty()) {
                continue;
            }
            lines.add(ind + "case " + numberOf(caseSuffix) + ":");
            appendArm(node, caseSuffix, helpers, lines);
        }

        lines.add(ind + "default:");
        appendArm(node, "default", helpers, lines);

        lines.add(ind + "}");
        return customExecution(lines);
    }

    private void appendArm(GraphNode node, String portSuffix, GeneratorHelpers helpers, List<String> lines) {
        lines.addAll(nestedBlock(node, portSuffix, helpers));
        helpers.pushIndent();
        lines.add(helpers.indent() + "break;");
        helpers.popIndent();
    }
}
