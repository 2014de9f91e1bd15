package com.visprog.generator.codegen.generator.flow;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import com.visprog.generator.codegen.diagnostics.CodeGenWarningCode;
import com.visprog.generator.codegen.generator.BaseNodeGenerator;
import com.visprog.generator.codegen.generator.GeneratorHelpers;
import com.visprog.generator.codegen.generator.NodeGenerationResult;
import com.visprog.generator.codegen.model.core.context.GenerationContext;
import com.visprog.generator.model.GraphNode;
import com.visprog.generator.model.StandardNodeType;

/**
 * if / else over the {@code condition} input (default {@code true}).
 * The else arm is only emitted when {@code false} is connected.
 */
public class BranchNodeGenerator extends BaseNodeGenerator {

    public BranchNodeGenerator() {
        super(StandardNodeType.BRANCH);
    }

    @Override
    public NodeGenerationResult generate(GraphNode node, GenerationContext context, GeneratorHelpers helpers) {
        String ind = helpers.indent();
        List<String> lines = new ArrayList<>();

        String condition = helpers.getInputExpression(node, "condition").orElse("true");
        lines.add(ind + "if (" + condition + ") {");

        helpers.pushIndent();
        Optional<GraphNode> trueNode = helpers.getExecutionTarget(node, "true");
        if (trueNode.isPresent()) {
            lines.addAll(helpers.generateFromNode(trueNode.get()));
        } else {
            lines.add(helpers.indent() + "// Пустая ветка");
            helpers.addWarning(node.getId(), CodeGenWarningCode.EMPTY_BRANCH,
                    "Ветка \"True\" пуста", "Branch \"True\" is empty");
        }
        helpers.popIndent();

        if (helpers.getExecutionTarget(node, "false").isPresent()) {
            lines.add(ind + "} else {");
            lines.addAll(nestedBlock(node, "false", helpers));
        }

        lines.add(ind + "}");
        return customExecution(lines);
    }
}
