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
 * Runs {@code completed} on the first execution only. {@code reset} re-arms it;
 * property {@code startClosed} starts it already used up.
 */
public class DoOnceNodeGenerator extends BaseNodeGenerator {

    public DoOnceNodeGenerator() {
        super(StandardNodeType.DO_ONCE);
    }

    @Override
    public NodeGenerationResult generate(GraphNode node, GenerationContext context, GeneratorHelpers helpers) {
        String ind = helpers.indent();
        List<String> lines = new ArrayList<>();

        boolean startClosed = node.booleanProperty("startClosed", false);
        String done = PersistentState.declare(node, "doonce", "done", "bool",
                startClosed ? "true" : "false", helpers, lines);
        PersistentState.onInput(node, "reset", done + " = false;", helpers, lines);

        lines.add(ind + "if (!" + done + ") {");
        helpers.pushIndent();
        lines.add(helpers.indent() + done + " = true;");
        helpers.popIndent();
        lines.addAll(nestedBlock(node, "completed", helpers));
        lines.add(ind + "}");

        return customExecution(lines);
    }
}
