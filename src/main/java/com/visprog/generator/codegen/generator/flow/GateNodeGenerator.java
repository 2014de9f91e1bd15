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
 * Persistent latch. The {@code open}, {@code close} and {@code toggle} inputs
 * update it before the check; {@code exit} runs while it is open.
 * Property {@code startClosed} (default false) sets the initial state.
 */
public class GateNodeGenerator extends BaseNodeGenerator {

    public GateNodeGenerator() {
        super(StandardNodeType.GATE);
    }

    @Override
    public NodeGenerationResult generate(GraphNode node, GenerationContext context, GeneratorHelpers helpers) {
        String ind = helpers.indent();
        List<String> lines = new ArrayList<>();

        boolean startClosed = node.booleanProperty("startClosed", false);
        String open = PersistentState.declare(node, "gate", "open", "bool",
                startClosed ? "false" : "true", helpers, lines);

        PersistentState.onInput(node, "open", open + " = true;", helpers, lines);
        PersistentState.onInput(node, "close", open + " = false;", helpers, lines);
        PersistentState.onInput(node, "toggle", open + " = !" + open + ";", helpers, lines);

        lines.add(ind + "if (" + open + ") {");
        lines.addAll(nestedBlock(node, "exit", helpers));
        lines.add(ind + "}");

        return customExecution(lines);
    }
}
