package com.visprog.generator.codegen.generator.flow;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import com.visprog.generator.codegen.generator.BaseNodeGenerator;
import com.visprog.generator.codegen.generator.GeneratorHelpers;
import com.visprog.generator.codegen.generator.NodeGenerationResult;
import com.visprog.generator.codegen.model.core.context.GenerationContext;
import com.visprog.generator.codegen.model.core.context.VariableInfo;
import com.visprog.generator.model.GraphNode;
import com.visprog.generator.model.NodePort;
import com.visprog.generator.model.StandardNodeType;

/**
 * Lets the first {@code n} executions through to {@code exit}; negative n counts as 0.
 * {@code reset} zeroes the counter.
 */
public class DoNNodeGenerator extends BaseNodeGenerator {

    public DoNNodeGenerator() {
        super(StandardNodeType.DO_N);
    }

    @Override
    public NodeGenerationResult generate(GraphNode node, GenerationContext context, GeneratorHelpers helpers) {
        String ind = helpers.indent();
        List<String> lines = new ArrayList<>();
        helpers.requireInclude("<algorithm>");

        String limit = helpers.getInputExpression(node, "n").orElse("1");
        String counter = PersistentState.declare(node, "don", "counter", "int", "0", helpers, lines);
        PersistentState.onInput(node, "reset", counter + " = 0;", helpers, lines);

        lines.add(ind + "if (" + counter + " < std::max(0, static_cast<int>(" + limit + "))) {");
        helpers.pushIndent();
        lines.add(helpers.indent() + counter + "++;");
        helpers.popIndent();
        lines.addAll(nestedBlock(node, "exit", helpers));
        lines.add(ind + "}");

        return customExecution(lines);
    }

    @Override
    public Optional<String> getOutputExpression(GraphNode node, String portId,
                                                GenerationContext context, GeneratorHelpers helpers) {
        if (NodePort.idMatches(portId, "counter")) {
            return Optional.of(helpers.getVariable(node.getId() + "-counter")
                    .map(VariableInfo::getCodeName)
                    .orElse(PersistentState.name("don", "counter", node)));
        }
        return Optional.of("0");
    }
}
