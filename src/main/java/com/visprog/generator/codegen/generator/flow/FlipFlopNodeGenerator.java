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
 * Alternates between {@code a} and {@code b}, starting with {@code a}.
 * Output {@code is-a} reads the toggle.
 */
public class FlipFlopNodeGenerator extends BaseNodeGenerator {

    public FlipFlopNodeGenerator() {
        super(StandardNodeType.FLIP_FLOP);
    }

    @Override
    public NodeGenerationResult generate(GraphNode node, GenerationContext context, GeneratorHelpers helpers) {
        String ind = helpers.indent();
        List<String> lines = new ArrayList<>();

        String isA = PersistentState.declare(node, "flipflop", "isa", "bool", "false", helpers, lines);
        lines.add(ind + isA + " = !" + isA + ";");

        lines.add(ind + "if (" + isA + ") {");
        lines.addAll(nestedBlock(node, "a", helpers));
        if (helpers.getExecutionTarget(node, "b").isPresent()) {
            lines.add(ind + "} else {");
            lines.addAll(nestedBlock(node, "b", helpers));
        }
        lines.add(ind + "}");

        return customExecution(lines);
    }

    @Override
    public Optional<String> getOutputExpression(GraphNode node, String portId,
                                                GenerationContext context, GeneratorHelpers helpers) {
        if (NodePort.idMatches(portId, "is-a")) {
            return Optional.of(helpers.getVariable(node.getId() + "-isa")
                    .map(VariableInfo::getCodeName)
                    .orElse(PersistentState.name("flipflop", "isa", node)));
        }
        return Optional.of("false");
    }
}
