package com.visprog.generator.codegen.generator.flow;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import com.visprog.generator.codegen.generator.BaseNodeGenerator;
import com.visprog.generator.codegen.generator.GeneratorHelpers;
import com.visprog.generator.codegen.generator.NodeGenerationResult;
import com.visprog.generator.codegen.model.core.context.GenerationContext;
import com.visprog.generator.codegen.model.core.context.VariableInfo;
import com.visprog.generator.codegen.util.NamingUtil;
import com.visprog.generator.model.GraphNode;
import com.visprog.generator.model.NodePort;
import com.visprog.generator.model.StandardNodeType;

/**
 * Counted loop from {@code first} to {@code last} inclusive (defaults 0 and 10).
 * The index is registered as {@code <nodeId>-index} for the body.
 */
public class ForLoopNodeGenerator extends BaseNodeGenerator {

    public ForLoopNodeGenerator() {
        super(StandardNodeType.FOR_LOOP);
    }

    @Override
    public NodeGenerationResult generate(GraphNode node, GenerationContext context, GeneratorHelpers helpers) {
        String ind = helpers.indent();
        List<String> lines = new ArrayList<>();

        String first = helpers.getInputExpression(node, "first").orElse("0");
        String last = helpers.getInputExpression(node, "last").orElse("10");
        String indexVar = "i_" + NamingUtil.nodeSuffix(node.getId());

        lines.add(ind + "for (int " + indexVar + " = " + first + "; "
                + indexVar + " <= " + last + "; " + indexVar + "++) {");

        Optional<GraphNode> body = helpers.getExecutionTarget(node, "loop-body");
        if (body.isPresent()) {
            helpers.declareVariable(node.getId() + "-index", indexVar, "Index", "int", node.getId());
            lines.addAll(nestedBlock(node, "loop-body", helpers));
        }

        lines.add(ind + "}");
        lines.addAll(followOutput(node, "completed", helpers));
        return customExecution(lines);
    }

    @Override
    public Optional<String> getOutputExpression(GraphNode node, String portId,
                                                GenerationContext context, GeneratorHelpers helpers) {
        if (NodePort.idMatches(portId, "index")) {
            return Optional.of(helpers.getVariable(node.getId() + "-index")
                    .map(VariableInfo::getCodeName)
                    .orElse("i"));
        }
        return Optional.of("0");
    }
}
