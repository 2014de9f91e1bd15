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
 * Range-based loop over {@code array} (default {@code items}) with a manually
 * counted index. Registers {@code <nodeId>-element} and {@code <nodeId>-index}.
 */
public class ForEachNodeGenerator extends BaseNodeGenerator {

    public ForEachNodeGenerator() {
        super(StandardNodeType.FOR_EACH);
    }

    @Override
    public NodeGenerationResult generate(GraphNode node, GenerationContext context, GeneratorHelpers helpers) {
        String ind = helpers.indent();
        List<String> lines = new ArrayList<>();

        String array = helpers.getInputExpression(node, "array").orElse("items");
        String suffix = NamingUtil.nodeSuffix(node.getId());
        String indexVar = "i_" + suffix;
        String elemVar = "elem_" + suffix;

        lines.add(ind + "int " + indexVar + " = 0;");
        lines.add(ind + "for (const auto& " + elemVar + " : " + array + ") {");

        helpers.pushIndent();
        helpers.declareVariable(node.getId() + "-element", elemVar, "Element", "auto", node.getId());
        helpers.declareVariable(node.getId() + "-index", indexVar, "Index", "int", node.getId());

        helpers.getExecutionTarget(node, "loop-body")
                .ifPresent(body -> lines.addAll(helpers.generateFromNode(body)));

        lines.add(helpers.indent() + indexVar + "++;");
        helpers.popIndent();

        lines.add(ind + "}");
        lines.addAll(followOutput(node, "completed", helpers));
        return customExecution(lines);
    }

    @Override
    public Optional<String> getOutputExpression(GraphNode node, String portId,
                                                GenerationContext context, GeneratorHelpers helpers) {
        if (NodePort.idMatches(portId, "element")) {
            return Optional.of(helpers.getVariable(node.getId() + "-element")
                    .map(VariableInfo::getCodeName)
                    .orElse("elem"));
        }
        if (NodePort.idMatches(portId, "index")) {
            return Optional.of(helpers.getVariable(node.getId() + "-index")
                    .map(VariableInfo::getCodeName)
                    .orElse("i"));
        }
        return Optional.of("0");
    }
}
