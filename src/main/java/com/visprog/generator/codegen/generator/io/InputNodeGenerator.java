package com.visprog.generator.codegen.generator.io;

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
 * Reads one word from stdin into a fresh string, echoing the prompt first
 * when it is not empty. The string is registered as {@code <nodeId>-value}.
 */
public class InputNodeGenerator extends BaseNodeGenerator {

    public InputNodeGenerator() {
        super(StandardNodeType.INPUT);
    }

    @Override
    public NodeGenerationResult generate(GraphNode node, GenerationContext context, GeneratorHelpers helpers) {
        String ind = helpers.indent();
        List<String> lines = new ArrayList<>();

        Optional<String> prompt = helpers.getInputExpression(node, "prompt");
        String varName = "input_" + NamingUtil.nodeSuffix(node.getId());

        if (prompt.isPresent() && !"\"\"".equals(prompt.get())) {
            lines.add(ind + "std::cout << " + prompt.get() + ";");
        }
        lines.add(ind + "std::string " + varName + ";");
        lines.add(ind + "std::cin >> " + varName + ";");

        helpers.declareVariable(node.getId() + "-value", varName, "Input Value", "std::string", node.getId());
        return code(lines);
    }

    @Override
    public Optional<String> getOutputExpression(GraphNode node, String portId,
                                                GenerationContext context, GeneratorHelpers helpers) {
        if (NodePort.idMatches(portId, "value")) {
            return Optional.of(helpers.getVariable(node.getId() + "-value")
                    .map(VariableInfo::getCodeName)
                    .orElse("input"));
        }
        return Optional.of("\"\"");
    }
}
