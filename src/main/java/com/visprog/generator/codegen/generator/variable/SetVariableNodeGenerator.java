package com.visprog.generator.codegen.generator.variable;

import java.util.List;
import java.util.Optional;

import com.visprog.generator.codegen.generator.BaseNodeGenerator;
import com.visprog.generator.codegen.generator.GeneratorHelpers;
import com.visprog.generator.codegen.generator.NodeGenerationResult;
import com.visprog.generator.codegen.mapper.PortTypeMapper;
import com.visprog.generator.codegen.model.core.context.GenerationContext;
import com.visprog.generator.codegen.model.core.context.VariableInfo;
import com.visprog.generator.codegen.util.NamingUtil;
import com.visprog.generator.model.GraphNode;
import com.visprog.generator.model.NodePort;
import com.visprog.generator.model.StandardNodeType;

/**
 * Assigns {@code value} (default 0) to the variable named by the label,
 * declaring it on the spot when neither label nor node id is known yet.
 * The value output reads the variable back.
 */
public class SetVariableNodeGenerator extends BaseNodeGenerator {

    public SetVariableNodeGenerator() {
        super(StandardNodeType.SET_VARIABLE);
    }

    @Override
    public NodeGenerationResult generate(GraphNode node, GenerationContext context, GeneratorHelpers helpers) {
        String ind = helpers.indent();
        String varName = NamingUtil.toValidIdentifier(node.getLabel());
        String value = helpers.getInputExpression(node, "value").orElse("0");

        if (!helpers.isVariableDeclared(node.getLabel()) && !helpers.isVariableDeclared(node.getId())) {
            Optional<NodePort> valuePort = node.findInput("value");
            String cppType = valuePort.map(PortTypeMapper::targetType).orElse("auto");
            helpers.declareVariable(node.getLabel(), varName, node.getLabel(), cppType, node.getId());
            return code(List.of(ind + cppType + " " + varName + " = " + value + ";"));
        }

        return code(List.of(ind + varName + " = " + value + ";"));
    }

    @Override
    public Optional<String> getOutputExpression(GraphNode node, String portId,
                                                GenerationContext context, GeneratorHelpers helpers) {
        return Optional.of(helpers.getVariable(node.getLabel())
                .or(() -> helpers.getVariable(node.getId()))
                .map(VariableInfo::getCodeName)
                .orElse(NamingUtil.toValidIdentifier(node.getLabel())));
    }
}
