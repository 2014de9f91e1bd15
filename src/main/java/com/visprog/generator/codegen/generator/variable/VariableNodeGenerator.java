package com.visprog.generator.codegen.generator.variable;

import java.util.ArrayList;
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
import com.visprog.generator.model.PortDataType;
import com.visprog.generator.model.StandardNodeType;

/**
 * Declares a variable named after the node label, initialized to the default
 * literal of its type. A node already declared in this run emits nothing.
 */
public class VariableNodeGenerator extends BaseNodeGenerator {

    public VariableNodeGenerator() {
        super(StandardNodeType.VARIABLE);
    }

    @Override
    public NodeGenerationResult generate(GraphNode node, GenerationContext context, GeneratorHelpers helpers) {
        List<String> lines = new ArrayList<>();

        String varName = NamingUtil.toValidIdentifier(node.getLabel());
        Optional<NodePort> valuePort = node.findOutput("value");
        PortDataType dataType = valuePort.map(NodePort::getDataType).orElse(PortDataType.FLOAT);
        String cppType = valuePort.map(PortTypeMapper::targetType).orElse(PortTypeMapper.targetType(dataType));

        if (!helpers.isVariableDeclared(node.getId())) {
            lines.add(helpers.indent() + cppType + " " + varName + " = " + PortTypeMapper.defaultLiteral(dataType) + ";");
            helpers.declareVariable(node.getId(), varName, node.getLabel(), cppType, node.getId());
        }

        return code(lines);
    }

    @Override
    public Optional<String> getOutputExpression(GraphNode node, String portId,
                                                GenerationContext context, GeneratorHelpers helpers) {
        return Optional.of(helpers.getVariable(node.getId())
                .or(() -> helpers.getVariable(node.getLabel()))
                .map(VariableInfo::getCodeName)
                .orElse(NamingUtil.toValidIdentifier(node.getLabel())));
    }
}
